package com.blockhub.gameservice.platform.transport;

import com.blockhub.gameservice.application.user.EmptyNameException;
import com.blockhub.gameservice.application.user.NameTakenException;
import com.blockhub.gameservice.application.user.PlayerDirectoryService;
import com.blockhub.gameservice.application.user.PlayerIdentity;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(AuthController.class)
class AuthControllerTest {

    @Autowired
    private MockMvc mvc;

    @MockBean
    private PlayerDirectoryService playerDirectory;

    @Test
    void authIssuesIdentity() throws Exception {
        when(playerDirectory.issue("t1")).thenReturn(new PlayerIdentity("id-1", "Swift Fox"));

        mvc.perform(post("/auth").contentType(MediaType.APPLICATION_JSON).content("{\"token\":\"t1\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.code").value(200))
                .andExpect(jsonPath("$.data.id").value("id-1"))
                .andExpect(jsonPath("$.data.username").value("Swift Fox"));
    }

    @Test
    void authWithoutBodyStillWorks() throws Exception {
        when(playerDirectory.issue(null)).thenReturn(new PlayerIdentity("id-2", "Bold Badger"));

        mvc.perform(post("/auth"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.id").value("id-2"));
    }

    @Test
    void signupMapsDomainErrorsToStatusCodes() throws Exception {
        doThrow(new EmptyNameException("name may not be empty")).when(playerDirectory).registerName(any());
        mvc.perform(post("/auth/signup").contentType(MediaType.APPLICATION_JSON).content("{\"name\":\" \"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value(400))
                .andExpect(jsonPath("$.message").value("name may not be empty"));

        doThrow(new NameTakenException("name already in use")).when(playerDirectory).registerName(any());
        mvc.perform(post("/auth/signup").contentType(MediaType.APPLICATION_JSON).content("{\"name\":\"bob\"}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value(409));
    }

    @Test
    void signupReturnsNewIdentity() throws Exception {
        when(playerDirectory.registerName("Alice")).thenReturn(new PlayerIdentity("id-3", "Alice"));

        mvc.perform(post("/auth/signup").contentType(MediaType.APPLICATION_JSON).content("{\"name\":\"Alice\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.username").value("Alice"));
    }
}
