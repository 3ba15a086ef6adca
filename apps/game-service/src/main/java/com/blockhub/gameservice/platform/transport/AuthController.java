package com.blockhub.gameservice.platform.transport;

import com.blockhub.gameservice.application.user.PlayerDirectoryService;
import com.blockhub.gameservice.common.ApiResponse;
import com.blockhub.gameservice.platform.transport.dto.AuthRequest;
import com.blockhub.gameservice.platform.transport.dto.AuthResponse;
import com.blockhub.gameservice.platform.transport.dto.SignupRequest;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * 玩家身份接口。
 * 返回的 id 即 WebSocket 握手时的 player 参数。
 */
@RestController
@RequestMapping("/auth")
@RequiredArgsConstructor
public class AuthController {

    private final PlayerDirectoryService playerDirectory;

    /**
     * 签发或复用身份
     * @param request 可带上次拿到的 token；请求体可空
     */
    @PostMapping
    public ResponseEntity<ApiResponse<AuthResponse>> auth(@RequestBody(required = false) AuthRequest request) {
        String token = request == null ? null : request.token();
        return ResponseEntity.ok(ApiResponse.success(AuthResponse.of(playerDirectory.issue(token))));
    }

    /**
     * 按昵称注册。空昵称 400，重名 409（见 WebExceptionAdvice）。
     */
    @PostMapping("/signup")
    public ResponseEntity<ApiResponse<AuthResponse>> signup(@RequestBody SignupRequest request) {
        return ResponseEntity.ok(ApiResponse.success(AuthResponse.of(playerDirectory.registerName(request.name()))));
    }
}
