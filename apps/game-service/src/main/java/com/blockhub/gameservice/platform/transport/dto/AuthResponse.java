package com.blockhub.gameservice.platform.transport.dto;

import com.blockhub.gameservice.application.user.PlayerIdentity;

/** 身份接口返回：{id, username} */
public record AuthResponse(String id, String username) {

    public static AuthResponse of(PlayerIdentity identity) {
        return new AuthResponse(identity.id(), identity.name());
    }
}
