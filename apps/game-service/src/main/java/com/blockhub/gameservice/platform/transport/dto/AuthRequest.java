package com.blockhub.gameservice.platform.transport.dto;

/** POST /auth 请求体，token 为空时签发新身份 */
public record AuthRequest(String token) {
}
