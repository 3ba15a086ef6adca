package com.blockhub.gameservice.platform.transport.dto;

/** POST /auth/signup 请求体 */
public record SignupRequest(String name) {
}
