package com.blockhub.gameservice.application.user;

/**
 * 玩家身份：id + 昵称
 */
public record PlayerIdentity(String id, String name) {
}
