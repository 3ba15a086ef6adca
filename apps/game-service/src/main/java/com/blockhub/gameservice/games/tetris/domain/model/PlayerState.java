package com.blockhub.gameservice.games.tetris.domain.model;

/**
 * 单局内的玩家积分。不可变：加分时生成新实例替换。
 */
public record PlayerState(String playerId, long points) {

    public static PlayerState joined(String playerId) {
        return new PlayerState(playerId, 0);
    }

    public PlayerState award(long gained) {
        return new PlayerState(playerId, points + gained);
    }
}
