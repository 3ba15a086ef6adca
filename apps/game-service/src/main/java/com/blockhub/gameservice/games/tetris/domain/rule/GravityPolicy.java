package com.blockhub.gameservice.games.tetris.domain.rule;

/**
 * 重力节奏：每隔多少毫秒自动下落一格。
 * delay(level) = max(minMillis, baseMillis − level × stepPerLevelMillis)；
 * stepPerLevelMillis 为 0 时节奏固定。
 */
public record GravityPolicy(long baseMillis, long stepPerLevelMillis, long minMillis) {

    public static GravityPolicy fixed(long baseMillis) {
        return new GravityPolicy(baseMillis, 0, baseMillis);
    }

    public long delayFor(int level) {
        return Math.max(minMillis, baseMillis - level * stepPerLevelMillis);
    }
}
