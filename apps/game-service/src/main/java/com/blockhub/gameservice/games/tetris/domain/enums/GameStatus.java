package com.blockhub.gameservice.games.tetris.domain.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 对局状态机：
 * WAITING → RUNNING → {ENDED | PAUSED | STOPPING}，PAUSED/STOPPING → ENDED。
 * ENDED 为终态。
 */
public enum GameStatus {

    WAITING("waiting"),     // 等待房主开始，可改配置、可加人
    RUNNING("running"),     // 进行中，重力与输入都生效
    PAUSED("paused"),       // 会话中断：既不消费输入也不下落
    STOPPING("stopping"),   // 收尾中：只消费已排队输入，不再下落
    ENDED("ended");         // 已结束

    private final String wireName;

    GameStatus(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    /** 按状态机判断能否迁移到 target */
    public boolean canTransitionTo(GameStatus target) {
        return switch (this) {
            case WAITING -> target == RUNNING || target == ENDED;
            case RUNNING -> target == ENDED || target == PAUSED || target == STOPPING;
            case PAUSED, STOPPING -> target == ENDED;
            case ENDED -> false;
        };
    }
}
