package com.blockhub.gameservice.games.tetris.domain.enums;

/**
 * 引擎对外发布的事件类型，wireName 即广播给客户端的事件名。
 */
public enum GameEventType {

    STARTED("started"),
    STOPPED("stopped"),
    LOOPED("looped"),
    BLOCK_CREATED("blockCreated"),
    NEXT_BLOCK_CREATED("nextBlockCreated"),
    ROUND_DONE("roundDone"),
    LINES_COMPLETED("linesCompleted"),
    CONFIG_UPDATED("configUpdated"),
    PLAYER_ADDED("playerAdded"),
    PLAYER_REMOVED("playerRemoved"),
    STATUS_CHANGED("statusChanged");

    private final String wireName;

    GameEventType(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }
}
