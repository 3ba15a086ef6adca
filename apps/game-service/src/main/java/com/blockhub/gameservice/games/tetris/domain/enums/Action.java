package com.blockhub.gameservice.games.tetris.domain.enums;

/** 玩家输入意图，入队后由下一次 tick 消费 */
public enum Action {
    LEFT,
    RIGHT,
    DOWN,
    ROTATE
}
