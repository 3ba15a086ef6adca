package com.blockhub.gameservice.games.tetris.domain.repository;

import com.blockhub.gameservice.games.tetris.application.GameEngine;

import java.util.List;
import java.util.Optional;

/**
 * GameRegistry
 * ----------------------------------------
 * 对局登记表：gameId → GameEngine。
 * - 当前实现为进程内存，不做持久化；
 * - 所有方法必须线程安全（指令处理线程与 tick 线程都会访问）。
 */
public interface GameRegistry {

    /**
     * 创建并登记一局新游戏
     * @param ownerId 房主玩家ID
     * @return 新引擎（WAITING）
     */
    GameEngine create(String ownerId);

    /**
     * 按 id 查找
     * @param gameId 对局ID
     * @return 不存在返回 empty
     */
    Optional<GameEngine> find(String gameId);

    /**
     * 移除登记（不负责停止引擎）
     * @param gameId 对局ID
     * @return 被移除的引擎
     */
    Optional<GameEngine> evict(String gameId);

    /** 全部已登记的对局，按创建顺序 */
    List<GameEngine> all();
}
