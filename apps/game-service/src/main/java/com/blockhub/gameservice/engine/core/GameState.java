package com.blockhub.gameservice.engine.core;

/**
 * 游戏状态接口（引擎内部可变状态）。
 * - 状态只由所属引擎在串行上下文中修改；
 * - 外部读者拿到的永远是 snapshot() 生成的不可变快照，不会看到修改到一半的数据。
 *
 * @param <S> 快照类型
 */
public interface GameState<S> {

    /**
     * 生成当前状态的不可变快照。
     */
    S snapshot();
}
