package com.blockhub.gameservice.engine.core;

/**
 * 引擎事件监听器。
 * - 回调在引擎的串行上下文中同步执行，实现方必须尽快返回（例如只把快照转交给广播线程）；
 * - 同一引擎上的多个监听器按订阅顺序回调。
 *
 * @param <S> 快照类型
 * @param <E> 事件类型
 */
@FunctionalInterface
public interface GameEventListener<S, E extends Enum<E>> {

    void onEvent(S snapshot, E event);
}
