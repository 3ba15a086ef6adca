package com.blockhub.gameservice.platform.ws;

/**
 * 一条客户端连接的抽象（与具体 WebSocket 实现解耦，便于测试）。
 */
public interface Connection {

    /** 连接ID（进程内唯一） */
    String id();

    /** 连接所属玩家（来自握手参数 player） */
    String playerId();

    /**
     * 发送一帧文本。失败只记录日志，不抛异常。
     * @param frame 已编码的文本帧
     */
    void send(String frame);

    /**
     * 关闭连接
     * @param code   WebSocket 关闭码
     * @param reason 原因，可空
     */
    void close(int code, String reason);

    boolean isOpen();
}
