package com.blockhub.gameservice.platform.ws;

import lombok.extern.slf4j.Slf4j;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;
import org.springframework.web.socket.handler.SessionLimitExceededException;

import java.io.IOException;

/**
 * 基于 Spring WebSocketSession 的连接实现。
 * 原始会话被 ConcurrentWebSocketSessionDecorator 包装，send 与 close 可来自不同线程；
 * 出站顺序与慢连接限额由 BroadcastHub 的每连接出站队列负责。
 */
@Slf4j
public class WebSocketConnection implements Connection {

    private final WebSocketSession session;
    private final String playerId;

    public WebSocketConnection(WebSocketSession rawSession, String playerId, int sendTimeLimitMs, int bufferSizeLimit) {
        this.session = new ConcurrentWebSocketSessionDecorator(rawSession, sendTimeLimitMs, bufferSizeLimit);
        this.playerId = playerId;
    }

    @Override
    public String id() {
        return session.getId();
    }

    @Override
    public String playerId() {
        return playerId;
    }

    @Override
    public void send(String frame) {
        if (!session.isOpen()) {
            log.debug("skip send on closed connection: id={}", id());
            return;
        }
        try {
            session.sendMessage(new TextMessage(frame));
        } catch (SessionLimitExceededException e) {
            log.warn("慢连接超限已关闭: id={}, player={}, reason={}", id(), playerId, e.getMessage());
        } catch (IOException | IllegalStateException e) {
            log.warn("发送失败: id={}, player={}, ex={}", id(), playerId, e.toString());
        }
    }

    @Override
    public void close(int code, String reason) {
        try {
            session.close(new CloseStatus(code, reason));
        } catch (IOException e) {
            log.warn("关闭连接失败: id={}, ex={}", id(), e.toString());
        }
    }

    @Override
    public boolean isOpen() {
        return session.isOpen();
    }
}
