package com.blockhub.gameservice.platform.ws;

import com.blockhub.gameservice.games.tetris.interfaces.ws.CommandRouter;
import com.blockhub.gameservice.games.tetris.interfaces.ws.CommandRouterFactory;
import com.blockhub.gameservice.games.tetris.interfaces.ws.dto.TetrisMessages;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;
import org.springframework.web.util.UriComponentsBuilder;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 原生 WebSocket 入口：/ws?player=&lt;playerId&gt;
 * - 握手后：缺少 player 参数 → unauthenticated@null 并以 4401 关闭；否则登记到大厅并创建路由；
 * - 收到文本帧：交给该连接的 CommandRouter；
 * - 连接关闭：路由负责离开对局，目录负责移出大厅。
 */
@Slf4j
@Component
public class GameWebSocketHandler extends TextWebSocketHandler {

    private static final String PLAYER_PARAM = "player";

    private final SessionDirectory sessions;
    private final BroadcastHub hub;
    private final CommandRouterFactory routerFactory;

    /** sessionId → 路由 */
    private final Map<String, CommandRouter> routers = new ConcurrentHashMap<>();

    @Value("${blockhub.ws.send-time-limit-ms:5000}")
    private int sendTimeLimitMs;

    @Value("${blockhub.ws.buffer-size-limit:524288}")
    private int bufferSizeLimit;

    public GameWebSocketHandler(SessionDirectory sessions, BroadcastHub hub, CommandRouterFactory routerFactory) {
        this.sessions = sessions;
        this.hub = hub;
        this.routerFactory = routerFactory;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        String playerId = playerOf(session);
        Connection connection = new WebSocketConnection(session, playerId, sendTimeLimitMs, bufferSizeLimit);
        if (StringUtils.isBlank(playerId)) {
            log.warn("连接缺少 player 参数，拒绝: session={}, remote={}", session.getId(), session.getRemoteAddress());
            hub.sendAndClose(connection, TetrisMessages.UNAUTHENTICATED, null, TetrisMessages.CLOSE_UNAUTHORIZED);
            return;
        }
        sessions.register(connection);
        routers.put(session.getId(), routerFactory.create(connection));
        log.info("connection opened: session={}, player={}, remote={}", session.getId(), playerId, session.getRemoteAddress());
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        CommandRouter router = routers.get(session.getId());
        if (router == null) {
            log.debug("frame on unregistered session ignored: {}", session.getId());
            return;
        }
        router.handle(message.getPayload());
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        log.warn("transport error: session={}, ex={}", session.getId(), exception.toString());
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        CommandRouter router = routers.remove(session.getId());
        if (router != null) {
            router.onClose();
        }
        hub.release(session.getId());
        log.info("connection closed: session={}, status={}", session.getId(), status);
    }

    private String playerOf(WebSocketSession session) {
        if (session.getUri() == null) {
            return null;
        }
        return UriComponentsBuilder.fromUri(session.getUri()).build().getQueryParams().getFirst(PLAYER_PARAM);
    }
}
