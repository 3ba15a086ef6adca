package com.blockhub.gameservice.platform.ws;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 连接目录：维护两种广播范围。
 * - 大厅：所有已登记的连接；
 * - 对局：与某个 gameId 关联的连接（一条连接同一时刻最多关联一局）。
 */
@Slf4j
@Component
public class SessionDirectory {

    /** connectionId → 连接 */
    private final Map<String, Connection> connections = new ConcurrentHashMap<>();

    /** connectionId → gameId */
    private final Map<String, String> gameByConnection = new ConcurrentHashMap<>();

    /** 连接建立：加入大厅 */
    public void register(Connection connection) {
        connections.put(connection.id(), connection);
    }

    /** 连接关闭：移出大厅，并解除对局关联 */
    public void unregister(Connection connection) {
        connections.remove(connection.id());
        gameByConnection.remove(connection.id());
    }

    /** 关联到对局（覆盖旧关联） */
    public void associate(Connection connection, String gameId) {
        String previous = gameByConnection.put(connection.id(), gameId);
        if (previous != null && !previous.equals(gameId)) {
            log.debug("connection re-associated: id={}, {} -> {}", connection.id(), previous, gameId);
        }
    }

    public void release(Connection connection) {
        gameByConnection.remove(connection.id());
    }

    public Optional<String> gameOf(Connection connection) {
        return Optional.ofNullable(gameByConnection.get(connection.id()));
    }

    /** 当前关联到该对局的连接 */
    public List<Connection> connectionsOf(String gameId) {
        List<Connection> out = new ArrayList<>();
        if (gameId == null) {
            return out;
        }
        gameByConnection.forEach((connectionId, gid) -> {
            if (gameId.equals(gid)) {
                Connection c = connections.get(connectionId);
                if (c != null) {
                    out.add(c);
                }
            }
        });
        return out;
    }

    public boolean hasConnections(String gameId) {
        return gameId != null && gameByConnection.containsValue(gameId);
    }

    /** 解除该对局的全部关联（对局结束时） */
    public void releaseGame(String gameId) {
        gameByConnection.values().removeIf(gameId::equals);
    }

    public List<Connection> lobby() {
        return new ArrayList<>(connections.values());
    }
}
