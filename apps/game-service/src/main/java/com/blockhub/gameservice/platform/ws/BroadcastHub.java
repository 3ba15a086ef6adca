package com.blockhub.gameservice.platform.ws;

import com.blockhub.gameservice.platform.transport.CommandResponse;
import com.blockhub.gameservice.platform.transport.WireCodec;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.function.LongSupplier;
import java.util.function.Supplier;

/**
 * 出站消息中心。
 * 收件人与帧内容在调用线程上立即确定，写 socket 交给每条连接自己的 {@link ConnectionOutbox}：
 * 同一连接内保持顺序，不同连接在 broadcastExecutor 上并行写出，慢连接只拖慢自己。
 * 投递语义为至多一次：失败只记日志，不重试。
 */
@Slf4j
@Component
public class BroadcastHub {

    public static final String GAME_NOT_FOUND_EVENT = "game_not_found";

    private final SessionDirectory directory;
    private final WireCodec codec;
    private final Executor executor;
    private final long sendTimeLimitMs;
    private final int bufferSizeLimit;
    private final LongSupplier clock;

    /** connectionId → 出站队列 */
    private final Map<String, ConnectionOutbox> outboxes = new ConcurrentHashMap<>();

    @Autowired
    public BroadcastHub(SessionDirectory directory,
                        WireCodec codec,
                        @Qualifier("broadcastExecutor") Executor executor,
                        @Value("${blockhub.ws.send-time-limit-ms:5000}") long sendTimeLimitMs,
                        @Value("${blockhub.ws.buffer-size-limit:524288}") int bufferSizeLimit) {
        this(directory, codec, executor, sendTimeLimitMs, bufferSizeLimit, System::currentTimeMillis);
    }

    BroadcastHub(SessionDirectory directory, WireCodec codec, Executor executor,
                 long sendTimeLimitMs, int bufferSizeLimit, LongSupplier clock) {
        this.directory = directory;
        this.codec = codec;
        this.executor = executor;
        this.sendTimeLimitMs = sendTimeLimitMs;
        this.bufferSizeLimit = bufferSizeLimit;
        this.clock = clock;
    }

    /** 推送到对局范围；对局没有连接时为空操作 */
    public void toGame(String gameId, String event, Object payload) {
        deliver(directory.connectionsOf(gameId), event, payload);
    }

    /** 推送到大厅（全部连接） */
    public void toLobby(String event, Object payload) {
        deliver(directory.lobby(), event, payload);
    }

    public void toConnection(Connection connection, String event, Object payload) {
        deliver(List.of(connection), event, payload);
    }

    /** 指令应答 */
    public void respond(Connection connection, String commandId, CommandResponse response) {
        publish(List.of(connection), () -> codec.encodeResponse(commandId, response), null);
    }

    /** 应答后关闭连接（帧非法时） */
    public void respondAndClose(Connection connection, String commandId, CommandResponse response, int closeCode) {
        publish(List.of(connection), () -> codec.encodeResponse(commandId, response), closeCode);
    }

    /** 发送事件后关闭连接（握手缺少身份时） */
    public void sendAndClose(Connection connection, String event, Object payload, int closeCode) {
        publish(List.of(connection), () -> codec.encodeEvent(event, payload), closeCode);
    }

    /** 连接关闭后丢弃其出站队列 */
    public void release(String connectionId) {
        outboxes.remove(connectionId);
    }

    /** game_not_found 发给调用者以及该对局范围 */
    public void gameNotFound(Connection caller, String gameId) {
        List<Connection> recipients = new ArrayList<>(directory.connectionsOf(gameId));
        if (recipients.stream().noneMatch(c -> c.id().equals(caller.id()))) {
            recipients.add(caller);
        }
        deliver(recipients, GAME_NOT_FOUND_EVENT, gameId);
    }

    private void deliver(List<Connection> recipients, String event, Object payload) {
        publish(recipients, () -> codec.encodeEvent(event, payload), null);
    }

    private void publish(List<Connection> recipients, Supplier<String> encoder, Integer closeCode) {
        if (recipients.isEmpty()) {
            return;
        }
        String frame;
        try {
            frame = encoder.get();
        } catch (IllegalStateException e) {
            log.warn("出站帧序列化失败，丢弃: {}", e.toString());
            return;
        }
        for (Connection c : recipients) {
            if (!c.isOpen()) {
                continue;
            }
            outboxes.computeIfAbsent(c.id(), id -> new ConnectionOutbox(
                            c, executor, sendTimeLimitMs, bufferSizeLimit, clock, () -> release(id)))
                    .offer(frame, closeCode);
        }
    }
}
