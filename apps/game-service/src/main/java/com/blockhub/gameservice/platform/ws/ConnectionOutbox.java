package com.blockhub.gameservice.platform.ws;

import lombok.extern.slf4j.Slf4j;
import org.springframework.web.socket.CloseStatus;

import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.LongSupplier;

/**
 * 单条连接的出站队列。
 * 帧按入队顺序在共享线程池上串行写出，同一时刻每条连接最多占用一个线程；
 * 连接忙（有帧正在写或排队）时再入队，若写出已超过发送时限或排队字符数超过缓冲上限，
 * 直接关闭连接并丢弃剩余帧。
 */
@Slf4j
final class ConnectionOutbox {

    static final int CLOSE_SLOW_CONSUMER = CloseStatus.SESSION_NOT_RELIABLE.getCode();

    private record Outbound(String frame, Integer closeCode) {
    }

    private final Connection connection;
    private final Executor executor;
    private final long sendTimeLimitMs;
    private final int bufferSizeLimit;
    private final LongSupplier clock;
    private final Runnable onClosed;

    private final Queue<Outbound> queue = new ConcurrentLinkedQueue<>();
    private final AtomicBoolean scheduled = new AtomicBoolean();
    private final AtomicInteger bufferedChars = new AtomicInteger();

    /** 当前帧开始写出的时间，0 表示空闲 */
    private volatile long sendStartedAt;
    private volatile boolean closed;

    ConnectionOutbox(Connection connection, Executor executor, long sendTimeLimitMs, int bufferSizeLimit,
                     LongSupplier clock, Runnable onClosed) {
        this.connection = connection;
        this.executor = executor;
        this.sendTimeLimitMs = sendTimeLimitMs;
        this.bufferSizeLimit = bufferSizeLimit;
        this.clock = clock;
        this.onClosed = onClosed;
    }

    /**
     * 入队一帧
     * @param closeCode 非空时写出该帧后以此关闭连接
     */
    void offer(String frame, Integer closeCode) {
        if (closed) {
            return;
        }
        if (scheduled.get() && limitExceeded(frame.length())) {
            return;
        }
        bufferedChars.addAndGet(frame.length());
        queue.add(new Outbound(frame, closeCode));
        schedule();
    }

    private boolean limitExceeded(int incoming) {
        long started = sendStartedAt;
        if (started > 0 && clock.getAsLong() - started > sendTimeLimitMs) {
            abandon("send time limit " + sendTimeLimitMs + " ms exceeded");
            return true;
        }
        if (bufferedChars.get() + incoming > bufferSizeLimit) {
            abandon("buffer size limit " + bufferSizeLimit + " exceeded");
            return true;
        }
        return false;
    }

    private void abandon(String reason) {
        closed = true;
        queue.clear();
        log.warn("慢连接超限已关闭: id={}, player={}, reason={}", connection.id(), connection.playerId(), reason);
        connection.close(CLOSE_SLOW_CONSUMER, null);
        onClosed.run();
    }

    private void schedule() {
        if (!scheduled.compareAndSet(false, true)) {
            return;
        }
        try {
            executor.execute(this::drain);
        } catch (RejectedExecutionException e) {
            scheduled.set(false);
            log.warn("广播任务被拒绝: id={}, ex={}", connection.id(), e.toString());
        }
    }

    private void drain() {
        try {
            Outbound next;
            while (!closed && (next = queue.poll()) != null) {
                bufferedChars.addAndGet(-next.frame().length());
                write(next);
            }
        } finally {
            scheduled.set(false);
        }
        if (!closed && !queue.isEmpty()) {
            schedule();
        }
    }

    private void write(Outbound outbound) {
        sendStartedAt = Math.max(1L, clock.getAsLong());
        try {
            connection.send(outbound.frame());
        } catch (RuntimeException e) {
            log.warn("broadcast send failed: id={}, ex={}", connection.id(), e.toString());
        } finally {
            sendStartedAt = 0L;
        }
        if (outbound.closeCode() != null && !closed) {
            closed = true;
            queue.clear();
            connection.close(outbound.closeCode(), null);
            onClosed.run();
        }
    }
}
