package com.blockhub.gameservice.games.tetris.application;

import com.blockhub.gameservice.clock.scheduler.TickScheduler;
import com.blockhub.gameservice.engine.core.GameEventListener;
import com.blockhub.gameservice.games.tetris.domain.enums.Action;
import com.blockhub.gameservice.games.tetris.domain.enums.GameEventType;
import com.blockhub.gameservice.games.tetris.domain.enums.GameStatus;
import com.blockhub.gameservice.games.tetris.domain.model.Block;
import com.blockhub.gameservice.games.tetris.domain.model.GameConfig;
import com.blockhub.gameservice.games.tetris.domain.model.PlayerState;
import com.blockhub.gameservice.games.tetris.domain.model.TetrisSnapshot;
import com.blockhub.gameservice.games.tetris.domain.model.TetrisState;
import com.blockhub.gameservice.games.tetris.domain.model.Vector;
import com.blockhub.gameservice.games.tetris.domain.rule.BlockGenerator;
import com.blockhub.gameservice.games.tetris.domain.rule.CollisionField;
import com.blockhub.gameservice.games.tetris.domain.rule.GravityPolicy;
import com.blockhub.gameservice.games.tetris.domain.rule.LineScoring;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.LongSupplier;

/**
 * GameEngine
 * -------------------------------------------------
 * 单局游戏引擎：一局一个实例，是该局状态的唯一写者。
 *
 * 并发模型：
 * - tick 与所有生命周期/房主操作（start/stop/pause/configure/加人/踢人）都在 monitor 上串行执行；
 * - 方向/旋转指令只入队（ConcurrentLinkedQueue），由下一次 tick 统一消费，这是唯一的跨线程交互点；
 * - 读者通过 getState() 拿到 volatile 的不可变快照。
 *
 * tick 流程：
 * 1) 队列非空：按 FIFO 全部消费，发布 looped 后返回；
 * 2) STOPPING：不再下落；
 * 3) 距上次下落超过 gravity.delayFor(level)：下落一格并发布 looped。
 */
@Slf4j
public class GameEngine {

    private final Object monitor = new Object();

    private final TetrisState state;
    private final BlockGenerator generator;
    private final TickScheduler scheduler;
    private final long tickMillis;
    private final GravityPolicy gravity;
    private final LongSupplier clock;

    /** 待消费的玩家输入 */
    private final Queue<Action> inputQueue = new ConcurrentLinkedQueue<>();

    private final List<GameEventListener<TetrisSnapshot, GameEventType>> listeners = new CopyOnWriteArrayList<>();

    /** 上次重力下落时间（毫秒），只在 monitor 内读写 */
    private long lastGravityAt;

    private volatile TetrisSnapshot snapshot;

    public GameEngine(TetrisState state,
                      BlockGenerator generator,
                      TickScheduler scheduler,
                      long tickMillis,
                      GravityPolicy gravity,
                      LongSupplier clock) {
        this.state = state;
        this.generator = generator;
        this.scheduler = scheduler;
        this.tickMillis = tickMillis;
        this.gravity = gravity;
        this.clock = clock;
        this.snapshot = state.snapshot();
    }

    public String id() {
        return state.getId();
    }

    /** 最近一次提交的只读快照 */
    public TetrisSnapshot getState() {
        return snapshot;
    }

    public void addListener(GameEventListener<TetrisSnapshot, GameEventType> listener) {
        listeners.add(listener);
    }

    // ===================== 玩家/配置（仅 waiting 阶段） =====================

    public void addPlayer(String playerId) {
        synchronized (monitor) {
            if (state.getStatus() != GameStatus.WAITING || state.hasPlayer(playerId)) {
                return;
            }
            state.getPlayers().add(PlayerState.joined(playerId));
            publish(GameEventType.PLAYER_ADDED);
        }
    }

    public void removePlayer(String playerId) {
        synchronized (monitor) {
            if (state.removePlayer(playerId)) {
                publish(GameEventType.PLAYER_REMOVED);
            }
        }
    }

    public void configure(GameConfig config) {
        synchronized (monitor) {
            if (state.getStatus() != GameStatus.WAITING) {
                return;
            }
            state.apply(config);
            publish(GameEventType.CONFIG_UPDATED);
        }
    }

    public boolean isCurrentPlayer(String playerId) {
        return snapshot.isCurrentPlayer(playerId);
    }

    // ===================== 输入（只入队） =====================

    public void moveLeft() { enqueue(Action.LEFT); }

    public void moveRight() { enqueue(Action.RIGHT); }

    public void moveDown() { enqueue(Action.DOWN); }

    public void rotate() { enqueue(Action.ROTATE); }

    /** 未开始或已结束的对局丢弃输入 */
    private void enqueue(Action action) {
        GameStatus status = snapshot.status();
        if (status != GameStatus.RUNNING && status != GameStatus.PAUSED && status != GameStatus.STOPPING) {
            return;
        }
        inputQueue.add(action);
    }

    // ===================== 生命周期 =====================

    public void start() {
        synchronized (monitor) {
            if (state.getStatus() != GameStatus.WAITING) {
                return;
            }
            CollisionField field = new CollisionField(state.getCols(), state.getRows());
            state.setField(field);
            state.setStatus(GameStatus.RUNNING);
            state.setActiveBlock(createBlock());
            state.setNextBlock(createBlock());
            state.incrementBlockCount();
            field.draw(state.getActiveBlock());
            lastGravityAt = clock.getAsLong();
            log.info("game started: id={}, size={}x{}, players={}",
                    state.getId(), state.getCols(), state.getRows(), state.getPlayers().size());
            publish(GameEventType.STATUS_CHANGED);
            publish(GameEventType.STARTED);
            scheduler.start(state.getId(), tickMillis, this::tick);
        }
    }

    /**
     * 结束对局：取消 tick、丢弃未消费输入、进入 ENDED。已结束时为空操作。
     */
    public void stop() {
        synchronized (monitor) {
            if (state.getStatus() == GameStatus.ENDED) {
                return;
            }
            scheduler.stop(state.getId());
            inputQueue.clear();
            state.setStatus(GameStatus.ENDED);
            log.info("game stopped: id={}, blocks={}, lines={}", state.getId(), state.getBlockCount(), state.getLineCount());
            publish(GameEventType.STATUS_CHANGED);
            publish(GameEventType.STOPPED);
        }
    }

    /** 会话中断：暂停消费与下落，保留队列 */
    public void pause() {
        transition(GameStatus.PAUSED);
    }

    /** 收尾：停止下落，只消费已排队输入 */
    public void beginStopping() {
        transition(GameStatus.STOPPING);
    }

    private void transition(GameStatus target) {
        synchronized (monitor) {
            if (state.getStatus() != GameStatus.RUNNING || !state.getStatus().canTransitionTo(target)) {
                return;
            }
            state.setStatus(target);
            publish(GameEventType.STATUS_CHANGED);
        }
    }

    // ===================== tick =====================

    /**
     * 一次 tick。由调度器周期调用；测试中可直接调用。
     * 任何运行时异常只结束本局，不会影响其他对局。
     */
    public void tick() {
        synchronized (monitor) {
            try {
                advance(clock.getAsLong());
            } catch (RuntimeException e) {
                log.error("game engine failed, ending game: id={}", state.getId(), e);
                stop();
            }
        }
    }

    private void advance(long now) {
        GameStatus status = state.getStatus();
        if (status == GameStatus.ENDED) {
            inputQueue.clear();
            return;
        }
        if (status == GameStatus.WAITING || status == GameStatus.PAUSED) {
            return;
        }
        if (!inputQueue.isEmpty()) {
            Action action;
            while ((action = inputQueue.poll()) != null) {
                apply(action);
                if (state.getStatus() == GameStatus.ENDED) {
                    inputQueue.clear();
                    return;
                }
            }
            publish(GameEventType.LOOPED);
            return;
        }
        if (status == GameStatus.STOPPING) {
            return;
        }
        if (now - lastGravityAt > gravity.delayFor(state.getLevel())) {
            lastGravityAt = now;
            move(Action.DOWN);
            if (state.getStatus() != GameStatus.ENDED) {
                publish(GameEventType.LOOPED);
            }
        }
    }

    private void apply(Action action) {
        switch (action) {
            case ROTATE -> rotateActive();
            case LEFT, RIGHT, DOWN -> move(action);
        }
    }

    // ===================== 规则 =====================

    private void move(Action direction) {
        if (state.getStatus() != GameStatus.RUNNING) {
            return;
        }
        state.incrementStepCount();
        Block active = state.getActiveBlock();
        if (active == null) {
            spawnNextBlock();
            return;
        }
        CollisionField field = state.getField();
        // 先擦掉自己，才能可靠地判断目标位置是否空闲
        field.erase(active);
        Block candidate = switch (direction) {
            case DOWN -> active.shift(0, 1);
            case LEFT -> active.shift(-1, 0);
            case RIGHT -> active.shift(1, 0);
            default -> active;
        };
        if (field.isBlocked(candidate)) {
            field.draw(active);
            if (direction == Action.DOWN) {
                lockActiveBlock();
            }
            return;
        }
        state.setActiveBlock(candidate);
        field.draw(candidate);
    }

    private void lockActiveBlock() {
        state.setActiveBlock(null);
        publish(GameEventType.ROUND_DONE);
        clearCompletedLines();
        state.advanceTurn();
    }

    private void spawnNextBlock() {
        Block promoted = state.getNextBlock();
        state.setActiveBlock(promoted);
        state.setNextBlock(createBlock());
        state.incrementBlockCount();
        CollisionField field = state.getField();
        boolean toppedOut = field.isBlocked(promoted);
        field.draw(promoted);
        publish(GameEventType.BLOCK_CREATED);
        publish(GameEventType.NEXT_BLOCK_CREATED);
        if (toppedOut) {
            log.info("board topped out: id={}", state.getId());
            stop();
        }
    }

    private void rotateActive() {
        Block active = state.getActiveBlock();
        if (active == null || state.getStatus() != GameStatus.RUNNING) {
            return;
        }
        Block rotated = CollisionField.rotateClockwise(active);
        CollisionField field = state.getField();
        field.erase(active);
        if (field.isBlocked(rotated)) {
            field.draw(active);
            return;
        }
        state.setActiveBlock(rotated);
        field.draw(rotated);
        state.incrementStepCount();
    }

    private void clearCompletedLines() {
        CollisionField field = state.getField();
        List<Integer> completed = field.completedRows();
        if (completed.isEmpty()) {
            return;
        }
        state.setLineCount(state.getLineCount() + completed.size());
        state.setLevel(LineScoring.levelFor(state.getLineCount()));
        state.awardCurrentPlayer(LineScoring.points(completed.size(), state.getLevel()));
        // 事件快照中仍保留满行，之后再消行
        publish(GameEventType.LINES_COMPLETED);
        field.dropRows(completed);
    }

    private Block createBlock() {
        return generator.next(new Vector(Math.floorDiv(state.getCols(), 2), 0));
    }

    /**
     * 刷新快照并同步通知监听器；单个监听器失败不影响引擎和其他监听器。
     */
    private void publish(GameEventType event) {
        TetrisSnapshot current = state.snapshot();
        snapshot = current;
        for (GameEventListener<TetrisSnapshot, GameEventType> listener : listeners) {
            try {
                listener.onEvent(current, event);
            } catch (RuntimeException e) {
                log.warn("game listener failed: id={}, event={}", state.getId(), event, e);
            }
        }
    }
}
