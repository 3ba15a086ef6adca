package com.blockhub.gameservice.games.tetris.application;

import com.blockhub.gameservice.clock.scheduler.RecordingTickScheduler;
import com.blockhub.gameservice.games.tetris.domain.enums.GameEventType;
import com.blockhub.gameservice.games.tetris.domain.enums.GameStatus;
import com.blockhub.gameservice.games.tetris.domain.model.Block;
import com.blockhub.gameservice.games.tetris.domain.model.GameConfig;
import com.blockhub.gameservice.games.tetris.domain.model.PlayerState;
import com.blockhub.gameservice.games.tetris.domain.model.TetrisSnapshot;
import com.blockhub.gameservice.games.tetris.domain.model.TetrisState;
import com.blockhub.gameservice.games.tetris.domain.model.Vector;
import com.blockhub.gameservice.games.tetris.domain.rule.BlockGenerator;
import com.blockhub.gameservice.games.tetris.domain.rule.GravityPolicy;
import com.blockhub.gameservice.games.tetris.domain.rule.ShapeCatalog;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Random;
import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * 引擎测试：不启动真实定时器，手动调用 tick；时间由 AtomicLong 控制；
 * 形状目录只放竖条，结果可预期。
 */
class GameEngineTest {

    private static final List<Vector> VERTICAL_I = ShapeCatalog.SHAPES.get(0);

    private final AtomicLong clock = new AtomicLong();
    private final List<GameEventType> events = new ArrayList<>();
    private RecordingTickScheduler scheduler;
    private TetrisState state;

    @BeforeEach
    void setUp() {
        scheduler = new RecordingTickScheduler();
        events.clear();
    }

    private GameEngine engine(int cols, int rows) {
        return engine(cols, rows, new BlockGenerator(List.of(VERTICAL_I), new Random(1)));
    }

    private GameEngine engine(int cols, int rows, BlockGenerator generator) {
        state = new TetrisState("g1", "p1", new GameConfig(cols, rows, "test"));
        GameEngine engine = new GameEngine(state, generator, scheduler, 10, GravityPolicy.fixed(200), clock::get);
        engine.addListener((snapshot, event) -> events.add(event));
        return engine;
    }

    private void downTimes(GameEngine engine, int times) {
        for (int i = 0; i < times; i++) {
            engine.moveDown();
        }
        engine.tick();
    }

    @Test
    void newGameWaitsWithOwnerAsOnlyPlayer() {
        TetrisSnapshot snapshot = engine(10, 20).getState();

        assertThat(snapshot.status()).isEqualTo(GameStatus.WAITING);
        assertThat(snapshot.players()).extracting(PlayerState::playerId).containsExactly("p1");
        assertThat(snapshot.matrix()).isEmpty();
        assertThat(snapshot.activeBlock()).isNull();
    }

    @Test
    void startSpawnsBlocksAndSchedulesTicks() {
        GameEngine engine = engine(10, 20);

        engine.start();

        TetrisSnapshot snapshot = engine.getState();
        assertThat(snapshot.status()).isEqualTo(GameStatus.RUNNING);
        assertThat(snapshot.blockCount()).isEqualTo(1);
        assertThat(snapshot.activeBlock().origin()).isEqualTo(new Vector(5, 0));
        assertThat(snapshot.nextBlock()).isNotNull();
        assertThat(snapshot.matrix()).hasDimensions(20, 10);
        assertThat(events).containsExactly(GameEventType.STATUS_CHANGED, GameEventType.STARTED);
        assertThat(scheduler.isActive("g1")).isTrue();
    }

    @Test
    void startTwiceIsIgnored() {
        GameEngine engine = engine(10, 20);
        engine.start();
        events.clear();

        engine.start();

        assertThat(events).isEmpty();
    }

    @Test
    void verticalBarLocksOnBottomRows() {
        GameEngine engine = engine(10, 20);
        engine.start();

        // 竖条从 y=0 落到 y=16 需要 16 步，第 17 步触底锁定
        downTimes(engine, 17);

        TetrisSnapshot snapshot = engine.getState();
        assertThat(snapshot.activeBlock()).isNull();
        assertThat(snapshot.lineCount()).isZero();
        assertThat(snapshot.blockCount()).isEqualTo(1);
        for (int y = 16; y < 20; y++) {
            assertThat(snapshot.matrix()[y][5]).isEqualTo(1);
        }
        assertThat(snapshot.matrix()[15][5]).isZero();
        assertThat(events).contains(GameEventType.ROUND_DONE, GameEventType.LOOPED);
        assertThat(events).doesNotContain(GameEventType.LINES_COMPLETED);

        // 下一次移动先把 next 提升为 active
        downTimes(engine, 1);
        snapshot = engine.getState();
        assertThat(snapshot.blockCount()).isEqualTo(2);
        assertThat(snapshot.activeBlock().origin()).isEqualTo(new Vector(5, 0));
        assertThat(events).contains(GameEventType.BLOCK_CREATED, GameEventType.NEXT_BLOCK_CREATED);
    }

    @Test
    void completedRowsAreClearedAndScoredOnLock() {
        GameEngine engine = engine(2, 8);
        engine.start();
        for (int y = 4; y < 8; y++) {
            state.getField().occupy(0, y);
        }

        downTimes(engine, 5);

        TetrisSnapshot snapshot = engine.getState();
        assertThat(snapshot.lineCount()).isEqualTo(4);
        assertThat(snapshot.level()).isZero();
        assertThat(snapshot.players().get(0).points()).isEqualTo(1200);
        assertThat(Arrays.stream(snapshot.matrix()).flatMapToInt(Arrays::stream).sum()).isZero();
        assertThat(events).contains(GameEventType.LINES_COMPLETED);
    }

    @Test
    void linesCompletedCarriesFullRowsBeforeTheyAreDropped() {
        GameEngine engine = engine(2, 8);
        List<int[][]> atLinesCompleted = new ArrayList<>();
        engine.addListener((snapshot, event) -> {
            if (event == GameEventType.LINES_COMPLETED) {
                atLinesCompleted.add(snapshot.matrix());
            }
        });
        engine.start();
        for (int y = 4; y < 8; y++) {
            state.getField().occupy(0, y);
        }

        downTimes(engine, 5);

        assertThat(atLinesCompleted).hasSize(1);
        int[][] matrix = atLinesCompleted.get(0);
        for (int y = 4; y < 8; y++) {
            assertThat(matrix[y]).containsExactly(1, 1);
        }
        assertThat(engine.getState().lineCount()).isEqualTo(4);
        assertThat(Arrays.stream(engine.getState().matrix()).flatMapToInt(Arrays::stream).sum()).isZero();
    }

    @Test
    void inputBeforeStartIsDiscarded() {
        GameEngine engine = engine(10, 20);
        engine.moveLeft();
        engine.moveLeft();
        engine.moveDown();

        engine.start();
        engine.tick();

        TetrisSnapshot snapshot = engine.getState();
        assertThat(snapshot.activeBlock().origin()).isEqualTo(new Vector(5, 0));
        assertThat(snapshot.stepCount()).isZero();
    }

    @Test
    void gravityMovesBlockAfterDelay() {
        GameEngine engine = engine(10, 20);
        engine.start();
        events.clear();

        clock.set(200);
        engine.tick();
        assertThat(engine.getState().activeBlock().origin()).isEqualTo(new Vector(5, 0));
        assertThat(events).isEmpty();

        clock.set(201);
        engine.tick();
        assertThat(engine.getState().activeBlock().origin()).isEqualTo(new Vector(5, 1));
        assertThat(events).containsExactly(GameEventType.LOOPED);
    }

    @Test
    void queuedInputIsConsumedInOrderWithinOneTick() {
        GameEngine engine = engine(10, 20);
        engine.start();

        engine.moveLeft();
        engine.moveLeft();
        engine.moveRight();
        engine.moveDown();
        assertThat(engine.getState().activeBlock().origin()).isEqualTo(new Vector(5, 0));

        engine.tick();

        assertThat(engine.getState().activeBlock().origin()).isEqualTo(new Vector(4, 1));
        assertThat(engine.getState().stepCount()).isEqualTo(4);
    }

    @Test
    void movesAgainstTheWallAreRejected() {
        GameEngine engine = engine(1, 6);
        engine.start();

        engine.moveLeft();
        engine.moveRight();
        engine.tick();

        assertThat(engine.getState().activeBlock().origin()).isEqualTo(new Vector(0, 0));
    }

    @Test
    void rotationIsAppliedWhenThereIsRoom() {
        GameEngine engine = engine(10, 20);
        engine.start();
        downTimes(engine, 2);
        long steps = engine.getState().stepCount();

        engine.rotate();
        engine.tick();

        Block active = engine.getState().activeBlock();
        assertThat(active.degrees()).isEqualTo(90);
        assertThat(active.maxY()).isZero();
        assertThat(engine.getState().stepCount()).isEqualTo(steps + 1);
    }

    @Test
    void blockedRotationIsDiscarded() {
        GameEngine engine = engine(1, 6);
        engine.start();

        engine.rotate();
        engine.tick();

        assertThat(engine.getState().activeBlock().degrees()).isZero();
        assertThat(engine.getState().stepCount()).isZero();
    }

    @Test
    void topOutEndsTheGame() {
        GameEngine engine = engine(2, 4);
        engine.start();

        // 第一次 down 锁定，第二次 down 生成的方块无处可放
        downTimes(engine, 2);

        TetrisSnapshot snapshot = engine.getState();
        assertThat(snapshot.status()).isEqualTo(GameStatus.ENDED);
        assertThat(snapshot.blockCount()).isEqualTo(2);
        assertThat(events).endsWith(GameEventType.STATUS_CHANGED, GameEventType.STOPPED);
        assertThat(scheduler.isActive("g1")).isFalse();
    }

    @Test
    void inputAfterStopIsIgnored() {
        GameEngine engine = engine(10, 20);
        engine.start();
        engine.stop();
        long steps = engine.getState().stepCount();
        events.clear();

        engine.moveLeft();
        engine.moveDown();
        engine.tick();
        engine.stop();

        assertThat(engine.getState().stepCount()).isEqualTo(steps);
        assertThat(events).isEmpty();
        assertThat(scheduler.stopCalls()).isEqualTo(1);
    }

    @Test
    void stopWhileWaitingEndsTheGame() {
        GameEngine engine = engine(10, 20);

        engine.stop();

        assertThat(engine.getState().status()).isEqualTo(GameStatus.ENDED);
        assertThat(events).containsExactly(GameEventType.STATUS_CHANGED, GameEventType.STOPPED);
    }

    @Test
    void configureOnlyWhileWaiting() {
        GameEngine engine = engine(10, 20);

        engine.configure(new GameConfig(6, 12, "renamed"));
        assertThat(engine.getState().cols()).isEqualTo(6);
        assertThat(engine.getState().name()).isEqualTo("renamed");
        assertThat(events).containsExactly(GameEventType.CONFIG_UPDATED);

        engine.start();
        events.clear();
        engine.configure(new GameConfig(3, 3, "late"));

        assertThat(engine.getState().cols()).isEqualTo(6);
        assertThat(engine.getState().rows()).isEqualTo(12);
        assertThat(events).isEmpty();
    }

    @Test
    void playersJoinOnlyWhileWaitingAndOnlyOnce() {
        GameEngine engine = engine(10, 20);

        engine.addPlayer("p2");
        engine.addPlayer("p2");
        engine.start();
        engine.addPlayer("p3");

        assertThat(engine.getState().players()).extracting(PlayerState::playerId).containsExactly("p1", "p2");
        assertThat(events).containsOnlyOnce(GameEventType.PLAYER_ADDED);
    }

    @Test
    void removingUnknownPlayerEmitsNothing() {
        GameEngine engine = engine(10, 20);

        engine.removePlayer("stranger");
        assertThat(events).isEmpty();

        engine.removePlayer("p1");
        assertThat(events).containsExactly(GameEventType.PLAYER_REMOVED);
        assertThat(engine.getState().players()).isEmpty();
    }

    @Test
    void turnPassesToNextPlayerAfterLock() {
        GameEngine engine = engine(10, 20);
        engine.addPlayer("p2");
        engine.start();
        assertThat(engine.isCurrentPlayer("p1")).isTrue();

        downTimes(engine, 17);

        assertThat(engine.isCurrentPlayer("p2")).isTrue();
        assertThat(engine.getState().currentPlayer()).isEqualTo(1);
    }

    @Test
    void pausedGameNeitherFallsNorConsumesInput() {
        GameEngine engine = engine(10, 20);
        engine.start();
        engine.pause();
        assertThat(engine.getState().status()).isEqualTo(GameStatus.PAUSED);

        engine.moveDown();
        clock.set(1_000);
        engine.tick();

        assertThat(engine.getState().activeBlock().origin()).isEqualTo(new Vector(5, 0));
    }

    @Test
    void stoppingGameOnlyDrainsQueuedInput() {
        GameEngine engine = engine(10, 20);
        engine.start();
        engine.beginStopping();
        assertThat(engine.getState().status()).isEqualTo(GameStatus.STOPPING);

        // STOPPING 状态不再移动，只消费掉队列
        engine.moveDown();
        engine.tick();
        clock.set(1_000);
        engine.tick();

        assertThat(engine.getState().activeBlock().origin()).isEqualTo(new Vector(5, 0));
        assertThat(engine.getState().status()).isEqualTo(GameStatus.STOPPING);
    }

    @Test
    void failingListenerDoesNotBreakTheEngine() {
        GameEngine engine = engine(10, 20);
        engine.addListener((snapshot, event) -> {
            throw new IllegalStateException("listener down");
        });
        List<GameEventType> after = new ArrayList<>();
        engine.addListener((snapshot, event) -> after.add(event));

        engine.start();

        assertThat(engine.getState().status()).isEqualTo(GameStatus.RUNNING);
        assertThat(after).containsExactly(GameEventType.STATUS_CHANGED, GameEventType.STARTED);
    }

    @Test
    void exceptionDuringTickEndsOnlyThatGame() {
        BlockGenerator generator = mock(BlockGenerator.class);
        Block bar = new Block(new Vector(1, 0), VERTICAL_I, 0);
        when(generator.next(any())).thenReturn(bar, bar).thenThrow(new IllegalStateException("No elements in bag left"));
        GameEngine engine = engine(2, 4, generator);
        engine.start();

        // 锁定后生成下一个方块时取袋子失败
        downTimes(engine, 2);

        assertThat(engine.getState().status()).isEqualTo(GameStatus.ENDED);
        assertThat(events).contains(GameEventType.STOPPED);
    }
}
