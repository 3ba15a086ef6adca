package com.blockhub.gameservice.games.tetris.domain.model;

import com.blockhub.gameservice.engine.core.GameState;
import com.blockhub.gameservice.games.tetris.domain.enums.GameStatus;
import com.blockhub.gameservice.games.tetris.domain.rule.CollisionField;
import lombok.Getter;
import lombok.Setter;

import java.util.ArrayList;
import java.util.List;

/**
 * 对局状态：一局游戏的“单一事实来源”。
 * - 棋盘（CollisionField）在 start 时按当时的 cols/rows 创建，此后尺寸不变；
 * - 只由 GameEngine 在持有对局锁时修改；
 * - 对外只暴露 snapshot()。
 */
@Getter
@Setter
public class TetrisState implements GameState<TetrisSnapshot> {

    private final String id;
    private final String owner;

    private int cols;
    private int rows;
    private String name;

    private GameStatus status = GameStatus.WAITING;

    /** waiting 阶段为 null */
    private CollisionField field;

    private Block activeBlock;
    private Block nextBlock;

    private int blockCount;
    private int lineCount;
    private int level;

    private final List<PlayerState> players = new ArrayList<>();
    private int currentPlayerIndex;

    private long stepCount;

    public TetrisState(String id, String owner, GameConfig config) {
        this.id = id;
        this.owner = owner;
        apply(config);
        // 房主自动成为第一位玩家
        players.add(PlayerState.joined(owner));
    }

    public void apply(GameConfig config) {
        this.cols = config.getCols();
        this.rows = config.getRows();
        this.name = config.getName();
    }

    public boolean hasPlayer(String playerId) {
        return players.stream().anyMatch(p -> p.playerId().equals(playerId));
    }

    /**
     * 移除玩家，并保证 currentPlayerIndex 仍指向有效下标。
     * @return 是否真的移除了
     */
    public boolean removePlayer(String playerId) {
        for (int i = 0; i < players.size(); i++) {
            if (players.get(i).playerId().equals(playerId)) {
                players.remove(i);
                if (i < currentPlayerIndex) {
                    currentPlayerIndex--;
                }
                if (currentPlayerIndex >= players.size()) {
                    currentPlayerIndex = 0;
                }
                return true;
            }
        }
        return false;
    }

    /** 给当前玩家加分；没有玩家时忽略 */
    public void awardCurrentPlayer(long points) {
        if (players.isEmpty()) {
            return;
        }
        players.set(currentPlayerIndex, players.get(currentPlayerIndex).award(points));
    }

    /** 轮到下一位玩家（轮转） */
    public void advanceTurn() {
        if (players.size() > 1) {
            currentPlayerIndex = (currentPlayerIndex + 1) % players.size();
        }
    }

    public void incrementStepCount() {
        stepCount++;
    }

    public void incrementBlockCount() {
        blockCount++;
    }

    @Override
    public TetrisSnapshot snapshot() {
        int[][] matrix = field == null ? new int[0][] : field.toArray();
        return new TetrisSnapshot(id, owner, name, cols, rows, status, matrix,
                activeBlock, nextBlock, blockCount, lineCount, level,
                List.copyOf(players), currentPlayerIndex, stepCount);
    }
}
