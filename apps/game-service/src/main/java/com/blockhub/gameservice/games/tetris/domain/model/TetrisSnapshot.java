package com.blockhub.gameservice.games.tetris.domain.model;

import com.blockhub.gameservice.games.tetris.domain.enums.GameStatus;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * 对局只读快照：广播、send_state、大厅列表都用它序列化。
 * matrix 为 rows × cols 的深拷贝，持有者修改它不会影响引擎。
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TetrisSnapshot(
        String id,
        String owner,
        String name,
        int cols,
        int rows,
        GameStatus status,
        int[][] matrix,
        Block activeBlock,
        Block nextBlock,
        int blockCount,
        int lineCount,
        int level,
        List<PlayerState> players,
        int currentPlayer,
        long stepCount
) {

    public boolean isOwner(String playerId) {
        return owner.equals(playerId);
    }

    /** players[currentPlayer] 是否为该玩家 */
    public boolean isCurrentPlayer(String playerId) {
        if (playerId == null || players.isEmpty() || currentPlayer >= players.size()) {
            return false;
        }
        return playerId.equals(players.get(currentPlayer).playerId());
    }
}
