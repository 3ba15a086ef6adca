package com.blockhub.gameservice.games.tetris.application;

import com.blockhub.gameservice.application.user.PlayerDirectoryService;
import com.blockhub.gameservice.engine.core.GameEventListener;
import com.blockhub.gameservice.games.tetris.domain.enums.GameEventType;
import com.blockhub.gameservice.games.tetris.domain.model.Participant;
import com.blockhub.gameservice.games.tetris.domain.model.TetrisSnapshot;
import com.blockhub.gameservice.games.tetris.domain.repository.GameRegistry;
import com.blockhub.gameservice.games.tetris.interfaces.ws.dto.TetrisMessages;
import com.blockhub.gameservice.platform.ws.BroadcastHub;
import com.blockhub.gameservice.platform.ws.SessionDirectory;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * 引擎事件 → 出站消息。
 * 对局范围收到与引擎事件同名的快照推送；影响大厅展示的事件额外推送 games_list。
 * 运行在引擎 monitor 内，只做收件人解析与投递提交，不做耗时操作。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class GameEventRelay implements GameEventListener<TetrisSnapshot, GameEventType> {

    private final BroadcastHub hub;
    private final SessionDirectory sessions;
    private final GameRegistry registry;
    private final PlayerDirectoryService playerDirectory;

    @Override
    public void onEvent(TetrisSnapshot snapshot, GameEventType event) {
        String gameId = snapshot.id();
        hub.toGame(gameId, event.wireName(), snapshot);
        switch (event) {
            case STARTED, CONFIG_UPDATED -> broadcastGames();
            case PLAYER_ADDED, PLAYER_REMOVED -> {
                hub.toGame(gameId, TetrisMessages.PARTICIPANT_LIST, Participant.listOf(snapshot, playerDirectory::nameOf));
                broadcastGames();
            }
            case STOPPED -> {
                registry.evict(gameId);
                sessions.releaseGame(gameId);
                log.info("对局结束，已释放: id={}", gameId);
                broadcastGames();
            }
            default -> {
                // 其余事件只推送到对局范围
            }
        }
    }

    /** 大厅推送当前全部对局 */
    public void broadcastGames() {
        hub.toLobby(TetrisMessages.GAMES_LIST, registry.all().stream().map(GameEngine::getState).toList());
    }
}
