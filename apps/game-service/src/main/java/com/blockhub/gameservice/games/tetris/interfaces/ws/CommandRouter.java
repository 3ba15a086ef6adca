package com.blockhub.gameservice.games.tetris.interfaces.ws;

import com.blockhub.gameservice.application.user.EmptyNameException;
import com.blockhub.gameservice.application.user.NameTakenException;
import com.blockhub.gameservice.application.user.PlayerDirectoryService;
import com.blockhub.gameservice.application.user.PlayerIdentity;
import com.blockhub.gameservice.games.tetris.application.GameEngine;
import com.blockhub.gameservice.games.tetris.application.GameEventRelay;
import com.blockhub.gameservice.games.tetris.domain.constants.GameMessages;
import com.blockhub.gameservice.games.tetris.domain.model.GameConfig;
import com.blockhub.gameservice.games.tetris.domain.model.Participant;
import com.blockhub.gameservice.games.tetris.domain.model.TetrisSnapshot;
import com.blockhub.gameservice.games.tetris.domain.repository.GameRegistry;
import com.blockhub.gameservice.games.tetris.interfaces.ws.dto.TetrisMessages;
import com.blockhub.gameservice.platform.transport.CommandResponse;
import com.blockhub.gameservice.platform.transport.InboundCommand;
import com.blockhub.gameservice.platform.transport.ProtocolParseException;
import com.blockhub.gameservice.platform.transport.WireCodec;
import com.blockhub.gameservice.platform.ws.BroadcastHub;
import com.blockhub.gameservice.platform.ws.Connection;
import com.blockhub.gameservice.platform.ws.SessionDirectory;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * 单条连接的指令路由。
 * ----------------------------------------
 * - 一条连接一个实例，由容器线程按帧顺序调用 handle；
 * - 对局 id 取自连接当前的对局关联（enter_game / create_game 建立）；
 * - 方向/旋转只入队，不应答；其余指令都回 response_&lt;id&gt;。
 *
 * 权限不对称沿用客户端约定：非房主 start_game / cancel_game 静默忽略，
 * 非房主 change_config 返回错误。
 */
@Slf4j
public class CommandRouter {

    private final Connection connection;
    private final GameRegistry registry;
    private final SessionDirectory sessions;
    private final BroadcastHub hub;
    private final WireCodec codec;
    private final PlayerDirectoryService playerDirectory;
    private final GameEventRelay relay;

    private final Map<String, Consumer<InboundCommand>> handlers = new HashMap<>();

    public CommandRouter(Connection connection,
                         GameRegistry registry,
                         SessionDirectory sessions,
                         BroadcastHub hub,
                         WireCodec codec,
                         PlayerDirectoryService playerDirectory,
                         GameEventRelay relay) {
        this.connection = connection;
        this.registry = registry;
        this.sessions = sessions;
        this.hub = hub;
        this.codec = codec;
        this.playerDirectory = playerDirectory;
        this.relay = relay;

        handlers.put(TetrisMessages.CREATE_GAME, this::createGame);
        handlers.put(TetrisMessages.ENTER_GAME, this::enterGame);
        handlers.put(TetrisMessages.LEAVE_GAME, this::leaveGame);
        handlers.put(TetrisMessages.CANCEL_GAME, this::cancelGame);
        handlers.put(TetrisMessages.START_GAME, this::startGame);
        handlers.put(TetrisMessages.CHANGE_CONFIG, this::changeConfig);
        handlers.put(TetrisMessages.MOVE_LEFT, cmd -> input(cmd, GameEngine::moveLeft));
        handlers.put(TetrisMessages.MOVE_RIGHT, cmd -> input(cmd, GameEngine::moveRight));
        handlers.put(TetrisMessages.MOVE_DOWN, cmd -> input(cmd, GameEngine::moveDown));
        handlers.put(TetrisMessages.ROTATE, cmd -> input(cmd, GameEngine::rotate));
        handlers.put(TetrisMessages.SEND_STATE, this::sendState);
        handlers.put(TetrisMessages.SEND_GAMES, this::sendGames);
        handlers.put(TetrisMessages.SEND_PARTICIPANTS, this::sendParticipants);
        handlers.put(TetrisMessages.SIGNUP, this::signup);
        handlers.put(TetrisMessages.LOAD_USER, this::loadUser);
    }

    /**
     * 处理一帧。帧结构非法时应答后关闭连接；其他错误只影响本条指令。
     * @param frame 原始文本帧
     */
    public void handle(String frame) {
        InboundCommand cmd;
        try {
            cmd = codec.decode(frame);
        } catch (ProtocolParseException e) {
            log.warn("非法帧，关闭连接: connection={}, player={}, reason={}", connection.id(), playerId(), e.getMessage());
            hub.respondAndClose(connection, e.getCommandId(),
                    CommandResponse.error(GameMessages.INVALID_FRAME), TetrisMessages.CLOSE_PROTOCOL_ERROR);
            return;
        }
        log.debug("incoming command: connection={}, game={}, command={}",
                connection.id(), sessions.gameOf(connection).orElse(""), cmd.command());

        Consumer<InboundCommand> handler = handlers.get(cmd.command());
        if (handler == null) {
            respond(cmd, CommandResponse.error(GameMessages.formatUnknownCommand(cmd.command(), cmd.commandId())));
            return;
        }
        try {
            handler.accept(cmd);
        } catch (IllegalArgumentException e) {
            log.debug("invalid payload: command={}, ex={}", cmd.command(), e.toString());
            respond(cmd, CommandResponse.error(GameMessages.INVALID_PAYLOAD));
        } catch (RuntimeException e) {
            log.error("处理指令异常: command={}, connection={}", cmd.command(), connection.id(), e);
            respond(cmd, CommandResponse.error(GameMessages.INTERNAL_ERROR));
        }
    }

    /**
     * 连接关闭：解除关联、移出对局；对局已无连接时结束对局。
     */
    public void onClose() {
        Optional<String> gameId = sessions.gameOf(connection);
        sessions.unregister(connection);
        gameId.flatMap(registry::find).ifPresent(engine -> {
            engine.removePlayer(playerId());
            if (!sessions.hasConnections(engine.id())) {
                log.info("对局已无连接，结束对局: id={}", engine.id());
                engine.stop();
            }
        });
    }

    // ===================== 对局生命周期 =====================

    private void createGame(InboundCommand cmd) {
        GameEngine engine = registry.create(playerId());
        engine.addListener(relay);
        sessions.associate(connection, engine.id());
        respond(cmd, CommandResponse.ok(engine.getState()));
        relay.broadcastGames();
    }

    private void enterGame(InboundCommand cmd) {
        String gameId = codec.readPayload(cmd, String.class);
        Optional<GameEngine> found = registry.find(gameId);
        if (found.isEmpty()) {
            log.debug("enter_game: game not found, id={}", gameId);
            respond(cmd, CommandResponse.errorWithData(gameId));
            return;
        }
        GameEngine engine = found.get();
        sessions.associate(connection, engine.id());
        engine.addPlayer(playerId());
        respond(cmd, CommandResponse.ok(engine.id()));
    }

    private void leaveGame(InboundCommand cmd) {
        Optional<GameEngine> found = currentGame();
        if (found.isEmpty()) {
            respond(cmd, CommandResponse.error(GameMessages.GAME_NOT_FOUND));
            return;
        }
        sessions.release(connection);
        found.get().removePlayer(playerId());
        respond(cmd, CommandResponse.ok());
    }

    private void cancelGame(InboundCommand cmd) {
        Optional<GameEngine> found = currentGame();
        if (found.isEmpty()) {
            respond(cmd, CommandResponse.error(GameMessages.GAME_NOT_FOUND));
            return;
        }
        GameEngine engine = found.get();
        if (!engine.getState().isOwner(playerId())) {
            log.debug("cancel_game ignored, not owner: game={}, player={}", engine.id(), playerId());
            return;
        }
        engine.stop();
        respond(cmd, CommandResponse.ok());
    }

    private void startGame(InboundCommand cmd) {
        Optional<GameEngine> found = currentGame();
        if (found.isEmpty()) {
            respond(cmd, CommandResponse.error(GameMessages.GAME_NOT_FOUND));
            return;
        }
        GameEngine engine = found.get();
        if (!engine.getState().isOwner(playerId())) {
            log.debug("start_game ignored, not owner: game={}, player={}", engine.id(), playerId());
            return;
        }
        engine.start();
        respond(cmd, CommandResponse.ok());
    }

    private void changeConfig(InboundCommand cmd) {
        GameConfig config = codec.readPayload(cmd, GameConfig.class);
        Optional<GameEngine> found = currentGame();
        if (found.isEmpty()) {
            return;
        }
        GameEngine engine = found.get();
        if (!engine.getState().isOwner(playerId())) {
            respond(cmd, CommandResponse.error(GameMessages.CONFIG_OWNER_ONLY));
            return;
        }
        if (config == null || !config.isValid()) {
            respond(cmd, CommandResponse.error(GameMessages.INVALID_CONFIG));
            return;
        }
        engine.configure(config);
        respond(cmd, CommandResponse.ok());
    }

    // ===================== 输入 =====================

    private void input(InboundCommand cmd, Consumer<GameEngine> action) {
        Optional<GameEngine> found = currentGame();
        if (found.isEmpty()) {
            log.debug("{} ignored, game not found: connection={}", cmd.command(), connection.id());
            return;
        }
        GameEngine engine = found.get();
        if (!engine.isCurrentPlayer(playerId())) {
            log.debug("{} ignored, not {}'s turn: game={}", cmd.command(), playerId(), engine.id());
            return;
        }
        action.accept(engine);
    }

    // ===================== 查询 =====================

    private void sendState(InboundCommand cmd) {
        Optional<String> gameId = sessions.gameOf(connection);
        if (gameId.isEmpty()) {
            return;
        }
        Optional<GameEngine> found = registry.find(gameId.get());
        if (found.isEmpty()) {
            respond(cmd, CommandResponse.error(GameMessages.GAME_NOT_FOUND));
            return;
        }
        respond(cmd, CommandResponse.ok(found.get().getState()));
    }

    private void sendGames(InboundCommand cmd) {
        respond(cmd, CommandResponse.ok(registry.all().stream().map(GameEngine::getState).toList()));
    }

    private void sendParticipants(InboundCommand cmd) {
        String gameId = sessions.gameOf(connection).orElse("");
        Optional<GameEngine> found = registry.find(gameId);
        if (found.isEmpty()) {
            hub.gameNotFound(connection, gameId);
            return;
        }
        TetrisSnapshot snapshot = found.get().getState();
        respond(cmd, CommandResponse.ok(Participant.listOf(snapshot, playerDirectory::nameOf)));
    }

    // ===================== 玩家 =====================

    private void signup(InboundCommand cmd) {
        String name = codec.readPayload(cmd, String.class);
        try {
            PlayerIdentity identity = playerDirectory.registerName(name);
            respond(cmd, CommandResponse.ok(identity));
        } catch (EmptyNameException | NameTakenException e) {
            respond(cmd, CommandResponse.error(e.getMessage()));
        }
    }

    private void loadUser(InboundCommand cmd) {
        String id = StringUtils.trimToEmpty(codec.readPayload(cmd, String.class));
        Optional<PlayerIdentity> identity = playerDirectory.resolvePlayer(id);
        if (identity.isEmpty()) {
            respond(cmd, CommandResponse.error(GameMessages.USER_NOT_FOUND));
            return;
        }
        respond(cmd, CommandResponse.ok(identity.get()));
    }

    // ===================== 工具 =====================

    private Optional<GameEngine> currentGame() {
        return sessions.gameOf(connection).flatMap(registry::find);
    }

    private String playerId() {
        return connection.playerId();
    }

    private void respond(InboundCommand cmd, CommandResponse response) {
        hub.respond(connection, cmd.commandId(), response);
    }
}
