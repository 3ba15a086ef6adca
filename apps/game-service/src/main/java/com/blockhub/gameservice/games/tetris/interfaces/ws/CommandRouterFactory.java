package com.blockhub.gameservice.games.tetris.interfaces.ws;

import com.blockhub.gameservice.application.user.PlayerDirectoryService;
import com.blockhub.gameservice.games.tetris.application.GameEventRelay;
import com.blockhub.gameservice.games.tetris.domain.repository.GameRegistry;
import com.blockhub.gameservice.platform.transport.WireCodec;
import com.blockhub.gameservice.platform.ws.BroadcastHub;
import com.blockhub.gameservice.platform.ws.Connection;
import com.blockhub.gameservice.platform.ws.SessionDirectory;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * 为每条新连接创建 CommandRouter。
 */
@Component
@RequiredArgsConstructor
public class CommandRouterFactory {

    private final GameRegistry registry;
    private final SessionDirectory sessions;
    private final BroadcastHub hub;
    private final WireCodec codec;
    private final PlayerDirectoryService playerDirectory;
    private final GameEventRelay relay;

    public CommandRouter create(Connection connection) {
        return new CommandRouter(connection, registry, sessions, hub, codec, playerDirectory, relay);
    }
}
