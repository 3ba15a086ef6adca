package com.blockhub.gameservice.games.tetris.application;

import com.blockhub.gameservice.clock.scheduler.TickScheduler;
import com.blockhub.gameservice.games.tetris.domain.model.GameConfig;
import com.blockhub.gameservice.games.tetris.domain.model.TetrisState;
import com.blockhub.gameservice.games.tetris.domain.rule.BlockGenerator;
import com.blockhub.gameservice.games.tetris.domain.rule.GravityPolicy;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.UUID;

/**
 * 按配置组装 GameEngine：默认棋盘尺寸、tick 周期、重力节奏。
 * 每个引擎独占一个 BlockGenerator（袋子游标是有状态的）。
 */
@Component
public class GameEngineFactory {

    private final TickScheduler tickScheduler;

    @Value("${blockhub.game.tick-millis:10}")
    private long tickMillis;

    @Value("${blockhub.game.gravity.base-millis:200}")
    private long gravityBaseMillis;

    @Value("${blockhub.game.gravity.step-per-level-millis:0}")
    private long gravityStepPerLevelMillis;

    @Value("${blockhub.game.gravity.min-millis:50}")
    private long gravityMinMillis;

    @Value("${blockhub.game.default-cols:10}")
    private int defaultCols;

    @Value("${blockhub.game.default-rows:20}")
    private int defaultRows;

    @Value("${blockhub.game.default-name:New Game}")
    private String defaultName;

    public GameEngineFactory(TickScheduler tickScheduler) {
        this.tickScheduler = tickScheduler;
    }

    /**
     * 新建一局（WAITING），房主自动成为第一位玩家。
     * @param ownerId 房主玩家ID
     */
    public GameEngine create(String ownerId) {
        TetrisState state = new TetrisState(UUID.randomUUID().toString(), ownerId,
                new GameConfig(defaultCols, defaultRows, defaultName));
        GravityPolicy gravity = new GravityPolicy(gravityBaseMillis, gravityStepPerLevelMillis, gravityMinMillis);
        return new GameEngine(state, new BlockGenerator(), tickScheduler, tickMillis, gravity, System::currentTimeMillis);
    }
}
