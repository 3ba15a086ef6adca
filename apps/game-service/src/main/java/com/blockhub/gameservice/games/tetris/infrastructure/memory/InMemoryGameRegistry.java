package com.blockhub.gameservice.games.tetris.infrastructure.memory;

import com.blockhub.gameservice.games.tetris.application.GameEngine;
import com.blockhub.gameservice.games.tetris.application.GameEngineFactory;
import com.blockhub.gameservice.games.tetris.domain.repository.GameRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 内存版对局登记表。
 * 以“创建序号”为键保证大厅列表按创建顺序输出，另维护 gameId → 序号 的索引。
 */
@Slf4j
@Repository
@RequiredArgsConstructor
public class InMemoryGameRegistry implements GameRegistry {

    private final GameEngineFactory engineFactory;

    private final AtomicLong sequence = new AtomicLong();
    private final Map<Long, GameEngine> gamesBySeq = new ConcurrentSkipListMap<>();
    private final Map<String, Long> seqById = new ConcurrentHashMap<>();

    @Override
    public GameEngine create(String ownerId) {
        GameEngine engine = engineFactory.create(ownerId);
        long seq = sequence.incrementAndGet();
        gamesBySeq.put(seq, engine);
        seqById.put(engine.id(), seq);
        log.info("game created: id={}, owner={}", engine.id(), ownerId);
        return engine;
    }

    @Override
    public Optional<GameEngine> find(String gameId) {
        if (gameId == null) {
            return Optional.empty();
        }
        Long seq = seqById.get(gameId);
        return seq == null ? Optional.empty() : Optional.ofNullable(gamesBySeq.get(seq));
    }

    @Override
    public Optional<GameEngine> evict(String gameId) {
        if (gameId == null) {
            return Optional.empty();
        }
        Long seq = seqById.remove(gameId);
        if (seq == null) {
            return Optional.empty();
        }
        GameEngine removed = gamesBySeq.remove(seq);
        log.info("game evicted: id={}", gameId);
        return Optional.ofNullable(removed);
    }

    @Override
    public List<GameEngine> all() {
        return new ArrayList<>(gamesBySeq.values());
    }
}
