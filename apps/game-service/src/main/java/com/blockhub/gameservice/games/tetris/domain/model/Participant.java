package com.blockhub.gameservice.games.tetris.domain.model;

import java.util.List;
import java.util.function.Function;

/**
 * 参与者视图：玩家 id + 昵称 + 本局积分（participant_list / send_participants 使用）。
 */
public record Participant(String id, String name, long points) {

    public static List<Participant> listOf(TetrisSnapshot snapshot, Function<String, String> nameLookup) {
        return snapshot.players().stream()
                .map(p -> new Participant(p.playerId(), nameLookup.apply(p.playerId()), p.points()))
                .toList();
    }
}
