package com.blockhub.gameservice.application.user;

import com.blockhub.gameservice.games.tetris.domain.constants.GameMessages;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ThreadLocalRandom;

/**
 * 玩家目录服务（进程内存）。
 * - issue：令牌为已知 playerId 或已登记令牌时复用身份，否则签发新身份并随机分配昵称；
 * - registerName：注册指定昵称，与所有已有玩家昵称不区分大小写判重；
 * - nameOf：参与者列表展示用。
 */
@Slf4j
@Service
public class PlayerDirectoryService {

    private static final List<String> RANDOM_NAMES = List.of(
            "Clever Turtle", "Brave Panda", "Quiet Falcon", "Lucky Otter",
            "Swift Fox", "Sleepy Koala", "Bold Badger", "Happy Heron");

    /** playerId → 身份 */
    private final Map<String, PlayerIdentity> players = new ConcurrentHashMap<>();

    /** 客户端令牌 → playerId */
    private final Map<String, String> tokens = new ConcurrentHashMap<>();

    /** 小写昵称 → playerId，含随机分配的昵称 */
    private final Map<String, String> takenNames = new ConcurrentHashMap<>();

    /**
     * 令牌已知则返回原身份，否则签发新身份
     * @param token 客户端令牌，可空
     */
    public synchronized PlayerIdentity issue(String token) {
        if (StringUtils.isNotBlank(token)) {
            PlayerIdentity byId = players.get(token);
            if (byId != null) {
                return byId;
            }
            String known = tokens.get(token);
            if (known != null && players.containsKey(known)) {
                return players.get(known);
            }
        }
        String name = RANDOM_NAMES.get(ThreadLocalRandom.current().nextInt(RANDOM_NAMES.size()));
        PlayerIdentity identity = new PlayerIdentity(UUID.randomUUID().toString(), name);
        players.put(identity.id(), identity);
        takenNames.putIfAbsent(name.toLowerCase(Locale.ROOT), identity.id());
        if (StringUtils.isNotBlank(token)) {
            tokens.put(token, identity.id());
        }
        log.info("player issued: id={}, name={}", identity.id(), name);
        return identity;
    }

    public Optional<PlayerIdentity> resolvePlayer(String playerId) {
        if (playerId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(players.get(playerId));
    }

    /**
     * 注册昵称
     * @throws EmptyNameException 昵称为空
     * @throws NameTakenException 昵称已被占用
     */
    public synchronized PlayerIdentity registerName(String name) {
        String trimmed = StringUtils.trimToEmpty(name);
        if (trimmed.isEmpty()) {
            throw new EmptyNameException(GameMessages.NAME_EMPTY);
        }
        String key = trimmed.toLowerCase(Locale.ROOT);
        if (takenNames.containsKey(key)) {
            throw new NameTakenException(GameMessages.NAME_TAKEN);
        }
        PlayerIdentity identity = new PlayerIdentity(UUID.randomUUID().toString(), trimmed);
        players.put(identity.id(), identity);
        takenNames.put(key, identity.id());
        log.info("player signed up: id={}, name={}", identity.id(), trimmed);
        return identity;
    }

    /** 未知玩家回退为 id 本身 */
    public String nameOf(String playerId) {
        PlayerIdentity identity = playerId == null ? null : players.get(playerId);
        return identity == null ? playerId : identity.name();
    }
}
