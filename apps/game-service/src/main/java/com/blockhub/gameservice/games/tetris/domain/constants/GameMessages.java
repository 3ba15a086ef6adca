package com.blockhub.gameservice.games.tetris.domain.constants;

/**
 * 对客户端可见的错误消息常量。
 * 客户端按原文匹配，修改前需确认前端兼容。
 */
public final class GameMessages {

    private GameMessages() {
        // 工具类，禁止实例化
    }

    // ========== 对局 ==========

    /** 对局不存在 */
    public static final String GAME_NOT_FOUND = "Game not found";

    /** 非房主修改配置 */
    public static final String CONFIG_OWNER_ONLY = "config_changes_are_only_allowed_to_the_owner";

    /** 行列非正数 */
    public static final String INVALID_CONFIG = "invalid config";

    // ========== 协议 ==========

    /** payload 不是合法 JSON */
    public static final String INVALID_PAYLOAD = "invalid payload";

    /** 帧结构非法 */
    public static final String INVALID_FRAME = "invalid frame";

    /** 处理指令时出现未预期异常 */
    public static final String INTERNAL_ERROR = "internal error";

    /** 未知指令（需要格式化，传入指令名与指令 id） */
    public static final String UNKNOWN_COMMAND = "command %s for command id %s not found";

    public static String formatUnknownCommand(String command, String commandId) {
        return String.format(UNKNOWN_COMMAND, command, commandId);
    }

    // ========== 玩家 ==========

    public static final String NAME_EMPTY = "name may not be empty";

    public static final String NAME_TAKEN = "name already in use";

    public static final String USER_NOT_FOUND = "User not found";
}
