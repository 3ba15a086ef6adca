package com.blockhub.gameservice.games.tetris.interfaces.ws.dto;

/**
 * WebSocket 指令名与服务端推送事件名
 * ----------------------------------------
 * 帧格式：
 *   客户端 → 服务端：command:commandId@json
 *   服务端 → 客户端：response_commandId@json / event@json
 * 引擎事件（started / looped ...）的名称见 GameEventType#wireName。
 */
public final class TetrisMessages {

    private TetrisMessages() {
    }

    // ========== 指令（客户端 → 服务端） ==========

    public static final String CREATE_GAME = "create_game";
    public static final String ENTER_GAME = "enter_game";
    public static final String LEAVE_GAME = "leave_game";
    public static final String CANCEL_GAME = "cancel_game";
    public static final String START_GAME = "start_game";
    public static final String CHANGE_CONFIG = "change_config";
    public static final String MOVE_LEFT = "move_left";
    public static final String MOVE_RIGHT = "move_right";
    public static final String MOVE_DOWN = "move_down";
    public static final String ROTATE = "rotate";
    public static final String SEND_STATE = "send_state";
    public static final String SEND_GAMES = "send_games";
    public static final String SEND_PARTICIPANTS = "send_participants";
    public static final String SIGNUP = "signup";
    public static final String LOAD_USER = "load_user";

    // ========== 事件（服务端 → 客户端） ==========

    /** 大厅对局列表 */
    public static final String GAMES_LIST = "games_list";

    /** 对局参与者列表 */
    public static final String PARTICIPANT_LIST = "participant_list";

    /** 握手缺少 player 参数 */
    public static final String UNAUTHENTICATED = "unauthenticated";

    // ========== 关闭码 ==========

    /** 未认证 */
    public static final int CLOSE_UNAUTHORIZED = 4401;

    /** 帧结构非法 */
    public static final int CLOSE_PROTOCOL_ERROR = 1002;
}
