package com.blockhub.gameservice.platform.transport;

/**
 * 帧结构非法（缺少 ':' 或 '@'，或 payload 为空）。
 * 对所在连接是致命错误：应答后关闭连接。
 */
public class ProtocolParseException extends RuntimeException {

    /** 能解析出的指令 id；解析不到时为 nil id */
    private final String commandId;

    public ProtocolParseException(String message, String commandId) {
        super(message);
        this.commandId = commandId;
    }

    public String getCommandId() {
        return commandId;
    }
}
