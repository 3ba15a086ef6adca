package com.blockhub.gameservice.platform.transport;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

/**
 * 文本帧编解码。
 * <pre>
 *   客户端 → 服务端：  command:commandId@json
 *   服务端 → 客户端：  response_commandId@{"status":...}
 *                      eventName@json
 * </pre>
 * 只有第一个 '@' 是分隔符，payload 内的 '@' 原样保留。
 */
@Component
@RequiredArgsConstructor
public class WireCodec {

    /** 不需要关联应答时使用的指令 id */
    public static final String NIL_ID = "00000000-0000-0000-0000-000000000000";

    private static final String RESPONSE_PREFIX = "response_";

    private final ObjectMapper objectMapper;

    /**
     * 解码客户端帧
     * @param frame 原始文本
     * @return 指令
     * @throws ProtocolParseException 帧结构非法
     */
    public InboundCommand decode(String frame) {
        if (frame == null) {
            throw new ProtocolParseException("empty frame", NIL_ID);
        }
        int at = frame.indexOf('@');
        String head = at < 0 ? frame : frame.substring(0, at);
        int colon = head.indexOf(':');
        String commandId = colon < 0 ? NIL_ID : StringUtils.defaultIfEmpty(head.substring(colon + 1), NIL_ID);
        if (at < 0 || at == frame.length() - 1) {
            throw new ProtocolParseException("missing payload", commandId);
        }
        if (colon <= 0 || colon == head.length() - 1) {
            throw new ProtocolParseException("missing command or command id", commandId);
        }
        return new InboundCommand(head.substring(0, colon), head.substring(colon + 1), frame.substring(at + 1));
    }

    /**
     * 把 payload 读成目标类型
     * @throws IllegalArgumentException JSON 非法
     */
    public <T> T readPayload(InboundCommand command, Class<T> type) {
        try {
            return objectMapper.readValue(command.payload(), type);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("invalid payload for " + command.command(), e);
        }
    }

    public String encodeResponse(String commandId, CommandResponse response) {
        return RESPONSE_PREFIX + commandId + "@" + toJson(response);
    }

    public String encodeEvent(String eventName, Object payload) {
        return eventName + "@" + toJson(payload);
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("failed to serialize outbound frame", e);
        }
    }
}
