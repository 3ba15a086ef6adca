package com.blockhub.gameservice.platform.transport;

/**
 * 解码后的客户端指令帧：{@code <command>:<commandId>@<payload>}
 * payload 保留原始 JSON 文本，由具体指令按需解析。
 */
public record InboundCommand(String command, String commandId, String payload) {
}
