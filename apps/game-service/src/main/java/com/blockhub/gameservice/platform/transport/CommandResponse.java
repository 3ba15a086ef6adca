package com.blockhub.gameservice.platform.transport;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * 指令应答体：{"status":"ok"|"error","data":...,"errors":[...]}
 * data / errors 为空时不输出。
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CommandResponse(String status, Object data, List<String> errors) {

    public static final String OK = "ok";
    public static final String ERROR = "error";

    public static CommandResponse ok() {
        return new CommandResponse(OK, null, null);
    }

    public static CommandResponse ok(Object data) {
        return new CommandResponse(OK, data, null);
    }

    public static CommandResponse error(String... errors) {
        return new CommandResponse(ERROR, null, List.of(errors));
    }

    /** 带数据的错误（enter_game 找不到对局时回传 gameId） */
    public static CommandResponse errorWithData(Object data) {
        return new CommandResponse(ERROR, data, null);
    }
}
