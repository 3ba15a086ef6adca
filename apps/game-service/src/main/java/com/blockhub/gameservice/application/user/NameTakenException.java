package com.blockhub.gameservice.application.user;

/** 昵称已被占用（不区分大小写） */
public class NameTakenException extends IllegalStateException {
    public NameTakenException(String message) {
        super(message);
    }
}
