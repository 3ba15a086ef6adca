package com.blockhub.gameservice.application.user;

/** 昵称为空（去掉首尾空白后） */
public class EmptyNameException extends IllegalArgumentException {
    public EmptyNameException(String message) {
        super(message);
    }
}
