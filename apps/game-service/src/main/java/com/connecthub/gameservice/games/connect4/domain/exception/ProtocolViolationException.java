package com.connecthub.gameservice.games.connect4.domain.exception;

/**
 * 协议错误：参与者返回了结构上不合法的动作（空动作、未知类型、越界列）。
 * 说明参与者实现有缺陷，不可恢复，对局立即中止。
 */
public class ProtocolViolationException extends RuntimeException {

    public ProtocolViolationException(String message) {
        super(message);
    }
}
