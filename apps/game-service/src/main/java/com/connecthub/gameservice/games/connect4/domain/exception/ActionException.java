package com.connecthub.gameservice.games.connect4.domain.exception;

import lombok.Getter;

/**
 * 依赖局面的非法动作（例如往已满的列落子）。
 * 可恢复：由编排方决定重新询问还是判负，棋盘保持不变。
 */
@Getter
public class ActionException extends RuntimeException {

    /** 被拒绝的列（1 基） */
    private final int column;

    public ActionException(int column, String message) {
        super(message);
        this.column = column;
    }
}
