package com.connecthub.gameservice.games.connect4.domain.model;

import com.connecthub.gameservice.games.connect4.domain.enums.ActionKind;

/**
 * 一个动作：动作类型 + 目标列（1 基）。
 * 由参与者产生，编排方校验后交给状态执行。
 * column 用包装类型：参与者实现有缺陷时可能给出 null，由编排方按协议错误处理。
 */
public record Action(ActionKind kind, Integer column) {

    public static Action place(int column) {
        return new Action(ActionKind.PLACE, column);
    }

    @Override
    public String toString() {
        return kind + "," + column;
    }
}
