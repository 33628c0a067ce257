package com.connecthub.gameservice.games.connect4.domain.enums;

public enum GamePhase {

    NOT_STARTED,  // 未开始
    IN_PROGRESS,  // 对局中（唯一可以继续落子的阶段）
    WON,          // 有胜者（含判负）
    DRAWN;        // 和棋

    public boolean isTerminal() {
        return this == WON || this == DRAWN;
    }
}
