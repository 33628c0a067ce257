package com.connecthub.gameservice.games.connect4.domain.enums;

/** 动作类型（封闭集合）。目前四子棋只允许落子。 */
public enum ActionKind {
    /** 在某列投下一枚棋子 */
    PLACE
}
