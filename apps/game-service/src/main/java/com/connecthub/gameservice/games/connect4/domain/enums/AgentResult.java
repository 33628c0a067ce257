package com.connecthub.gameservice.games.connect4.domain.enums;

/** 单个参与者的对局结果 */
public enum AgentResult {
    /** 对局未结束（尚未判定） */
    PENDING,
    /** 胜 */
    WIN,
    /** 负 */
    LOSE,
    /** 和 */
    DRAW
}
