package com.connecthub.gameservice.games.connect4.domain.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Data;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * OutcomeRecord
 * -------------------------------------------------------
 * 一盘对局结果的审计视图（用于日志输出 JSON）。
 * - token 一律转成字符串，结果用枚举名；
 * - record 按落子顺序排列，可据此重演整盘。
 * -------------------------------------------------------
 */
@Data
@JsonInclude(JsonInclude.Include.NON_NULL)
public class OutcomeRecord {
    /** 棋局ID（UUID） */
    private String gameId;
    /** 阶段：IN_PROGRESS / WON / DRAWN */
    private String phase;
    /** 胜者 token；和棋/未结束为 null */
    private String winner;
    /** 被判负的 token；没有则为 null */
    private String forfeitedBy;
    /** token -> WIN/LOSE/DRAW/PENDING，按登记顺序 */
    private Map<String, String> results = new LinkedHashMap<>();
    /** 行棋记录 */
    private List<Step> record = new ArrayList<>();

    @Data
    public static class Step {
        /** 第几手（1 基） */
        private int step;
        private String token;
        /** 动作类型，目前只有 PLACE */
        private String action;
        /** 列号（1 基） */
        private Integer column;
    }
}
