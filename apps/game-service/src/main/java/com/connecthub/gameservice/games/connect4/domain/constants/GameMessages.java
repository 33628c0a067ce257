package com.connecthub.gameservice.games.connect4.domain.constants;

/**
 * 四子棋命令行相关的消息常量
 * 统一管理所有用户可见的提示消息，避免硬编码
 */
public final class GameMessages {

    private GameMessages() {
        // 工具类，禁止实例化
    }

    // ========== 输入提示 ==========

    /** 轮到某方落子（需要格式化，传入 token） */
    public static final String TO_PLAY = "%s to play.";

    /** 输入不是整数 */
    public static final String NOT_AN_INTEGER = "Input could not be converted to an integer.";

    /** 列号越界（需要格式化，传入列数） */
    public static final String COLUMN_OUT_OF_BOARD = "Selected column lies outside the board. Columns are indexed from 1 to %d.";

    /** 列已满（需要格式化，传入列号） */
    public static final String COLUMN_FULL = "Column %d is full.";

    // ========== 结果消息 ==========

    /** 单个玩家结果（需要格式化，传入 token 与结果） */
    public static final String AGENT_RESULT = "%s: %s";

    /** 输入流已关闭 */
    public static final String INPUT_CLOSED = "INPUT_CLOSED: no more console input";

    public static String formatToPlay(Object token) {
        return String.format(TO_PLAY, token);
    }

    public static String formatColumnOutOfBoard(int columns) {
        return String.format(COLUMN_OUT_OF_BOARD, columns);
    }

    public static String formatColumnFull(int column) {
        return String.format(COLUMN_FULL, column);
    }

    public static String formatAgentResult(Object token, Object result) {
        return String.format(AGENT_RESULT, token, result);
    }
}
