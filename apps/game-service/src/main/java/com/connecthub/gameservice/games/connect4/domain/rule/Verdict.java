package com.connecthub.gameservice.games.connect4.domain.rule;

import java.util.function.Function;

/**
 * 终局判定结果：未结束 / 某方胜 / 和棋。
 * winner 只在 WIN 时非空。
 */
public record Verdict<T>(Status status, T winner) {

    public enum Status {
        /** 对局进行中 */
        UNFINISHED,
        /** 有人连成四子 */
        WIN,
        /** 棋盘已满且无人获胜 */
        DRAW
    }

    public Verdict {
        if ((status == Status.WIN) != (winner != null)) {
            throw new IllegalArgumentException("VERDICT_WINNER_MISMATCH: " + status + "/" + winner);
        }
    }

    public static <T> Verdict<T> unfinished() {
        return new Verdict<>(Status.UNFINISHED, null);
    }

    public static <T> Verdict<T> win(T winner) {
        return new Verdict<>(Status.WIN, winner);
    }

    public static <T> Verdict<T> draw() {
        return new Verdict<>(Status.DRAW, null);
    }

    public boolean isTerminal() {
        return status != Status.UNFINISHED;
    }

    /** 把内部表示（如内部编号）映射成外部表示（如外部 token） */
    public <U> Verdict<U> map(Function<? super T, ? extends U> mapper) {
        return status == Status.WIN ? win(mapper.apply(winner)) : new Verdict<>(status, null);
    }
}
