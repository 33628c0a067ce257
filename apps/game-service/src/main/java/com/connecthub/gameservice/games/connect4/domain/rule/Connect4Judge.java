package com.connecthub.gameservice.games.connect4.domain.rule;

import com.connecthub.gameservice.games.connect4.domain.model.Board;
import com.connecthub.gameservice.games.connect4.domain.model.Line;

import java.util.Optional;

/**
 * 核心规则判断
 * 四子棋终局判定：只包含纯判断逻辑（胜负、和棋），不修改棋盘。
 * 与五子棋"基于最后一步"的判定不同，这里每次全盘扫描所有连线，结果与落子历史无关。
 */
public final class Connect4Judge {

    private Connect4Judge() {
    }

    /** 第一条四格相同且非空的连线（按 LineScanner 顺序） */
    public static Optional<Line> winningLine(Board b) {
        return LineScanner.lines(b.getRows(), b.getColumns())
                .filter(line -> line.owner(b) != Board.EMPTY)
                .findFirst();
    }

    /** 棋盘是否已满（用于和棋判断） */
    public static boolean isFull(Board b) {
        return !b.hasEmptyCell();
    }

    /**
     * 全盘判定。胜者以内部编号返回；先判胜再判和，最后一格落子成四算胜。
     */
    public static Verdict<Byte> judge(Board b) {
        Optional<Line> line = winningLine(b);
        if (line.isPresent()) {
            return Verdict.win(line.get().owner(b));
        }
        if (isFull(b)) {
            return Verdict.draw();
        }
        return Verdict.unfinished();
    }
}
