package com.connecthub.gameservice.games.connect4.domain.model;

import com.connecthub.gameservice.engine.core.GameState;
import com.connecthub.gameservice.games.connect4.domain.exception.ActionException;
import com.connecthub.gameservice.games.connect4.domain.rule.Connect4Judge;
import com.connecthub.gameservice.games.connect4.domain.rule.Verdict;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 对局状态。
 * 作用：整盘对局的"单一事实来源"（棋盘 + token 映射）。
 * - 外部 token ↔ 内部编号 是双向映射（正向 Map + 反向 List），构造时建立，之后只读；
 * - place 是唯一修改棋盘的入口，采用重力落子：从最底行往上找第一个空位；
 * - 对外只通过 exposeView 暴露快照，快照里只有外部 token。
 * 设计说明
 * - 结构性校验（动作类型、列范围）在编排层 Game 做；这里仍会拒绝越界列，保证单独使用时也不会写坏棋盘。
 */
public class Connect4State<T> implements GameState<StateView<T>> {

    private final Board board;

    /** 外部 token -> 内部编号（1..127） */
    private final Map<T, Byte> forward;
    /** 内部编号 - 1 -> 外部 token */
    private final List<T> inverse;

    public Connect4State(List<T> externalTokens, BoardSize size) {
        if (externalTokens == null || externalTokens.isEmpty()) {
            throw new IllegalArgumentException("TOKENS_EMPTY");
        }
        if (externalTokens.size() > Board.MAX_ID) {
            throw new IllegalArgumentException("TOO_MANY_TOKENS: " + externalTokens.size() + " > " + Board.MAX_ID);
        }
        Map<T, Byte> fwd = new HashMap<>();
        List<T> inv = new ArrayList<>(externalTokens.size());
        for (T token : externalTokens) {
            if (token == null) {
                throw new IllegalArgumentException("TOKEN_NULL");
            }
            if (fwd.containsKey(token)) {
                throw new IllegalArgumentException("TOKEN_DUPLICATE: " + token);
            }
            inv.add(token);
            fwd.put(token, (byte) inv.size());
        }
        this.forward = Collections.unmodifiableMap(fwd);
        this.inverse = Collections.unmodifiableList(inv);
        this.board = new Board(size);
    }

    private Connect4State(Connect4State<T> source) {
        this.forward = source.forward;
        this.inverse = source.inverse;
        this.board = source.board.copy();
    }

    public int rows() {
        return board.getRows();
    }

    public int columns() {
        return board.getColumns();
    }

    /**
     * 在第 column 列（1 基）落下 token 的棋子。
     * @return 棋子最终落在的行（0 基，0 为最上面一行）
     * @throws ActionException 列已满或列越界（依赖局面的非法动作，棋盘不变）
     * @throws IllegalArgumentException token 不属于本局
     */
    public int place(int column, T token) {
        Byte id = forward.get(token);
        if (id == null) {
            throw new IllegalArgumentException("UNKNOWN_TOKEN: " + token);
        }
        if (column < 1 || column > board.getColumns()) {
            throw new ActionException(column, "COLUMN_OUT_OF_RANGE: " + column
                    + " (columns are indexed from 1 to " + board.getColumns() + ")");
        }
        int c = column - 1;
        for (int row = board.getRows() - 1; row >= 0; row--) {
            if (board.get(row, c) == Board.EMPTY) {
                board.set(row, c, id);
                return row;
            }
        }
        throw new ActionException(column, "COLUMN_FULL: " + column);
    }

    /** 全盘判定，胜者以外部 token 返回 */
    public Verdict<T> checkOutcome() {
        return Connect4Judge.judge(board).map(this::tokenOf);
    }

    /** 生成只读快照：内部编号翻译回外部 token，空位为 null */
    @Override
    public StateView<T> exposeView() {
        List<T> cells = new ArrayList<>(rows() * columns());
        for (byte cell : board.cells()) {
            cells.add(cell == Board.EMPTY ? null : tokenOf(cell));
        }
        return new StateView<>(rows(), columns(), cells);
    }

    /** 深拷贝：复制棋盘，映射表只读可共享 */
    @Override
    public Connect4State<T> copy() {
        return new Connect4State<>(this);
    }

    /** 本局的外部 token，按内部编号顺序 */
    public List<T> tokens() {
        return inverse;
    }

    /** 文本棋盘（调试日志用） */
    public String render() {
        return exposeView().render();
    }

    private T tokenOf(byte id) {
        return inverse.get(id - 1);
    }
}
