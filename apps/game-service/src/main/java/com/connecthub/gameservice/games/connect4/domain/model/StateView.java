package com.connecthub.gameservice.games.connect4.domain.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.StringJoiner;

/**
 * 交给参与者的只读局面快照。
 * - board：按行优先、自上而下的 rows*columns 个格子，值为外部 token，空位为 null；
 * - 不包含任何内部编号，也不持有实盘引用，改不到实盘。
 * 每次询问参与者时都重新生成。
 */
public record StateView<T>(int rows, int columns, List<T> board) {

    public StateView {
        if (board.size() != rows * columns) {
            throw new IllegalArgumentException("VIEW_SIZE_MISMATCH: " + board.size() + " != " + rows + "x" + columns);
        }
        // List.copyOf 不接受 null，空位需要保留 null
        board = Collections.unmodifiableList(new ArrayList<>(board));
    }

    /** 读取 (row, column) 的 token，0 基坐标；空位返回 null */
    public T tokenAt(int row, int column) {
        return board.get(row * columns + column);
    }

    /** 该列（1 基）是否还能落子：最上面一格为空即可 */
    public boolean isColumnOpen(int column) {
        return column >= 1 && column <= columns && tokenAt(0, column - 1) == null;
    }

    /** 所有还能落子的列（1 基，升序） */
    public List<Integer> openColumns() {
        List<Integer> open = new ArrayList<>();
        for (int column = 1; column <= columns; column++) {
            if (isColumnOpen(column)) open.add(column);
        }
        return open;
    }

    /** 文本棋盘：每行形如 [X, ,O]，取 token 字符串的首字符 */
    public String render() {
        StringJoiner lines = new StringJoiner(System.lineSeparator());
        for (int row = 0; row < rows; row++) {
            StringJoiner cells = new StringJoiner(",", "[", "]");
            for (int column = 0; column < columns; column++) {
                T token = tokenAt(row, column);
                String text = token == null ? "" : String.valueOf(token);
                cells.add(text.isEmpty() ? " " : text.substring(0, 1));
            }
            lines.add(cells.toString());
        }
        return lines.toString();
    }
}
