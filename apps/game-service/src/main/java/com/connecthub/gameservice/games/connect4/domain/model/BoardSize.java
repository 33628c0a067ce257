package com.connecthub.gameservice.games.connect4.domain.model;

/**
 * 棋盘尺寸：行数 × 列数，两者都必须为正整数。
 * 默认 6 行 7 列（标准四子棋）。
 */
public record BoardSize(int rows, int columns) {

    public static final BoardSize DEFAULT = new BoardSize(6, 7);

    public BoardSize {
        if (rows < 1 || columns < 1) {
            throw new IllegalArgumentException("BOARD_SIZE_NOT_POSITIVE: " + rows + "x" + columns);
        }
    }

    public int cellCount() {
        return rows * columns;
    }

    @Override
    public String toString() {
        return rows + "x" + columns;
    }
}
