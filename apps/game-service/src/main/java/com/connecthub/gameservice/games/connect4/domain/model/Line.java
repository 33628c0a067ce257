package com.connecthub.gameservice.games.connect4.domain.model;

import com.connecthub.gameservice.games.connect4.domain.enums.Direction;

import java.util.Arrays;

/**
 * 一条长度为 4 的连线：方向 + 锚点 + 4 个格子的一维下标。
 * 派生数据，不落盘，每次判定时重新生成。
 */
public record Line(Direction direction, int row, int column, int[] cells) {

    public static final int LENGTH = 4;

    public Line {
        if (cells.length != LENGTH) {
            throw new IllegalArgumentException("LINE_LENGTH: " + cells.length);
        }
        cells = cells.clone();
    }

    @Override
    public int[] cells() {
        return cells.clone();
    }

    /** 四格都非空且相同则返回该内部编号，否则返回 Board.EMPTY */
    public byte owner(Board board) {
        byte first = board.get(cells[0]);
        if (first == Board.EMPTY) return Board.EMPTY;
        for (int i = 1; i < LENGTH; i++) {
            if (board.get(cells[i]) != first) return Board.EMPTY;
        }
        return first;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Line other)) return false;
        return direction == other.direction && Arrays.equals(cells, other.cells);
    }

    @Override
    public int hashCode() {
        return 31 * direction.hashCode() + Arrays.hashCode(cells);
    }

    @Override
    public String toString() {
        return direction + "@(" + row + "," + column + ")" + Arrays.toString(cells);
    }
}
