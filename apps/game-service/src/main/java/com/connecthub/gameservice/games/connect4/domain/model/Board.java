package com.connecthub.gameservice.games.connect4.domain.model;

import lombok.AccessLevel;
import lombok.Getter;

import java.util.Arrays;

/**
 * 四子棋棋盘：rows x columns 网格，按行优先压平成一维数组，第 0 行是最上面一行。
 * 约定：EMPTY=0，其余取值是棋子的内部编号（1..127）。
 * 尺寸在构造时固定，之后不变。
 */
@Getter
public class Board {
    /** 空位标记 */
    public static final byte EMPTY = 0;
    /** 内部编号上限（byte 可表示的最大正数） */
    public static final int MAX_ID = Byte.MAX_VALUE;

    private final int rows;
    private final int columns;

    /** 棋盘一维数组，下标 = row * columns + column */
    @Getter(AccessLevel.NONE)
    private final byte[] cells;

    public Board(BoardSize size) {
        this.rows = size.rows();
        this.columns = size.columns();
        this.cells = new byte[size.cellCount()];
    }

    private Board(int rows, int columns, byte[] cells) {
        this.rows = rows;
        this.columns = columns;
        this.cells = cells;
    }

    /** 是否在棋盘内（0 基坐标） */
    public boolean inBounds(int row, int column) {
        return row >= 0 && row < rows && column >= 0 && column < columns;
    }

    /** (row, column) 对应的一维下标 */
    public int index(int row, int column) {
        return row * columns + column;
    }

    public byte get(int row, int column) {
        return cells[index(row, column)];
    }

    public byte get(int index) {
        return cells[index];
    }

    public boolean isEmpty(int row, int column) {
        return inBounds(row, column) && get(row, column) == EMPTY;
    }

    /** 写入格子（不做合法性校验，重力落子规则由 Connect4State 负责） */
    public void set(int row, int column, byte id) {
        cells[index(row, column)] = id;
    }

    /** 是否还有空位（用于和棋判断） */
    public boolean hasEmptyCell() {
        for (byte cell : cells) {
            if (cell == EMPTY) return true;
        }
        return false;
    }

    public BoardSize size() {
        return new BoardSize(rows, columns);
    }

    /** 深拷贝棋盘 */
    public Board copy() {
        return new Board(rows, columns, cells.clone());
    }

    /** 返回一份副本（用于视图/日志），不暴露内部数组 */
    public byte[] cells() {
        return cells.clone();
    }

    @Override
    public String toString() {
        return "Board{" + rows + "x" + columns + ", cells=" + Arrays.toString(cells) + '}';
    }
}
