package com.connecthub.gameservice.games.connect4.domain.enums;

/**
 * 连线方向，声明顺序即扫描顺序：横、竖、主对角（\）、反对角（/）。
 * dRow/dColumn 为从锚点出发每一步的偏移量。
 */
public enum Direction {
    /** 横 → */
    HORIZONTAL(0, 1),
    /** 竖 ↓ */
    VERTICAL(1, 0),
    /** 主对角 ↘ */
    DIAGONAL_DOWN(1, 1),
    /** 反对角 ↙（锚点在右上端） */
    DIAGONAL_UP(1, -1);

    private final int dRow;
    private final int dColumn;

    Direction(int dRow, int dColumn) {
        this.dRow = dRow;
        this.dColumn = dColumn;
    }

    public int dRow() {
        return dRow;
    }

    public int dColumn() {
        return dColumn;
    }
}
