package com.connecthub.gameservice.games.connect4.domain.rule;

import com.connecthub.gameservice.games.connect4.domain.enums.Direction;
import com.connecthub.gameservice.games.connect4.domain.model.Line;

import java.util.Arrays;
import java.util.stream.IntStream;
import java.util.stream.Stream;

/**
 * 连线枚举：按 横 → 竖 → 主对角 → 反对角 的顺序，惰性生成棋盘上所有长度为 4 的连线。
 * 同一方向内按锚点自上而下、自左而右。每条连线恰好出现一次，放不下的方向不生成（支持任意长宽比）。
 */
public final class LineScanner {

    private LineScanner() {
    }

    /** 生成 rows x columns 棋盘上的全部连线（惰性流，配合 findFirst 可提前结束） */
    public static Stream<Line> lines(int rows, int columns) {
        return Arrays.stream(Direction.values())
                .flatMap(d -> lines(rows, columns, d));
    }

    /** 单个方向上的全部连线 */
    public static Stream<Line> lines(int rows, int columns, Direction d) {
        return IntStream.range(0, rows).boxed()
                .flatMap(row -> IntStream.range(0, columns)
                        .filter(column -> fits(rows, columns, row, column, d))
                        .mapToObj(column -> lineAt(columns, row, column, d)));
    }

    /**
     * 连线条数的闭式解：rows·(c-3)⁺ + (r-3)⁺·columns + 2·(r-3)⁺·(c-3)⁺
     */
    public static long count(int rows, int columns) {
        long r = Math.max(0, rows - (Line.LENGTH - 1));
        long c = Math.max(0, columns - (Line.LENGTH - 1));
        return rows * c + r * columns + 2 * r * c;
    }

    // ----------- private helpers -----------

    /** 锚点与终点都在棋盘内才算放得下 */
    private static boolean fits(int rows, int columns, int row, int column, Direction d) {
        int endRow = row + (Line.LENGTH - 1) * d.dRow();
        int endColumn = column + (Line.LENGTH - 1) * d.dColumn();
        return endRow >= 0 && endRow < rows && endColumn >= 0 && endColumn < columns;
    }

    private static Line lineAt(int columns, int row, int column, Direction d) {
        int[] cells = new int[Line.LENGTH];
        for (int i = 0; i < Line.LENGTH; i++) {
            cells[i] = (row + i * d.dRow()) * columns + (column + i * d.dColumn());
        }
        return new Line(d, row, column, cells);
    }
}
