package com.blockhub.gameservice.games.tetris.domain.rule;

import com.blockhub.gameservice.games.tetris.domain.model.Block;
import com.blockhub.gameservice.games.tetris.domain.model.Vector;

import java.util.ArrayList;
import java.util.List;

/**
 * 占用网格与纯几何运算：画/擦方块、碰撞检测、旋转、整行检测与消除。
 * 约定：cells[y][x]，EMPTY=0，OCCUPIED=1；y 向下递增，y &lt; 0 表示棋盘上方的不可见区域。
 *
 * 不做任何规则判断（是否该锁定、如何计分），那是引擎的职责。
 */
public final class CollisionField {

    public static final int EMPTY = 0;
    public static final int OCCUPIED = 1;

    private final int cols;
    private final int rows;
    private int[][] cells;

    public CollisionField(int cols, int rows) {
        if (cols <= 0 || rows <= 0) {
            throw new IllegalArgumentException("field size must be positive: " + cols + "x" + rows);
        }
        this.cols = cols;
        this.rows = rows;
        this.cells = emptyRows(rows, cols);
    }

    public int cols() { return cols; }

    public int rows() { return rows; }

    public boolean isOccupied(int x, int y) {
        return inBounds(x, y) && cells[y][x] != EMPTY;
    }

    /** 直接占用一格（用于布置残局） */
    public void occupy(int x, int y) {
        if (!inBounds(x, y)) {
            throw new IllegalArgumentException("cell out of field: " + x + "/" + y);
        }
        cells[y][x] = OCCUPIED;
    }

    /**
     * 碰撞判定：任一绝对格子越过左右边界、越过最后一行，
     * 或（y ≥ 0 时）落在已占用格子上，即视为碰撞。
     * y &lt; 0 的格子只检查左右边界。
     */
    public boolean isBlocked(Block block) {
        int lastRow = rows - 1;
        int lastCol = cols - 1;
        for (Vector v : block.absoluteCells()) {
            if (v.x() < 0 || v.x() > lastCol || v.y() > lastRow) {
                return true;
            }
            if (v.y() >= 0 && cells[v.y()][v.x()] != EMPTY) {
                return true;
            }
        }
        return false;
    }

    public void draw(Block block) {
        paint(block, OCCUPIED);
    }

    /** 擦除方块；null 时不做任何事 */
    public void erase(Block block) {
        if (block != null) {
            paint(block, EMPTY);
        }
    }

    /** 所有已填满的行下标（自上而下） */
    public List<Integer> completedRows() {
        List<Integer> found = new ArrayList<>();
        for (int y = 0; y < rows; y++) {
            boolean complete = true;
            for (int x = 0; x < cols; x++) {
                if (cells[y][x] == EMPTY) {
                    complete = false;
                    break;
                }
            }
            if (complete) {
                found.add(y);
            }
        }
        return found;
    }

    /**
     * 删除给定行，并在顶部补同样数量的空行（上方各行整体下移）。
     */
    public void dropRows(List<Integer> dropped) {
        if (dropped.isEmpty()) {
            return;
        }
        int[][] next = new int[rows][];
        int target = rows - 1;
        for (int y = rows - 1; y >= 0; y--) {
            if (!dropped.contains(y)) {
                next[target--] = cells[y];
            }
        }
        while (target >= 0) {
            next[target--] = new int[cols];
        }
        cells = next;
    }

    /** 深拷贝，供快照/序列化使用 */
    public int[][] toArray() {
        int[][] copy = new int[rows][];
        for (int y = 0; y < rows; y++) {
            copy[y] = cells[y].clone();
        }
        return copy;
    }

    /**
     * 顺时针旋转 90°：在形状自身包围盒内做 (x, y) → (maxY − y, x)。
     * 旋转后按包围盒变化量的一半回调 origin，使方块视觉上保持居中；
     * 取整方向按角度交替（0/180 向上取整，90/270 向下取整），连续旋转不会整体漂移。
     */
    public static Block rotateClockwise(Block block) {
        int maxX = block.maxX();
        int maxY = block.maxY();
        List<Vector> rotated = block.vectors().stream()
                .map(v -> new Vector(maxY - v.y(), v.x()))
                .toList();

        int newMaxX = rotated.stream().mapToInt(Vector::x).max().orElse(0);
        int newMaxY = rotated.stream().mapToInt(Vector::y).max().orElse(0);

        boolean ceil = block.degrees() % 180 == 0;
        int dx = halfRounded(newMaxX - maxX, ceil);
        int dy = halfRounded(newMaxY - maxY, ceil);

        Vector origin = block.origin().plus(-dx, -dy);
        return new Block(origin, rotated, (block.degrees() + 90) % 360);
    }

    private static int halfRounded(int distance, boolean ceil) {
        return ceil ? (int) Math.ceil(distance / 2.0) : Math.floorDiv(distance, 2);
    }

    private void paint(Block block, int value) {
        for (Vector v : block.absoluteCells()) {
            if (inBounds(v.x(), v.y())) {
                cells[v.y()][v.x()] = value;
            }
        }
    }

    private boolean inBounds(int x, int y) {
        return x >= 0 && x < cols && y >= 0 && y < rows;
    }

    private static int[][] emptyRows(int rows, int cols) {
        int[][] out = new int[rows][];
        for (int y = 0; y < rows; y++) {
            out[y] = new int[cols];
        }
        return out;
    }
}
