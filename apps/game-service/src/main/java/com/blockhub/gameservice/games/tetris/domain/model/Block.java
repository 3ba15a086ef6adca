package com.blockhub.gameservice.games.tetris.domain.model;

import java.util.List;

/**
 * 方块（不可变值对象）。
 * - origin  ：方块在棋盘上的锚点（左上角）
 * - vectors ：相对 origin 的占用格子
 * - degrees ：累计旋转角度，取值 0/90/180/270
 *
 * 所有变换（平移/旋转）都返回新对象，引擎内部与外部快照可以安全共享同一个实例。
 */
public record Block(Vector origin, List<Vector> vectors, int degrees) {

    public Block {
        vectors = List.copyOf(vectors);
    }

    /** 平移 */
    public Block shift(int dx, int dy) {
        return new Block(origin.plus(dx, dy), vectors, degrees);
    }

    /** 绝对坐标 = origin + 相对坐标 */
    public List<Vector> absoluteCells() {
        return vectors.stream().map(v -> origin.plus(v.x(), v.y())).toList();
    }

    public int maxX() {
        return vectors.stream().mapToInt(Vector::x).max().orElse(0);
    }

    public int maxY() {
        return vectors.stream().mapToInt(Vector::y).max().orElse(0);
    }
}
