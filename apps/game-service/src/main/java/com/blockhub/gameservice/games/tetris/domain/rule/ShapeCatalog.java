package com.blockhub.gameservice.games.tetris.domain.rule;

import com.blockhub.gameservice.games.tetris.domain.model.Vector;

import java.util.List;

/**
 * 方块形状目录：每种形状是一组相对锚点的格子。
 * 例如 (0,0)(0,1)(1,1)(2,1) 表示：
 * <pre>
 * +---+
 * |   |
 * +---+---+---+
 * |   |   |   |
 * +---+---+---+
 * </pre>
 * 前 7 种为经典四格方块，后 2 种为自定义三格方块。
 */
public final class ShapeCatalog {

    private ShapeCatalog() {
    }

    public static final List<List<Vector>> SHAPES = List.of(
            // 1x4
            List.of(v(0, 0), v(0, 1), v(0, 2), v(0, 3)),
            // 半 T 左
            List.of(v(0, 2), v(1, 2), v(1, 1), v(1, 0)),
            // 半 T 右
            List.of(v(1, 2), v(0, 2), v(0, 1), v(0, 0)),
            // 方块
            List.of(v(0, 0), v(1, 0), v(0, 1), v(1, 1)),
            // T
            List.of(v(0, 1), v(1, 1), v(1, 0), v(2, 1)),
            // S
            List.of(v(0, 1), v(1, 1), v(1, 0), v(2, 0)),
            // Z
            List.of(v(0, 0), v(1, 0), v(1, 1), v(2, 1)),
            // 拐角（三格）
            List.of(v(1, 0), v(1, 1), v(0, 1)),
            // 1x3
            List.of(v(0, 0), v(0, 1), v(0, 2))
    );

    private static Vector v(int x, int y) {
        return new Vector(x, y);
    }
}
