package com.blockhub.gameservice.games.tetris.domain.model;

/**
 * 棋盘上的二维整数坐标：x 为列，y 为行（向下递增）。
 * 既用于方块的相对格子，也用于方块原点 origin 的绝对位置。
 */
public record Vector(int x, int y) {

    /** 平移后的新坐标 */
    public Vector plus(int dx, int dy) {
        return new Vector(x + dx, y + dy);
    }
}
