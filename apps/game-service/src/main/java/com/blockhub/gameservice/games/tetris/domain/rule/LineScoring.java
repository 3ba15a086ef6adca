package com.blockhub.gameservice.games.tetris.domain.rule;

/**
 * 消行计分与等级。
 * 基础分：1 行 40，2 行 100，3 行 300，4 行 1200，更多 1500；再乘以 (level + 1)。
 * 等级：每 10 行升一级。
 */
public final class LineScoring {

    /** 升级所需行数 */
    public static final int LEVEL_THRESHOLD = 10;

    private LineScoring() {
    }

    public static long points(int lines, int level) {
        int base = switch (lines) {
            case 1 -> 40;
            case 2 -> 100;
            case 3 -> 300;
            case 4 -> 1200;
            default -> 1500;
        };
        return (long) base * (level + 1);
    }

    public static int levelFor(int lineCount) {
        return lineCount / LEVEL_THRESHOLD;
    }
}
