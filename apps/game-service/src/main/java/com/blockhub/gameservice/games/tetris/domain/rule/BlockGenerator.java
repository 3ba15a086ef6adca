package com.blockhub.gameservice.games.tetris.domain.rule;

import com.blockhub.gameservice.games.tetris.domain.model.Block;
import com.blockhub.gameservice.games.tetris.domain.model.Vector;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Random;

/**
 * 方块生成器（7-bag 思路的“袋子随机”）。
 * - 每个袋子装入目录中全部形状的下标并洗牌；
 * - 逐个取出，袋子取空后再装一袋新的；
 * - 因此同一袋内不会重复，且所有形状都出现一次后才会重复。
 *
 * 非线程安全：每个对局引擎独占一个实例，只在引擎串行上下文里调用。
 */
public class BlockGenerator {

    private final List<List<Vector>> catalog;
    private final Random random;
    private final Deque<Integer> bag = new ArrayDeque<>();

    public BlockGenerator() {
        this(ShapeCatalog.SHAPES, new Random());
    }

    public BlockGenerator(List<List<Vector>> catalog, Random random) {
        if (catalog == null || catalog.isEmpty()) {
            throw new IllegalArgumentException("shape catalog must not be empty");
        }
        this.catalog = List.copyOf(catalog);
        this.random = random;
    }

    /**
     * 取下一个方块，放在给定锚点，角度为 0。
     * @param origin 出生位置
     */
    public Block next(Vector origin) {
        if (bag.isEmpty()) {
            refill();
        }
        Integer index = bag.poll();
        if (index == null) {
            // 刚装过袋子仍为空，只可能是实现错误
            throw new IllegalStateException("No elements in bag left");
        }
        return new Block(origin, catalog.get(index), 0);
    }

    /** 当前袋子剩余数量 */
    public int remainingInBag() {
        return bag.size();
    }

    private void refill() {
        List<Integer> keys = new ArrayList<>(catalog.size());
        for (int i = 0; i < catalog.size(); i++) {
            keys.add(i);
        }
        Collections.shuffle(keys, random);
        bag.addAll(keys);
    }
}
