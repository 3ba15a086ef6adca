package com.blockhub.gameservice.games.tetris.domain.rule;

import com.blockhub.gameservice.games.tetris.domain.model.Block;
import com.blockhub.gameservice.games.tetris.domain.model.Vector;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BlockGeneratorTest {

    private static final Vector ORIGIN = new Vector(5, 0);

    @Test
    void everyShapeAppearsOncePerBag() {
        BlockGenerator generator = new BlockGenerator(ShapeCatalog.SHAPES, new Random(42));
        int n = ShapeCatalog.SHAPES.size();

        for (int round = 0; round < 3; round++) {
            Set<List<Vector>> seen = new HashSet<>();
            for (int i = 0; i < n; i++) {
                seen.add(generator.next(ORIGIN).vectors());
            }
            assertThat(seen).hasSize(n);
            assertThat(generator.remainingInBag()).isZero();
        }
    }

    @Test
    void refillsOnlyWhenBagIsEmpty() {
        BlockGenerator generator = new BlockGenerator(ShapeCatalog.SHAPES, new Random(7));

        generator.next(ORIGIN);
        assertThat(generator.remainingInBag()).isEqualTo(ShapeCatalog.SHAPES.size() - 1);

        List<Block> rest = new ArrayList<>();
        while (generator.remainingInBag() > 0) {
            rest.add(generator.next(ORIGIN));
        }
        assertThat(rest).hasSize(ShapeCatalog.SHAPES.size() - 1);

        generator.next(ORIGIN);
        assertThat(generator.remainingInBag()).isEqualTo(ShapeCatalog.SHAPES.size() - 1);
    }

    @Test
    void newBlockSitsAtOriginWithoutRotation() {
        Block block = new BlockGenerator().next(ORIGIN);

        assertThat(block.origin()).isEqualTo(ORIGIN);
        assertThat(block.degrees()).isZero();
        assertThat(ShapeCatalog.SHAPES).contains(block.vectors());
    }

    @Test
    void emptyCatalogIsRejected() {
        assertThatThrownBy(() -> new BlockGenerator(List.of(), new Random()))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
