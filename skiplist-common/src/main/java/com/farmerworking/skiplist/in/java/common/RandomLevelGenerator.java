package com.farmerworking.skiplist.in.java.common;

import com.farmerworking.skiplist.in.java.api.Options;
import com.google.common.base.Preconditions;

import java.util.Random;

// Geometric level distribution truncated at maxLevel: starting from 0, each
// successful coin flip (probability p) raises the level by one.
public class RandomLevelGenerator implements LevelGenerator {
    private final int maxLevel;
    private final double probability;
    private final long seed;
    private final Random random;

    public RandomLevelGenerator(int maxLevel, double probability, long seed) {
        Preconditions.checkArgument(maxLevel >= 0 && maxLevel <= Options.MAX_LEVEL_LIMIT,
                "max level should be in [0, %s]: %s", Options.MAX_LEVEL_LIMIT, maxLevel);
        Preconditions.checkArgument(probability >= 0 && probability < 1,
                "probability should be in [0, 1): %s", probability);

        this.maxLevel = maxLevel;
        this.probability = probability;
        this.seed = seed;
        this.random = new Random(seed);
    }

    public RandomLevelGenerator(Options options) {
        this(options.getMaxLevel(),
                options.getProbability(),
                options.getSeed() == null ? System.nanoTime() : options.getSeed());

        if (options.getInfoLog() != null) {
            options.getInfoLog().log("level generator created",
                    String.valueOf(seed), String.valueOf(maxLevel), String.valueOf(probability));
        }
    }

    @Override
    public int maxLevel() {
        return maxLevel;
    }

    @Override
    public int randomLevel() {
        int level = 0;
        while (level < maxLevel && random.nextDouble() < probability) {
            level ++;
        }
        return level;
    }

    public long getSeed() {
        return seed;
    }

    public double getProbability() {
        return probability;
    }
}
