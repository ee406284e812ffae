package com.farmerworking.skiplist.in.java.common;

public interface LevelGenerator {
    // Highest level randomLevel() may return.
    int maxLevel();

    // Draw the level for a newly inserted node, in [0, maxLevel()].
    int randomLevel();
}
