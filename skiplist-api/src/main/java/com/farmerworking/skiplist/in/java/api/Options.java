package com.farmerworking.skiplist.in.java.api;

import lombok.Data;

@Data
public class Options {
    public interface Logger {
        // Write an entry to the log with the specified message and arguments.
        void log(String msg, String... args);
    }

    // Upper bound accepted for maxLevel.
    public static final int MAX_LEVEL_LIMIT = 32;

    // Highest level a node may be assigned. The head sentinel keeps
    // maxLevel + 1 forward links, so the expected number of elements that
    // can be handled in logarithmic time is about (1/probability)^maxLevel.
    //
    // REQUIRES: 0 <= maxLevel <= MAX_LEVEL_LIMIT
    // Default: 16
    private int maxLevel = 16;

    // Probability that a node present at level i is also linked at level
    // i + 1. Smaller values use fewer links per node, larger values make
    // searches touch fewer nodes per level.
    //
    // REQUIRES: 0 <= probability < 1
    // Default: 0.5
    private double probability = 0.5;

    // Seed for the level generator. Two lists created with the same seed and
    // fed the same insertions end up with the same topology.
    //
    // Default: null, which seeds from the system clock
    private Long seed = null;

    // Informational messages (for example the seed actually used) are written
    // to infoLog if it is non-null.
    //
    // Default: null
    private Logger infoLog = null;

    public Options() {}

    public Options(Options options) {
        this.maxLevel = options.maxLevel;
        this.probability = options.probability;
        this.seed = options.seed;
        this.infoLog = options.infoLog;
    }
}
