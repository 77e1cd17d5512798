package com.loadforecast.split;

/**
 * @param stratificationMinMax keep the days with the highest and the lowest peak load in the train set
 * @param backTest             take the test days from the end of the dataset instead of the start
 * @param seed                 seed of the day shuffle, so a split is reproducible
 */
public record SplitOptions(boolean stratificationMinMax, boolean backTest, long seed) {

    public static final long DEFAULT_SEED = 42L;

    public static SplitOptions defaults() {
        return new SplitOptions(true, true, DEFAULT_SEED);
    }
}
