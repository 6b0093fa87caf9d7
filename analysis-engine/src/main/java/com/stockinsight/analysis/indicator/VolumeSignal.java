package com.stockinsight.analysis.indicator;

/**
 * CONFIRMING when volume is above its trailing average and the latest price move
 * agrees with the recent trend; DIVERGENT otherwise.
 */
public enum VolumeSignal {
    CONFIRMING,
    DIVERGENT
}
