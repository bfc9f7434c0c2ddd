package com.supalosa.hive.performance;

/**
 * How much rendering effort a parasite gets. The core only decides the tier; drawing it is up to the host.
 */
public enum FidelityTier {
    FULL,
    REDUCED,
    MINIMAL,
    HIDDEN
}
