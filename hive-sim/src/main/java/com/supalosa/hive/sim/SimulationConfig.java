package com.supalosa.hive.sim;

import org.apache.commons.lang3.Validate;
import org.immutables.value.Value;

/**
 * Settings of a headless simulation run. Times are in seconds, distances in world units.
 */
@Value.Immutable
public abstract class SimulationConfig {

    @Value.Default
    public int ticks() {
        return 1200;
    }

    @Value.Default
    public double tickLength() {
        return 0.05;
    }

    @Value.Default
    public long seed() {
        return 1L;
    }

    /**
     * Each queen holds one territory, laid out side by side along the x axis.
     */
    @Value.Default
    public int queens() {
        return 2;
    }

    @Value.Default
    public int workersPerTerritory() {
        return 6;
    }

    @Value.Default
    public int protectorsPerTerritory() {
        return 2;
    }

    @Value.Default
    public int maxParasitesPerTerritory() {
        return 8;
    }

    @Value.Default
    public double spawnInterval() {
        return 2.0;
    }

    @Value.Default
    public double territorySize() {
        return 128.0;
    }

    @Value.Default
    public double viewRadius() {
        return 400.0;
    }

    /**
     * The frame rate with no parasites around. Every live parasite costs {@link #fpsCostPerParasite()} frames.
     */
    @Value.Default
    public double baseFps() {
        return 60.0;
    }

    @Value.Default
    public double fpsCostPerParasite() {
        return 1.0;
    }

    @Value.Default
    public double statsInterval() {
        return 5.0;
    }

    @Value.Default
    public double controlCheckInterval() {
        return 10.0;
    }

    @Value.Check
    protected void check() {
        Validate.isTrue(ticks() > 0, "ticks must be positive: %d", ticks());
        Validate.isTrue(tickLength() > 0, "tickLength must be positive: %f", tickLength());
        Validate.isTrue(queens() > 0, "queens must be positive: %d", queens());
        Validate.isTrue(workersPerTerritory() >= 0, "workersPerTerritory must not be negative");
        Validate.isTrue(protectorsPerTerritory() >= 0, "protectorsPerTerritory must not be negative");
        Validate.isTrue(maxParasitesPerTerritory() > 0, "maxParasitesPerTerritory must be positive");
        Validate.isTrue(spawnInterval() > 0, "spawnInterval must be positive: %f", spawnInterval());
        Validate.isTrue(territorySize() > 0, "territorySize must be positive: %f", territorySize());
        Validate.isTrue(viewRadius() > 0, "viewRadius must be positive: %f", viewRadius());
        Validate.isTrue(baseFps() > 0, "baseFps must be positive: %f", baseFps());
        Validate.isTrue(fpsCostPerParasite() >= 0, "fpsCostPerParasite must not be negative");
        Validate.isTrue(statsInterval() > 0, "statsInterval must be positive: %f", statsInterval());
        Validate.isTrue(controlCheckInterval() > 0, "controlCheckInterval must be positive: %f",
                controlCheckInterval());
    }

    public static SimulationConfig defaults() {
        return ImmutableSimulationConfig.builder().build();
    }
}
