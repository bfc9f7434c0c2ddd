package com.supalosa.hive.statistics;

import org.apache.commons.lang3.Validate;
import org.immutables.value.Value;

/**
 * The target mix of parasite types among spawns.
 */
@Value.Immutable
public abstract class SpawnDistribution {

    @Value.Default
    public double energyRate() {
        return 0.75;
    }

    @Value.Default
    public double combatRate() {
        return 0.25;
    }

    /**
     * How far the observed rate may drift from the target before it is corrected.
     */
    @Value.Default
    public double accuracy() {
        return 0.10;
    }

    @Value.Check
    protected void check() {
        Validate.inclusiveBetween(0.0, 1.0, energyRate(), "energyRate must be in [0, 1]");
        Validate.inclusiveBetween(0.0, 1.0, combatRate(), "combatRate must be in [0, 1]");
        Validate.isTrue(Math.abs(energyRate() + combatRate() - 1.0) < 1e-6,
                "Spawn rates must add up to 1: %f + %f", energyRate(), combatRate());
        Validate.isTrue(accuracy() > 0 && accuracy() < 1, "accuracy must be in (0, 1): %f", accuracy());
    }

    public static SpawnDistribution defaults() {
        return ImmutableSpawnDistribution.builder().build();
    }
}
