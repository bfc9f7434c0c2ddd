package com.supalosa.hive.control;

import org.apache.commons.lang3.Validate;
import org.immutables.value.Value;

/**
 * Spawning settings for a single territory.
 */
@Value.Immutable
public abstract class TerritorialSpawnConfig {

    @Value.Default
    public SpawnStrategy spawnStrategy() {
        return SpawnStrategy.BALANCED;
    }

    /**
     * Base spawn rate multiplier.
     */
    public abstract double spawnRate();

    @Value.Check
    protected void check() {
        Validate.isTrue(spawnRate() > 0, "spawnRate must be positive: %f", spawnRate());
    }
}
