package com.supalosa.hive.statistics;

import org.immutables.value.Value;

@Value.Immutable
public interface DistributionStats {

    int totalSpawns();

    int energySpawns();

    int combatSpawns();

    double energyRatio();

    double combatRatio();

    SpawnDistribution target();

    boolean isAccurate();

    int windowSize();
}
