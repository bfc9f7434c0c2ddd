package com.supalosa.hive.statistics;

import org.immutables.value.Value;

import java.util.Map;

@Value.Immutable
public interface LifecycleStats {

    int totalParasites();

    int energyParasites();

    int combatParasites();

    /**
     * Number of tracked parasites per owning territory.
     */
    Map<String, Integer> parasitesByTerritory();

    /**
     * 1.0 if the spawn mix is within tolerance, otherwise 0.0.
     */
    double distributionAccuracy();
}
