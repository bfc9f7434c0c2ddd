package com.supalosa.hive.sim;

import org.immutables.value.Value;

@Value.Immutable
public interface SimulationSummary {

    int ticks();

    double simulatedSeconds();

    int parasitesSpawned();

    int parasitesDestroyed();

    int liveParasites();

    int energyParasites();

    int combatParasites();

    int protectorKills();

    int protectorEnergy();

    int protectorsAlive();

    double energyDrained();

    String optimizationLevel();

    int maxActiveParasites();

    boolean controlConsistent();
}
