package com.supalosa.hive.performance;

import com.supalosa.hive.agent.ParasiteAgent;

/**
 * Receives the fidelity tier decisions of the {@link PerformanceGovernor}.
 */
public interface FidelityListener {

    void onFidelityAssigned(ParasiteAgent agent, FidelityTier tier);
}
