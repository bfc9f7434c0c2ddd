package com.supalosa.hive.statistics;

import org.immutables.value.Value;

import java.util.Optional;

@Value.Immutable
public interface PerformanceStats {

    int optimizationLevel();

    /**
     * {@code None}, {@code Basic} or {@code Aggressive}.
     */
    String renderingOptimizations();

    int maxActiveParasites();

    int activeParasites();

    Optional<Double> lastPerformanceCheck();
}
