package com.supalosa.hive.performance;

import org.apache.commons.lang3.Validate;
import org.immutables.value.Value;

/**
 * Thresholds of the {@link PerformanceGovernor}. Times are in seconds, distances in world units.
 */
@Value.Immutable
public abstract class GovernorConfig {

    @Value.Default
    public double checkInterval() {
        return 1.0;
    }

    /**
     * Below this frame rate, with more than {@link #aggressiveMinParasites()} parasites, optimisation is aggressive.
     */
    @Value.Default
    public double aggressiveFps() {
        return 45.0;
    }

    @Value.Default
    public int aggressiveMinParasites() {
        return 5;
    }

    @Value.Default
    public double basicFps() {
        return 55.0;
    }

    @Value.Default
    public int basicMinParasites() {
        return 7;
    }

    /**
     * At or above this frame rate optimisation is switched off and the cap recovers.
     */
    @Value.Default
    public double recoveryFps() {
        return 58.0;
    }

    @Value.Default
    public int aggressiveCapFloor() {
        return 5;
    }

    @Value.Default
    public double aggressiveCapFactor() {
        return 0.7;
    }

    @Value.Default
    public int basicCapFloor() {
        return 7;
    }

    @Value.Default
    public double basicCapFactor() {
        return 0.85;
    }

    /**
     * The cap never recovers past this value, and starts at it.
     */
    @Value.Default
    public int maxCap() {
        return 10;
    }

    @Value.Default
    public int manualCapMin() {
        return 1;
    }

    @Value.Default
    public int manualCapMax() {
        return 20;
    }

    @Value.Default
    public double basicMinimalDistance() {
        return 100.0;
    }

    @Value.Default
    public double basicReducedDistance() {
        return 50.0;
    }

    @Value.Default
    public double aggressiveMinimalDistance() {
        return 75.0;
    }

    @Value.Default
    public double aggressiveReducedDistance() {
        return 40.0;
    }

    /**
     * Added to the priority of combat parasites when deciding who stays visible.
     */
    @Value.Default
    public double combatPriorityBonus() {
        return 1000.0;
    }

    @Value.Check
    protected void check() {
        Validate.isTrue(checkInterval() > 0, "checkInterval must be positive: %f", checkInterval());
        Validate.isTrue(aggressiveFps() <= basicFps() && basicFps() <= recoveryFps(),
                "Frame rate thresholds must be ordered: %f <= %f <= %f", aggressiveFps(), basicFps(), recoveryFps());
        Validate.isTrue(aggressiveCapFloor() > 0 && basicCapFloor() > 0, "Cap floors must be positive");
        Validate.isTrue(aggressiveCapFactor() > 0 && aggressiveCapFactor() <= 1, "aggressiveCapFactor must be in (0, 1]");
        Validate.isTrue(basicCapFactor() > 0 && basicCapFactor() <= 1, "basicCapFactor must be in (0, 1]");
        Validate.isTrue(maxCap() >= Math.max(aggressiveCapFloor(), basicCapFloor()),
                "maxCap (%d) must not be below the cap floors", maxCap());
        Validate.isTrue(manualCapMin() > 0 && manualCapMin() <= manualCapMax(), "Invalid manual cap bounds");
        Validate.isTrue(basicReducedDistance() < basicMinimalDistance(), "basic distance bands must be ordered");
        Validate.isTrue(aggressiveReducedDistance() < aggressiveMinimalDistance(),
                "aggressive distance bands must be ordered");
    }

    public static GovernorConfig defaults() {
        return ImmutableGovernorConfig.builder().build();
    }
}
