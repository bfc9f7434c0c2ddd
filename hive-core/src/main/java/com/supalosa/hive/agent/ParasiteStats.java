package com.supalosa.hive.agent;

import org.apache.commons.lang3.Validate;
import org.immutables.value.Value;

import java.util.Optional;

/**
 * The fixed statistics of a parasite type.
 */
@Value.Immutable
public abstract class ParasiteStats {

    public abstract int maxHealth();

    /**
     * Movement speed in units per second.
     */
    public abstract double speed();

    /**
     * Damage per second applied to protectors while feeding.
     */
    @Value.Default
    public double attackDamage() {
        return 0.0;
    }

    /**
     * Energy awarded to whoever kills the parasite.
     */
    @Value.Default
    public int energyReward() {
        return 1;
    }

    /**
     * Energy drained per second from workers while feeding.
     */
    @Value.Default
    public double drainRate() {
        return 3.0;
    }

    /**
     * Distance to the target at which hunting turns into feeding.
     */
    public abstract double engagementDistance();

    /**
     * Distance to the target at which a feeding parasite lets go.
     */
    public abstract double disengageDistance();

    /**
     * Fraction of a worker's energy capacity below which the worker flees.
     */
    @Value.Default
    public double fleeThreshold() {
        return 0.4;
    }

    /**
     * How far a worker runs when it flees.
     */
    @Value.Default
    public double fleeDistance() {
        return 25.0;
    }

    /**
     * Seconds without feeding after which the parasite starves, if it can starve at all.
     */
    public abstract Optional<Double> starvationTime();

    @Value.Check
    protected void check() {
        Validate.isTrue(maxHealth() > 0, "maxHealth must be positive: %d", maxHealth());
        Validate.isTrue(speed() > 0, "speed must be positive: %f", speed());
        Validate.isTrue(attackDamage() >= 0, "attackDamage must not be negative: %f", attackDamage());
        Validate.isTrue(drainRate() >= 0, "drainRate must not be negative: %f", drainRate());
        Validate.isTrue(engagementDistance() > 0, "engagementDistance must be positive: %f", engagementDistance());
        Validate.isTrue(disengageDistance() >= engagementDistance(),
                "disengageDistance (%f) must not be less than engagementDistance", disengageDistance());
        Validate.inclusiveBetween(0.0, 1.0, fleeThreshold(), "fleeThreshold must be in [0, 1]");
        Validate.isTrue(starvationTime().map(time -> time > 0).orElse(true), "starvationTime must be positive");
    }
}
