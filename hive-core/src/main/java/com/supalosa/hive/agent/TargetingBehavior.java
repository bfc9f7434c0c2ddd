package com.supalosa.hive.agent;

import com.supalosa.hive.target.TargetClass;
import org.apache.commons.lang3.Validate;
import org.immutables.value.Value;

import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Which targets a parasite type goes after, and how far it is willing to look and chase.
 */
@Value.Immutable
public abstract class TargetingBehavior {

    /**
     * Target classes in priority order.
     */
    public abstract List<TargetClass> primaryTargets();

    /**
     * Target classes only engaged when no primary target is available.
     */
    public abstract List<TargetClass> secondaryTargets();

    /**
     * Seconds between target re-evaluations.
     */
    public abstract double targetSwitchCooldown();

    /**
     * Detection range around the territory centre. Also the default territory radius.
     */
    public abstract double maxTargetDistance();

    /**
     * Maximum distance from the territory centre a target is chased to.
     */
    public abstract double pursuitDistance();

    public boolean isValidTarget(TargetClass targetClass) {
        return primaryTargets().contains(targetClass) || secondaryTargets().contains(targetClass);
    }

    @Value.Check
    protected void check() {
        Validate.notEmpty(primaryTargets(), "A parasite needs at least one primary target class.");
        Set<TargetClass> seen = new HashSet<>();
        Stream.concat(primaryTargets().stream(), secondaryTargets().stream()).forEach(targetClass ->
                Validate.isTrue(seen.add(targetClass), "Target class %s listed more than once", targetClass));
        Validate.isTrue(targetSwitchCooldown() >= 0, "targetSwitchCooldown must not be negative");
        Validate.isTrue(maxTargetDistance() > 0, "maxTargetDistance must be positive: %f", maxTargetDistance());
        Validate.isTrue(pursuitDistance() > 0, "pursuitDistance must be positive: %f", pursuitDistance());
    }
}
