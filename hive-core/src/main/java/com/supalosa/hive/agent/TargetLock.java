package com.supalosa.hive.agent;

import com.supalosa.hive.target.TargetClass;
import org.immutables.value.Value;

/**
 * A parasite's hold on its current target. Only the id is kept, the unit itself is looked up every tick so a
 * destroyed target simply stops being found.
 */
@Value.Immutable
public interface TargetLock {

    @Value.Parameter
    String targetId();

    @Value.Parameter
    TargetClass targetClass();

    /**
     * Simulation time the lock was taken.
     */
    @Value.Parameter
    double lockedAt();

    static TargetLock of(String targetId, TargetClass targetClass, double lockedAt) {
        return ImmutableTargetLock.of(targetId, targetClass, lockedAt);
    }
}
