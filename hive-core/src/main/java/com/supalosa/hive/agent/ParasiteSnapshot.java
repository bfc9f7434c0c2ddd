package com.supalosa.hive.agent;

import com.supalosa.hive.geometry.Point3d;
import com.supalosa.hive.target.TargetClass;
import org.immutables.value.Value;

import java.util.Optional;

/**
 * A read-only view of a parasite at one moment, for statistics and debugging.
 */
@Value.Immutable
public interface ParasiteSnapshot {

    String id();

    ParasiteType type();

    ParasiteState state();

    Point3d position();

    int health();

    int maxHealth();

    Optional<TargetClass> currentTargetClass();

    Optional<Double> aggression();

    Optional<String> territoryId();
}
