package com.supalosa.hive.target;

import com.supalosa.hive.geometry.Point3d;

import java.util.Optional;

/**
 * An external unit that parasites may consider as a target. Parasites never own these units; they are looked up
 * again every tick.
 */
public interface TargetUnit {

    String getId();

    TargetClass getTargetClass();

    Point3d getPosition();

    /**
     * Current health, if this unit has any.
     */
    Optional<Double> getHealth();

    Optional<Double> getMaxHealth();

    /**
     * Whether the unit can currently be targeted by parasites at all (for example, not immune or dead).
     */
    boolean canBeTargetedByParasites();
}
