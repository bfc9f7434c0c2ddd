package com.supalosa.hive.agent;

import com.supalosa.hive.geometry.Point3d;
import org.immutables.value.Value;

/**
 * The result of moving one step on the ground plane.
 */
@Value.Immutable
public interface MovementStep {

    /**
     * The new position. The height is unchanged from where the step started.
     */
    Point3d position();

    /**
     * The facing angle, {@code atan2(dx, dz)}.
     */
    double facing();

    double distanceMoved();
}
