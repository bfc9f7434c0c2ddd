package com.supalosa.hive.agent;

import com.supalosa.hive.geometry.Point3d;

import java.util.Optional;

/**
 * The straight-line movement primitive shared by every parasite.
 */
public class Movement {

    /**
     * Steps shorter than this do not count as movement.
     */
    public static final double EPSILON = 1e-4;

    private Movement() {
    }

    /**
     * Moves from {@code from} towards {@code to} at {@code speed} for {@code deltaTime} seconds, on the x/z plane,
     * without overshooting the destination.
     *
     * @return The step taken, or empty if the step would be too small to count as movement.
     */
    public static Optional<MovementStep> step(Point3d from, Point3d to, double speed, double deltaTime) {
        double dx = to.getX() - from.getX();
        double dz = to.getZ() - from.getZ();
        double remaining = Math.sqrt(dx * dx + dz * dz);
        double distance = Math.min(speed * deltaTime, remaining);
        if (remaining <= EPSILON || distance <= EPSILON) {
            return Optional.empty();
        }
        double ratio = distance / remaining;
        return Optional.of(ImmutableMovementStep.builder()
                .position(Point3d.of(from.getX() + dx * ratio, from.getY(), from.getZ() + dz * ratio))
                .facing(Math.atan2(dx, dz))
                .distanceMoved(distance)
                .build());
    }
}
