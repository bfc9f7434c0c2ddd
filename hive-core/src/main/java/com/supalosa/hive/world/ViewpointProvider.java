package com.supalosa.hive.world;

import com.supalosa.hive.geometry.Point3d;

import java.util.Optional;

/**
 * Supplies the focal point of the player's view, used for distance culling.
 */
@FunctionalInterface
public interface ViewpointProvider {

    /**
     * @return The current viewpoint, or empty if there is no camera yet.
     */
    Optional<Point3d> viewpoint();
}
