package com.supalosa.hive.world;

import com.supalosa.hive.geometry.Point3d;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Index of entity positions by id, used to find entities near a point without scanning every entity.
 */
public interface SpatialIndex {

    void add(String entityId, Point3d position, EntityTag tag);

    void remove(String entityId);

    /**
     * Moves an entity that was previously added. Unknown ids are ignored.
     */
    void updatePosition(String entityId, Point3d position);

    /**
     * Returns the ids of entities with one of the given tags that are within {@code radius} of {@code centre}.
     */
    List<String> queryInRadius(Point3d centre, double radius, Set<EntityTag> tags);

    Optional<Point3d> getPosition(String entityId);

    int size();

    void clear();
}
