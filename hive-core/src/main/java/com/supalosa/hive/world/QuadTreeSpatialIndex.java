package com.supalosa.hive.world;

import com.supalosa.hive.geometry.Point3d;
import com.supalosa.hive.utils.Point3dMap;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * {@link SpatialIndex} backed by a quad-tree on the ground plane.
 */
public class QuadTreeSpatialIndex implements SpatialIndex {

    private static final class IndexedEntity {
        private final String entityId;
        private final EntityTag tag;
        private final Point3d position;

        private IndexedEntity(String entityId, EntityTag tag, Point3d position) {
            this.entityId = entityId;
            this.tag = tag;
            this.position = position;
        }
    }

    private Point3dMap<IndexedEntity> tree;
    private final Map<String, IndexedEntity> entities;

    public QuadTreeSpatialIndex() {
        this.tree = new Point3dMap<>(entity -> entity.position);
        this.entities = new HashMap<>();
    }

    @Override
    public void add(String entityId, Point3d position, EntityTag tag) {
        remove(entityId);
        IndexedEntity entity = new IndexedEntity(entityId, tag, position);
        entities.put(entityId, entity);
        tree.insert(entity);
    }

    @Override
    public void remove(String entityId) {
        IndexedEntity existing = entities.remove(entityId);
        if (existing != null) {
            tree.remove(existing);
        }
    }

    @Override
    public void updatePosition(String entityId, Point3d position) {
        IndexedEntity existing = entities.get(entityId);
        if (existing == null || existing.position.equals(position)) {
            return;
        }
        tree.remove(existing);
        IndexedEntity moved = new IndexedEntity(entityId, existing.tag, position);
        entities.put(entityId, moved);
        tree.insert(moved);
    }

    @Override
    public List<String> queryInRadius(Point3d centre, double radius, Set<EntityTag> tags) {
        return tree.getInRadius(centre, radius, entity -> tags.contains(entity.tag)).stream()
                .map(entity -> entity.entityId)
                .collect(Collectors.toList());
    }

    @Override
    public Optional<Point3d> getPosition(String entityId) {
        return Optional.ofNullable(entities.get(entityId)).map(entity -> entity.position);
    }

    public Optional<EntityTag> getTag(String entityId) {
        return Optional.ofNullable(entities.get(entityId)).map(entity -> entity.tag);
    }

    @Override
    public int size() {
        return entities.size();
    }

    @Override
    public void clear() {
        entities.clear();
        tree = new Point3dMap<>(entity -> entity.position);
    }
}
