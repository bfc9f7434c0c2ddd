package com.supalosa.hive.utils;

import com.supalosa.hive.geometry.Point3d;
import org.danilopianini.util.FlexibleQuadTree;
import org.danilopianini.util.SpatialIndex;

import java.util.Collection;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * A quad-tree over the ground (x/z) plane. Items are located by the extractor, so an item must be removed
 * with the position it was inserted at.
 */
public class Point3dMap<T> {

    private final class ItemWithDistance {
        private T item;
        private double distance;
        private ItemWithDistance(T item, double distance) {
            this.item = item;
            this.distance = distance;
        }
    }

    private final SpatialIndex<T> index;
    private final Function<T, Point3d> extractor;
    private int size = 0;

    public Point3dMap(Function<T, Point3d> extractor) {
        this.index = new FlexibleQuadTree<>();
        this.extractor = extractor;
    }

    public void insert(T item, Point3d point) {
        index.insert(item, point.getX(), point.getZ());
        ++size;
    }

    public void insert(T item) {
        insert(item, extractor.apply(item));
    }

    public boolean remove(T item, Point3d point) {
        boolean removed = index.remove(item, point.getX(), point.getZ());
        if (removed) {
            --size;
        }
        return removed;
    }

    public boolean remove(T item) {
        return remove(item, extractor.apply(item));
    }

    public int size() {
        return size;
    }

    // The quad-tree only answers box queries, so the result is trimmed to the circle here.
    private Stream<ItemWithDistance> internalGetStreamInRadius(Point3d point, double radius) {
        Collection<T> initialResults = index.query(
                new double[]{point.getX() - radius, point.getZ() - radius},
                new double[]{point.getX() + radius, point.getZ() + radius});
        return initialResults.stream()
                .map(result -> new ItemWithDistance(result, extractor.apply(result).distance(point)))
                .filter(result -> result.distance <= radius);
    }

    public Collection<T> getInRadius(Point3d point, double radius, Predicate<T> filter) {
        return internalGetStreamInRadius(point, radius)
                .map(result -> result.item)
                .filter(filter)
                .collect(Collectors.toUnmodifiableList());
    }
}
