package com.supalosa.hive.geometry;

import java.util.Objects;

/**
 * An immutable point (or vector) in world space. The ground plane is x/z, y is up.
 */
public final class Point3d {

    public static final Point3d ORIGIN = new Point3d(0.0, 0.0, 0.0);

    private final double x;
    private final double y;
    private final double z;

    private Point3d(double x, double y, double z) {
        this.x = x;
        this.y = y;
        this.z = z;
    }

    public static Point3d of(double x, double y, double z) {
        return new Point3d(x, y, z);
    }

    public double getX() {
        return x;
    }

    public double getY() {
        return y;
    }

    public double getZ() {
        return z;
    }

    public double distance(Point3d other) {
        double dx = other.x - x;
        double dy = other.y - y;
        double dz = other.z - z;
        return Math.sqrt(dx * dx + dy * dy + dz * dz);
    }

    /**
     * Distance on the ground (x/z) plane, ignoring height.
     */
    public double distance2d(Point3d other) {
        double dx = other.x - x;
        double dz = other.z - z;
        return Math.sqrt(dx * dx + dz * dz);
    }

    public double length() {
        return Math.sqrt(x * x + y * y + z * z);
    }

    public Point3d add(Point3d other) {
        return new Point3d(x + other.x, y + other.y, z + other.z);
    }

    public Point3d sub(Point3d other) {
        return new Point3d(x - other.x, y - other.y, z - other.z);
    }

    public Point3d mul(double scalar) {
        return new Point3d(x * scalar, y * scalar, z * scalar);
    }

    public Point3d div(double scalar) {
        return new Point3d(x / scalar, y / scalar, z / scalar);
    }

    public Point3d withY(double newY) {
        return new Point3d(x, newY, z);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Point3d other = (Point3d) o;
        return Double.compare(other.x, x) == 0 &&
                Double.compare(other.y, y) == 0 &&
                Double.compare(other.z, z) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(x, y, z);
    }

    @Override
    public String toString() {
        return String.format("(%.2f, %.2f, %.2f)", x, y, z);
    }
}
