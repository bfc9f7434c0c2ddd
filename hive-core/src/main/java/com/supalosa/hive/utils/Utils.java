package com.supalosa.hive.utils;

import com.supalosa.hive.geometry.Point3d;

import java.util.Random;

public class Utils {

    /**
     * Returns a random point on the ground plane around {@code centre}, at a uniformly chosen angle and a
     * uniformly chosen distance in {@code [0, maxDistance)}. The height of the centre is kept.
     */
    public static Point3d randomPointAround(Point3d centre, double maxDistance, Random random) {
        double angle = random.nextDouble() * Math.PI * 2;
        double distance = random.nextDouble() * maxDistance;
        return Point3d.of(
                centre.getX() + Math.cos(angle) * distance,
                centre.getY(),
                centre.getZ() + Math.sin(angle) * distance);
    }

    public static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }

    /**
     * Returns the position a certain distance away from the danger, on the ground plane.
     * @param myPosition The position of the current unit.
     * @param dangerPosition The position of the thing to get away from.
     * @param distance The distance to move away.
     */
    public static Point3d getFleePosition(Point3d myPosition, Point3d dangerPosition, double distance) {
        double dx = dangerPosition.getX() - myPosition.getX();
        double dz = dangerPosition.getZ() - myPosition.getZ();
        double length = Math.max(1.0, myPosition.distance2d(dangerPosition));
        return Point3d.of(
                myPosition.getX() - (dx / length) * distance,
                myPosition.getY(),
                myPosition.getZ() - (dz / length) * distance);
    }
}
