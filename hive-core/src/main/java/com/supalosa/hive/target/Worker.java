package com.supalosa.hive.target;

import com.supalosa.hive.geometry.Point3d;

/**
 * A target whose energy can be drained.
 */
public interface Worker extends TargetUnit {

    @Override
    default TargetClass getTargetClass() {
        return TargetClass.WORKER;
    }

    double getEnergy();

    double getEnergyCapacity();

    /**
     * Drains up to {@code amount} energy.
     *
     * @return The amount actually drained.
     */
    double drainEnergy(double amount);

    /**
     * Instructs the worker to run away from {@code danger} for the given distance.
     */
    void fleeFrom(Point3d danger, double distance);
}
