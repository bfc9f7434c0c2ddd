package com.supalosa.hive.target;

import com.supalosa.hive.geometry.Point3d;

import java.util.Optional;

public class FakeWorker implements Worker {

    private final String id;
    private Point3d position;
    private double energy;
    private final double energyCapacity;
    private boolean targetable = true;
    private Optional<Point3d> fledFrom = Optional.empty();

    public FakeWorker(String id, Point3d position) {
        this(id, position, 100.0, 100.0);
    }

    public FakeWorker(String id, Point3d position, double energy, double energyCapacity) {
        this.id = id;
        this.position = position;
        this.energy = energy;
        this.energyCapacity = energyCapacity;
    }

    @Override
    public String getId() {
        return id;
    }

    @Override
    public Point3d getPosition() {
        return position;
    }

    public void setPosition(Point3d position) {
        this.position = position;
    }

    @Override
    public Optional<Double> getHealth() {
        return Optional.empty();
    }

    @Override
    public Optional<Double> getMaxHealth() {
        return Optional.empty();
    }

    @Override
    public boolean canBeTargetedByParasites() {
        return targetable;
    }

    public void setTargetable(boolean targetable) {
        this.targetable = targetable;
    }

    @Override
    public double getEnergy() {
        return energy;
    }

    public void setEnergy(double energy) {
        this.energy = energy;
    }

    @Override
    public double getEnergyCapacity() {
        return energyCapacity;
    }

    @Override
    public double drainEnergy(double amount) {
        double drained = Math.min(amount, energy);
        energy -= drained;
        return drained;
    }

    @Override
    public void fleeFrom(Point3d danger, double distance) {
        fledFrom = Optional.of(danger);
    }

    public Optional<Point3d> getFledFrom() {
        return fledFrom;
    }
}
