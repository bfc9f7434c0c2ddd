package com.supalosa.hive.sim;

import com.supalosa.hive.agent.Movement;
import com.supalosa.hive.agent.MovementStep;
import com.supalosa.hive.geometry.Point3d;
import com.supalosa.hive.target.Worker;
import com.supalosa.hive.utils.Utils;

import java.util.Optional;
import java.util.Random;

/**
 * A worker that wanders around its home, slowly regains energy and runs away when a parasite scares it off.
 */
public class SimpleWorker implements Worker {

    private final String id;
    private final Point3d home;
    private final double wanderRadius;
    private final double speed;
    private final double energyCapacity;
    private final double energyRegenRate;
    private final Random random;

    private Point3d position;
    private Point3d wanderTarget;
    private Optional<Point3d> fleeDestination = Optional.empty();
    private double energy;
    private double totalDrained;

    public SimpleWorker(String id, Point3d home, double wanderRadius, double speed, double energyCapacity,
                        double energyRegenRate, Random random) {
        this.id = id;
        this.home = home;
        this.wanderRadius = wanderRadius;
        this.speed = speed;
        this.energyCapacity = energyCapacity;
        this.energyRegenRate = energyRegenRate;
        this.random = random;
        this.position = home;
        this.wanderTarget = home;
        this.energy = energyCapacity;
    }

    public void step(double deltaTime) {
        energy = Math.min(energyCapacity, energy + energyRegenRate * deltaTime);

        if (fleeDestination.isPresent()) {
            if (!moveTowards(fleeDestination.get(), speed * 1.5, deltaTime)) {
                fleeDestination = Optional.empty();
            }
            return;
        }
        if (!moveTowards(wanderTarget, speed, deltaTime)) {
            wanderTarget = Utils.randomPointAround(home, wanderRadius, random);
        }
    }

    private boolean moveTowards(Point3d destination, double moveSpeed, double deltaTime) {
        Optional<MovementStep> step = Movement.step(position, destination, moveSpeed, deltaTime);
        step.ifPresent(movement -> position = movement.position());
        return step.isPresent();
    }

    @Override
    public String getId() {
        return id;
    }

    @Override
    public Point3d getPosition() {
        return position;
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
        // Fleeing workers are left alone until they stop.
        return fleeDestination.isEmpty();
    }

    @Override
    public double getEnergy() {
        return energy;
    }

    @Override
    public double getEnergyCapacity() {
        return energyCapacity;
    }

    @Override
    public double drainEnergy(double amount) {
        double drained = Math.min(amount, energy);
        energy -= drained;
        totalDrained += drained;
        return drained;
    }

    @Override
    public void fleeFrom(Point3d danger, double distance) {
        fleeDestination = Optional.of(Utils.getFleePosition(position, danger, distance));
    }

    public boolean isFleeing() {
        return fleeDestination.isPresent();
    }

    public double getTotalDrained() {
        return totalDrained;
    }
}
