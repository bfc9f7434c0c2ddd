package com.supalosa.hive.sim;

import com.supalosa.hive.ParasiteManager;
import com.supalosa.hive.geometry.Point3d;
import com.supalosa.hive.target.Protector;

import java.util.Optional;

/**
 * A stationary guard that hits a parasite in range every tick.
 */
public class SimpleProtector implements Protector {

    private final String id;
    private final Point3d position;
    private final double maxHealth;
    private final double attackRange;
    private final double attackDamagePerSecond;

    private double health;
    private int kills;
    private int energyCollected;

    public SimpleProtector(String id, Point3d position, double maxHealth, double attackRange,
                           double attackDamagePerSecond) {
        this.id = id;
        this.position = position;
        this.maxHealth = maxHealth;
        this.attackRange = attackRange;
        this.attackDamagePerSecond = attackDamagePerSecond;
        this.health = maxHealth;
    }

    public void step(double deltaTime, ParasiteManager manager) {
        if (!isAlive()) {
            return;
        }
        manager.damageParasiteAt(position, attackRange, attackDamagePerSecond * deltaTime)
                .filter(parasite -> !parasite.isAlive())
                .ifPresent(parasite -> {
                    ++kills;
                    energyCollected += parasite.getEnergyReward();
                });
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
        return Optional.of(health);
    }

    @Override
    public Optional<Double> getMaxHealth() {
        return Optional.of(maxHealth);
    }

    @Override
    public boolean canBeTargetedByParasites() {
        return isAlive();
    }

    @Override
    public void takeDamage(double amount) {
        health = Math.max(0.0, health - amount);
    }

    public boolean isAlive() {
        return health > 0;
    }

    public int getKills() {
        return kills;
    }

    /**
     * @return The energy rewards of every parasite this protector has killed.
     */
    public int getEnergyCollected() {
        return energyCollected;
    }
}
