package com.supalosa.hive.agent;

import com.supalosa.hive.utils.Utils;

/**
 * The aggression level of a tactical parasite, in [0, 1]. It drops when the parasite is hurt, rises when there is a
 * lot to fight, and moves slowly because every recomputation is blended with the previous value.
 */
public class Aggression {

    public static final double INITIAL_LEVEL = 0.85;
    public static final double UPDATE_INTERVAL = 0.5;

    static final double BASE_LEVEL = 0.80;
    static final double CAP = 0.95;
    static final double SMOOTHING = 0.8;

    private double level;
    private double lastUpdateAt = Double.NEGATIVE_INFINITY;

    public Aggression() {
        this(INITIAL_LEVEL);
    }

    public Aggression(double initialLevel) {
        this.level = Utils.clamp(initialLevel, 0.0, 1.0);
    }

    public double getLevel() {
        return level;
    }

    /**
     * Recomputes the level if the update interval has passed.
     *
     * @param healthFraction Current health over max health.
     * @param candidateCount Number of targets currently available.
     * @param priorityTargetPresent Whether any protector is available.
     * @param recentlyLocked Whether the current target lock is younger than the lock duration.
     * @return True if the level was recomputed.
     */
    public boolean update(double now, double healthFraction, int candidateCount, boolean priorityTargetPresent,
                          boolean recentlyLocked) {
        if (now - lastUpdateAt < UPDATE_INTERVAL) {
            return false;
        }
        lastUpdateAt = now;

        double target = BASE_LEVEL;
        if (healthFraction < 0.15) {
            target *= 0.4;
        } else if (healthFraction < 0.5) {
            target *= 0.75;
        }
        if (candidateCount > 2) {
            target = Math.min(CAP, target * 1.15);
        }
        if (priorityTargetPresent) {
            target = Math.min(CAP, target * 1.08);
        }
        if (recentlyLocked) {
            target *= 0.95;
        }
        level = Utils.clamp(level * SMOOTHING + target * (1.0 - SMOOTHING), 0.0, 1.0);
        return true;
    }
}
