package com.supalosa.hive.agent;

import com.supalosa.hive.target.TargetClass;
import com.supalosa.hive.target.TargetUnit;
import com.supalosa.hive.utils.Utils;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Hunts protectors before workers, adjusts its speed, reach and willingness to switch targets to its current
 * {@link Aggression}.
 */
public class TacticalTargetingStrategy implements TargetingStrategy {

    /**
     * Minimum age of a protector lock before switching to another protector is considered.
     */
    public static final double LOCK_DURATION = 3.0;
    public static final double WORKER_AGGRESSION_THRESHOLD = 0.6;

    static final double PROTECTOR_PRIORITY_BONUS = 0.5;
    static final double DAMAGED_TARGET_BONUS = 0.3;
    static final double SWITCH_THRESHOLD_FACTOR = 0.3;

    private final Aggression aggression;
    private double lastReevaluationAt = Double.NEGATIVE_INFINITY;

    public TacticalTargetingStrategy() {
        this(new Aggression());
    }

    public TacticalTargetingStrategy(Aggression aggression) {
        this.aggression = aggression;
    }

    @Override
    public List<TargetClass> targetPriority() {
        return List.of(TargetClass.PROTECTOR, TargetClass.WORKER);
    }

    @Override
    public void onStep(ParasiteAgent agent, List<TargetUnit> candidates, double now) {
        boolean protectorPresent = candidates.stream()
                .anyMatch(candidate -> candidate.getTargetClass() == TargetClass.PROTECTOR);
        boolean recentlyLocked = agent.getTargetLock()
                .map(lock -> now - lock.lockedAt() < LOCK_DURATION)
                .orElse(false);
        aggression.update(now, agent.getHealthFraction(), candidates.size(), protectorPresent, recentlyLocked);
    }

    @Override
    public Optional<TargetUnit> selectTarget(ParasiteAgent agent, List<TargetUnit> candidates) {
        Optional<TargetUnit> protector = nearestOfClass(agent, candidates, TargetClass.PROTECTOR);
        if (protector.isPresent()) {
            return protector;
        }
        if (aggression.getLevel() > WORKER_AGGRESSION_THRESHOLD) {
            return nearestOfClass(agent, candidates, TargetClass.WORKER);
        }
        return Optional.empty();
    }

    @Override
    public double computeSpeed(ParasiteAgent agent) {
        double multiplier = Utils.clamp(0.85 + 0.3 * aggression.getLevel(), 0.8, 1.2);
        return agent.getStats().speed() * multiplier;
    }

    @Override
    public double patrolRadiusFraction() {
        return 0.65 + 0.25 * aggression.getLevel();
    }

    @Override
    public double pursuitDistance(ParasiteAgent agent) {
        return agent.getTargetingBehavior().pursuitDistance() * aggression.getLevel();
    }

    @Override
    public Optional<TargetUnit> reevaluateTarget(ParasiteAgent agent, TargetUnit current,
                                                 List<TargetUnit> candidates, double now) {
        double cooldown = agent.getTargetingBehavior().targetSwitchCooldown();
        if (now - lastReevaluationAt < cooldown) {
            return Optional.empty();
        }
        lastReevaluationAt = now;

        if (current.getTargetClass() == TargetClass.WORKER) {
            // Any protector beats a worker.
            return nearestOfClass(agent, candidates, TargetClass.PROTECTOR);
        }
        boolean lockExpired = agent.getTargetLock()
                .map(lock -> now - lock.lockedAt() >= LOCK_DURATION)
                .orElse(true);
        if (!lockExpired) {
            return Optional.empty();
        }
        double currentScore = score(agent, current);
        double threshold = switchThreshold();
        return candidates.stream()
                .filter(candidate -> candidate.getTargetClass() == TargetClass.PROTECTOR)
                .filter(candidate -> !candidate.getId().equals(current.getId()))
                .max(Comparator.comparingDouble(candidate -> score(agent, candidate)))
                .filter(best -> score(agent, best) - currentScore > threshold);
    }

    @Override
    public double drainRate(ParasiteAgent agent) {
        return agent.getStats().drainRate() * (0.8 + 0.4 * aggression.getLevel());
    }

    @Override
    public double fleeThreshold(ParasiteAgent agent) {
        return agent.getStats().fleeThreshold() + 0.1 * aggression.getLevel();
    }

    @Override
    public Optional<Double> getAggression() {
        return Optional.of(aggression.getLevel());
    }

    /**
     * The margin a candidate has to win by to replace the current protector. Shrinks as aggression rises.
     */
    double switchThreshold() {
        return SWITCH_THRESHOLD_FACTOR * (1.0 - aggression.getLevel());
    }

    /**
     * Closer, higher priority and more damaged targets score higher.
     */
    double score(ParasiteAgent agent, TargetUnit target) {
        double distance = agent.getPosition().distance(target.getPosition());
        double closeness = Utils.clamp(1.0 - distance / agent.getTargetingBehavior().maxTargetDistance(), 0.0, 1.0);
        double priorityBonus = target.getTargetClass() == TargetClass.PROTECTOR ? PROTECTOR_PRIORITY_BONUS : 0.0;
        double healthFraction = target.getHealth()
                .flatMap(health -> target.getMaxHealth()
                        .filter(maxHealth -> maxHealth > 0)
                        .map(maxHealth -> Utils.clamp(health / maxHealth, 0.0, 1.0)))
                .orElse(1.0);
        return closeness + priorityBonus + DAMAGED_TARGET_BONUS * (1.0 - healthFraction);
    }

    private static Optional<TargetUnit> nearestOfClass(ParasiteAgent agent, List<TargetUnit> candidates,
                                                       TargetClass targetClass) {
        return candidates.stream()
                .filter(candidate -> candidate.getTargetClass() == targetClass)
                .min(Comparator.comparingDouble(candidate -> agent.getPosition().distance(candidate.getPosition())));
    }
}
