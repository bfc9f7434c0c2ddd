package com.supalosa.hive.agent;

import com.supalosa.hive.target.TargetClass;
import com.supalosa.hive.target.TargetUnit;

import java.util.List;
import java.util.Optional;

/**
 * Goes after the first worker it sees, at a fixed speed, and never switches.
 */
public class BasicTargetingStrategy implements TargetingStrategy {

    public static final double PATROL_RADIUS_FRACTION = 0.8;

    @Override
    public List<TargetClass> targetPriority() {
        return List.of(TargetClass.WORKER);
    }

    @Override
    public Optional<TargetUnit> selectTarget(ParasiteAgent agent, List<TargetUnit> candidates) {
        return candidates.stream()
                .filter(candidate -> candidate.getTargetClass() == TargetClass.WORKER)
                .findFirst();
    }

    @Override
    public double computeSpeed(ParasiteAgent agent) {
        return agent.getStats().speed();
    }

    @Override
    public double patrolRadiusFraction() {
        return PATROL_RADIUS_FRACTION;
    }

    @Override
    public double pursuitDistance(ParasiteAgent agent) {
        return agent.getTerritoryRadius();
    }
}
