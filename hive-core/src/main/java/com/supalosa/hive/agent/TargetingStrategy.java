package com.supalosa.hive.agent;

import com.supalosa.hive.target.TargetClass;
import com.supalosa.hive.target.TargetUnit;

import java.util.List;
import java.util.Optional;

/**
 * Decides what a parasite goes after and how hard it pushes. The state machine itself lives in
 * {@link ParasiteAgent}; a strategy only answers the questions the state machine asks it.
 *
 * Strategies may keep per-parasite state, so each parasite gets its own instance.
 */
public interface TargetingStrategy {

    /**
     * The target classes this strategy considers, most important first.
     */
    List<TargetClass> targetPriority();

    /**
     * Called at the start of every update with the eligible candidates for this tick.
     */
    default void onStep(ParasiteAgent agent, List<TargetUnit> candidates, double now) {
    }

    /**
     * Picks a target from the eligible candidates, or empty if none should be engaged.
     */
    Optional<TargetUnit> selectTarget(ParasiteAgent agent, List<TargetUnit> candidates);

    /**
     * The current movement speed in units per second.
     */
    double computeSpeed(ParasiteAgent agent);

    /**
     * The fraction of the territory radius that patrol waypoints are drawn from.
     */
    double patrolRadiusFraction();

    /**
     * How far from the territory centre a target is chased before being given up.
     */
    double pursuitDistance(ParasiteAgent agent);

    /**
     * Called while hunting. Returns a replacement for the current target if the strategy wants to switch.
     */
    default Optional<TargetUnit> reevaluateTarget(ParasiteAgent agent, TargetUnit current,
                                                  List<TargetUnit> candidates, double now) {
        return Optional.empty();
    }

    /**
     * Energy drained from a worker per second.
     */
    default double drainRate(ParasiteAgent agent) {
        return agent.getStats().drainRate();
    }

    /**
     * Energy fraction below which a drained worker flees.
     */
    default double fleeThreshold(ParasiteAgent agent) {
        return agent.getStats().fleeThreshold();
    }

    default Optional<Double> getAggression() {
        return Optional.empty();
    }
}
