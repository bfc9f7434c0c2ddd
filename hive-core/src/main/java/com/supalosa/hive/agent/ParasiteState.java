package com.supalosa.hive.agent;

public enum ParasiteState {
    /**
     * Just spawned, waiting out the spawn delay.
     */
    SPAWNING,
    /**
     * Wandering between waypoints inside the territory, looking for targets.
     */
    PATROLLING,
    /**
     * Moving towards a locked target.
     */
    HUNTING,
    /**
     * In contact with the locked target, draining or attacking it.
     */
    FEEDING,
    /**
     * Heading back to the territory centre after abandoning a target.
     */
    RETURNING
}
