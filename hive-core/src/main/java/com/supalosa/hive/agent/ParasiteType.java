package com.supalosa.hive.agent;

import com.supalosa.hive.target.TargetClass;
import com.supalosa.hive.world.EntityTag;

import java.util.List;

public enum ParasiteType {
    /**
     * Drains energy from workers. Cheap, fragile and starves if it cannot feed.
     */
    ENERGY(ImmutableParasiteStats.builder()
                    .maxHealth(2)
                    .speed(2.0)
                    .attackDamage(0.0)
                    .energyReward(2)
                    .drainRate(3.0)
                    .engagementDistance(3.0)
                    .disengageDistance(5.0)
                    .fleeThreshold(0.4)
                    .fleeDistance(25.0)
                    .starvationTime(180.0)
                    .build(),
            ImmutableTargetingBehavior.builder()
                    .primaryTargets(List.of(TargetClass.WORKER))
                    .targetSwitchCooldown(2.0)
                    .maxTargetDistance(50.0)
                    .pursuitDistance(60.0)
                    .build(),
            EntityTag.ENERGY_PARASITE),
    /**
     * Hunts protectors first and workers second. Twice as tough and a bit faster.
     */
    COMBAT(ImmutableParasiteStats.builder()
                    .maxHealth(4)
                    .speed(2.5)
                    .attackDamage(2.0)
                    .energyReward(4)
                    .drainRate(3.0)
                    .engagementDistance(3.5)
                    .disengageDistance(5.0)
                    .fleeThreshold(0.35)
                    .fleeDistance(30.0)
                    .build(),
            ImmutableTargetingBehavior.builder()
                    .primaryTargets(List.of(TargetClass.PROTECTOR))
                    .secondaryTargets(List.of(TargetClass.WORKER))
                    .targetSwitchCooldown(1.5)
                    .maxTargetDistance(60.0)
                    .pursuitDistance(75.0)
                    .build(),
            EntityTag.COMBAT_PARASITE);

    private final ParasiteStats stats;
    private final TargetingBehavior targetingBehavior;
    private final EntityTag entityTag;

    ParasiteType(ParasiteStats stats, TargetingBehavior targetingBehavior, EntityTag entityTag) {
        this.stats = stats;
        this.targetingBehavior = targetingBehavior;
        this.entityTag = entityTag;
    }

    public ParasiteStats getStats() {
        return stats;
    }

    public TargetingBehavior getTargetingBehavior() {
        return targetingBehavior;
    }

    public EntityTag getEntityTag() {
        return entityTag;
    }
}
