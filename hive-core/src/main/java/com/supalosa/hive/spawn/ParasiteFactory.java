package com.supalosa.hive.spawn;

import com.supalosa.hive.agent.BasicTargetingStrategy;
import com.supalosa.hive.agent.ParasiteAgent;
import com.supalosa.hive.agent.ParasiteType;
import com.supalosa.hive.agent.TacticalTargetingStrategy;
import com.supalosa.hive.agent.TargetingStrategy;
import com.supalosa.hive.geometry.Point3d;
import com.supalosa.hive.world.TerrainHeightProvider;

import java.util.Optional;
import java.util.Random;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Creates parasites with sequential ids and the targeting strategy that goes with their type.
 */
public class ParasiteFactory {

    private final AtomicLong nextId = new AtomicLong(1);
    private final Optional<TerrainHeightProvider> terrain;
    private final Random random;

    public ParasiteFactory(Optional<TerrainHeightProvider> terrain, Random random) {
        this.terrain = terrain;
        this.random = random;
    }

    /**
     * Creates a parasite whose territory is centred on its spawn position, with the type's detection range as the
     * territory radius.
     */
    public ParasiteAgent create(ParasiteType type, Point3d position, Optional<String> territoryId, double now) {
        return create(type, position, type.getTargetingBehavior().maxTargetDistance(), territoryId, now);
    }

    public ParasiteAgent create(ParasiteType type, Point3d position, double territoryRadius,
                                Optional<String> territoryId, double now) {
        String id = "parasite_" + nextId.getAndIncrement();
        return new ParasiteAgent(id, type, position, territoryRadius, createStrategy(type), terrain, territoryId,
                new Random(random.nextLong()), now);
    }

    static TargetingStrategy createStrategy(ParasiteType type) {
        switch (type) {
            case ENERGY:
                return new BasicTargetingStrategy();
            case COMBAT:
                return new TacticalTargetingStrategy();
            default:
                throw new IllegalStateException("Unsupported parasite type: " + type);
        }
    }
}
