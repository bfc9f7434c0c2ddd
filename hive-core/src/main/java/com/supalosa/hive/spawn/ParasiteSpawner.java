package com.supalosa.hive.spawn;

import com.supalosa.hive.agent.ParasiteAgent;
import com.supalosa.hive.agent.ParasiteType;
import com.supalosa.hive.geometry.Point3d;
import com.supalosa.hive.world.Queen;
import com.supalosa.hive.world.TerrainHeightProvider;
import com.supalosa.hive.world.Territory;
import com.supalosa.hive.world.TerritoryAuthority;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Spawns parasites on behalf of a queen, inside the queen's own territory.
 */
public class ParasiteSpawner {

    private static final Logger log = LoggerFactory.getLogger(ParasiteSpawner.class);

    /**
     * Parasites appear slightly above the ground.
     */
    public static final double SPAWN_HEIGHT = 0.5;

    private final TerritoryAuthority territoryAuthority;
    private final ParasiteFactory factory;
    private final Optional<TerrainHeightProvider> terrain;

    public ParasiteSpawner(TerritoryAuthority territoryAuthority, ParasiteFactory factory,
                           Optional<TerrainHeightProvider> terrain) {
        this.territoryAuthority = territoryAuthority;
        this.factory = factory;
        this.terrain = terrain;
    }

    /**
     * Creates a parasite of the given type and places it under the queen's control. The caller is responsible for
     * registering the parasite with whatever owns it.
     *
     * @return The new parasite, or empty if the queen is inactive or the position is outside her territory.
     */
    public Optional<ParasiteAgent> spawn(ParasiteType type, Point3d position, Queen queen, double now) {
        if (!queen.isActiveQueen()) {
            log.debug("Not spawning {} parasite: queen {} is not active", type, queen.getId());
            return Optional.empty();
        }
        Optional<Territory> territory = territoryAuthority.getTerritoryAt(position.getX(), position.getZ())
                .filter(candidate -> candidate.getQueen()
                        .map(owner -> owner.getId().equals(queen.getId()))
                        .orElse(false));
        if (territory.isEmpty()) {
            log.debug("Not spawning {} parasite: {} is outside the territory of queen {}",
                    type, position, queen.getId());
            return Optional.empty();
        }
        double groundHeight = terrain.map(provider -> provider.heightAt(position.getX(), position.getZ()))
                .orElse(0.0);
        Point3d spawnPosition = position.withY(groundHeight + SPAWN_HEIGHT);

        ParasiteAgent agent = factory.create(type, spawnPosition, Optional.of(territory.get().getId()), now);
        queen.addControlledParasite(agent.getId());
        log.debug("Spawned {} parasite {} at {} for queen {}", type, agent.getId(), spawnPosition, queen.getId());
        return Optional.of(agent);
    }
}
