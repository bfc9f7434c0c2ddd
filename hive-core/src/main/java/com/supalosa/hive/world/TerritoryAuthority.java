package com.supalosa.hive.world;

import com.supalosa.hive.geometry.Point3d;

import java.util.Collection;
import java.util.Optional;

/**
 * The authority on which territory covers which part of the world.
 */
public interface TerritoryAuthority {

    Optional<Territory> getTerritoryAt(double x, double z);

    Collection<Territory> getAllTerritories();

    Optional<Territory> getTerritory(String territoryId);

    default boolean isPositionInTerritory(Point3d position, String territoryId) {
        return getTerritoryAt(position.getX(), position.getZ())
                .map(territory -> territory.getId().equals(territoryId))
                .orElse(false);
    }
}
