package com.supalosa.hive.world;

import com.supalosa.hive.geometry.Point3d;
import org.apache.commons.lang3.Validate;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * A {@link TerritoryAuthority} that divides the world into a regular grid of square territories, created lazily
 * as positions are looked up. Territory (0, 0) spans {@code [0, size)} on both axes.
 */
public class GridTerritoryAuthority implements TerritoryAuthority {

    public static final int DEFAULT_GRID_SIZE = 16;
    public static final double DEFAULT_CHUNK_SIZE = 64.0;

    private final double territorySize;
    private final Map<String, Territory> territories = new LinkedHashMap<>();

    public GridTerritoryAuthority() {
        this(DEFAULT_GRID_SIZE, DEFAULT_CHUNK_SIZE);
    }

    /**
     * @param gridSize The side of a territory in chunks.
     * @param chunkSize The side of a chunk in world units.
     */
    public GridTerritoryAuthority(int gridSize, double chunkSize) {
        Validate.isTrue(gridSize > 0, "gridSize must be positive: %d", gridSize);
        Validate.isTrue(chunkSize > 0, "chunkSize must be positive: %f", chunkSize);
        this.territorySize = gridSize * chunkSize;
    }

    public double getTerritorySize() {
        return territorySize;
    }

    public static String territoryId(int gridX, int gridZ) {
        return "territory_" + gridX + "_" + gridZ;
    }

    /**
     * Returns the territory covering the position, creating it if it has not been seen yet.
     */
    public Territory getOrCreateTerritoryAt(double x, double z) {
        int gridX = (int) Math.floor(x / territorySize);
        int gridZ = (int) Math.floor(z / territorySize);
        return territories.computeIfAbsent(territoryId(gridX, gridZ), id -> new Territory(
                id,
                Point3d.of((gridX + 0.5) * territorySize, 0.0, (gridZ + 0.5) * territorySize),
                territorySize));
    }

    @Override
    public Optional<Territory> getTerritoryAt(double x, double z) {
        int gridX = (int) Math.floor(x / territorySize);
        int gridZ = (int) Math.floor(z / territorySize);
        return Optional.ofNullable(territories.get(territoryId(gridX, gridZ)));
    }

    @Override
    public Collection<Territory> getAllTerritories() {
        return Collections.unmodifiableCollection(territories.values());
    }

    @Override
    public Optional<Territory> getTerritory(String territoryId) {
        return Optional.ofNullable(territories.get(territoryId));
    }
}
