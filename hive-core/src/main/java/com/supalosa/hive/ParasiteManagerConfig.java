package com.supalosa.hive;

import com.supalosa.hive.performance.FidelityListener;
import com.supalosa.hive.performance.GovernorConfig;
import com.supalosa.hive.scheduler.SchedulerConfig;
import com.supalosa.hive.statistics.SpawnDistribution;
import com.supalosa.hive.world.FrameRateSource;
import com.supalosa.hive.world.SpatialIndex;
import com.supalosa.hive.world.TerrainHeightProvider;
import com.supalosa.hive.world.TerritoryAuthority;
import com.supalosa.hive.world.ViewpointProvider;
import org.apache.commons.lang3.Validate;
import org.immutables.value.Value;

import java.util.Optional;

/**
 * The collaborators and settings of a {@link ParasiteManager}. Only the territory authority is required; every
 * other collaborator is optional and the manager degrades gracefully without it.
 */
@Value.Immutable
public abstract class ParasiteManagerConfig {

    public abstract TerritoryAuthority territoryAuthority();

    public abstract Optional<SpatialIndex> spatialIndex();

    public abstract Optional<ViewpointProvider> viewpointProvider();

    public abstract Optional<FrameRateSource> frameRateSource();

    public abstract Optional<TerrainHeightProvider> terrainHeightProvider();

    public abstract Optional<FidelityListener> fidelityListener();

    public abstract Optional<ParasiteEventListener> eventListener();

    @Value.Default
    public SchedulerConfig schedulerConfig() {
        return SchedulerConfig.defaults();
    }

    @Value.Default
    public GovernorConfig governorConfig() {
        return GovernorConfig.defaults();
    }

    @Value.Default
    public SpawnDistribution spawnDistribution() {
        return SpawnDistribution.defaults();
    }

    /**
     * Seconds between cleanups of statistics for parasites that no longer exist.
     */
    @Value.Default
    public double statisticsCleanupInterval() {
        return 10.0;
    }

    @Value.Default
    public long randomSeed() {
        return 0L;
    }

    @Value.Check
    protected void check() {
        Validate.isTrue(statisticsCleanupInterval() > 0, "statisticsCleanupInterval must be positive: %f",
                statisticsCleanupInterval());
    }

    public static ImmutableParasiteManagerConfig.Builder builder() {
        return ImmutableParasiteManagerConfig.builder();
    }
}
