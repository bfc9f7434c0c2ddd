package com.supalosa.hive;

import com.supalosa.hive.agent.ParasiteAgent;
import com.supalosa.hive.agent.ParasiteType;
import com.supalosa.hive.control.ControlValidation;
import com.supalosa.hive.control.TerritorialSpawnConfig;
import com.supalosa.hive.control.TerritorialStats;
import com.supalosa.hive.control.TerritoryControlReconciler;
import com.supalosa.hive.geometry.Point3d;
import com.supalosa.hive.performance.PerformanceGovernor;
import com.supalosa.hive.scheduler.SpatialUpdateScheduler;
import com.supalosa.hive.spawn.ParasiteFactory;
import com.supalosa.hive.spawn.ParasiteSpawner;
import com.supalosa.hive.statistics.DistributionStats;
import com.supalosa.hive.statistics.LifecycleStats;
import com.supalosa.hive.statistics.ParasiteStatisticsCollector;
import com.supalosa.hive.statistics.PerformanceStats;
import com.supalosa.hive.statistics.SpawnDistributionTracker;
import com.supalosa.hive.target.Protector;
import com.supalosa.hive.target.Worker;
import com.supalosa.hive.world.Queen;
import com.supalosa.hive.world.Territory;
import com.supalosa.hive.world.TerritoryAuthority;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;
import java.util.stream.Collectors;

/**
 * Owns every parasite and runs the per-tick pipeline: simulate, reap the dead, tidy statistics and let the
 * performance governor react.
 */
public class ParasiteManager {

    private static final Logger log = LoggerFactory.getLogger(ParasiteManager.class);

    private final ParasiteManagerConfig config;
    private final TerritoryAuthority territoryAuthority;
    private final Map<String, ParasiteAgent> parasites = new LinkedHashMap<>();

    private final SpatialUpdateScheduler scheduler;
    private final TerritoryControlReconciler reconciler;
    private final PerformanceGovernor governor;
    private final ParasiteStatisticsCollector statistics;
    private final ParasiteSpawner spawner;

    private double now = 0.0;

    public ParasiteManager(ParasiteManagerConfig config) {
        this.config = config;
        this.territoryAuthority = config.territoryAuthority();
        Random random = new Random(config.randomSeed());
        this.scheduler = new SpatialUpdateScheduler(config.schedulerConfig());
        this.reconciler = new TerritoryControlReconciler(territoryAuthority);
        this.governor = new PerformanceGovernor(config.governorConfig(), config.frameRateSource(),
                config.viewpointProvider(), config.fidelityListener());
        this.statistics = new ParasiteStatisticsCollector(
                new SpawnDistributionTracker(config.spawnDistribution(), new Random(random.nextLong())));
        this.spawner = new ParasiteSpawner(territoryAuthority,
                new ParasiteFactory(config.terrainHeightProvider(), new Random(random.nextLong())),
                config.terrainHeightProvider());
    }

    /**
     * Advances the simulation by one tick.
     */
    public void update(double deltaTime, Collection<? extends Worker> workers,
                       Collection<? extends Protector> protectors) {
        double previous = now;
        now += deltaTime;

        scheduler.update(deltaTime, now, parasites.values(), workers, protectors, config.spatialIndex(),
                config.viewpointProvider().flatMap(provider -> provider.viewpoint()));

        reapDeadParasites();

        double interval = config.statisticsCleanupInterval();
        if (Math.floor(now / interval) != Math.floor(previous / interval)) {
            statistics.cleanupOrphanedTracking(parasites.values());
        }

        governor.checkAndOptimize(now, parasites.values());
    }

    private void reapDeadParasites() {
        List<String> dead = parasites.values().stream()
                .filter(agent -> !agent.isAlive())
                .map(ParasiteAgent::getId)
                .collect(Collectors.toList());
        dead.forEach(this::handleParasiteDestruction);
    }

    /**
     * Spawns a parasite for a queen and starts tracking it.
     *
     * @return The parasite, or empty if the spawner refused.
     */
    public Optional<ParasiteAgent> spawn(ParasiteType type, Point3d position, Queen queen) {
        Optional<ParasiteAgent> spawned = spawner.spawn(type, position, queen, now);
        spawned.ifPresent(this::register);
        return spawned;
    }

    /**
     * Spawns whichever type keeps the spawn mix on target.
     */
    public Optional<ParasiteAgent> spawnNext(Point3d position, Queen queen) {
        return spawn(statistics.getDistributionTracker().nextType(), position, queen);
    }

    private void register(ParasiteAgent agent) {
        parasites.put(agent.getId(), agent);
        config.spatialIndex().ifPresent(index ->
                index.add(agent.getId(), agent.getPosition(), agent.getType().getEntityTag()));
        statistics.incrementTypeCount(agent.getType());
        agent.getTerritoryId().ifPresent(territoryId -> statistics.addToTerritory(territoryId, agent.getId()));
        statistics.getDistributionTracker().recordSpawn(agent.getId(), agent.getType(), agent.getTerritoryId(), now);
        config.eventListener().ifPresent(listener -> listener.onParasiteSpawned(agent));
    }

    /**
     * Releases a parasite from queen control and stops tracking it. Unknown ids are ignored.
     */
    public void handleParasiteDestruction(String parasiteId) {
        ParasiteAgent agent = parasites.get(parasiteId);
        if (agent == null) {
            return;
        }
        reconciler.releaseControl(parasiteId);
        remove(agent);
        config.eventListener().ifPresent(listener -> listener.onParasiteDestroyed(agent));
    }

    private void remove(ParasiteAgent agent) {
        parasites.remove(agent.getId());
        statistics.decrementTypeCount(agent.getType());
        agent.getTerritoryId().ifPresent(territoryId -> statistics.removeFromTerritory(territoryId, agent.getId()));
        config.spatialIndex().ifPresent(index -> index.remove(agent.getId()));
        governor.forget(agent.getId());
    }

    /**
     * Removes every live parasite inside a territory at once, for example when its queen is destroyed.
     *
     * @return The number of parasites removed.
     */
    public int explodeParasitesInTerritory(String territoryId) {
        Optional<Territory> territory = territoryAuthority.getTerritory(territoryId);
        if (territory.isEmpty()) {
            return 0;
        }
        List<ParasiteAgent> victims = reconciler.getAgentsInTerritory(territoryId, parasites.values());
        victims.forEach(agent -> handleParasiteDestruction(agent.getId()));
        territory.get().setParasiteCount(0);
        log.info("Exploded {} parasites in territory {}", victims.size(), territoryId);
        return victims.size();
    }

    /**
     * Damages the first live parasite within {@code tolerance} of the position. A parasite killed this way is
     * removed on the next update.
     *
     * @return The parasite that was hit, if any.
     */
    public Optional<ParasiteAgent> damageParasiteAt(Point3d position, double tolerance, double damage) {
        Optional<ParasiteAgent> hit = getParasites().stream()
                .filter(agent -> agent.getPosition().distance(position) <= tolerance)
                .findFirst();
        hit.ifPresent(agent -> {
            if (agent.takeDamage(damage)) {
                log.debug("Parasite {} destroyed by damage at {}", agent.getId(), position);
            }
        });
        return hit;
    }

    public ControlValidation validateControl() {
        ControlValidation validation = reconciler.validateConsistency(parasites.values());
        if (!validation.isConsistent()) {
            log.warn("Parasite control inconsistent: {} orphaned, {} wrongly controlled, {} duplicated",
                    validation.orphanedParasites().size(), validation.wrongControl().size(),
                    validation.duplicateControl().size());
        }
        return validation;
    }

    public void recalculateControl() {
        reconciler.recalculate(parasites.values());
    }

    /**
     * @return True if the parasite exists and the new queen accepted it.
     */
    public boolean transferControl(String parasiteId, Queen newQueen) {
        ParasiteAgent agent = parasites.get(parasiteId);
        if (agent == null) {
            return false;
        }
        return reconciler.transferControl(agent, newQueen);
    }

    public void configureTerritorialSpawning(String territoryId, TerritorialSpawnConfig spawnConfig) {
        reconciler.configureTerritorialSpawning(territoryId, spawnConfig);
    }

    public boolean shouldSpawnInTerritory(Territory territory) {
        return reconciler.shouldSpawnInTerritory(territory);
    }

    public double spawnRateForTerritory(Territory territory) {
        return reconciler.spawnRateForTerritory(territory);
    }

    public void forcePerformanceCheck() {
        governor.forceCheck(now, parasites.values());
    }

    public void setMaxActiveParasites(int max) {
        governor.setMaxActiveParasites(max);
    }

    public Optional<ParasiteAgent> getParasite(String parasiteId) {
        return Optional.ofNullable(parasites.get(parasiteId));
    }

    /**
     * @return The live parasites.
     */
    public List<ParasiteAgent> getParasites() {
        return parasites.values().stream().filter(ParasiteAgent::isAlive).collect(Collectors.toList());
    }

    public List<ParasiteAgent> getParasitesNear(Point3d position, double radius) {
        return getParasites().stream()
                .filter(agent -> agent.getPosition().distance(position) <= radius)
                .collect(Collectors.toList());
    }

    public List<ParasiteAgent> getParasitesByType(ParasiteType type) {
        return getParasites().stream()
                .filter(agent -> agent.getType() == type)
                .collect(Collectors.toList());
    }

    public List<ParasiteAgent> getParasitesInTerritory(String territoryId) {
        return reconciler.getAgentsInTerritory(territoryId, parasites.values());
    }

    public int getActiveParasiteCount() {
        return getParasites().size();
    }

    public int getParasiteCountByType(ParasiteType type) {
        return statistics.getCountByType(type);
    }

    public LifecycleStats getLifecycleStats() {
        return statistics.lifecycleStats(parasites.size());
    }

    public PerformanceStats getPerformanceStats() {
        return statistics.performanceStats(governor.getOptimizationLevel(), governor.getMaxActiveParasites(),
                getActiveParasiteCount(), governor.getLastCheckTime());
    }

    public TerritorialStats getTerritorialStats() {
        return reconciler.territorialStats();
    }

    public DistributionStats getDistributionStats() {
        return statistics.distributionStats();
    }

    public void resetDistribution() {
        statistics.resetDistribution();
    }

    public double getSimulationTime() {
        return now;
    }

    /**
     * Stops tracking every parasite, without notifying the event listener.
     */
    public void dispose() {
        List<ParasiteAgent> all = new ArrayList<>(parasites.values());
        all.forEach(agent -> reconciler.releaseControl(agent.getId()));
        all.forEach(this::remove);
        reconciler.clearConfigurations();
        statistics.clear();
        log.info("Disposed parasite manager with {} parasites", all.size());
    }
}
