package com.supalosa.hive.sim;

import com.google.common.collect.ImmutableList;
import com.supalosa.hive.ParasiteEventListener;
import com.supalosa.hive.ParasiteManager;
import com.supalosa.hive.ParasiteManagerConfig;
import com.supalosa.hive.agent.ParasiteAgent;
import com.supalosa.hive.agent.ParasiteType;
import com.supalosa.hive.control.ControlValidation;
import com.supalosa.hive.control.ImmutableTerritorialSpawnConfig;
import com.supalosa.hive.control.SpawnStrategy;
import com.supalosa.hive.geometry.Point3d;
import com.supalosa.hive.scheduler.ImmutableSchedulerConfig;
import com.supalosa.hive.statistics.DistributionStats;
import com.supalosa.hive.statistics.LifecycleStats;
import com.supalosa.hive.statistics.PerformanceStats;
import com.supalosa.hive.utils.Utils;
import com.supalosa.hive.world.EntityTag;
import com.supalosa.hive.world.GridTerritoryAuthority;
import com.supalosa.hive.world.QuadTreeSpatialIndex;
import com.supalosa.hive.world.Queen;
import com.supalosa.hive.world.Territory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;

/**
 * A headless world: a row of queen-held territories, each with wandering workers and a couple of guards, and
 * queens spawning parasites into them on a timer.
 */
public class Simulation {

    private static final Logger log = LoggerFactory.getLogger(Simulation.class);

    private static final double WORKER_SPEED = 3.0;
    private static final double WORKER_ENERGY = 100.0;
    private static final double WORKER_ENERGY_REGEN = 0.5;
    private static final double PROTECTOR_HEALTH = 20.0;
    private static final double PROTECTOR_RANGE = 4.0;
    private static final double PROTECTOR_DAMAGE = 1.5;

    private final SimulationConfig config;
    private final Random random;
    private final GridTerritoryAuthority territoryAuthority;
    private final QuadTreeSpatialIndex spatialIndex;
    private final ParasiteManager manager;
    private final List<Territory> hives = new ArrayList<>();
    private final List<SimpleWorker> workers = new ArrayList<>();
    private final List<SimpleProtector> protectors = new ArrayList<>();
    private final Map<String, Double> spawnCredit = new HashMap<>();

    private int ticksRun = 0;
    private int parasitesSpawned = 0;
    private int parasitesDestroyed = 0;
    private double nextSpawnAt = 0.0;
    private double nextStatsAt;
    private double nextControlCheckAt;

    public Simulation(SimulationConfig config) {
        this.config = config;
        this.random = new Random(config.seed());
        this.territoryAuthority = new GridTerritoryAuthority(1, config.territorySize());
        this.spatialIndex = new QuadTreeSpatialIndex();
        this.nextStatsAt = config.statsInterval();
        this.nextControlCheckAt = config.controlCheckInterval();

        seedTerritories();
        Point3d viewpoint = hives.get(0).getCentrePosition();
        this.manager = new ParasiteManager(ParasiteManagerConfig.builder()
                .territoryAuthority(territoryAuthority)
                .spatialIndex(spatialIndex)
                .viewpointProvider(() -> Optional.of(viewpoint))
                .frameRateSource(this::estimateFps)
                .eventListener(new CountingListener())
                .schedulerConfig(ImmutableSchedulerConfig.builder().viewRadius(config.viewRadius()).build())
                .randomSeed(random.nextLong())
                .build());

        for (int i = 0; i < hives.size(); ++i) {
            // Alternate between eager and reluctant territories so the rate multiplier shows up in the mix.
            SpawnStrategy strategy = i % 2 == 0 ? SpawnStrategy.AGGRESSIVE : SpawnStrategy.DEFENSIVE;
            manager.configureTerritorialSpawning(hives.get(i).getId(), ImmutableTerritorialSpawnConfig.builder()
                    .spawnStrategy(strategy)
                    .spawnRate(strategy == SpawnStrategy.AGGRESSIVE ? 1.0 : 0.5)
                    .build());
        }
    }

    private void seedTerritories() {
        double size = config.territorySize();
        for (int i = 0; i < config.queens(); ++i) {
            Territory territory = territoryAuthority.getOrCreateTerritoryAt((i + 0.5) * size, 0.5 * size);
            Queen queen = new Queen("queen_" + i);
            queen.setVulnerable(true);
            territory.setQueen(Optional.of(queen));
            hives.add(territory);

            Point3d centre = territory.getCentrePosition();
            for (int w = 0; w < config.workersPerTerritory(); ++w) {
                SimpleWorker worker = new SimpleWorker("worker_" + i + "_" + w,
                        Utils.randomPointAround(centre, size * 0.4, random), size * 0.2, WORKER_SPEED,
                        WORKER_ENERGY, WORKER_ENERGY_REGEN, new Random(random.nextLong()));
                workers.add(worker);
                spatialIndex.add(worker.getId(), worker.getPosition(), EntityTag.WORKER);
            }
            for (int p = 0; p < config.protectorsPerTerritory(); ++p) {
                SimpleProtector protector = new SimpleProtector("protector_" + i + "_" + p,
                        Utils.randomPointAround(centre, size * 0.3, random), PROTECTOR_HEALTH, PROTECTOR_RANGE,
                        PROTECTOR_DAMAGE);
                protectors.add(protector);
                spatialIndex.add(protector.getId(), protector.getPosition(), EntityTag.PROTECTOR);
            }
        }
    }

    private double estimateFps() {
        return Math.max(1.0, config.baseFps() - config.fpsCostPerParasite() * manager.getActiveParasiteCount());
    }

    public SimulationSummary run() {
        log.info("Starting simulation: {} ticks of {}s, {} territories, {} workers, {} protectors",
                config.ticks(), config.tickLength(), hives.size(), workers.size(), protectors.size());
        for (int i = 0; i < config.ticks(); ++i) {
            step();
        }
        manager.recalculateControl();
        SimulationSummary summary = summary();
        log.info("Simulation finished: {}", summary);
        return summary;
    }

    public void step() {
        double dt = config.tickLength();
        double now = manager.getSimulationTime();

        if (now >= nextSpawnAt) {
            spawnParasites();
            nextSpawnAt = now + config.spawnInterval();
        }

        for (SimpleWorker worker : workers) {
            worker.step(dt);
            spatialIndex.updatePosition(worker.getId(), worker.getPosition());
        }
        for (SimpleProtector protector : protectors) {
            protector.step(dt, manager);
            if (!protector.isAlive()) {
                spatialIndex.remove(protector.getId());
            }
        }

        manager.update(dt, workers, protectors);
        ++ticksRun;
        now = manager.getSimulationTime();

        if (now >= nextControlCheckAt) {
            ControlValidation validation = manager.validateControl();
            if (!validation.isConsistent()) {
                manager.recalculateControl();
            }
            nextControlCheckAt += config.controlCheckInterval();
        }
        if (now >= nextStatsAt) {
            logStats(now);
            nextStatsAt += config.statsInterval();
        }
    }

    private void spawnParasites() {
        for (Territory territory : hives) {
            if (!manager.shouldSpawnInTerritory(territory)) {
                continue;
            }
            double credit = spawnCredit.getOrDefault(territory.getId(), 0.0)
                    + manager.spawnRateForTerritory(territory);
            Queen queen = territory.getActiveQueen().orElseThrow();
            while (credit >= 1.0 &&
                    manager.getParasitesInTerritory(territory.getId()).size() < config.maxParasitesPerTerritory()) {
                Point3d position = Utils.randomPointAround(territory.getCentrePosition(),
                        territory.getSize() * 0.45, random);
                manager.spawnNext(position, queen);
                credit -= 1.0;
            }
            spawnCredit.put(territory.getId(), Math.min(credit, 1.0));
        }
    }

    private void logStats(double now) {
        LifecycleStats lifecycle = manager.getLifecycleStats();
        PerformanceStats performance = manager.getPerformanceStats();
        DistributionStats distribution = manager.getDistributionStats();
        log.info("t={}s parasites={} (energy {}, combat {}) optimisation={} cap={} combatRatio={}",
                String.format("%.1f", now), lifecycle.totalParasites(), lifecycle.energyParasites(),
                lifecycle.combatParasites(), performance.renderingOptimizations(), performance.maxActiveParasites(),
                String.format("%.2f", distribution.combatRatio()));
    }

    public SimulationSummary summary() {
        PerformanceStats performance = manager.getPerformanceStats();
        return ImmutableSimulationSummary.builder()
                .ticks(ticksRun)
                .simulatedSeconds(manager.getSimulationTime())
                .parasitesSpawned(parasitesSpawned)
                .parasitesDestroyed(parasitesDestroyed)
                .liveParasites(manager.getActiveParasiteCount())
                .energyParasites(manager.getParasitesByType(ParasiteType.ENERGY).size())
                .combatParasites(manager.getParasitesByType(ParasiteType.COMBAT).size())
                .protectorKills(protectors.stream().mapToInt(SimpleProtector::getKills).sum())
                .protectorEnergy(protectors.stream().mapToInt(SimpleProtector::getEnergyCollected).sum())
                .protectorsAlive((int) protectors.stream().filter(SimpleProtector::isAlive).count())
                .energyDrained(workers.stream().mapToDouble(SimpleWorker::getTotalDrained).sum())
                .optimizationLevel(performance.renderingOptimizations())
                .maxActiveParasites(performance.maxActiveParasites())
                .controlConsistent(manager.validateControl().isConsistent())
                .build();
    }

    public ParasiteManager getManager() {
        return manager;
    }

    public List<SimpleWorker> getWorkers() {
        return ImmutableList.copyOf(workers);
    }

    public List<SimpleProtector> getProtectors() {
        return ImmutableList.copyOf(protectors);
    }

    public List<Territory> getHives() {
        return ImmutableList.copyOf(hives);
    }

    private class CountingListener implements ParasiteEventListener {

        @Override
        public void onParasiteSpawned(ParasiteAgent agent) {
            ++parasitesSpawned;
        }

        @Override
        public void onParasiteDestroyed(ParasiteAgent agent) {
            ++parasitesDestroyed;
            log.debug("Parasite {} ({}) destroyed at {}", agent.getId(), agent.getType(), agent.getPosition());
        }
    }
}
