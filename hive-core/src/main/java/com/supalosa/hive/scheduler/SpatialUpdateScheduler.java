package com.supalosa.hive.scheduler;

import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Sets;
import com.supalosa.hive.agent.NearbyTargets;
import com.supalosa.hive.agent.ParasiteAgent;
import com.supalosa.hive.geometry.Point3d;
import com.supalosa.hive.target.Protector;
import com.supalosa.hive.target.Worker;
import com.supalosa.hive.world.EntityTag;
import com.supalosa.hive.world.SpatialIndex;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Decides which parasites get simulated this tick and gives each one the targets near its territory.
 *
 * All maps and lists here are working storage that is overwritten every tick.
 */
public class SpatialUpdateScheduler {

    private static final Set<EntityTag> PARASITE_TAGS = Arrays.stream(EntityTag.values())
            .filter(EntityTag::isParasite)
            .collect(Sets.toImmutableEnumSet());
    private static final Set<EntityTag> TARGET_TAGS = ImmutableSet.of(EntityTag.WORKER, EntityTag.PROTECTOR);

    private final SchedulerConfig config;

    private final Map<String, ParasiteAgent> agentsById = new HashMap<>();
    private final Map<String, Worker> workersById = new HashMap<>();
    private final Map<String, Protector> protectorsById = new HashMap<>();
    private final List<ParasiteAgent> workingSet = new ArrayList<>();
    private final NearbyTargets nearbyTargets = new NearbyTargets();

    public SpatialUpdateScheduler() {
        this(SchedulerConfig.defaults());
    }

    public SpatialUpdateScheduler(SchedulerConfig config) {
        this.config = config;
    }

    /**
     * Updates every live parasite near the viewpoint.
     *
     * @param spatialIndex If present, used to find the parasites near the viewpoint and the targets near each
     *                     territory. Otherwise every parasite is updated and targets are found by a linear scan.
     * @param viewpoint The camera position. Nothing is updated without one.
     * @return The number of parasites updated.
     */
    public int update(double deltaTime,
                      double now,
                      Collection<ParasiteAgent> agents,
                      Collection<? extends Worker> workers,
                      Collection<? extends Protector> protectors,
                      Optional<SpatialIndex> spatialIndex,
                      Optional<Point3d> viewpoint) {
        if (agents.isEmpty() || viewpoint.isEmpty()) {
            return 0;
        }
        workersById.clear();
        workers.forEach(worker -> workersById.put(worker.getId(), worker));
        protectorsById.clear();
        protectors.forEach(protector -> protectorsById.put(protector.getId(), protector));

        buildWorkingSet(agents, spatialIndex, viewpoint.get());

        int updated = 0;
        for (ParasiteAgent agent : workingSet) {
            if (!agent.isAlive()) {
                continue;
            }
            collectNearbyTargets(agent, workers, protectors, spatialIndex);
            agent.update(deltaTime, now, nearbyTargets);
            spatialIndex.ifPresent(index -> index.updatePosition(agent.getId(), agent.getPosition()));
            ++updated;
        }
        nearbyTargets.clear();
        return updated;
    }

    private void buildWorkingSet(Collection<ParasiteAgent> agents, Optional<SpatialIndex> spatialIndex,
                                 Point3d viewpoint) {
        workingSet.clear();
        if (spatialIndex.isEmpty()) {
            workingSet.addAll(agents);
            return;
        }
        agentsById.clear();
        agents.forEach(agent -> agentsById.put(agent.getId(), agent));
        for (String id : spatialIndex.get().queryInRadius(viewpoint, config.viewRadius(), PARASITE_TAGS)) {
            ParasiteAgent agent = agentsById.get(id);
            if (agent != null) {
                workingSet.add(agent);
            }
        }
    }

    private void collectNearbyTargets(ParasiteAgent agent,
                                      Collection<? extends Worker> workers,
                                      Collection<? extends Protector> protectors,
                                      Optional<SpatialIndex> spatialIndex) {
        nearbyTargets.clear();
        Point3d centre = agent.getTerritoryCentre();
        double searchRadius = agent.getTerritoryRadius() * config.searchRadiusMultiplier();
        if (spatialIndex.isPresent()) {
            for (String id : spatialIndex.get().queryInRadius(centre, searchRadius, TARGET_TAGS)) {
                Worker worker = workersById.get(id);
                if (worker != null) {
                    nearbyTargets.addWorker(worker);
                    continue;
                }
                Protector protector = protectorsById.get(id);
                if (protector != null) {
                    nearbyTargets.addProtector(protector);
                }
            }
        } else {
            for (Worker worker : workers) {
                if (worker.getPosition().distance(centre) <= searchRadius) {
                    nearbyTargets.addWorker(worker);
                }
            }
            for (Protector protector : protectors) {
                if (protector.getPosition().distance(centre) <= searchRadius) {
                    nearbyTargets.addProtector(protector);
                }
            }
        }
    }

    public SchedulerConfig getConfig() {
        return config;
    }
}
