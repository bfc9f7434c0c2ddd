package com.supalosa.hive.statistics;

import com.google.common.collect.HashMultimap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Multimap;
import com.supalosa.hive.agent.ParasiteAgent;
import com.supalosa.hive.agent.ParasiteType;
import com.supalosa.hive.performance.OptimizationLevel;

import java.util.Collection;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Bookkeeping of parasite counts for reporting. Nothing here feeds back into behaviour.
 */
public class ParasiteStatisticsCollector {

    private final Map<ParasiteType, Integer> countByType = new EnumMap<>(ParasiteType.class);
    private final Multimap<String, String> parasitesByTerritory = HashMultimap.create();
    private final SpawnDistributionTracker distributionTracker;

    public ParasiteStatisticsCollector(SpawnDistributionTracker distributionTracker) {
        this.distributionTracker = distributionTracker;
        resetTypeCounts();
    }

    private void resetTypeCounts() {
        for (ParasiteType type : ParasiteType.values()) {
            countByType.put(type, 0);
        }
    }

    public void incrementTypeCount(ParasiteType type) {
        countByType.merge(type, 1, Integer::sum);
    }

    public void decrementTypeCount(ParasiteType type) {
        countByType.put(type, Math.max(0, countByType.getOrDefault(type, 0) - 1));
    }

    public int getCountByType(ParasiteType type) {
        return countByType.getOrDefault(type, 0);
    }

    public void addToTerritory(String territoryId, String parasiteId) {
        parasitesByTerritory.put(territoryId, parasiteId);
    }

    public void removeFromTerritory(String territoryId, String parasiteId) {
        parasitesByTerritory.remove(territoryId, parasiteId);
    }

    public Set<String> getParasiteIdsForTerritory(String territoryId) {
        return ImmutableSet.copyOf(parasitesByTerritory.get(territoryId));
    }

    /**
     * Drops territory entries for parasites that no longer exist and recounts the live parasites of each type.
     */
    public void cleanupOrphanedTracking(Collection<ParasiteAgent> agents) {
        Set<String> existingIds = agents.stream().map(ParasiteAgent::getId).collect(Collectors.toSet());
        parasitesByTerritory.values().removeIf(parasiteId -> !existingIds.contains(parasiteId));

        resetTypeCounts();
        agents.stream()
                .filter(ParasiteAgent::isAlive)
                .forEach(agent -> incrementTypeCount(agent.getType()));
    }

    public LifecycleStats lifecycleStats(int totalParasites) {
        Map<String, Integer> byTerritory = new HashMap<>();
        parasitesByTerritory.asMap().forEach((territoryId, ids) -> byTerritory.put(territoryId, ids.size()));
        return ImmutableLifecycleStats.builder()
                .totalParasites(totalParasites)
                .energyParasites(getCountByType(ParasiteType.ENERGY))
                .combatParasites(getCountByType(ParasiteType.COMBAT))
                .parasitesByTerritory(byTerritory)
                .distributionAccuracy(distributionTracker.isAccurate() ? 1.0 : 0.0)
                .build();
    }

    public PerformanceStats performanceStats(OptimizationLevel level, int maxActiveParasites, int activeParasites,
                                             Optional<Double> lastPerformanceCheck) {
        return ImmutablePerformanceStats.builder()
                .optimizationLevel(level.getLevel())
                .renderingOptimizations(level.getDisplayName())
                .maxActiveParasites(maxActiveParasites)
                .activeParasites(activeParasites)
                .lastPerformanceCheck(lastPerformanceCheck)
                .build();
    }

    public SpawnDistributionTracker getDistributionTracker() {
        return distributionTracker;
    }

    public DistributionStats distributionStats() {
        return distributionTracker.stats();
    }

    public void resetDistribution() {
        distributionTracker.reset();
    }

    public void clear() {
        resetTypeCounts();
        parasitesByTerritory.clear();
    }
}
