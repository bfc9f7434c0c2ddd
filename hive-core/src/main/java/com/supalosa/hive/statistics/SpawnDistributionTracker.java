package com.supalosa.hive.statistics;

import com.supalosa.hive.agent.ParasiteType;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.Random;
import java.util.stream.Collectors;

/**
 * Picks parasite types so that, over a rolling window of spawns, the mix stays close to a {@link SpawnDistribution}.
 */
public class SpawnDistributionTracker {

    public static final int WINDOW_SIZE = 20;
    public static final int MAX_RECORDS = 100;
    /**
     * Below this many spawns the type is picked at random.
     */
    static final int MIN_HISTORY_FOR_CORRECTION = 4;
    /**
     * Below this many spawns the distribution is considered accurate.
     */
    static final int MIN_HISTORY_FOR_ACCURACY = 10;

    private final Deque<ParasiteType> history = new ArrayDeque<>();
    private final Deque<SpawnRecord> records = new ArrayDeque<>();
    private final Random random;
    private SpawnDistribution distribution;

    public SpawnDistributionTracker(SpawnDistribution distribution, Random random) {
        this.distribution = distribution;
        this.random = random;
    }

    public ParasiteType nextType() {
        if (history.size() < MIN_HISTORY_FOR_CORRECTION) {
            return randomType();
        }
        double combatDeficit = distribution.combatRate() - ratioOf(ParasiteType.COMBAT);
        double energyDeficit = distribution.energyRate() - ratioOf(ParasiteType.ENERGY);
        if (combatDeficit > distribution.accuracy()) {
            return ParasiteType.COMBAT;
        }
        if (energyDeficit > distribution.accuracy()) {
            return ParasiteType.ENERGY;
        }
        return randomType();
    }

    private ParasiteType randomType() {
        return random.nextDouble() < distribution.combatRate() ? ParasiteType.COMBAT : ParasiteType.ENERGY;
    }

    public void recordSpawn(String parasiteId, ParasiteType type, Optional<String> territoryId, double now) {
        history.addLast(type);
        while (history.size() > WINDOW_SIZE) {
            history.removeFirst();
        }
        records.addLast(ImmutableSpawnRecord.builder()
                .parasiteId(parasiteId)
                .type(type)
                .spawnTime(now)
                .territoryId(territoryId)
                .build());
        while (records.size() > MAX_RECORDS) {
            records.removeFirst();
        }
    }

    /**
     * @return The share of the given type in the window, or 0 if nothing has spawned yet.
     */
    public double ratioOf(ParasiteType type) {
        if (history.isEmpty()) {
            return 0.0;
        }
        return (double) countOf(type) / history.size();
    }

    private int countOf(ParasiteType type) {
        return (int) history.stream().filter(historyType -> historyType == type).count();
    }

    public boolean isAccurate() {
        if (history.size() < MIN_HISTORY_FOR_ACCURACY) {
            return true;
        }
        return Math.abs(ratioOf(ParasiteType.ENERGY) - distribution.energyRate()) <= distribution.accuracy() &&
                Math.abs(ratioOf(ParasiteType.COMBAT) - distribution.combatRate()) <= distribution.accuracy();
    }

    public DistributionStats stats() {
        return ImmutableDistributionStats.builder()
                .totalSpawns(history.size())
                .energySpawns(countOf(ParasiteType.ENERGY))
                .combatSpawns(countOf(ParasiteType.COMBAT))
                .energyRatio(ratioOf(ParasiteType.ENERGY))
                .combatRatio(ratioOf(ParasiteType.COMBAT))
                .target(distribution)
                .isAccurate(isAccurate())
                .windowSize(WINDOW_SIZE)
                .build();
    }

    public List<SpawnRecord> recordsForTerritory(String territoryId) {
        return records.stream()
                .filter(record -> record.territoryId().map(territoryId::equals).orElse(false))
                .collect(Collectors.toList());
    }

    public List<SpawnRecord> recentRecords(double now, double window) {
        return records.stream()
                .filter(record -> record.spawnTime() >= now - window)
                .collect(Collectors.toList());
    }

    /**
     * @return Spawns per second over the last {@code window} seconds.
     */
    public double spawnRate(double now, double window) {
        return recentRecords(now, window).size() / window;
    }

    public void updateDistribution(SpawnDistribution distribution) {
        this.distribution = distribution;
    }

    public SpawnDistribution getDistribution() {
        return distribution;
    }

    public void reset() {
        history.clear();
        records.clear();
    }
}
