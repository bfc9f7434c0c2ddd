package com.supalosa.hive.statistics;

import com.supalosa.hive.agent.ParasiteType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Optional;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SpawnDistributionTrackerTest {

    private SpawnDistributionTracker tracker;

    @BeforeEach
    void setUp() {
        tracker = new SpawnDistributionTracker(SpawnDistribution.defaults(), new Random(11));
    }

    private void record(ParasiteType type, int count) {
        for (int i = 0; i < count; ++i) {
            tracker.recordSpawn("p" + i, type, Optional.empty(), 0.0);
        }
    }

    @Test
    void testCorrectsMissingCombatSpawns() {
        record(ParasiteType.ENERGY, 4);
        assertThat(tracker.nextType()).isEqualTo(ParasiteType.COMBAT);
    }

    @Test
    void testCorrectsMissingEnergySpawns() {
        record(ParasiteType.ENERGY, 2);
        record(ParasiteType.COMBAT, 2);
        assertThat(tracker.nextType()).isEqualTo(ParasiteType.ENERGY);
    }

    @Test
    void testLongRunMixConvergesOnTarget() {
        for (int i = 0; i < 200; ++i) {
            ParasiteType type = tracker.nextType();
            tracker.recordSpawn("p" + i, type, Optional.empty(), i);
        }
        assertThat(tracker.ratioOf(ParasiteType.COMBAT)).isBetween(0.1, 0.4);
    }

    @Test
    void testAccuracyNeedsEnoughHistory() {
        record(ParasiteType.COMBAT, 9);
        assertThat(tracker.isAccurate()).isTrue();

        record(ParasiteType.COMBAT, 1);
        assertThat(tracker.isAccurate()).isFalse();
    }

    @Test
    void testStatsCoverTheRollingWindow() {
        record(ParasiteType.COMBAT, 10);
        record(ParasiteType.ENERGY, 20);

        DistributionStats stats = tracker.stats();
        assertThat(stats.totalSpawns()).isEqualTo(SpawnDistributionTracker.WINDOW_SIZE);
        assertThat(stats.energySpawns()).isEqualTo(20);
        assertThat(stats.combatSpawns()).isZero();
        assertThat(stats.energyRatio()).isEqualTo(1.0);
        assertThat(stats.isAccurate()).isFalse();
        assertThat(stats.target()).isEqualTo(SpawnDistribution.defaults());
    }

    @Test
    void testEmptyTrackerRatios() {
        assertThat(tracker.ratioOf(ParasiteType.ENERGY)).isZero();
        assertThat(tracker.stats().totalSpawns()).isZero();
    }

    @Test
    void testRecordsAreBounded() {
        for (int i = 0; i < 150; ++i) {
            tracker.recordSpawn("p" + i, ParasiteType.ENERGY, Optional.empty(), i);
        }
        assertThat(tracker.recentRecords(150, 1000)).hasSize(SpawnDistributionTracker.MAX_RECORDS);
        assertThat(tracker.recentRecords(150, 1000).get(0).parasiteId()).isEqualTo("p50");
    }

    @Test
    void testRecordsForTerritoryAndSpawnRate() {
        for (int i = 0; i < 10; ++i) {
            Optional<String> territory = i % 2 == 0 ? Optional.of("territory_0_0") : Optional.empty();
            tracker.recordSpawn("p" + i, ParasiteType.ENERGY, territory, i);
        }
        assertThat(tracker.recordsForTerritory("territory_0_0")).extracting(SpawnRecord::parasiteId)
                .containsExactly("p0", "p2", "p4", "p6", "p8");
        assertThat(tracker.recordsForTerritory("territory_1_0")).isEmpty();
        assertThat(tracker.spawnRate(10, 5)).isEqualTo(1.0);
    }

    @Test
    void testUpdateDistributionAndReset() {
        SpawnDistribution evenSplit = ImmutableSpawnDistribution.builder().energyRate(0.5).combatRate(0.5).build();
        tracker.updateDistribution(evenSplit);
        assertThat(tracker.getDistribution()).isEqualTo(evenSplit);

        record(ParasiteType.ENERGY, 5);
        tracker.reset();
        assertThat(tracker.stats().totalSpawns()).isZero();
        assertThat(tracker.recentRecords(0, 100)).isEmpty();
    }

    @Test
    void testDistributionMustAddUpToOne() {
        assertThatThrownBy(() -> ImmutableSpawnDistribution.builder().energyRate(0.5).combatRate(0.6).build())
                .isInstanceOf(IllegalArgumentException.class);
    }
}
