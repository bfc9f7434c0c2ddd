package com.supalosa.hive;

import com.supalosa.hive.agent.ParasiteAgent;
import com.supalosa.hive.agent.ParasiteState;
import com.supalosa.hive.agent.ParasiteType;
import com.supalosa.hive.control.ControlValidation;
import com.supalosa.hive.geometry.Point3d;
import com.supalosa.hive.performance.OptimizationLevel;
import com.supalosa.hive.statistics.PerformanceStats;
import com.supalosa.hive.target.FakeWorker;
import com.supalosa.hive.world.GridTerritoryAuthority;
import com.supalosa.hive.world.QuadTreeSpatialIndex;
import com.supalosa.hive.world.Queen;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

class ParasiteManagerTest {

    private GridTerritoryAuthority authority;
    private QuadTreeSpatialIndex index;
    private ParasiteEventListener listener;
    private Queen queen;
    private Queen rival;
    private double fps;
    private ParasiteManager manager;

    @BeforeEach
    void setUp() {
        authority = new GridTerritoryAuthority(1, 100);
        index = new QuadTreeSpatialIndex();
        listener = mock(ParasiteEventListener.class);
        queen = new Queen("queen");
        rival = new Queen("rival");
        authority.getOrCreateTerritoryAt(50, 50).setQueen(Optional.of(queen));
        authority.getOrCreateTerritoryAt(150, 50).setQueen(Optional.of(rival));
        fps = 60.0;
        manager = new ParasiteManager(ParasiteManagerConfig.builder()
                .territoryAuthority(authority)
                .spatialIndex(index)
                .viewpointProvider(() -> Optional.of(Point3d.ORIGIN))
                .frameRateSource(() -> fps)
                .eventListener(listener)
                .randomSeed(42L)
                .build());
    }

    private ParasiteAgent spawn(ParasiteType type, double x, double z) {
        Queen owner = x < 100 ? queen : rival;
        return manager.spawn(type, Point3d.of(x, 0, z), owner).orElseThrow();
    }

    @Test
    void testSpawnRegistersParasite() {
        ParasiteAgent agent = spawn(ParasiteType.ENERGY, 10, 10);

        assertThat(manager.getParasite(agent.getId())).contains(agent);
        assertThat(manager.getActiveParasiteCount()).isEqualTo(1);
        assertThat(manager.getParasiteCountByType(ParasiteType.ENERGY)).isEqualTo(1);
        assertThat(manager.getParasitesInTerritory("territory_0_0")).containsExactly(agent);
        assertThat(index.getPosition(agent.getId())).contains(agent.getPosition());
        assertThat(queen.controls(agent.getId())).isTrue();
        assertThat(agent.getEnergyReward()).isEqualTo(2);
        verify(listener).onParasiteSpawned(agent);
    }

    @Test
    void testRefusedSpawnIsNotRegistered() {
        assertThat(manager.spawn(ParasiteType.ENERGY, Point3d.of(110, 0, 10), queen)).isEmpty();
        assertThat(manager.getActiveParasiteCount()).isZero();
        verify(listener, never()).onParasiteSpawned(any());
    }

    @Test
    void testUpdateAdvancesParasites() {
        ParasiteAgent agent = spawn(ParasiteType.ENERGY, 10, 10);
        for (int i = 0; i < 20; ++i) {
            manager.update(0.1, List.of(), List.of());
        }

        assertThat(manager.getSimulationTime()).isCloseTo(2.0, within(1e-9));
        assertThat(agent.getState()).isEqualTo(ParasiteState.PATROLLING);
        assertThat(agent.getPosition()).isNotEqualTo(Point3d.of(10, 0.5, 10));
        assertThat(index.getPosition(agent.getId())).contains(agent.getPosition());
    }

    @Test
    void testEnergyParasiteFeedsOnNearbyWorker() {
        spawn(ParasiteType.ENERGY, 10, 10);
        FakeWorker worker = new FakeWorker("worker", Point3d.of(12, 0, 10), 100, 100);

        for (int i = 0; i < 30; ++i) {
            manager.update(0.1, List.of(worker), List.of());
        }
        assertThat(worker.getEnergy()).isLessThan(100);
    }

    @Test
    void testDestroyedParasiteIsReapedOnUpdate() {
        ParasiteAgent agent = spawn(ParasiteType.ENERGY, 10, 10);

        Optional<ParasiteAgent> hit = manager.damageParasiteAt(agent.getPosition(), 1.0, 100);
        assertThat(hit).contains(agent);
        assertThat(agent.isAlive()).isFalse();
        assertThat(manager.getParasites()).isEmpty();

        manager.update(0.1, List.of(), List.of());

        assertThat(manager.getParasite(agent.getId())).isEmpty();
        assertThat(manager.getParasiteCountByType(ParasiteType.ENERGY)).isZero();
        assertThat(index.size()).isZero();
        assertThat(queen.controls(agent.getId())).isFalse();
        verify(listener).onParasiteDestroyed(agent);
    }

    @Test
    void testDamageMissesWhenNothingIsNearby() {
        spawn(ParasiteType.COMBAT, 10, 10);
        assertThat(manager.damageParasiteAt(Point3d.of(60, 0, 60), 1.0, 100)).isEmpty();
    }

    @Test
    void testUnknownDestructionIsIgnored() {
        manager.handleParasiteDestruction("nobody");
        verify(listener, never()).onParasiteDestroyed(any());
    }

    @Test
    void testExplodeParasitesInTerritory() {
        spawn(ParasiteType.ENERGY, 10, 10);
        spawn(ParasiteType.ENERGY, 20, 10);
        spawn(ParasiteType.COMBAT, 30, 10);
        ParasiteAgent survivor = spawn(ParasiteType.ENERGY, 110, 10);

        assertThat(manager.explodeParasitesInTerritory("territory_0_0")).isEqualTo(3);
        assertThat(manager.getParasites()).containsExactly(survivor);
        assertThat(queen.getControlledParasiteCount()).isZero();
        assertThat(authority.getTerritory("territory_0_0").orElseThrow().getParasiteCount()).isZero();
        assertThat(manager.explodeParasitesInTerritory("territory_7_7")).isZero();
    }

    @Test
    void testSpawnNextCorrectsTheMix() {
        for (int i = 0; i < 4; ++i) {
            spawn(ParasiteType.ENERGY, 10 + i, 10);
        }
        ParasiteAgent next = manager.spawnNext(Point3d.of(40, 0, 40), queen).orElseThrow();
        assertThat(next.getType()).isEqualTo(ParasiteType.COMBAT);
        assertThat(manager.getDistributionStats().totalSpawns()).isEqualTo(5);
    }

    @Test
    void testTransferAndReconcileControl() {
        ParasiteAgent agent = spawn(ParasiteType.ENERGY, 10, 10);
        assertThat(manager.validateControl().isConsistent()).isTrue();

        assertThat(manager.transferControl(agent.getId(), rival)).isTrue();
        ControlValidation validation = manager.validateControl();
        assertThat(validation.wrongControl()).hasSize(1);

        manager.recalculateControl();
        assertThat(manager.validateControl().isConsistent()).isTrue();
        assertThat(queen.controls(agent.getId())).isTrue();
        assertThat(manager.transferControl("nobody", rival)).isFalse();
    }

    @Test
    void testGovernorReactsToLowFrameRate() {
        for (int i = 0; i < 8; ++i) {
            spawn(ParasiteType.ENERGY, 10 + i * 5, 10);
        }
        fps = 30.0;
        manager.update(0.1, List.of(), List.of());

        PerformanceStats stats = manager.getPerformanceStats();
        assertThat(stats.optimizationLevel()).isEqualTo(OptimizationLevel.AGGRESSIVE.getLevel());
        assertThat(stats.maxActiveParasites()).isEqualTo(5);
        assertThat(stats.activeParasites()).isEqualTo(8);
        assertThat(stats.lastPerformanceCheck()).isPresent();

        manager.setMaxActiveParasites(3);
        assertThat(manager.getPerformanceStats().maxActiveParasites()).isEqualTo(3);
    }

    @Test
    void testForcedPerformanceCheckIgnoresInterval() {
        for (int i = 0; i < 8; ++i) {
            spawn(ParasiteType.ENERGY, 10 + i * 5, 10);
        }
        manager.update(0.1, List.of(), List.of());
        assertThat(manager.getPerformanceStats().optimizationLevel()).isEqualTo(OptimizationLevel.NONE.getLevel());

        fps = 30.0;
        manager.update(0.1, List.of(), List.of());
        assertThat(manager.getPerformanceStats().optimizationLevel()).isEqualTo(OptimizationLevel.NONE.getLevel());

        manager.forcePerformanceCheck();
        assertThat(manager.getPerformanceStats().optimizationLevel())
                .isEqualTo(OptimizationLevel.AGGRESSIVE.getLevel());
    }

    @Test
    void testQueriesAndLifecycleStats() {
        ParasiteAgent energy = spawn(ParasiteType.ENERGY, 10, 10);
        ParasiteAgent combat = spawn(ParasiteType.COMBAT, 40, 40);

        assertThat(manager.getParasitesByType(ParasiteType.COMBAT)).containsExactly(combat);
        assertThat(manager.getParasitesNear(Point3d.of(10, 0, 10), 5)).containsExactly(energy);
        assertThat(manager.getLifecycleStats().totalParasites()).isEqualTo(2);
        assertThat(manager.getLifecycleStats().parasitesByTerritory()).containsEntry("territory_0_0", 2);
        assertThat(manager.getTerritorialStats().territoriesWithActiveQueens()).isEqualTo(2);
    }

    @Test
    void testDisposeForgetsEverything() {
        ParasiteAgent agent = spawn(ParasiteType.ENERGY, 10, 10);
        manager.dispose();

        assertThat(manager.getParasite(agent.getId())).isEmpty();
        assertThat(queen.getControlledParasiteCount()).isZero();
        assertThat(index.size()).isZero();
        verify(listener, never()).onParasiteDestroyed(any());
    }
}
