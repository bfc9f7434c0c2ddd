package com.supalosa.hive.sim;

import com.supalosa.hive.ParasiteManager;
import com.supalosa.hive.ParasiteManagerConfig;
import com.supalosa.hive.agent.ParasiteType;
import com.supalosa.hive.geometry.Point3d;
import com.supalosa.hive.world.GridTerritoryAuthority;
import com.supalosa.hive.world.Queen;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class SimpleProtectorTest {

    private ParasiteManager manager;
    private Queen queen;

    @BeforeEach
    void setUp() {
        GridTerritoryAuthority authority = new GridTerritoryAuthority(1, 100);
        queen = new Queen("queen");
        authority.getOrCreateTerritoryAt(50, 50).setQueen(Optional.of(queen));
        manager = new ParasiteManager(ParasiteManagerConfig.builder()
                .territoryAuthority(authority)
                .randomSeed(7L)
                .build());
    }

    @Test
    void testKillsCollectTheParasiteEnergyReward() {
        manager.spawn(ParasiteType.COMBAT, Point3d.of(10, 0, 10), queen).orElseThrow();
        manager.spawn(ParasiteType.ENERGY, Point3d.of(12, 0, 10), queen).orElseThrow();
        SimpleProtector protector = new SimpleProtector("guard", Point3d.of(11, 0, 10), 20, 5.0, 100.0);

        protector.step(0.1, manager);
        protector.step(0.1, manager);
        protector.step(0.1, manager);

        assertThat(protector.getKills()).isEqualTo(2);
        assertThat(protector.getEnergyCollected())
                .isEqualTo(ParasiteType.COMBAT.getStats().energyReward()
                        + ParasiteType.ENERGY.getStats().energyReward());
    }

    @Test
    void testWoundingHitsCollectNothing() {
        manager.spawn(ParasiteType.COMBAT, Point3d.of(10, 0, 10), queen).orElseThrow();
        SimpleProtector protector = new SimpleProtector("guard", Point3d.of(10, 0, 10), 20, 5.0, 10.0);

        protector.step(0.1, manager);

        assertThat(protector.getKills()).isZero();
        assertThat(protector.getEnergyCollected()).isZero();
    }
}
