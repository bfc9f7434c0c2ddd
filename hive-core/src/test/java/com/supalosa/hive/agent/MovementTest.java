package com.supalosa.hive.agent;

import com.supalosa.hive.geometry.Point3d;
import org.junit.jupiter.api.Test;

import java.util.Optional;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class MovementTest {

    @Test
    void testBasicAndTacticalParasitesMoveIdentically() {
        Point3d start = Point3d.of(3, 1, -4);
        Point3d destination = Point3d.of(80, 0, 45);
        ParasiteAgent basic = new ParasiteAgent("basic", ParasiteType.ENERGY, start, 50,
                new BasicTargetingStrategy(), Optional.empty(), Optional.empty(), new Random(1), 0.0);
        ParasiteAgent tactical = new ParasiteAgent("tactical", ParasiteType.COMBAT, start, 60,
                new TacticalTargetingStrategy(), Optional.empty(), Optional.empty(), new Random(2), 0.0);

        for (int i = 0; i < 50; ++i) {
            basic.moveTowards(destination, 2.0, 1.0 / 60);
            tactical.moveTowards(destination, 2.0, 1.0 / 60);
            assertThat(basic.getPosition().distance(tactical.getPosition())).isLessThan(1e-3);
        }
    }

    @Test
    void testDistanceCoveredIsSpeedTimesTime() {
        Point3d start = Point3d.of(0, 1, 0);
        ParasiteAgent agent = new ParasiteAgent("basic", ParasiteType.ENERGY, start, 50,
                new BasicTargetingStrategy(), Optional.empty(), Optional.empty(), new Random(1), 0.0);

        for (int i = 0; i < 16; ++i) {
            agent.moveTowards(Point3d.of(100, 1, 100), 2.0, 0.1);
        }
        assertThat(agent.getPosition().distance(start)).isCloseTo(3.2, within(0.1));
        // Still on the straight line to the destination.
        assertThat(agent.getPosition().getX()).isCloseTo(agent.getPosition().getZ(), within(1e-9));
    }

    @Test
    void testStepDoesNotOvershoot() {
        Optional<MovementStep> step = Movement.step(Point3d.ORIGIN, Point3d.of(1, 0, 0), 10.0, 1.0);
        assertThat(step).hasValueSatisfying(movement -> {
            assertThat(movement.position()).isEqualTo(Point3d.of(1, 0, 0));
            assertThat(movement.distanceMoved()).isCloseTo(1.0, within(1e-9));
        });
    }

    @Test
    void testTinyStepsDoNotCount() {
        assertThat(Movement.step(Point3d.ORIGIN, Point3d.of(0.00001, 0, 0), 2.0, 1.0)).isEmpty();
        assertThat(Movement.step(Point3d.ORIGIN, Point3d.of(10, 0, 0), 2.0, 0.00001)).isEmpty();
    }

    @Test
    void testStepKeepsHeightAndFaces() {
        Optional<MovementStep> step = Movement.step(Point3d.of(0, 5, 0), Point3d.of(0, 0, 10), 2.0, 1.0);
        assertThat(step).hasValueSatisfying(movement -> {
            assertThat(movement.position()).isEqualTo(Point3d.of(0, 5, 2));
            assertThat(movement.facing()).isCloseTo(0.0, within(1e-9));
        });
    }
}
