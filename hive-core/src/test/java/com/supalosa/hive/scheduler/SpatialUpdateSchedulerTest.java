package com.supalosa.hive.scheduler;

import com.supalosa.hive.agent.NearbyTargets;
import com.supalosa.hive.agent.ParasiteAgent;
import com.supalosa.hive.geometry.Point3d;
import com.supalosa.hive.target.FakeProtector;
import com.supalosa.hive.target.FakeWorker;
import com.supalosa.hive.world.EntityTag;
import com.supalosa.hive.world.QuadTreeSpatialIndex;
import com.supalosa.hive.world.SpatialIndex;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class SpatialUpdateSchedulerTest {

    private static ParasiteAgent mockAgent(String id, Point3d position, double territoryRadius) {
        ParasiteAgent agent = mock(ParasiteAgent.class);
        when(agent.getId()).thenReturn(id);
        when(agent.isAlive()).thenReturn(true);
        when(agent.getPosition()).thenReturn(position);
        when(agent.getTerritoryCentre()).thenReturn(position);
        when(agent.getTerritoryRadius()).thenReturn(territoryRadius);
        return agent;
    }

    /**
     * Records the ids of the targets an agent is given, since the view is reused after the agent's update.
     */
    private static List<String> captureNearbyIds(ParasiteAgent agent) {
        List<String> ids = new ArrayList<>();
        doAnswer(invocation -> {
            NearbyTargets nearby = invocation.getArgument(2);
            nearby.getWorkers().forEach(worker -> ids.add(worker.getId()));
            nearby.getProtectors().forEach(protector -> ids.add(protector.getId()));
            return null;
        }).when(agent).update(anyDouble(), anyDouble(), any(NearbyTargets.class));
        return ids;
    }

    @Test
    void testNothingHappensWithoutViewpoint() {
        SpatialUpdateScheduler scheduler = new SpatialUpdateScheduler();
        ParasiteAgent agent = mockAgent("a", Point3d.ORIGIN, 10);

        int updated = scheduler.update(0.1, 1.0, List.of(agent), List.of(), List.of(), Optional.empty(),
                Optional.empty());

        assertThat(updated).isEqualTo(0);
        verify(agent, never()).update(anyDouble(), anyDouble(), any());
    }

    @Test
    void testNothingHappensWithoutAgents() {
        SpatialUpdateScheduler scheduler = new SpatialUpdateScheduler();
        assertThat(scheduler.update(0.1, 1.0, List.of(), List.of(), List.of(), Optional.empty(),
                Optional.of(Point3d.ORIGIN))).isEqualTo(0);
    }

    @Test
    void testLinearScanWithoutSpatialIndex() {
        SpatialUpdateScheduler scheduler = new SpatialUpdateScheduler();
        ParasiteAgent agent = mockAgent("a", Point3d.ORIGIN, 10);
        List<String> seen = captureNearbyIds(agent);
        List<FakeWorker> workers = List.of(
                new FakeWorker("near", Point3d.of(10, 0, 0)),
                new FakeWorker("far", Point3d.of(20, 0, 0)));
        List<FakeProtector> protectors = List.of(new FakeProtector("guard", Point3d.of(0, 0, 14), 10));

        int updated = scheduler.update(0.1, 1.0, List.of(agent), workers, protectors, Optional.empty(),
                Optional.of(Point3d.of(1000, 0, 1000)));

        // Without an index every parasite is updated, however far from the viewpoint.
        assertThat(updated).isEqualTo(1);
        assertThat(seen).containsExactlyInAnyOrder("near", "guard");
    }

    @Test
    void testSpatialIndexLimitsParasitesAndTargets() {
        SpatialUpdateScheduler scheduler = new SpatialUpdateScheduler();
        SpatialIndex index = new QuadTreeSpatialIndex();
        ParasiteAgent near = mockAgent("near", Point3d.of(0, 1, 0), 10);
        ParasiteAgent far = mockAgent("far", Point3d.of(500, 1, 0), 10);
        index.add("near", near.getPosition(), EntityTag.ENERGY_PARASITE);
        index.add("far", far.getPosition(), EntityTag.COMBAT_PARASITE);
        FakeWorker indexed = new FakeWorker("indexed", Point3d.of(5, 0, 0));
        FakeWorker unindexed = new FakeWorker("unindexed", Point3d.of(6, 0, 0));
        index.add("indexed", indexed.getPosition(), EntityTag.WORKER);
        List<String> seen = captureNearbyIds(near);

        int updated = scheduler.update(0.1, 1.0, List.of(near, far), List.of(indexed, unindexed), List.of(),
                Optional.of(index), Optional.of(Point3d.ORIGIN));

        assertThat(updated).isEqualTo(1);
        verify(far, never()).update(anyDouble(), anyDouble(), any());
        assertThat(seen).containsExactly("indexed");
    }

    @Test
    void testMovedParasitesArePushedBackIntoIndex() {
        SpatialUpdateScheduler scheduler = new SpatialUpdateScheduler();
        SpatialIndex index = new QuadTreeSpatialIndex();
        ParasiteAgent agent = mockAgent("a", Point3d.of(0, 1, 0), 10);
        index.add("a", Point3d.of(0, 1, 0), EntityTag.ENERGY_PARASITE);
        when(agent.getPosition()).thenReturn(Point3d.of(2, 1, 0));

        scheduler.update(0.1, 1.0, List.of(agent), List.of(), List.of(), Optional.of(index),
                Optional.of(Point3d.ORIGIN));

        assertThat(index.getPosition("a")).hasValue(Point3d.of(2, 1, 0));
    }

    @Test
    void testDeadParasitesAreSkipped() {
        SpatialUpdateScheduler scheduler = new SpatialUpdateScheduler();
        ParasiteAgent agent = mockAgent("a", Point3d.ORIGIN, 10);
        when(agent.isAlive()).thenReturn(false);

        assertThat(scheduler.update(0.1, 1.0, List.of(agent), List.of(), List.of(), Optional.empty(),
                Optional.of(Point3d.ORIGIN))).isEqualTo(0);
        verify(agent, never()).update(anyDouble(), anyDouble(), any());
    }

    @Test
    void testSearchRadiusFollowsConfig() {
        SpatialUpdateScheduler scheduler = new SpatialUpdateScheduler(ImmutableSchedulerConfig.builder()
                .searchRadiusMultiplier(3.0)
                .build());
        ParasiteAgent agent = mockAgent("a", Point3d.ORIGIN, 10);
        List<String> seen = captureNearbyIds(agent);

        scheduler.update(0.1, 1.0, List.of(agent), List.of(new FakeWorker("w", Point3d.of(25, 0, 0))), List.of(),
                Optional.empty(), Optional.of(Point3d.ORIGIN));

        assertThat(seen).containsExactly("w");
    }
}
