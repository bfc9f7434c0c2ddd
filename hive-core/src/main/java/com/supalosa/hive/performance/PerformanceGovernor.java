package com.supalosa.hive.performance;

import com.supalosa.hive.agent.ParasiteAgent;
import com.supalosa.hive.agent.ParasiteType;
import com.supalosa.hive.geometry.Point3d;
import com.supalosa.hive.world.FrameRateSource;
import com.supalosa.hive.world.ViewpointProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Watches the frame rate and trades parasite rendering fidelity for performance.
 *
 * The cap on visible parasites only moves one way per check: down while the frame rate is low, up by one once it
 * has recovered. Fidelity tiers are only reassigned when the optimisation level changes.
 */
public class PerformanceGovernor {

    private static final Logger log = LoggerFactory.getLogger(PerformanceGovernor.class);

    private final GovernorConfig config;
    private final Optional<FrameRateSource> frameRateSource;
    private final Optional<ViewpointProvider> viewpointProvider;
    private final Optional<FidelityListener> fidelityListener;

    private final Map<String, FidelityTier> tiers = new HashMap<>();
    private OptimizationLevel level = OptimizationLevel.NONE;
    private int maxActiveParasites;
    private Optional<Double> lastCheckTime = Optional.empty();

    public PerformanceGovernor(GovernorConfig config,
                               Optional<FrameRateSource> frameRateSource,
                               Optional<ViewpointProvider> viewpointProvider,
                               Optional<FidelityListener> fidelityListener) {
        this.config = config;
        this.frameRateSource = frameRateSource;
        this.viewpointProvider = viewpointProvider;
        this.fidelityListener = fidelityListener;
        this.maxActiveParasites = config.maxCap();
    }

    /**
     * Re-evaluates the optimisation level if the check interval has passed since the last check.
     *
     * @param now The current simulation time in seconds.
     * @param agents Every parasite currently owned, dead or alive.
     */
    public void checkAndOptimize(double now, Collection<ParasiteAgent> agents) {
        if (lastCheckTime.isPresent() && now - lastCheckTime.get() < config.checkInterval()) {
            return;
        }
        lastCheckTime = Optional.of(now);
        if (frameRateSource.isEmpty()) {
            return;
        }
        double fps = frameRateSource.get().currentFps();
        List<ParasiteAgent> live = agents.stream().filter(ParasiteAgent::isAlive).collect(Collectors.toList());
        int liveCount = live.size();

        OptimizationLevel newLevel = OptimizationLevel.NONE;
        if (fps < config.aggressiveFps() && liveCount > config.aggressiveMinParasites()) {
            newLevel = OptimizationLevel.AGGRESSIVE;
            maxActiveParasites = shrinkCap(config.aggressiveCapFloor(), config.aggressiveCapFactor(), liveCount);
        } else if (fps < config.basicFps() && liveCount > config.basicMinParasites()) {
            newLevel = OptimizationLevel.BASIC;
            maxActiveParasites = shrinkCap(config.basicCapFloor(), config.basicCapFactor(), liveCount);
        } else if (fps >= config.recoveryFps()) {
            maxActiveParasites = Math.min(config.maxCap(), maxActiveParasites + 1);
        }

        if (newLevel != level) {
            log.info("Parasite optimisation level {} -> {} at {} fps with {} parasites (cap {})",
                    level.getDisplayName(), newLevel.getDisplayName(), String.format("%.1f", fps), liveCount,
                    maxActiveParasites);
            level = newLevel;
            applyFidelity(live);
        }
    }

    /**
     * Runs a check immediately, ignoring the check interval.
     */
    public void forceCheck(double now, Collection<ParasiteAgent> agents) {
        lastCheckTime = Optional.empty();
        checkAndOptimize(now, agents);
    }

    /**
     * Shrinks towards the floor, by at least one per check while above it, but never raises the cap.
     */
    private int shrinkCap(int floor, double factor, int liveCount) {
        int cap = maxActiveParasites;
        int proportional = (int) Math.floor(factor * liveCount);
        return Math.max(Math.min(cap, floor), Math.min(cap - 1, proportional));
    }

    private void applyFidelity(List<ParasiteAgent> agents) {
        switch (level) {
            case NONE:
                agents.forEach(agent -> assign(agent, FidelityTier.FULL));
                break;
            case BASIC:
                viewpointProvider.flatMap(ViewpointProvider::viewpoint).ifPresent(viewpoint ->
                        agents.forEach(agent -> assign(agent, distanceBand(agent.getPosition().distance(viewpoint),
                                config.basicMinimalDistance(), config.basicReducedDistance()))));
                break;
            case AGGRESSIVE:
                viewpointProvider.flatMap(ViewpointProvider::viewpoint).ifPresent(viewpoint ->
                        applyAggressiveFidelity(agents, viewpoint));
                break;
            default:
                throw new IllegalStateException("Unsupported optimisation level: " + level);
        }
    }

    private void applyAggressiveFidelity(List<ParasiteAgent> agents, Point3d viewpoint) {
        List<ParasiteAgent> ranked = new ArrayList<>(agents);
        ranked.sort(Comparator.comparingDouble((ParasiteAgent agent) -> priority(agent, viewpoint)).reversed());
        int visibleCount = Math.min(maxActiveParasites, ranked.size());
        for (int i = 0; i < ranked.size(); ++i) {
            ParasiteAgent agent = ranked.get(i);
            if (i >= visibleCount) {
                assign(agent, FidelityTier.HIDDEN);
            } else {
                assign(agent, distanceBand(agent.getPosition().distance(viewpoint),
                        config.aggressiveMinimalDistance(), config.aggressiveReducedDistance()));
            }
        }
    }

    private double priority(ParasiteAgent agent, Point3d viewpoint) {
        double bonus = agent.getType() == ParasiteType.COMBAT ? config.combatPriorityBonus() : 0.0;
        return bonus - agent.getPosition().distance(viewpoint);
    }

    private static FidelityTier distanceBand(double distance, double minimalDistance, double reducedDistance) {
        if (distance > minimalDistance) {
            return FidelityTier.MINIMAL;
        } else if (distance > reducedDistance) {
            return FidelityTier.REDUCED;
        }
        return FidelityTier.FULL;
    }

    private void assign(ParasiteAgent agent, FidelityTier tier) {
        tiers.put(agent.getId(), tier);
        fidelityListener.ifPresent(listener -> listener.onFidelityAssigned(agent, tier));
    }

    public void setMaxActiveParasites(int max) {
        maxActiveParasites = Math.max(config.manualCapMin(), Math.min(config.manualCapMax(), max));
    }

    public int getMaxActiveParasites() {
        return maxActiveParasites;
    }

    public OptimizationLevel getOptimizationLevel() {
        return level;
    }

    public Optional<Double> getLastCheckTime() {
        return lastCheckTime;
    }

    public Optional<FidelityTier> getTier(String parasiteId) {
        return Optional.ofNullable(tiers.get(parasiteId));
    }

    public Map<String, FidelityTier> getTiers() {
        return Collections.unmodifiableMap(tiers);
    }

    /**
     * Forgets the tier of a parasite that no longer exists.
     */
    public void forget(String parasiteId) {
        tiers.remove(parasiteId);
    }

    public GovernorConfig getConfig() {
        return config;
    }
}
