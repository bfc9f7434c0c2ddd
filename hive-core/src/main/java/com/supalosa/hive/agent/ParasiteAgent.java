package com.supalosa.hive.agent;

import com.supalosa.hive.geometry.Point3d;
import com.supalosa.hive.target.Protector;
import com.supalosa.hive.target.TargetClass;
import com.supalosa.hive.target.TargetUnit;
import com.supalosa.hive.target.Worker;
import com.supalosa.hive.utils.Utils;
import com.supalosa.hive.world.TerrainHeightProvider;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Random;

/**
 * A single parasite and its behaviour state machine.
 *
 * The same state machine drives every parasite type; what differs between types is the {@link ParasiteStats},
 * the {@link TargetingBehavior} and the {@link TargetingStrategy} supplied at construction.
 */
public class ParasiteAgent {

    private static final Logger log = LoggerFactory.getLogger(ParasiteAgent.class);

    public static final double SPAWN_DELAY = 1.0;
    public static final double PATROL_ARRIVAL_DISTANCE = 1.0;
    public static final double RETURN_RADIUS_FRACTION = 0.5;
    /**
     * Height above the terrain that parasites move at.
     */
    public static final double ROAM_HEIGHT = 1.0;
    /**
     * Height used when there is no terrain to follow.
     */
    public static final double DEFAULT_HEIGHT = 1.0;

    private final String id;
    private final ParasiteType type;
    private final ParasiteStats stats;
    private final TargetingBehavior targetingBehavior;
    private final TargetingStrategy strategy;
    private final Optional<TerrainHeightProvider> terrain;
    private final Optional<String> territoryId;
    private final Random random;
    private final double spawnTime;
    private final double territoryRadius;

    private Point3d position;
    private double facing;
    private double health;
    private ParasiteState state;
    private Optional<TargetLock> targetLock;
    private Point3d territoryCentre;
    private Point3d patrolTarget;
    private double lastStateChange;
    private double lastFeedTime;

    public ParasiteAgent(String id,
                         ParasiteType type,
                         Point3d position,
                         double territoryRadius,
                         TargetingStrategy strategy,
                         Optional<TerrainHeightProvider> terrain,
                         Optional<String> territoryId,
                         Random random,
                         double now) {
        Validate.notBlank(id, "Parasite id must not be blank");
        Validate.isTrue(territoryRadius > 0, "territoryRadius must be positive: %f", territoryRadius);
        this.id = id;
        this.type = type;
        this.stats = type.getStats();
        this.targetingBehavior = type.getTargetingBehavior();
        this.strategy = strategy;
        this.terrain = terrain;
        this.territoryId = territoryId;
        this.random = random;
        this.spawnTime = now;
        this.territoryRadius = territoryRadius;
        this.position = position;
        this.facing = 0.0;
        this.health = stats.maxHealth();
        this.state = ParasiteState.SPAWNING;
        this.targetLock = Optional.empty();
        this.territoryCentre = position;
        this.patrolTarget = generatePatrolTarget();
        this.lastStateChange = now;
        this.lastFeedTime = now;
    }

    /**
     * Advances the parasite by one tick.
     *
     * @param deltaTime Seconds since the last tick.
     * @param now The current simulation time in seconds.
     * @param nearby The targets within search range this tick. Only valid for the duration of the call.
     */
    public void update(double deltaTime, double now, NearbyTargets nearby) {
        if (!isAlive()) {
            return;
        }
        if (hasStarved(now)) {
            log.debug("Parasite {} starved after {}s without feeding", id, now - lastFeedTime);
            health = 0;
            return;
        }
        List<TargetUnit> candidates = gatherCandidates(nearby);
        strategy.onStep(this, candidates, now);

        switch (state) {
            case SPAWNING:
                updateSpawning(now);
                break;
            case PATROLLING:
                updatePatrolling(deltaTime, now, candidates);
                break;
            case HUNTING:
                updateHunting(deltaTime, now, nearby, candidates);
                break;
            case FEEDING:
                updateFeeding(deltaTime, now, nearby);
                break;
            case RETURNING:
                updateReturning(deltaTime, now);
                break;
            default:
                throw new IllegalStateException("Unsupported state: " + state);
        }
    }

    private void updateSpawning(double now) {
        if (now - lastStateChange >= SPAWN_DELAY) {
            setState(ParasiteState.PATROLLING, now);
        }
    }

    private void updatePatrolling(double deltaTime, double now, List<TargetUnit> candidates) {
        Optional<TargetUnit> target = strategy.selectTarget(this, candidates);
        if (target.isPresent()) {
            lockOn(target.get(), now);
            setState(ParasiteState.HUNTING, now);
            return;
        }
        moveTowards(patrolTarget, strategy.computeSpeed(this), deltaTime);
        if (position.distance2d(patrolTarget) < PATROL_ARRIVAL_DISTANCE) {
            patrolTarget = generatePatrolTarget();
        }
    }

    private void updateHunting(double deltaTime, double now, NearbyTargets nearby, List<TargetUnit> candidates) {
        Optional<TargetUnit> resolved = resolveLockedTarget(nearby);
        if (resolved.isEmpty()) {
            clearTarget();
            setState(ParasiteState.PATROLLING, now);
            return;
        }
        TargetUnit target = resolved.get();

        Optional<TargetUnit> replacement = strategy.reevaluateTarget(this, target, candidates, now);
        if (replacement.isPresent()) {
            log.debug("Parasite {} switching target from {} to {}", id, target.getId(), replacement.get().getId());
            target = replacement.get();
            lockOn(target, now);
        }

        double pursuitDistance = strategy.pursuitDistance(this);
        if (target.getPosition().distance(territoryCentre) > pursuitDistance) {
            String abandonedId = target.getId();
            List<TargetUnit> alternatives = new ArrayList<>(candidates);
            // Alternatives are held to the same pursuit limit.
            alternatives.removeIf(candidate -> candidate.getId().equals(abandonedId)
                    || candidate.getPosition().distance(territoryCentre) > pursuitDistance);
            Optional<TargetUnit> alternative = strategy.selectTarget(this, alternatives);
            if (alternative.isPresent()) {
                lockOn(alternative.get(), now);
            } else {
                clearTarget();
                setState(ParasiteState.RETURNING, now);
            }
            return;
        }

        if (position.distance(target.getPosition()) <= stats.engagementDistance()) {
            setState(ParasiteState.FEEDING, now);
            return;
        }
        moveTowards(target.getPosition(), strategy.computeSpeed(this), deltaTime);
    }

    private void updateFeeding(double deltaTime, double now, NearbyTargets nearby) {
        if (targetLock.isEmpty()) {
            setState(ParasiteState.PATROLLING, now);
            return;
        }
        TargetLock lock = targetLock.get();
        Optional<? extends TargetUnit> resolved = nearby.resolve(lock)
                .filter(TargetUnit::canBeTargetedByParasites);
        if (resolved.isEmpty() || position.distance(resolved.get().getPosition()) > stats.disengageDistance()) {
            clearTarget();
            setState(ParasiteState.PATROLLING, now);
            return;
        }
        switch (lock.targetClass()) {
            case WORKER:
                drainWorker((Worker) resolved.get(), deltaTime, now);
                break;
            case PROTECTOR:
                attackProtector((Protector) resolved.get(), deltaTime, now);
                break;
            default:
                throw new IllegalStateException("Unsupported target class: " + lock.targetClass());
        }
    }

    private void updateReturning(double deltaTime, double now) {
        moveTowards(territoryCentre, strategy.computeSpeed(this), deltaTime);
        if (position.distance2d(territoryCentre) <= territoryRadius * RETURN_RADIUS_FRACTION) {
            setState(ParasiteState.PATROLLING, now);
        }
    }

    private void drainWorker(Worker worker, double deltaTime, double now) {
        double drained = worker.drainEnergy(strategy.drainRate(this) * deltaTime);
        if (drained > 0) {
            lastFeedTime = now;
        }
        if (worker.getEnergy() < worker.getEnergyCapacity() * strategy.fleeThreshold(this)) {
            worker.fleeFrom(position, stats.fleeDistance());
            clearTarget();
            setState(ParasiteState.PATROLLING, now);
        }
    }

    private void attackProtector(Protector protector, double deltaTime, double now) {
        double damage = stats.attackDamage() * deltaTime;
        if (damage <= 0) {
            return;
        }
        double protectorHealth = protector.getHealth().orElse(0.0);
        if (protectorHealth <= damage * 3) {
            // Ease off on the last hits so the kill is not instantaneous.
            damage *= Math.max(0.3, protectorHealth / (damage * 3));
        }
        protector.takeDamage(damage);
        lastFeedTime = now;
        if (protector.getHealth().orElse(0.0) <= 0) {
            log.debug("Parasite {} killed protector {}", id, protector.getId());
            clearTarget();
            setState(ParasiteState.PATROLLING, now);
        }
    }

    /**
     * Moves in a straight line towards the destination on the ground plane, following the terrain height.
     *
     * @return True if the parasite moved.
     */
    public boolean moveTowards(Point3d destination, double speed, double deltaTime) {
        Optional<MovementStep> step = Movement.step(position, destination, speed, deltaTime);
        if (step.isEmpty()) {
            return false;
        }
        Point3d next = step.get().position();
        double height = terrain
                .map(provider -> provider.heightAt(next.getX(), next.getZ()) + ROAM_HEIGHT)
                .orElse(DEFAULT_HEIGHT);
        position = next.withY(height);
        facing = step.get().facing();
        return true;
    }

    /**
     * Applies damage to the parasite.
     *
     * @return True if the parasite was destroyed.
     */
    public boolean takeDamage(double damage) {
        Validate.isTrue(damage >= 0, "damage must not be negative: %f", damage);
        health = Math.max(0.0, health - damage);
        return health <= 0;
    }

    /**
     * Brings the parasite back to full health at a new position, which also becomes its territory centre.
     */
    public void respawn(Point3d newPosition, double now) {
        health = stats.maxHealth();
        position = newPosition;
        territoryCentre = newPosition;
        clearTarget();
        patrolTarget = generatePatrolTarget();
        lastFeedTime = now;
        setState(ParasiteState.PATROLLING, now);
    }

    private boolean hasStarved(double now) {
        return stats.starvationTime()
                .map(starvationTime -> now - lastFeedTime > starvationTime)
                .orElse(false);
    }

    /**
     * Collects the targets this parasite may engage this tick: of a class the strategy considers and the type
     * allows, eligible, and within the territory radius of the territory centre.
     */
    private List<TargetUnit> gatherCandidates(NearbyTargets nearby) {
        List<TargetUnit> candidates = new ArrayList<>();
        for (TargetClass targetClass : strategy.targetPriority()) {
            if (!targetingBehavior.isValidTarget(targetClass)) {
                continue;
            }
            for (TargetUnit unit : nearby.getTargetsOfClass(targetClass)) {
                if (isEligible(unit) && unit.getPosition().distance(territoryCentre) <= territoryRadius) {
                    candidates.add(unit);
                }
            }
        }
        return candidates;
    }

    private Optional<TargetUnit> resolveLockedTarget(NearbyTargets nearby) {
        if (targetLock.isEmpty()) {
            return Optional.empty();
        }
        return nearby.resolve(targetLock.get())
                .filter(this::isEligible)
                .map(TargetUnit.class::cast);
    }

    /**
     * Whether a unit can be engaged right now. Protectors also have to be alive and within detection range.
     */
    boolean isEligible(TargetUnit unit) {
        if (!unit.canBeTargetedByParasites()) {
            return false;
        }
        switch (unit.getTargetClass()) {
            case WORKER:
                return true;
            case PROTECTOR:
                return unit.getHealth().map(health -> health > 0).orElse(false) &&
                        position.distance(unit.getPosition()) <= targetingBehavior.maxTargetDistance();
            default:
                throw new IllegalStateException("Unsupported target class: " + unit.getTargetClass());
        }
    }

    private void lockOn(TargetUnit target, double now) {
        targetLock = Optional.of(TargetLock.of(target.getId(), target.getTargetClass(), now));
    }

    private void clearTarget() {
        targetLock = Optional.empty();
    }

    private void setState(ParasiteState newState, double now) {
        if (newState != state) {
            log.debug("Parasite {} {} -> {}", id, state, newState);
            state = newState;
            lastStateChange = now;
        }
    }

    private Point3d generatePatrolTarget() {
        return Utils.randomPointAround(territoryCentre, territoryRadius * strategy.patrolRadiusFraction(), random);
    }

    public String getId() {
        return id;
    }

    public ParasiteType getType() {
        return type;
    }

    public ParasiteStats getStats() {
        return stats;
    }

    public TargetingBehavior getTargetingBehavior() {
        return targetingBehavior;
    }

    public TargetingStrategy getStrategy() {
        return strategy;
    }

    public Point3d getPosition() {
        return position;
    }

    public double getFacing() {
        return facing;
    }

    /**
     * @return The health, rounded down and never below zero.
     */
    public int getHealth() {
        return (int) Math.floor(Utils.clamp(health, 0, stats.maxHealth()));
    }

    public int getMaxHealth() {
        return stats.maxHealth();
    }

    public double getHealthFraction() {
        return Utils.clamp(health / stats.maxHealth(), 0.0, 1.0);
    }

    public boolean isAlive() {
        return health > 0;
    }

    public ParasiteState getState() {
        return state;
    }

    public Optional<TargetLock> getTargetLock() {
        return targetLock;
    }

    public Point3d getTerritoryCentre() {
        return territoryCentre;
    }

    public double getTerritoryRadius() {
        return territoryRadius;
    }

    public Optional<String> getTerritoryId() {
        return territoryId;
    }

    public Point3d getPatrolTarget() {
        return patrolTarget;
    }

    public double getSpawnTime() {
        return spawnTime;
    }

    public double getLastStateChange() {
        return lastStateChange;
    }

    public double getLastFeedTime() {
        return lastFeedTime;
    }

    public int getEnergyReward() {
        return stats.energyReward();
    }

    public Optional<Double> getAggression() {
        return strategy.getAggression();
    }

    public ParasiteSnapshot snapshot() {
        return ImmutableParasiteSnapshot.builder()
                .id(id)
                .type(type)
                .state(state)
                .position(position)
                .health(getHealth())
                .maxHealth(getMaxHealth())
                .currentTargetClass(targetLock.map(TargetLock::targetClass))
                .aggression(getAggression())
                .territoryId(territoryId)
                .build();
    }

    @Override
    public String toString() {
        return "Parasite[" + id + ", " + type + ", " + state + " at " + position + "]";
    }
}
