package com.supalosa.hive.agent;

import com.supalosa.hive.target.Protector;
import com.supalosa.hive.target.TargetClass;
import com.supalosa.hive.target.TargetUnit;
import com.supalosa.hive.target.Worker;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * The targets within search range of one parasite for one tick.
 *
 * The scheduler owns a single instance and refills it for every parasite it updates, so parasites must not hold on
 * to it (or the lists it returns) past their own update.
 */
public class NearbyTargets {

    private final List<Worker> workers = new ArrayList<>();
    private final List<Protector> protectors = new ArrayList<>();

    public static NearbyTargets of(List<? extends Worker> workers, List<? extends Protector> protectors) {
        NearbyTargets result = new NearbyTargets();
        result.workers.addAll(workers);
        result.protectors.addAll(protectors);
        return result;
    }

    public static NearbyTargets empty() {
        return new NearbyTargets();
    }

    public void clear() {
        workers.clear();
        protectors.clear();
    }

    public void addWorker(Worker worker) {
        workers.add(worker);
    }

    public void addProtector(Protector protector) {
        protectors.add(protector);
    }

    public List<Worker> getWorkers() {
        return Collections.unmodifiableList(workers);
    }

    public List<Protector> getProtectors() {
        return Collections.unmodifiableList(protectors);
    }

    public List<? extends TargetUnit> getTargetsOfClass(TargetClass targetClass) {
        switch (targetClass) {
            case WORKER:
                return getWorkers();
            case PROTECTOR:
                return getProtectors();
            default:
                throw new IllegalStateException("Unsupported target class: " + targetClass);
        }
    }

    public Optional<Worker> findWorker(String id) {
        return workers.stream().filter(worker -> worker.getId().equals(id)).findFirst();
    }

    public Optional<Protector> findProtector(String id) {
        return protectors.stream().filter(protector -> protector.getId().equals(id)).findFirst();
    }

    /**
     * Resolves a lock to the unit it refers to. Empty if the unit is not in range this tick.
     */
    public Optional<? extends TargetUnit> resolve(TargetLock lock) {
        switch (lock.targetClass()) {
            case WORKER:
                return findWorker(lock.targetId());
            case PROTECTOR:
                return findProtector(lock.targetId());
            default:
                throw new IllegalStateException("Unsupported target class: " + lock.targetClass());
        }
    }

    public int size() {
        return workers.size() + protectors.size();
    }
}
