package com.supalosa.hive.statistics;

import com.supalosa.hive.agent.ParasiteType;
import org.immutables.value.Value;

import java.util.Optional;

@Value.Immutable
public interface SpawnRecord {

    String parasiteId();

    ParasiteType type();

    double spawnTime();

    Optional<String> territoryId();
}
