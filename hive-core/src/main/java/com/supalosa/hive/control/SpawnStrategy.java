package com.supalosa.hive.control;

public enum SpawnStrategy {
    DEFENSIVE,
    AGGRESSIVE,
    BALANCED
}
