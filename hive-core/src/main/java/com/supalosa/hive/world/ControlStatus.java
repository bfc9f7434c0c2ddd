package com.supalosa.hive.world;

public enum ControlStatus {
    CONTESTED,
    QUEEN_CONTROLLED,
    LIBERATED
}
