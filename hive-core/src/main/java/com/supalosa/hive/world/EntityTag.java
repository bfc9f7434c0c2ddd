package com.supalosa.hive.world;

/**
 * The class tag an entity is registered with in the {@link SpatialIndex}.
 */
public enum EntityTag {
    WORKER,
    PROTECTOR,
    ENERGY_PARASITE,
    COMBAT_PARASITE;

    public boolean isParasite() {
        return this == ENERGY_PARASITE || this == COMBAT_PARASITE;
    }
}
