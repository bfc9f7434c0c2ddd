package com.supalosa.hive.target;

import com.supalosa.hive.world.EntityTag;

/**
 * The closed set of unit classes a parasite can target.
 */
public enum TargetClass {
    /**
     * Harvesting units. Parasites drain their energy.
     */
    WORKER(EntityTag.WORKER),
    /**
     * Defending units. Parasites damage them.
     */
    PROTECTOR(EntityTag.PROTECTOR);

    private final EntityTag entityTag;

    TargetClass(EntityTag entityTag) {
        this.entityTag = entityTag;
    }

    public EntityTag getEntityTag() {
        return entityTag;
    }
}
