package com.supalosa.hive.scheduler;

import org.apache.commons.lang3.Validate;
import org.immutables.value.Value;

@Value.Immutable
public abstract class SchedulerConfig {

    /**
     * Parasites further than this from the viewpoint are not simulated.
     */
    @Value.Default
    public double viewRadius() {
        return 192.0;
    }

    /**
     * Each parasite sees targets within its territory radius times this multiplier, around its territory centre.
     */
    @Value.Default
    public double searchRadiusMultiplier() {
        return 1.5;
    }

    @Value.Check
    protected void check() {
        Validate.isTrue(viewRadius() > 0, "viewRadius must be positive: %f", viewRadius());
        Validate.isTrue(searchRadiusMultiplier() > 0, "searchRadiusMultiplier must be positive: %f",
                searchRadiusMultiplier());
    }

    public static SchedulerConfig defaults() {
        return ImmutableSchedulerConfig.builder().build();
    }
}
