package com.supalosa.hive.world;

import com.google.common.collect.ImmutableSet;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashSet;
import java.util.Set;

/**
 * The controlling entity of a territory. A queen keeps the set of parasites it believes it controls; the
 * {@code TerritoryControlReconciler} is responsible for keeping that set consistent with where the parasites are.
 */
public class Queen {

    private static final Logger log = LoggerFactory.getLogger(Queen.class);

    public static final int DEFAULT_MAX_CONTROLLED_PARASITES = 100;

    private final String id;
    private final Set<String> controlledParasites = new HashSet<>();
    private final int maxControlledParasites;
    private boolean active;
    private boolean vulnerable;

    public Queen(String id) {
        this(id, DEFAULT_MAX_CONTROLLED_PARASITES);
    }

    public Queen(String id, int maxControlledParasites) {
        Validate.notBlank(id, "Queen id must not be blank");
        Validate.isTrue(maxControlledParasites > 0, "maxControlledParasites must be positive: %d",
                maxControlledParasites);
        this.id = id;
        this.maxControlledParasites = maxControlledParasites;
        this.active = true;
        this.vulnerable = false;
    }

    public String getId() {
        return id;
    }

    /**
     * Adds a parasite to the controlled set.
     *
     * @return True if the parasite is now controlled, false if the queen is at its control limit.
     */
    public boolean addControlledParasite(String parasiteId) {
        if (controlledParasites.contains(parasiteId)) {
            return true;
        }
        if (controlledParasites.size() >= maxControlledParasites) {
            log.warn("Queen {} at maximum parasite control limit ({}), rejected {}",
                    id, maxControlledParasites, parasiteId);
            return false;
        }
        controlledParasites.add(parasiteId);
        return true;
    }

    public boolean removeControlledParasite(String parasiteId) {
        return controlledParasites.remove(parasiteId);
    }

    public void clearControlledParasites() {
        controlledParasites.clear();
    }

    public boolean controls(String parasiteId) {
        return controlledParasites.contains(parasiteId);
    }

    /**
     * @return A snapshot of the controlled parasite ids.
     */
    public Set<String> getControlledParasites() {
        return ImmutableSet.copyOf(controlledParasites);
    }

    public int getControlledParasiteCount() {
        return controlledParasites.size();
    }

    public int getMaxControlledParasites() {
        return maxControlledParasites;
    }

    public boolean isActiveQueen() {
        return active;
    }

    public void setActive(boolean active) {
        this.active = active;
    }

    public boolean isVulnerable() {
        return vulnerable;
    }

    public void setVulnerable(boolean vulnerable) {
        this.vulnerable = vulnerable;
    }

    @Override
    public String toString() {
        return "Queen[" + id + ", controls " + controlledParasites.size() + "]";
    }
}
