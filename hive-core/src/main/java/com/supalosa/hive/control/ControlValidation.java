package com.supalosa.hive.control;

import org.immutables.value.Value;

import java.util.List;

/**
 * The findings of a control consistency check. A parasite appears in at most one of the lists.
 */
@Value.Immutable
public interface ControlValidation {

    /**
     * Parasites registered under a queen but not inside the territory of any active queen, or inside such a
     * territory but registered under nobody.
     */
    List<String> orphanedParasites();

    List<WrongControl> wrongControl();

    /**
     * Parasites registered under more than one active queen.
     */
    List<String> duplicateControl();

    default boolean isConsistent() {
        return orphanedParasites().isEmpty() && wrongControl().isEmpty() && duplicateControl().isEmpty();
    }

    default int issueCount() {
        return orphanedParasites().size() + wrongControl().size() + duplicateControl().size();
    }
}
