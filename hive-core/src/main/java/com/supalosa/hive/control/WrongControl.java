package com.supalosa.hive.control;

import org.immutables.value.Value;

/**
 * A parasite that is inside one queen's territory but registered under another queen.
 */
@Value.Immutable
public interface WrongControl {

    @Value.Parameter
    String parasiteId();

    @Value.Parameter
    String expectedQueenId();

    @Value.Parameter
    String actualQueenId();
}
