package com.supalosa.hive.control;

import org.immutables.value.Value;

@Value.Immutable
public interface TerritorialStats {

    int territoriesWithActiveQueens();

    int territoriesLiberated();

    int parasitesUnderQueenControl();

    int territorialConfigs();
}
