package com.supalosa.hive.performance;

public enum OptimizationLevel {
    NONE(0, "None"),
    BASIC(1, "Basic"),
    AGGRESSIVE(2, "Aggressive");

    private final int level;
    private final String displayName;

    OptimizationLevel(int level, String displayName) {
        this.level = level;
        this.displayName = displayName;
    }

    public int getLevel() {
        return level;
    }

    public String getDisplayName() {
        return displayName;
    }
}
