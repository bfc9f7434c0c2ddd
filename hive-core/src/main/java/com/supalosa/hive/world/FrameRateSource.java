package com.supalosa.hive.world;

@FunctionalInterface
public interface FrameRateSource {

    /**
     * The currently measured frames per second.
     */
    double currentFps();
}
