package com.supalosa.hive.world;

@FunctionalInterface
public interface TerrainHeightProvider {

    double heightAt(double x, double z);
}
