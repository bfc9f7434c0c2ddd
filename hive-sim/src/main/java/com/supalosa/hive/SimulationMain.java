package com.supalosa.hive;

import com.google.common.base.Splitter;
import com.supalosa.hive.sim.ImmutableSimulationConfig;
import com.supalosa.hive.sim.Simulation;
import com.supalosa.hive.sim.SimulationConfig;

import java.util.List;

/**
 * Runs a headless parasite simulation. Settings are passed as {@code key=value} arguments, for example
 * {@code ticks=2400 queens=3 seed=7}.
 */
public class SimulationMain {

    private static final Splitter ARGUMENT_SPLITTER = Splitter.on('=').limit(2).trimResults();

    public static void main(String[] args) {
        new Simulation(parseArgs(args)).run();
    }

    static SimulationConfig parseArgs(String[] args) {
        ImmutableSimulationConfig.Builder builder = ImmutableSimulationConfig.builder();
        for (String arg : args) {
            List<String> parts = ARGUMENT_SPLITTER.splitToList(arg);
            if (parts.size() != 2) {
                throw new IllegalArgumentException("Expected key=value but got: " + arg);
            }
            String value = parts.get(1);
            switch (parts.get(0)) {
                case "ticks":
                    builder.ticks(Integer.parseInt(value));
                    break;
                case "tickLength":
                    builder.tickLength(Double.parseDouble(value));
                    break;
                case "seed":
                    builder.seed(Long.parseLong(value));
                    break;
                case "queens":
                    builder.queens(Integer.parseInt(value));
                    break;
                case "workers":
                    builder.workersPerTerritory(Integer.parseInt(value));
                    break;
                case "protectors":
                    builder.protectorsPerTerritory(Integer.parseInt(value));
                    break;
                case "maxParasites":
                    builder.maxParasitesPerTerritory(Integer.parseInt(value));
                    break;
                case "spawnInterval":
                    builder.spawnInterval(Double.parseDouble(value));
                    break;
                case "territorySize":
                    builder.territorySize(Double.parseDouble(value));
                    break;
                case "fps":
                    builder.baseFps(Double.parseDouble(value));
                    break;
                case "fpsCost":
                    builder.fpsCostPerParasite(Double.parseDouble(value));
                    break;
                default:
                    throw new IllegalArgumentException("Unknown setting: " + parts.get(0));
            }
        }
        return builder.build();
    }
}
