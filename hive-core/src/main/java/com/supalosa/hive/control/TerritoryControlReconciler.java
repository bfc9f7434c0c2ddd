package com.supalosa.hive.control;

import com.supalosa.hive.agent.ParasiteAgent;
import com.supalosa.hive.geometry.Point3d;
import com.supalosa.hive.world.ControlStatus;
import com.supalosa.hive.world.Queen;
import com.supalosa.hive.world.Territory;
import com.supalosa.hive.world.TerritoryAuthority;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Keeps queens' control sets in line with the territories their parasites are physically in.
 *
 * Parasites move every tick but control is only reconciled when asked, so the two are expected to drift apart in
 * between. {@link #validateConsistency} reports the drift and {@link #recalculate} rebuilds control from scratch.
 */
public class TerritoryControlReconciler {

    private static final Logger log = LoggerFactory.getLogger(TerritoryControlReconciler.class);

    public static final double ACTIVE_QUEEN_SPAWN_RATE_MULTIPLIER = 1.5;

    private final TerritoryAuthority territoryAuthority;
    private final Map<String, TerritorialSpawnConfig> territorialConfigs = new HashMap<>();

    public TerritoryControlReconciler(TerritoryAuthority territoryAuthority) {
        this.territoryAuthority = territoryAuthority;
    }

    public ControlValidation validateConsistency(Collection<ParasiteAgent> agents) {
        Map<String, String> controllingQueenByParasite = new HashMap<>();
        Set<String> duplicates = new LinkedHashSet<>();
        for (Queen queen : activeQueens()) {
            for (String parasiteId : queen.getControlledParasites()) {
                if (controllingQueenByParasite.putIfAbsent(parasiteId, queen.getId()) != null) {
                    duplicates.add(parasiteId);
                }
            }
        }

        List<String> orphaned = new ArrayList<>();
        List<WrongControl> wrongControl = new ArrayList<>();
        for (ParasiteAgent agent : agents) {
            if (!agent.isAlive() || duplicates.contains(agent.getId())) {
                continue;
            }
            Optional<String> actualQueenId = Optional.ofNullable(controllingQueenByParasite.get(agent.getId()));
            Optional<Queen> expectedQueen = activeQueenAt(agent.getPosition());
            if (expectedQueen.isEmpty()) {
                actualQueenId.ifPresent(queenId -> orphaned.add(agent.getId()));
            } else if (actualQueenId.isEmpty()) {
                orphaned.add(agent.getId());
            } else if (!actualQueenId.get().equals(expectedQueen.get().getId())) {
                wrongControl.add(ImmutableWrongControl.of(agent.getId(), expectedQueen.get().getId(),
                        actualQueenId.get()));
            }
        }
        return ImmutableControlValidation.builder()
                .orphanedParasites(orphaned)
                .wrongControl(wrongControl)
                .duplicateControl(duplicates)
                .build();
    }

    /**
     * Rebuilds every queen's control set and every territory's parasite count from where the live parasites are.
     */
    public void recalculate(Collection<ParasiteAgent> agents) {
        Collection<Territory> territories = territoryAuthority.getAllTerritories();
        for (Territory territory : territories) {
            territory.getQueen().ifPresent(Queen::clearControlledParasites);
            territory.setParasiteCount(0);
        }
        int attributed = 0;
        for (ParasiteAgent agent : agents) {
            if (!agent.isAlive()) {
                continue;
            }
            Point3d position = agent.getPosition();
            Optional<Territory> territory = territoryAuthority.getTerritoryAt(position.getX(), position.getZ());
            if (territory.isEmpty()) {
                continue;
            }
            territory.get().setParasiteCount(territory.get().getParasiteCount() + 1);
            Optional<Queen> queen = territory.get().getActiveQueen();
            if (queen.isPresent() && queen.get().addControlledParasite(agent.getId())) {
                ++attributed;
            }
        }
        log.info("Recalculated parasite control: {} of {} parasites under queen control", attributed, agents.size());
    }

    /**
     * Moves a parasite under a new queen, removing it from any queen that currently holds it.
     *
     * @return True if the new queen accepted the parasite.
     */
    public boolean transferControl(ParasiteAgent agent, Queen newQueen) {
        if (!agent.isAlive()) {
            return false;
        }
        releaseControl(agent.getId());
        return newQueen.addControlledParasite(agent.getId());
    }

    /**
     * Removes a parasite from every queen's control set.
     */
    public void releaseControl(String parasiteId) {
        allQueens().forEach(queen -> queen.removeControlledParasite(parasiteId));
    }

    public List<ParasiteAgent> getAgentsInTerritory(String territoryId, Collection<ParasiteAgent> agents) {
        if (territoryAuthority.getTerritory(territoryId).isEmpty()) {
            return List.of();
        }
        return agents.stream()
                .filter(ParasiteAgent::isAlive)
                .filter(agent -> territoryAuthority.isPositionInTerritory(agent.getPosition(), territoryId))
                .collect(Collectors.toList());
    }

    /**
     * Territories only spawn while their queen is active and exposed.
     */
    public boolean shouldSpawnInTerritory(Territory territory) {
        if (territory.getControlStatus() == ControlStatus.LIBERATED) {
            return false;
        }
        return territory.getActiveQueen().map(Queen::isVulnerable).orElse(false);
    }

    public void configureTerritorialSpawning(String territoryId, TerritorialSpawnConfig config) {
        territorialConfigs.put(territoryId, config);
    }

    public double spawnRateForTerritory(Territory territory) {
        TerritorialSpawnConfig config = territorialConfigs.get(territory.getId());
        if (config == null) {
            return 1.0;
        }
        if (territory.getActiveQueen().isPresent()) {
            return config.spawnRate() * ACTIVE_QUEEN_SPAWN_RATE_MULTIPLIER;
        }
        return config.spawnRate();
    }

    public TerritorialStats territorialStats() {
        int withActiveQueens = 0;
        int liberated = 0;
        int underControl = 0;
        for (Territory territory : territoryAuthority.getAllTerritories()) {
            Optional<Queen> queen = territory.getActiveQueen();
            if (queen.isPresent()) {
                ++withActiveQueens;
                underControl += queen.get().getControlledParasiteCount();
            }
            if (territory.getControlStatus() == ControlStatus.LIBERATED) {
                ++liberated;
            }
        }
        return ImmutableTerritorialStats.builder()
                .territoriesWithActiveQueens(withActiveQueens)
                .territoriesLiberated(liberated)
                .parasitesUnderQueenControl(underControl)
                .territorialConfigs(territorialConfigs.size())
                .build();
    }

    public void clearConfigurations() {
        territorialConfigs.clear();
    }

    private Optional<Queen> activeQueenAt(Point3d position) {
        return territoryAuthority.getTerritoryAt(position.getX(), position.getZ())
                .flatMap(Territory::getActiveQueen);
    }

    private Collection<Queen> activeQueens() {
        return allQueens().stream().filter(Queen::isActiveQueen).collect(Collectors.toList());
    }

    /**
     * Every distinct queen, even one that holds several territories.
     */
    private Collection<Queen> allQueens() {
        Map<String, Queen> queens = new LinkedHashMap<>();
        for (Territory territory : territoryAuthority.getAllTerritories()) {
            territory.getQueen().ifPresent(queen -> queens.putIfAbsent(queen.getId(), queen));
        }
        return queens.values();
    }
}
