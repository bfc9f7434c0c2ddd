package com.supalosa.hive.world;

import com.supalosa.hive.geometry.Point3d;
import org.apache.commons.lang3.Validate;

import java.util.Optional;

/**
 * A square region of the world with an ownership status. Territories are owned by the {@link TerritoryAuthority};
 * the parasite core only reads the control fields and keeps {@code parasiteCount} up to date.
 */
public class Territory {

    private final String id;
    private final Point3d centrePosition;
    private final double size;
    private ControlStatus controlStatus;
    private Optional<Queen> queen;
    private int parasiteCount;

    public Territory(String id, Point3d centrePosition, double size) {
        Validate.notBlank(id, "Territory id must not be blank");
        Validate.isTrue(size > 0, "Territory size must be positive: %f", size);
        this.id = id;
        this.centrePosition = centrePosition;
        this.size = size;
        this.controlStatus = ControlStatus.CONTESTED;
        this.queen = Optional.empty();
        this.parasiteCount = 0;
    }

    public String getId() {
        return id;
    }

    public Point3d getCentrePosition() {
        return centrePosition;
    }

    /**
     * The length of a side of the territory.
     */
    public double getSize() {
        return size;
    }

    public boolean contains(double x, double z) {
        double halfSize = size / 2.0;
        return x >= centrePosition.getX() - halfSize && x < centrePosition.getX() + halfSize &&
                z >= centrePosition.getZ() - halfSize && z < centrePosition.getZ() + halfSize;
    }

    public ControlStatus getControlStatus() {
        return controlStatus;
    }

    public void setControlStatus(ControlStatus controlStatus) {
        this.controlStatus = controlStatus;
    }

    public Optional<Queen> getQueen() {
        return queen;
    }

    /**
     * Assigns a queen. A territory with a queen is queen-controlled, a territory losing its queen is contested
     * unless it has been liberated.
     */
    public void setQueen(Optional<Queen> queen) {
        this.queen = queen;
        if (queen.isPresent()) {
            this.controlStatus = ControlStatus.QUEEN_CONTROLLED;
        } else if (controlStatus == ControlStatus.QUEEN_CONTROLLED) {
            this.controlStatus = ControlStatus.CONTESTED;
        }
    }

    public Optional<Queen> getActiveQueen() {
        return queen.filter(Queen::isActiveQueen);
    }

    public int getParasiteCount() {
        return parasiteCount;
    }

    public void setParasiteCount(int parasiteCount) {
        this.parasiteCount = Math.max(0, parasiteCount);
    }

    @Override
    public String toString() {
        return "Territory[" + id + " at " + centrePosition + ", " + controlStatus + "]";
    }
}
