package org.janelia.darkroom.filters;

import org.apache.commons.lang3.builder.ToStringBuilder;
import org.janelia.darkroom.image.HexColor;

/**
 * Canonical tint parameter: target color and the blend strength, kept as the clamped
 * percentage so it can be written back unchanged.
 */
public final class TintValue {

    private final HexColor color;
    private final double strengthPercent;

    TintValue(HexColor color, double strengthPercent) {
        this.color = color;
        this.strengthPercent = strengthPercent;
    }

    public HexColor getColor() {
        return color;
    }

    /**
     * @return blend factor in [0, 1]
     */
    public double getStrength() {
        return strengthPercent / 100;
    }

    /**
     * @return blend strength in [0, 100]
     */
    public double getStrengthPercent() {
        return strengthPercent;
    }

    @Override
    public String toString() {
        return new ToStringBuilder(this)
                .append("color", color)
                .append("strength", strengthPercent)
                .toString();
    }
}
