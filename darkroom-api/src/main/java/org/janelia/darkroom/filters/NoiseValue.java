package org.janelia.darkroom.filters;

import org.apache.commons.lang3.builder.ToStringBuilder;

/**
 * Canonical noise parameter: the maximum channel offset and the seed that makes
 * the per pixel offsets reproducible.
 */
public final class NoiseValue {

    private final int strength;
    private final long seed;

    NoiseValue(int strength, long seed) {
        this.strength = strength;
        this.seed = seed;
    }

    public int getStrength() {
        return strength;
    }

    public long getSeed() {
        return seed;
    }

    @Override
    public String toString() {
        return new ToStringBuilder(this)
                .append("strength", strength)
                .append("seed", seed)
                .toString();
    }
}
