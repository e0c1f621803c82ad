package org.janelia.darkroom.filters;

import org.janelia.darkroom.image.PixelColor;

/**
 * Pure per pixel color transform.
 */
@FunctionalInterface
public interface PixelTransform {
    /**
     * @param pixel      input color
     * @param value      the filter's canonical value
     * @param pixelIndex row major index of the pixel; only filters that need a per pixel
     *                   seed, like noise, look at it
     * @return transformed color
     */
    PixelColor apply(PixelColor pixel, Object value, long pixelIndex);
}
