package org.janelia.darkroom.filters;

public enum BlackAndWhiteMode {
    /**
     * Rec.601 luma: 0.299 R + 0.587 G + 0.114 B.
     */
    REGULAR,
    /**
     * (R + G + B) / 3.
     */
    AVERAGE,
    /**
     * Rec.709 weights: 0.2126 R + 0.7152 G + 0.0722 B.
     */
    LUMINOSITY,
    /**
     * (max + min) / 2.
     */
    DESATURATE
}
