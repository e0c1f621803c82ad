package org.janelia.darkroom.filters;

import java.util.Arrays;
import java.util.Locale;

import org.apache.commons.lang3.StringUtils;

/**
 * All filters a darkroom session knows how to queue.
 */
public enum FilterType {
    BLACK_AND_WHITE("blackAndWhite"),
    INVERT("invert"),
    CONTRAST("contrast"),
    BRIGHTNESS("brightness"),
    SATURATION("saturation"),
    VIBRANCE("vibrance"),
    GAMMA("gamma"),
    NOISE("noise"),
    SEPIA("sepia"),
    HUE("hue"),
    TINT("tint"),
    /**
     * A filter named in a recipe that this library does not implement. It is kept in the
     * filter sequence but leaves every pixel unchanged.
     */
    UNKNOWN("unknown");

    private final String recipeName;

    FilterType(String recipeName) {
        this.recipeName = recipeName;
    }

    public String getRecipeName() {
        return recipeName;
    }

    /**
     * Lookup a filter type ignoring case, underscores and dashes, so "blackAndWhite",
     * "BLACK_AND_WHITE" and "black-and-white" all resolve to {@link #BLACK_AND_WHITE}.
     *
     * @return the matching type or {@link #UNKNOWN}
     */
    public static FilterType fromName(String name) {
        String key = simplify(name);
        return Arrays.stream(values())
                .filter(ft -> ft != UNKNOWN)
                .filter(ft -> simplify(ft.recipeName).equals(key))
                .findFirst()
                .orElse(UNKNOWN);
    }

    private static String simplify(String name) {
        return StringUtils.trimToEmpty(name)
                .replace("_", "")
                .replace("-", "")
                .toLowerCase(Locale.ROOT);
    }
}
