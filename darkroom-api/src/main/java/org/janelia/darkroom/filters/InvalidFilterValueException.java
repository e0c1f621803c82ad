package org.janelia.darkroom.filters;

/**
 * A raw filter value that cannot be normalized, or a malformed color.
 */
public class InvalidFilterValueException extends IllegalArgumentException {

    private final FilterType filterType;

    public InvalidFilterValueException(FilterType filterType, String message) {
        super(filterType + ": " + message);
        this.filterType = filterType;
    }

    public InvalidFilterValueException(FilterType filterType, String message, Throwable cause) {
        super(filterType + ": " + message, cause);
        this.filterType = filterType;
    }

    public FilterType getFilterType() {
        return filterType;
    }
}
