package org.janelia.darkroom.wash;

import java.io.Serializable;
import java.util.LinkedHashMap;
import java.util.Map;

import javax.annotation.Nullable;

import org.apache.commons.lang3.StringUtils;

/**
 * Settings of the pixel processing engine.
 */
public class WashParams implements Serializable {

    public static final String WASH_CONCURRENCY = "washConcurrency";
    public static final String ROWS_PER_TASK = "rowsPerTask";

    private static final String SYSTEM_PROPERTY_PREFIX = "darkroom.";

    private final Map<String, Object> params = new LinkedHashMap<>();

    /**
     * Read the parameters from <code>darkroom.washConcurrency</code> and <code>darkroom.rowsPerTask</code>
     * system properties. Missing properties fall back to the defaults.
     */
    public static WashParams fromSystemProperties() {
        WashParams washParams = new WashParams();
        for (String name : new String[] {WASH_CONCURRENCY, ROWS_PER_TASK}) {
            String value = System.getProperty(SYSTEM_PROPERTY_PREFIX + name);
            if (StringUtils.isNotBlank(value)) {
                washParams.setParam(name, value.trim());
            }
        }
        return washParams;
    }

    public WashParams setParam(String name, @Nullable Object value) {
        if (value == null) {
            params.remove(name);
        } else {
            params.put(name, value);
        }
        return this;
    }

    @Nullable
    public Object getParam(String name) {
        return params.get(name);
    }

    public int getIntParam(String name, int defaultValue) {
        Object value = params.get(name);
        if (value == null) {
            return defaultValue;
        } else if (value instanceof Number) {
            return ((Number) value).intValue();
        } else {
            try {
                return Integer.parseInt(value.toString().trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid value for " + name + ": " + value, e);
            }
        }
    }

    /**
     * @return number of worker threads used for washing; at least 1
     */
    public int getWashConcurrency() {
        return Math.max(1, getIntParam(WASH_CONCURRENCY, Runtime.getRuntime().availableProcessors() - 1));
    }

    /**
     * @return rows processed by one task, or 0 to split the rows evenly across {@link #getWashConcurrency()} tasks
     */
    public int getRowsPerTask() {
        return Math.max(0, getIntParam(ROWS_PER_TASK, 0));
    }

    public Map<String, Object> asMap() {
        return new LinkedHashMap<>(params);
    }

    @Override
    public String toString() {
        return params.toString();
    }
}
