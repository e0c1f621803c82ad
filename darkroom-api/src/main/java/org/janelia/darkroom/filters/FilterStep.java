package org.janelia.darkroom.filters;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import org.apache.commons.lang3.builder.ToStringBuilder;

/**
 * One step of a JSON filter recipe, e.g.
 * <code>{"filter": "tint", "value": "#FF0000", "strength": 30}</code>.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class FilterStep {

    @JsonProperty("filter")
    private String filter;
    @JsonProperty("value")
    private Object value;
    @JsonProperty("mode")
    private BlackAndWhiteMode mode;
    @JsonProperty("strength")
    private Double strength;
    @JsonProperty("seed")
    private Long seed;

    public String getFilter() {
        return filter;
    }

    public FilterStep setFilter(String filter) {
        this.filter = filter;
        return this;
    }

    public Object getValue() {
        return value;
    }

    public FilterStep setValue(Object value) {
        this.value = value;
        return this;
    }

    public BlackAndWhiteMode getMode() {
        return mode;
    }

    public FilterStep setMode(BlackAndWhiteMode mode) {
        this.mode = mode;
        return this;
    }

    public Double getStrength() {
        return strength;
    }

    public FilterStep setStrength(Double strength) {
        this.strength = strength;
        return this;
    }

    public Long getSeed() {
        return seed;
    }

    public FilterStep setSeed(Long seed) {
        this.seed = seed;
        return this;
    }

    @Override
    public String toString() {
        return new ToStringBuilder(this)
                .append("filter", filter)
                .append("value", value)
                .append("mode", mode)
                .append("strength", strength)
                .append("seed", seed)
                .toString();
    }
}
