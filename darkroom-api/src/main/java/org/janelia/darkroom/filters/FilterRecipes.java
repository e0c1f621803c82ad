package org.janelia.darkroom.filters;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.google.common.collect.ImmutableList;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads and writes filter sequences as JSON recipes. Steps are normalized exactly like the
 * builder methods of a darkroom, so one bad step rejects the whole recipe.
 */
public class FilterRecipes {

    private static final Logger LOG = LoggerFactory.getLogger(FilterRecipes.class);

    private static final ObjectMapper MAPPER = JsonMapper.builder()
            .enable(MapperFeature.ACCEPT_CASE_INSENSITIVE_ENUMS)
            .enable(SerializationFeature.INDENT_OUTPUT)
            .build();

    private static final TypeReference<List<FilterStep>> RECIPE_TYPE = new TypeReference<List<FilterStep>>() {};

    public static List<Filter> read(InputStream recipeStream) {
        try {
            return toFilters(MAPPER.readValue(recipeStream, RECIPE_TYPE));
        } catch (IOException e) {
            throw new UncheckedIOException("Error reading filter recipe", e);
        }
    }

    public static List<Filter> read(String recipe) {
        try {
            return toFilters(MAPPER.readValue(recipe, RECIPE_TYPE));
        } catch (IOException e) {
            throw new UncheckedIOException("Error reading filter recipe", e);
        }
    }

    public static void write(List<Filter> filters, OutputStream recipeStream) {
        try {
            MAPPER.writeValue(recipeStream, toSteps(filters));
        } catch (IOException e) {
            throw new UncheckedIOException("Error writing filter recipe", e);
        }
    }

    public static String write(List<Filter> filters) {
        try {
            return MAPPER.writeValueAsString(toSteps(filters));
        } catch (IOException e) {
            throw new UncheckedIOException("Error writing filter recipe", e);
        }
    }

    public static List<Filter> toFilters(List<FilterStep> steps) {
        if (steps == null) {
            return ImmutableList.of();
        }
        return steps.stream().map(FilterRecipes::toFilter).collect(ImmutableList.toImmutableList());
    }

    public static List<FilterStep> toSteps(List<Filter> filters) {
        return filters.stream().map(FilterRecipes::toStep).collect(Collectors.toList());
    }

    public static Filter toFilter(FilterStep step) {
        if (step == null) {
            throw new InvalidFilterValueException(FilterType.UNKNOWN, "empty recipe step");
        }
        FilterType filterType = FilterType.fromName(step.getFilter());
        switch (filterType) {
            case BLACK_AND_WHITE:
                if (step.getMode() != null) {
                    return Filter.blackAndWhite(step.getMode());
                } else if (step.getValue() != null) {
                    return Filter.blackAndWhite(parseMode(step.getValue()));
                } else {
                    return Filter.blackAndWhite();
                }
            case INVERT:
                return Filter.invert();
            case CONTRAST:
                return Filter.contrast(numericValue(filterType, step));
            case BRIGHTNESS:
                return Filter.brightness(numericValue(filterType, step));
            case SATURATION:
                return Filter.saturation(numericValue(filterType, step));
            case VIBRANCE:
                return Filter.vibrance(numericValue(filterType, step));
            case GAMMA:
                return Filter.gamma(numericValue(filterType, step));
            case NOISE:
                return Filter.noise(
                        numericValue(filterType, step),
                        step.getSeed() != null ? step.getSeed() : FilterValues.DEFAULT_NOISE_SEED);
            case SEPIA:
                return step.getValue() == null ? Filter.sepia() : Filter.sepia(numericValue(filterType, step));
            case HUE:
                return Filter.hue(numericValue(filterType, step));
            case TINT:
                if (!(step.getValue() instanceof String)) {
                    throw new InvalidFilterValueException(filterType, "expected a #RRGGBB color but got " + step.getValue());
                }
                return Filter.tint(
                        FilterValues.parseTintColor((String) step.getValue()),
                        step.getStrength() != null ? step.getStrength() : FilterValues.DEFAULT_TINT_STRENGTH);
            case UNKNOWN:
            default:
                LOG.warn("Unknown filter '{}' in recipe - it will not change any pixel", step.getFilter());
                return Filter.unknown(step.getFilter());
        }
    }

    static FilterStep toStep(Filter filter) {
        FilterStep step = new FilterStep();
        switch (filter.getType()) {
            case BLACK_AND_WHITE:
                return step.setFilter(filter.getType().getRecipeName()).setMode((BlackAndWhiteMode) filter.value);
            case INVERT:
                return step.setFilter(filter.getType().getRecipeName());
            case NOISE:
                return step.setFilter(filter.getType().getRecipeName())
                        .setValue(filter.getRawValue())
                        .setSeed(((NoiseValue) filter.value).getSeed());
            case TINT:
                TintValue tintValue = (TintValue) filter.value;
                return step.setFilter(filter.getType().getRecipeName())
                        .setValue(tintValue.getColor().toHex())
                        .setStrength(tintValue.getStrengthPercent());
            case UNKNOWN:
                return step.setFilter((String) filter.getRawValue());
            default:
                return step.setFilter(filter.getType().getRecipeName()).setValue(filter.getRawValue());
        }
    }

    private static BlackAndWhiteMode parseMode(Object value) {
        try {
            return BlackAndWhiteMode.valueOf(value.toString().trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new InvalidFilterValueException(FilterType.BLACK_AND_WHITE, "unknown mode " + value, e);
        }
    }

    private static double numericValue(FilterType filterType, FilterStep step) {
        Object value = step.getValue();
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        } else {
            throw new InvalidFilterValueException(filterType, "expected a number but got " + value);
        }
    }
}
