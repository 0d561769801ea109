package com.marketintel.router.processing;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * The single place raw record fields are read.
 *
 * Exported datasets spell the same thing several ways (ID, OBJECTID, area_id,
 * ZIP...). Each lookup walks an ordered candidate list and takes the first
 * usable value.
 */
public final class RecordFieldExtractor {

    public static final List<String> ID_FIELDS = List.of(
            "area_id", "ID", "id", "GEOID", "ZIP", "ZIPCODE", "zip_code", "OBJECTID");

    public static final List<String> NAME_FIELDS = List.of(
            "DESCRIPTION", "value_DESCRIPTION", "area_name", "name", "NAME");

    private static final List<String[]> COORDINATE_PAIRS = List.of(
            new String[]{"longitude", "latitude"},
            new String[]{"lng", "lat"},
            new String[]{"LONGITUDE", "LATITUDE"});

    private static final String SHAP_PREFIX = "shap_";

    private RecordFieldExtractor() {}

    // ── Identity ────────────────────────────────────────────────────────────

    /**
     * First non-blank id candidate. Numeric ids lose a trailing ".0": 10001.0 → "10001".
     */
    public static Optional<String> areaId(Map<String, Object> raw) {
        return firstText(raw, ID_FIELDS);
    }

    /** Id of the record at {@code index}, falling back to a positional "area_N". */
    public static String areaId(Map<String, Object> raw, int index) {
        return areaId(raw).orElse("area_" + (index + 1));
    }

    public static String areaName(Map<String, Object> raw, String fallbackId) {
        return firstText(raw, NAME_FIELDS).orElse(fallbackId);
    }

    // ── Location ────────────────────────────────────────────────────────────

    /**
     * [longitude, latitude], from a "coordinates" pair or a named lon/lat pair. Null when absent.
     */
    public static double[] coordinates(Map<String, Object> raw) {
        Object pair = raw.get("coordinates");
        if (pair instanceof List<?> list && list.size() >= 2) {
            OptionalDouble lon = number(list.get(0));
            OptionalDouble lat = number(list.get(1));
            if (lon.isPresent() && lat.isPresent()) {
                return new double[]{lon.getAsDouble(), lat.getAsDouble()};
            }
        }
        for (String[] names : COORDINATE_PAIRS) {
            OptionalDouble lon = number(raw.get(names[0]));
            OptionalDouble lat = number(raw.get(names[1]));
            if (lon.isPresent() && lat.isPresent()) {
                return new double[]{lon.getAsDouble(), lat.getAsDouble()};
            }
        }
        return null;
    }

    // ── Numbers ─────────────────────────────────────────────────────────────

    /**
     * Finite numeric value of a raw field. Numeric strings are accepted ("42", "12.5%", "1,200").
     */
    public static OptionalDouble number(Object value) {
        double parsed;
        if (value instanceof Number n) {
            parsed = n.doubleValue();
        } else if (value instanceof String s && !s.isBlank()) {
            try {
                parsed = Double.parseDouble(s.trim().replace(",", "").replace("%", ""));
            } catch (NumberFormatException e) {
                return OptionalDouble.empty();
            }
        } else {
            return OptionalDouble.empty();
        }
        return Double.isFinite(parsed) ? OptionalDouble.of(parsed) : OptionalDouble.empty();
    }

    /** First candidate field holding a finite number. */
    public static OptionalDouble firstNumber(Map<String, Object> raw, List<String> candidates) {
        for (String field : candidates) {
            OptionalDouble value = number(raw.get(field));
            if (value.isPresent()) return value;
        }
        return OptionalDouble.empty();
    }

    /** Like {@link #firstNumber} but 0 when no candidate holds a usable number. */
    public static double numeric(Map<String, Object> raw, List<String> candidates) {
        return firstNumber(raw, candidates).orElse(0);
    }

    /** Every shap_* field as feature → weight, prefix stripped. */
    public static Map<String, Double> shapValues(Map<String, Object> raw) {
        Map<String, Double> shap = new LinkedHashMap<>();
        raw.forEach((key, value) -> {
            if (key.startsWith(SHAP_PREFIX)) {
                number(value).ifPresent(v -> shap.put(key.substring(SHAP_PREFIX.length()), v));
            }
        });
        return shap;
    }

    /** First candidate holding non-blank text or a number. */
    public static Optional<String> firstText(Map<String, Object> raw, List<String> candidates) {
        for (String field : candidates) {
            String text = asText(raw.get(field));
            if (text != null) return Optional.of(text);
        }
        return Optional.empty();
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    private static String asText(Object value) {
        if (value == null) return null;
        if (value instanceof Number n) {
            double d = n.doubleValue();
            if (Double.isFinite(d) && d == Math.rint(d) && Math.abs(d) < 1e15) {
                return Long.toString((long) d);
            }
            return n.toString();
        }
        String text = value.toString().trim();
        return text.isEmpty() ? null : text;
    }
}
