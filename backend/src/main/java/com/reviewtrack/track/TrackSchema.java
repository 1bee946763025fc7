package com.reviewtrack.track;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable payload schema of one track: ordered field list, the high-level key subset and the designated text field.
 */
public record TrackSchema(long trackId, String name, List<String> fields, List<String> highLevelKeyFields,
                          String textField) {

    public static final String DEFAULT_TEXT_FIELD = "text";

    public TrackSchema {
        fields = List.copyOf(fields);
        highLevelKeyFields = List.copyOf(highLevelKeyFields);
        Objects.requireNonNull(textField, "textField");
        if (!fields.isEmpty() && !fields.containsAll(highLevelKeyFields)) {
            throw new IllegalArgumentException("Track " + trackId + ": high-level key fields "
                    + highLevelKeyFields + " must be a subset of " + fields);
        }
    }

    /** Schema used for tracks with no configuration: text field "text", no declared fields, no key fields. */
    public static TrackSchema fallback(long trackId) {
        return new TrackSchema(trackId, "track-" + trackId, List.of(), List.of(), DEFAULT_TEXT_FIELD);
    }

    /**
     * Declared fields absent from the payload (null payload = every field missing). Empty list when valid.
     */
    public List<String> validate(Map<String, Object> payload) {
        if (payload == null) {
            return fields;
        }
        List<String> missing = new ArrayList<>();
        for (String field : fields) {
            if (!payload.containsKey(field)) {
                missing.add(field);
            }
        }
        return missing;
    }

    /**
     * Ordered key values taken from the payload. Missing values become empty strings so the item still maps to one group.
     */
    public List<String> groupKeyOf(Map<String, Object> payload) {
        List<String> key = new ArrayList<>(highLevelKeyFields.size());
        for (String field : highLevelKeyFields) {
            Object value = payload != null ? payload.get(field) : null;
            key.add(value != null ? value.toString() : "");
        }
        return List.copyOf(key);
    }

    /**
     * Designated text value, or null when absent or not a string.
     */
    public String textOf(Map<String, Object> payload) {
        if (payload == null) {
            return null;
        }
        Object value = payload.get(textField);
        return value instanceof String s ? s : null;
    }
}
