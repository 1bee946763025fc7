package com.reviewtrack.track;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Resolves the schema of a track from {@link TrackProperties}. Unknown tracks get {@link TrackSchema#fallback(long)}.
 */
@Component
@Slf4j
public class TrackRegistry {

    private final Map<Long, TrackSchema> schemas;
    private final Map<Long, TrackSchema> fallbacks = new ConcurrentHashMap<>();

    public TrackRegistry(TrackProperties properties) {
        this.schemas = properties.getTracks().entrySet().stream()
                .collect(Collectors.toUnmodifiableMap(Map.Entry::getKey, e -> toSchema(e.getKey(), e.getValue())));
        log.info("Loaded {} track schema(s): {}", schemas.size(), schemas.keySet());
    }

    public TrackSchema schemaFor(long trackId) {
        TrackSchema schema = schemas.get(trackId);
        if (schema != null) {
            return schema;
        }
        return fallbacks.computeIfAbsent(trackId, id -> {
            log.warn("No schema configured for track {}; using fallback text field '{}'", id, TrackSchema.DEFAULT_TEXT_FIELD);
            return TrackSchema.fallback(id);
        });
    }

    public Collection<TrackSchema> configured() {
        return schemas.values();
    }

    private static TrackSchema toSchema(long trackId, TrackProperties.Track track) {
        String name = track.getName() != null ? track.getName() : "track-" + trackId;
        String textField = track.getTextField() != null && !track.getTextField().isBlank()
                ? track.getTextField()
                : TrackSchema.DEFAULT_TEXT_FIELD;
        return new TrackSchema(trackId, name, track.getFields(), track.getHighLevelKeyFields(), textField);
    }
}
