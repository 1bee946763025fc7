package com.reviewtrack.track;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Per-track payload schema, keyed by track id (reviewtrack.tracks.&lt;id&gt;.*). Documented in application.yml.
 */
@ConfigurationProperties(prefix = "reviewtrack")
@NoArgsConstructor
@Getter
@Setter
public class TrackProperties {

    private Map<Long, Track> tracks = new HashMap<>();

    @NoArgsConstructor
    @Getter
    @Setter
    public static class Track {

        /** Display name for reporting. */
        private String name;

        /** Ordered payload field list every item of the track is validated against. */
        private List<String> fields = new ArrayList<>();

        /** Ordered subset of fields whose values form the group key. */
        private List<String> highLevelKeyFields = new ArrayList<>();

        /** Field whose whitespace tokens give the item's word count. Default "text". */
        private String textField = TrackSchema.DEFAULT_TEXT_FIELD;
    }
}
