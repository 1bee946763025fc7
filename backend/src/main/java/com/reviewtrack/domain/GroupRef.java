package com.reviewtrack.domain;

import java.util.List;
import java.util.Objects;

/**
 * Identity of a derived group: (trackId, groupKey). Used as lease and publish-attempt key.
 */
public record GroupRef(long trackId, List<String> groupKey) {

    public GroupRef {
        Objects.requireNonNull(groupKey, "groupKey");
        groupKey = List.copyOf(groupKey);
    }

    /**
     * Stable string key: trackId followed by the key values, pipe separated. Backslash and pipe inside a value are
     * backslash-escaped, so distinct groups never share a key.
     */
    public String key() {
        StringBuilder sb = new StringBuilder().append(trackId);
        for (String value : groupKey) {
            sb.append('|');
            appendEscaped(sb, value);
        }
        return sb.toString();
    }

    private static void appendEscaped(StringBuilder sb, String value) {
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c == '|' || c == '\\') {
                sb.append('\\');
            }
            sb.append(c);
        }
    }
}
