package com.reviewtrack.progress.engine;

import com.reviewtrack.domain.GroupRef;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Publish-action token consumed by reporting: {@code publishaction;<key_1>;...;<key_n>;<trackId>} for publish-eligible
 * groups, empty string otherwise. The format is fixed; downstream consumers split on ';'.
 */
public final class PublishActionToken {

    public static final String PREFIX = "publishaction";
    private static final String SEPARATOR = ";";

    private PublishActionToken() {
    }

    public static String of(ResolvedStatus status, List<String> groupKey, long trackId) {
        if (status == null || !status.isPublishEligible()) {
            return "";
        }
        StringBuilder sb = new StringBuilder(PREFIX);
        for (String value : groupKey) {
            sb.append(SEPARATOR).append(value);
        }
        return sb.append(SEPARATOR).append(trackId).toString();
    }

    /**
     * Inverse of {@link #of}. Empty when the token is blank, lacks the prefix, or its last element is not a track id.
     */
    public static Optional<GroupRef> parse(String token) {
        if (token == null || token.isBlank()) {
            return Optional.empty();
        }
        String[] parts = token.split(SEPARATOR, -1);
        if (parts.length < 2 || !PREFIX.equals(parts[0])) {
            return Optional.empty();
        }
        long trackId;
        try {
            trackId = Long.parseLong(parts[parts.length - 1]);
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
        List<String> groupKey = Arrays.asList(parts).subList(1, parts.length - 1);
        return Optional.of(new GroupRef(trackId, groupKey));
    }
}
