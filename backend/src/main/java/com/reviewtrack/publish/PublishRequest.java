package com.reviewtrack.publish;

import java.util.List;
import java.util.Map;

/**
 * Body sent to the publish collaborator: the group identity, its action token and every member payload.
 */
public record PublishRequest(long trackId, List<String> groupKey, String publishActionToken, List<Item> items) {

    public record Item(String id, Map<String, Object> payload) {
    }
}
