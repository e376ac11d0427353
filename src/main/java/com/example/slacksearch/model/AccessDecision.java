package com.example.slacksearch.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Whether a caller may see hits from one channel, plus its display name. Cached and advisory;
 * always re-derivable from the live directory.
 */
@Value
@Builder
@Jacksonized
public class AccessDecision {
    String channelId;
    boolean permitted;
    String channelName;

    public static AccessDecision denied(String channelId) {
        return AccessDecision.builder().channelId(channelId).permitted(false).build();
    }
}
