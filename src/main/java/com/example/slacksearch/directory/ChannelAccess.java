package com.example.slacksearch.directory;

import lombok.Builder;
import lombok.Value;

/**
 * Live view of one channel from the perspective of one member.
 */
@Value
@Builder
public class ChannelAccess {
    String channelId;
    String name;
    boolean privateChannel;
    boolean member;
}
