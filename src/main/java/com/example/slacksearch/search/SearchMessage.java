package com.example.slacksearch.search;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class SearchMessage {
    String text;
    @JsonProperty("team_id")
    String teamId;
    @JsonProperty("channel_id")
    String channelId;
    @JsonProperty("channel_name")
    String channelName;
    String ts;
    @JsonProperty("user_id")
    String userId;
    @JsonProperty("user_name")
    String userName;
    String url;
    @JsonProperty("thread_ts")
    String threadTs;
}
