package com.example.slacksearch.search;

import lombok.Builder;
import lombok.Value;

/**
 * One nearest-neighbour candidate: a message position in a channel. Lower distance is closer.
 */
@Value
@Builder
public class SearchHit {
    String channelId;
    String ts;
    double distance;
}
