package com.example.slacksearch.directory;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class ThreadMessage {
    String ts;
    String threadTs;
    String userId;
    String text;
}
