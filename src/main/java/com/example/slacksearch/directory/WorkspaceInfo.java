package com.example.slacksearch.directory;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class WorkspaceInfo {
    String teamId;
    String domain;
}
