package com.example.slacksearch.directory;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * A workspace member as reported by the directory. On Enterprise Grid the team id may be
 * absent at the top level and only present in {@code enterpriseTeamIds}.
 */
@Value
@Builder
@Jacksonized
public class DirectoryUser {
    String id;
    String email;
    String teamId;
    String enterpriseId;
    @Builder.Default
    List<String> enterpriseTeamIds = List.of();
    String realName;
    String name;

    /**
     * Team id, falling back to the first enterprise team when the direct field is empty.
     */
    public String effectiveTeamId() {
        if (teamId != null && !teamId.isBlank()) {
            return teamId;
        }
        return enterpriseTeamIds == null || enterpriseTeamIds.isEmpty() ? null : enterpriseTeamIds.get(0);
    }

    public String displayName() {
        if (realName != null && !realName.isBlank()) {
            return realName;
        }
        if (name != null && !name.isBlank()) {
            return name;
        }
        return id;
    }
}
