package com.example.slacksearch.directory;

import java.util.List;
import java.util.Optional;

/**
 * Black-box view of the workspace messaging API: directory, channel ACLs and thread content.
 * Every method throws {@link DirectoryException} when the answer cannot be determined;
 * {@link Optional#empty()} means the API answered "no such entity".
 */
public interface WorkspaceDirectory {

    Optional<DirectoryUser> lookupUserByEmail(String email);

    Optional<DirectoryUser> lookupUserById(String userId);

    /**
     * Channel metadata plus whether {@code memberUserId} currently belongs to it.
     */
    Optional<ChannelAccess> channelAccess(String channelId, String memberUserId);

    List<ThreadMessage> threadReplies(String channelId, String threadTs);

    WorkspaceInfo workspaceInfo();
}
