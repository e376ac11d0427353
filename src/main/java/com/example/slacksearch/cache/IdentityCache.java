package com.example.slacksearch.cache;

import com.example.slacksearch.directory.DirectoryUser;
import com.example.slacksearch.directory.WorkspaceInfo;
import com.example.slacksearch.model.AccessDecision;

/**
 * The short-lived lookups shared by the gateway and the search pipeline.
 */
public class IdentityCache {

    public static final String WORKSPACE_KEY = "workspace";

    private final TtlCache<String, DirectoryUser> usersByEmail;
    private final TtlCache<String, AccessDecision> channelAccess;
    private final TtlCache<String, String> userNames;
    private final TtlCache<String, WorkspaceInfo> workspace;

    public IdentityCache(TtlCache<String, DirectoryUser> usersByEmail,
                         TtlCache<String, AccessDecision> channelAccess,
                         TtlCache<String, String> userNames,
                         TtlCache<String, WorkspaceInfo> workspace) {
        this.usersByEmail = usersByEmail;
        this.channelAccess = channelAccess;
        this.userNames = userNames;
        this.workspace = workspace;
    }

    public TtlCache<String, DirectoryUser> usersByEmail() { return usersByEmail; }
    public TtlCache<String, AccessDecision> channelAccess() { return channelAccess; }
    public TtlCache<String, String> userNames() { return userNames; }
    public TtlCache<String, WorkspaceInfo> workspace() { return workspace; }

    /** Access depends on who is asking, so decisions are keyed by channel and member. */
    public static String channelAccessKey(String channelId, String memberUserId) {
        return channelId + ":" + memberUserId;
    }
}
