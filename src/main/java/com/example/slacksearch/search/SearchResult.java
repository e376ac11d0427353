package com.example.slacksearch.search;

import lombok.Value;

import java.util.List;

/**
 * What the search tool hands back to the agent: messages, or an explicit empty or error
 * outcome with a human-readable message. Never an exception.
 */
@Value
public class SearchResult {

    public enum Status { OK, EMPTY, ERROR }

    Status status;
    String message;
    List<SearchMessage> messages;

    public static SearchResult ok(List<SearchMessage> messages) {
        return new SearchResult(Status.OK, "Found " + messages.size() + " messages.", List.copyOf(messages));
    }

    public static SearchResult empty(String message) {
        return new SearchResult(Status.EMPTY, message, List.of());
    }

    public static SearchResult error(String message) {
        return new SearchResult(Status.ERROR, message, List.of());
    }
}
