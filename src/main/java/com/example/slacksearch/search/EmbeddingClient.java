package com.example.slacksearch.search;

public interface EmbeddingClient {
    float[] embed(String text);
}
