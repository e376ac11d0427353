package com.example.slacksearch.search;

import java.util.List;

public interface VectorIndex {
    /**
     * @return up to {@code topK} hits ordered by ascending distance
     */
    List<SearchHit> nearest(float[] embedding, int topK);
}
