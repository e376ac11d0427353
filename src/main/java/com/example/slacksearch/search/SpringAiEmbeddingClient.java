package com.example.slacksearch.search;

import org.springframework.ai.embedding.EmbeddingModel;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;

/**
 * Embeds queries with whichever Spring AI {@link EmbeddingModel} the deployment brings
 * (for example the Vertex AI text-embedding starter).
 */
@Component
public class SpringAiEmbeddingClient implements EmbeddingClient {

    private final ObjectProvider<EmbeddingModel> embeddingModel;

    public SpringAiEmbeddingClient(ObjectProvider<EmbeddingModel> embeddingModel) {
        this.embeddingModel = embeddingModel;
    }

    @Override
    public float[] embed(String text) {
        EmbeddingModel model = embeddingModel.getIfAvailable();
        if (model == null) {
            throw new IllegalStateException("No EmbeddingModel configured");
        }
        return model.embed(text);
    }
}
