package com.branchat.backend.chat.provider;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.springframework.ai.document.Document;
import org.springframework.ai.embedding.Embedding;
import org.springframework.ai.embedding.EmbeddingModel;
import org.springframework.ai.embedding.EmbeddingRequest;
import org.springframework.ai.embedding.EmbeddingResponse;

/**
 * Exposes {@link GenerationProvider#embed(String)} as a Spring AI {@link EmbeddingModel} so vector
 * stores embed through the provider. Usage is recorded and failures surface as {@link
 * GenerationUnavailableException}.
 *
 * <p>Not registered as a bean; the raw model stays the only {@link EmbeddingModel} in the context.
 */
public class GenerationProviderEmbeddingModel implements EmbeddingModel {

  private final GenerationProvider generationProvider;
  private final int dimensions;

  public GenerationProviderEmbeddingModel(GenerationProvider generationProvider, int dimensions) {
    this.generationProvider =
        Objects.requireNonNull(generationProvider, "generationProvider must not be null");
    this.dimensions = dimensions;
  }

  @Override
  public EmbeddingResponse call(EmbeddingRequest request) {
    List<String> inputs = request.getInstructions();
    List<Embedding> embeddings = new ArrayList<>(inputs.size());
    for (int index = 0; index < inputs.size(); index++) {
      embeddings.add(new Embedding(generationProvider.embed(inputs.get(index)), index));
    }
    return new EmbeddingResponse(embeddings);
  }

  @Override
  public float[] embed(Document document) {
    return generationProvider.embed(document.getText());
  }

  @Override
  public int dimensions() {
    return dimensions;
  }
}
