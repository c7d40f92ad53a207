package com.identity.matching.enrollment;

import com.identity.matching.core.exception.ExtractionFailedException;
import com.identity.matching.core.model.Embedding;

/**
 * External collaborator turning a raw sample (an image, an audio clip...) into an embedding.
 * Implementations produce vectors of a fixed dimension; the pipeline re-validates them.
 *
 * @param <R> raw sample type
 */
@FunctionalInterface
public interface EmbeddingExtractor<R> {

    /**
     * @throws ExtractionFailedException if no embedding can be derived from the sample
     */
    Embedding extract(R rawSample);
}
