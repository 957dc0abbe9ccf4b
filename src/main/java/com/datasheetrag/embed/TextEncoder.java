package com.datasheetrag.embed;

import java.util.List;

/**
 * Maps texts to fixed-width float vectors.
 *
 * <p>Implementations may reject blank entries; {@link EmbeddingProvider} filters
 * them out before calling {@link #encode(List)}.</p>
 */
public interface TextEncoder extends AutoCloseable {

    /**
     * Encodes each text into a vector of {@link #dimension()} floats, in input order.
     */
    List<float[]> encode(List<String> texts);

    int dimension();

    /**
     * Identifies the encoder and its model. Vectors produced by encoders with
     * different versions are not comparable.
     */
    String version();

    @Override
    default void close() {
    }
}
