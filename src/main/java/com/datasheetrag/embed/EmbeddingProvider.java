package com.datasheetrag.embed;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.FutureTask;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.datasheetrag.error.AllInputsEmptyException;
import com.datasheetrag.error.DatasheetRagException;
import com.datasheetrag.error.EmptyInputException;
import com.datasheetrag.error.EncoderUnavailableException;

/**
 * Owns a lazily created {@link TextEncoder} and exposes single and batch embedding.
 *
 * <p>The encoder is built on first use. Concurrent first callers share one
 * {@link FutureTask}: exactly one thread runs the factory, the others block on the
 * same task and observe the same encoder. A failed initialization is cleared so the
 * next call tries again.</p>
 *
 * <p>{@link #embedMany(List)} returns one entry per input position. Blank inputs are
 * not sent to the encoder and come back as {@link Optional#empty()}.</p>
 */
public class EmbeddingProvider implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(EmbeddingProvider.class);
    public static final int DEFAULT_BATCH_SIZE = 32;

    private final Supplier<TextEncoder> encoderFactory;
    private final int batchSize;
    private final AtomicReference<FutureTask<TextEncoder>> initialization = new AtomicReference<>();
    private final Set<TextEncoder> released = ConcurrentHashMap.newKeySet();
    private volatile boolean closed;

    public EmbeddingProvider(Supplier<TextEncoder> encoderFactory) {
        this(encoderFactory, DEFAULT_BATCH_SIZE);
    }

    public EmbeddingProvider(Supplier<TextEncoder> encoderFactory, int batchSize) {
        if (encoderFactory == null) {
            throw new IllegalArgumentException("encoderFactory must not be null");
        }
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be > 0");
        }
        this.encoderFactory = encoderFactory;
        this.batchSize = batchSize;
    }

    public float[] embedOne(String text) {
        if (text == null || text.isBlank()) {
            throw new EmptyInputException("Text cannot be empty");
        }
        List<float[]> vectors = encode(encoder(), List.of(text));
        return vectors.get(0);
    }

    public List<Optional<float[]>> embedMany(List<String> texts) {
        if (texts == null || texts.isEmpty()) {
            return List.of();
        }
        List<Integer> positions = new ArrayList<>();
        List<String> valid = new ArrayList<>();
        for (int i = 0; i < texts.size(); i++) {
            String text = texts.get(i);
            if (text != null && !text.isBlank()) {
                positions.add(i);
                valid.add(text);
            }
        }
        if (valid.isEmpty()) {
            throw new AllInputsEmptyException(texts.size());
        }

        TextEncoder encoder = encoder();
        List<Optional<float[]>> aligned = new ArrayList<>(Collections.nCopies(texts.size(), Optional.empty()));
        for (int from = 0; from < valid.size(); from += batchSize) {
            int to = Math.min(valid.size(), from + batchSize);
            List<float[]> vectors = encode(encoder, valid.subList(from, to));
            for (int i = 0; i < vectors.size(); i++) {
                aligned.set(positions.get(from + i), Optional.of(vectors.get(i)));
            }
        }
        if (valid.size() < texts.size()) {
            log.debug("Skipped {} blank texts out of {}", texts.size() - valid.size(), texts.size());
        }
        return aligned;
    }

    public int dimension() {
        return encoder().dimension();
    }

    public String version() {
        return encoder().version();
    }

    public boolean isInitialized() {
        FutureTask<TextEncoder> task = initialization.get();
        return task != null && task.isDone() && !closed;
    }

    @Override
    public void close() {
        closed = true;
        FutureTask<TextEncoder> task = initialization.getAndSet(null);
        if (task != null && task.isDone()) {
            release(task);
        }
    }

    private void release(FutureTask<TextEncoder> task) {
        TextEncoder encoder;
        try {
            encoder = task.get();
        } catch (ExecutionException e) {
            log.debug("Encoder never initialized, nothing to close", e);
            return;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return;
        }
        // close may race with a late initialization; each encoder is closed once
        if (!released.add(encoder)) {
            return;
        }
        try {
            encoder.close();
        } catch (Exception e) {
            log.warn("Failed to close text encoder", e);
        }
    }

    private List<float[]> encode(TextEncoder encoder, List<String> batch) {
        List<float[]> vectors;
        try {
            vectors = encoder.encode(batch);
        } catch (DatasheetRagException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new EncoderUnavailableException("Text encoder " + encoder.version() + " failed", e);
        }
        if (vectors == null || vectors.size() != batch.size()) {
            throw new EncoderUnavailableException("Text encoder " + encoder.version() + " returned "
                    + (vectors == null ? 0 : vectors.size()) + " vectors for " + batch.size() + " texts");
        }
        return vectors;
    }

    private TextEncoder encoder() {
        if (closed) {
            throw new IllegalStateException("EmbeddingProvider is closed");
        }
        while (true) {
            FutureTask<TextEncoder> task = initialization.get();
            if (task == null) {
                FutureTask<TextEncoder> created = new FutureTask<>(this::loadEncoder);
                if (!initialization.compareAndSet(null, created)) {
                    continue;
                }
                created.run();
                task = created;
            }
            TextEncoder encoder;
            try {
                encoder = task.get();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new EncoderUnavailableException("Interrupted while waiting for the text encoder", e);
            } catch (ExecutionException e) {
                initialization.compareAndSet(task, null);
                Throwable cause = e.getCause();
                if (cause instanceof EncoderUnavailableException) {
                    throw (EncoderUnavailableException) cause;
                }
                throw new EncoderUnavailableException("Failed to initialize text encoder", cause);
            }
            if (closed) {
                release(task);
                throw new IllegalStateException("EmbeddingProvider is closed");
            }
            return encoder;
        }
    }

    private TextEncoder loadEncoder() {
        long start = System.nanoTime();
        log.info("Loading text encoder");
        TextEncoder encoder = encoderFactory.get();
        if (encoder == null) {
            throw new EncoderUnavailableException("Encoder factory returned null");
        }
        log.info("Text encoder {} loaded in {} ms (dimension={})",
                encoder.version(),
                (System.nanoTime() - start) / 1_000_000,
                encoder.dimension());
        return encoder;
    }
}
