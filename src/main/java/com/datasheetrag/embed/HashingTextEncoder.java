package com.datasheetrag.embed;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Local encoder that hashes word tokens and character trigrams into a fixed number
 * of buckets. Deterministic and dependency free; used offline and in tests.
 */
public class HashingTextEncoder implements TextEncoder {
    private static final String VERSION_PREFIX = "hashing-v1-";
    private final int dimension;

    public HashingTextEncoder(int dimension) {
        if (dimension <= 0) {
            throw new IllegalArgumentException("dimension must be > 0");
        }
        this.dimension = dimension;
    }

    @Override
    public List<float[]> encode(List<String> texts) {
        if (texts.isEmpty()) {
            throw new IllegalArgumentException("No texts to encode");
        }
        List<float[]> vectors = new ArrayList<>(texts.size());
        for (String text : texts) {
            vectors.add(encodeOne(text));
        }
        return vectors;
    }

    @Override
    public int dimension() {
        return dimension;
    }

    @Override
    public String version() {
        return VERSION_PREFIX + dimension;
    }

    private float[] encodeOne(String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("Text cannot be empty");
        }
        float[] vector = new float[dimension];
        String[] tokens = text.toLowerCase(Locale.ROOT).split("[^\\p{L}\\p{N}]+");
        for (String token : tokens) {
            if (token.isBlank()) {
                continue;
            }
            addHashed(vector, "tok:" + token, 1.0f);
            if (token.length() >= 3) {
                for (int i = 0; i <= token.length() - 3; i++) {
                    addHashed(vector, "tri:" + token.substring(i, i + 3), 0.35f);
                }
            }
            // extra weight for part numbers such as esp32 or lm317
            if (isPartNumberLike(token)) {
                addHashed(vector, "mpn:" + token, 1.6f);
            }
        }
        normalize(vector);
        return vector;
    }

    private void addHashed(float[] vector, String key, float weight) {
        int index = Math.floorMod(key.hashCode(), vector.length);
        vector[index] += weight;
    }

    private static boolean isPartNumberLike(String token) {
        boolean letter = false;
        boolean digit = false;
        for (int i = 0; i < token.length(); i++) {
            char c = token.charAt(i);
            if (Character.isDigit(c)) {
                digit = true;
            } else if (Character.isLetter(c)) {
                letter = true;
            }
        }
        return letter && digit && token.length() >= 3;
    }

    private static void normalize(float[] vector) {
        float norm = 0f;
        for (float value : vector) {
            norm += value * value;
        }
        norm = (float) Math.sqrt(norm);
        if (norm <= 0f) {
            return;
        }
        for (int i = 0; i < vector.length; i++) {
            vector[i] /= norm;
        }
    }
}
