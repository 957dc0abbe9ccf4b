package com.datasheetrag.embed;

import java.time.Duration;
import java.util.Locale;
import java.util.function.Supplier;

import com.datasheetrag.runtime.AppConfig;

import okhttp3.OkHttpClient;

public final class TextEncoders {
    private TextEncoders() {
    }

    /**
     * Returns a factory for the configured encoder. Nothing is constructed until the
     * factory is invoked, so model loading stays on the first embedding call.
     */
    public static Supplier<TextEncoder> fromConfig(AppConfig.EmbeddingConfig config) {
        String provider = config.getProvider() == null ? "hashing" : config.getProvider().toLowerCase(Locale.ROOT);
        switch (provider) {
            case "hashing":
                return () -> new HashingTextEncoder(config.getDimension());
            case "http":
                return () -> {
                    Duration timeout = Duration.ofMillis(config.getTimeoutMs());
                    OkHttpClient httpClient = new OkHttpClient.Builder()
                            .callTimeout(timeout)
                            .readTimeout(timeout)
                            .build();
                    String apiKey = config.getApiKeyEnv() == null ? null : System.getenv(config.getApiKeyEnv());
                    return new HttpTextEncoder(httpClient, config.getEndpoint(), config.getModel(), apiKey,
                            config.getDimension());
                };
            default:
                throw new IllegalArgumentException("Unknown embedding provider: " + config.getProvider());
        }
    }
}
