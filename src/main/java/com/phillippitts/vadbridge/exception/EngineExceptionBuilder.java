package com.phillippitts.vadbridge.exception;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fluent builder for {@link EngineInitializationException} with contextual metadata.
 *
 * <p><b>Usage Examples:</b>
 * <pre>
 * throw EngineExceptionBuilder.create("Failed to initialize VAD engine")
 *         .engine("frame")
 *         .cause(exception)
 *         .metadata("modelPath", modelPath)
 *         .metadata("sampleRate", sampleRate)
 *         .build();
 * </pre>
 *
 * <p>The resulting message has the form
 * {@code {message} (durationMs={ms}, {key1}={val1}, ...) (engine: {engine})}.
 */
public final class EngineExceptionBuilder {

    private final String message;
    private String engineName;
    private Throwable cause;
    private Long durationMs;
    private final Map<String, String> metadata = new LinkedHashMap<>();

    private EngineExceptionBuilder(String message) {
        this.message = message;
    }

    /**
     * Creates a new builder with the base error message.
     *
     * @param message base error message (must not be null or empty)
     * @return new builder instance
     */
    public static EngineExceptionBuilder create(String message) {
        if (message == null || message.isEmpty()) {
            throw new IllegalArgumentException("message must not be null or empty");
        }
        return new EngineExceptionBuilder(message);
    }

    public EngineExceptionBuilder engine(String engineName) {
        this.engineName = engineName;
        return this;
    }

    public EngineExceptionBuilder cause(Throwable cause) {
        this.cause = cause;
        return this;
    }

    /**
     * Sets how long the failed initialization ran.
     *
     * @param durationMs duration in milliseconds
     * @return this builder for chaining
     */
    public EngineExceptionBuilder durationMs(long durationMs) {
        this.durationMs = durationMs;
        return this;
    }

    /**
     * Adds a metadata key-value pair to the exception message.
     * Null keys or values are skipped.
     *
     * @param key metadata key (e.g. modelPath, sampleRate)
     * @param value metadata value
     * @return this builder for chaining
     */
    public EngineExceptionBuilder metadata(String key, Object value) {
        if (key != null && value != null) {
            this.metadata.put(key, String.valueOf(value));
        }
        return this;
    }

    public EngineInitializationException build() {
        String detailedMessage = buildDetailedMessage();
        String engine = engineName != null ? engineName : "unknown";

        if (cause != null) {
            return new EngineInitializationException(detailedMessage, engine, cause);
        }
        return new EngineInitializationException(detailedMessage, engine);
    }

    private String buildDetailedMessage() {
        if (durationMs == null && metadata.isEmpty()) {
            return message;
        }

        StringBuilder sb = new StringBuilder(message).append(" (");
        boolean first = true;

        if (durationMs != null) {
            sb.append("durationMs=").append(durationMs);
            first = false;
        }

        for (Map.Entry<String, String> entry : metadata.entrySet()) {
            if (!first) {
                sb.append(", ");
            }
            sb.append(entry.getKey()).append("=").append(entry.getValue());
            first = false;
        }

        return sb.append(")").toString();
    }
}
