package com.phillippitts.audiofetch.exception;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fluent builder for {@link FetchFailedException} with contextual metadata.
 *
 * <p><b>Usage:</b>
 * <pre>
 * throw FetchExceptionBuilder.create("Non-zero exit: 1")
 *         .tool("yt-dlp")
 *         .exitCode(1)
 *         .durationMs(1500)
 *         .metadata("stderr", stderrSnippet)
 *         .build();
 * </pre>
 */
public final class FetchExceptionBuilder {

    private final String message;
    private String tool;
    private Throwable cause;
    private Integer exitCode;
    private Long durationMs;
    private boolean timedOut;
    private final Map<String, String> metadata = new LinkedHashMap<>();

    private FetchExceptionBuilder(String message) {
        this.message = message;
    }

    /**
     * Creates a new builder with the base error message.
     *
     * @param message base error message (must not be null or empty)
     * @return new builder instance
     */
    public static FetchExceptionBuilder create(String message) {
        if (message == null || message.isEmpty()) {
            throw new IllegalArgumentException("message must not be null or empty");
        }
        return new FetchExceptionBuilder(message);
    }

    public FetchExceptionBuilder tool(String tool) {
        this.tool = tool;
        return this;
    }

    public FetchExceptionBuilder cause(Throwable cause) {
        this.cause = cause;
        return this;
    }

    public FetchExceptionBuilder exitCode(int exitCode) {
        this.exitCode = exitCode;
        return this;
    }

    public FetchExceptionBuilder durationMs(long durationMs) {
        this.durationMs = durationMs;
        return this;
    }

    /**
     * Marks the failure as a timeout rather than a nonzero exit.
     */
    public FetchExceptionBuilder timedOut() {
        this.timedOut = true;
        return this;
    }

    /**
     * Adds a metadata key-value pair to the exception message. Null keys or values are ignored.
     */
    public FetchExceptionBuilder metadata(String key, Object value) {
        if (key != null && value != null) {
            this.metadata.put(key, String.valueOf(value));
        }
        return this;
    }

    /**
     * Builds the exception. Message format:
     * <pre>
     * {message} (exitCode={code}, durationMs={ms}, {key1}={val1}, ...) (tool: {tool})
     * </pre>
     */
    public FetchFailedException build() {
        String detailedMessage = buildDetailedMessage();
        String toolName = tool != null ? tool : "unknown";
        int code = exitCode != null ? exitCode : -1;
        return new FetchFailedException(detailedMessage, toolName, code, timedOut, cause);
    }

    private String buildDetailedMessage() {
        boolean hasDetails = exitCode != null || durationMs != null || !metadata.isEmpty();
        if (!hasDetails) {
            return message;
        }

        StringBuilder sb = new StringBuilder(message).append(" (");
        boolean first = true;
        if (exitCode != null) {
            sb.append("exitCode=").append(exitCode);
            first = false;
        }
        if (durationMs != null) {
            if (!first) {
                sb.append(", ");
            }
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
