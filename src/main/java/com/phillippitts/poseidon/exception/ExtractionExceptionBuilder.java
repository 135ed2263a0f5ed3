package com.phillippitts.poseidon.exception;

import com.phillippitts.poseidon.domain.FailureKind;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fluent builder for constructing {@link ExtractionException} with contextual information.
 *
 * <p><b>Usage Examples:</b>
 * <pre>
 * throw ExtractionExceptionBuilder.create("Model reply contained no JSON object")
 *         .backend("vision")
 *         .kind(FailureKind.MALFORMED_OUTPUT)
 *         .metadata("replyLength", reply.length())
 *         .build();
 *
 * throw ExtractionExceptionBuilder.create("Forecast API request failed")
 *         .backend("direct-api")
 *         .kind(FailureKind.BACKEND_UNAVAILABLE)
 *         .cause(exception)
 *         .httpStatus(503)
 *         .build();
 * </pre>
 */
public final class ExtractionExceptionBuilder {

    private final String message;
    private String backend;
    private FailureKind kind = FailureKind.BACKEND_UNAVAILABLE;
    private Throwable cause;
    private Integer httpStatus;
    private final Map<String, String> metadata = new LinkedHashMap<>();

    private ExtractionExceptionBuilder(String message) {
        this.message = message;
    }

    /**
     * Creates a new builder with the base error message.
     *
     * @param message base error message (must not be null or empty)
     * @return new builder instance
     */
    public static ExtractionExceptionBuilder create(String message) {
        if (message == null || message.isEmpty()) {
            throw new IllegalArgumentException("message must not be null or empty");
        }
        return new ExtractionExceptionBuilder(message);
    }

    public ExtractionExceptionBuilder backend(String backend) {
        this.backend = backend;
        return this;
    }

    /**
     * Sets the failure kind. Defaults to {@link FailureKind#BACKEND_UNAVAILABLE}.
     */
    public ExtractionExceptionBuilder kind(FailureKind kind) {
        if (kind != null) {
            this.kind = kind;
        }
        return this;
    }

    public ExtractionExceptionBuilder cause(Throwable cause) {
        this.cause = cause;
        return this;
    }

    /**
     * Sets the HTTP status returned by a remote backend.
     */
    public ExtractionExceptionBuilder httpStatus(int httpStatus) {
        this.httpStatus = httpStatus;
        return this;
    }

    /**
     * Adds a metadata key-value pair to the exception message. Null keys or values are skipped.
     */
    public ExtractionExceptionBuilder metadata(String key, Object value) {
        if (key != null && value != null) {
            this.metadata.put(key, String.valueOf(value));
        }
        return this;
    }

    /**
     * Builds the exception. Message format:
     * <pre>
     * {message} (kind={kind}, httpStatus={status}, {key1}={val1}, ...)
     * </pre>
     */
    public ExtractionException build() {
        String detailedMessage = buildDetailedMessage();
        String name = backend != null ? backend : "unknown";
        if (cause != null) {
            return new ExtractionException(detailedMessage, name, kind, cause);
        }
        return new ExtractionException(detailedMessage, name, kind);
    }

    private String buildDetailedMessage() {
        StringBuilder sb = new StringBuilder(message);
        sb.append(" (kind=").append(kind);
        if (httpStatus != null) {
            sb.append(", httpStatus=").append(httpStatus);
        }
        for (Map.Entry<String, String> entry : metadata.entrySet()) {
            sb.append(", ").append(entry.getKey()).append("=").append(entry.getValue());
        }
        sb.append(")");
        return sb.toString();
    }
}
