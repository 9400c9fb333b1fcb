package fr.lapetina.scheduler.exception;

/**
 * Failure reported by the downstream RAG pipeline. Surfaced to the caller as-is.
 */
public class PipelineException extends RuntimeException {

    private final int statusCode;

    public PipelineException(String message) {
        this(message, -1, null);
    }

    public PipelineException(String message, int statusCode) {
        this(message, statusCode, null);
    }

    public PipelineException(String message, int statusCode, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    /**
     * HTTP status returned by the pipeline, -1 when the call never got a response.
     */
    public int getStatusCode() {
        return statusCode;
    }
}
