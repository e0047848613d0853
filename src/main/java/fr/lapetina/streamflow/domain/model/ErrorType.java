package fr.lapetina.streamflow.domain.model;

/**
 * Error taxonomy for flow execution.
 * Provides clear categorization for error handling and metrics.
 */
public enum ErrorType {
    /** Reading or writing a stream failed */
    IO_ERROR,

    /** The flow context was cancelled */
    CANCELLED,

    /** The flow context deadline passed */
    DEADLINE_EXCEEDED,

    /** A handler failed with a checked exception */
    HANDLER_ERROR,

    /** Every retry attempt failed */
    RETRY_EXHAUSTED,

    /** Circuit breaker is open for the target handler */
    CIRCUIT_OPEN,

    /** Every fallback handler was skipped or failed */
    ALL_HANDLERS_FAILED,

    /** Middleware was built with unusable parameters */
    INVALID_CONFIGURATION,

    /** A batched response could not be attributed to its caller */
    BATCH_SPLIT_FAILED,

    /** No converter exists for the given input or output type */
    UNSUPPORTED_TYPE,

    /** A wrapped handler exceeded its time budget */
    TIMEOUT,

    /** The component was closed */
    SHUTDOWN,

    /** Internal system error */
    INTERNAL_ERROR;

    /**
     * Returns true for errors that originate from the flow context rather than a handler.
     */
    public boolean isContextError() {
        return this == CANCELLED || this == DEADLINE_EXCEEDED;
    }
}
