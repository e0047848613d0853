package fr.lapetina.streamflow.flow.exception;

import fr.lapetina.streamflow.domain.model.ErrorType;

import java.io.IOException;
import java.io.UncheckedIOException;

/**
 * Exception raised by the flow engine and its middleware.
 *
 * Every instance carries an {@link ErrorType} so callers can tell, for example,
 * a cancelled run from an exhausted retry without inspecting messages.
 */
public class FlowException extends RuntimeException {

    private final ErrorType errorType;

    public FlowException(ErrorType errorType, String message) {
        super(message);
        this.errorType = errorType;
    }

    public FlowException(ErrorType errorType, String message, Throwable cause) {
        super(message, cause);
        this.errorType = errorType;
    }

    public ErrorType getErrorType() {
        return errorType;
    }

    public boolean isContextError() {
        return errorType.isContextError();
    }

    public static FlowException cancelled() {
        return new FlowException(ErrorType.CANCELLED, "context cancelled");
    }

    public static FlowException deadlineExceeded() {
        return new FlowException(ErrorType.DEADLINE_EXCEEDED, "context deadline exceeded");
    }

    public static FlowException invalidConfiguration(String message) {
        return new FlowException(ErrorType.INVALID_CONFIGURATION, message);
    }

    /**
     * Classifies an arbitrary failure. Existing FlowExceptions are returned as-is.
     */
    public static FlowException wrap(Throwable throwable) {
        if (throwable instanceof FlowException flowException) {
            return flowException;
        }
        if (throwable instanceof IOException || throwable instanceof UncheckedIOException) {
            return new FlowException(ErrorType.IO_ERROR, String.valueOf(throwable.getMessage()), throwable);
        }
        return new FlowException(ErrorType.HANDLER_ERROR, String.valueOf(throwable.getMessage()), throwable);
    }

    /**
     * Rethrows unchecked failures verbatim and wraps checked ones.
     * Used wherever a handler failure has to cross a method that cannot declare it.
     */
    public static RuntimeException propagate(Throwable throwable) {
        if (throwable instanceof RuntimeException runtimeException) {
            return runtimeException;
        }
        if (throwable instanceof Error error) {
            throw error;
        }
        return wrap(throwable);
    }

    @Override
    public String toString() {
        return "FlowException{" +
                "errorType=" + errorType +
                ", message='" + getMessage() + '\'' +
                '}';
    }
}
