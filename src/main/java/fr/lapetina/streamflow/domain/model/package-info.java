/**
 * Domain types shared by the flow engine and its middleware.
 *
 * <p>{@link fr.lapetina.streamflow.domain.model.ErrorType} is the single error taxonomy used by
 * {@link fr.lapetina.streamflow.flow.exception.FlowException}, logging and metrics.
 */
package fr.lapetina.streamflow.domain.model;
