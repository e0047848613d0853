/**
 * Streaming pipeline engine.
 *
 * A {@link fr.lapetina.streamflow.flow.Flow} connects {@link fr.lapetina.streamflow.flow.Handler}s
 * through synchronous {@link fr.lapetina.streamflow.flow.Pipe}s and runs them concurrently.
 * {@link fr.lapetina.streamflow.flow.FlowContext} carries cancellation, deadlines and the
 * request id used in logs.
 */
package fr.lapetina.streamflow.flow;
