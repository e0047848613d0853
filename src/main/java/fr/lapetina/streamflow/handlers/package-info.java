/**
 * Middleware and control handlers.
 *
 * Resilience: {@link fr.lapetina.streamflow.handlers.RetryHandler},
 * {@link fr.lapetina.streamflow.handlers.FallbackHandler},
 * {@link fr.lapetina.streamflow.handlers.RateLimitHandler},
 * {@link fr.lapetina.streamflow.handlers.TimeoutHandler}.
 * Throughput: {@link fr.lapetina.streamflow.handlers.BatchHandler},
 * {@link fr.lapetina.streamflow.handlers.ParallelHandler}.
 * Observability: {@link fr.lapetina.streamflow.handlers.MetricsHandler},
 * {@link fr.lapetina.streamflow.handlers.LogHandlers}.
 */
package fr.lapetina.streamflow.handlers;
