/**
 * Micrometer metrics for instrumented stages and circuit breakers, exposed in Prometheus format.
 */
package fr.lapetina.streamflow.infrastructure.metrics;
