/**
 * YAML configuration for flows and middleware.
 *
 * <pre>
 * retry:
 *   maxAttempts: 3
 *   initialBackoffMs: 100
 * rateLimit:
 *   rate: 10
 *   perMs: 1000
 * </pre>
 */
package fr.lapetina.streamflow.infrastructure.config;
