/**
 * Response caching with a pluggable store.
 */
package fr.lapetina.streamflow.infrastructure.cache;
