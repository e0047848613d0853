/**
 * Stream Flow - streaming, middleware-composable handler pipelines.
 *
 * <p>Handlers read a request stream and write a response stream. A
 * {@link fr.lapetina.streamflow.flow.Flow} runs them concurrently, connected by pipes,
 * so data moves through the chain as it is produced and slow stages apply backpressure.
 *
 * <h2>Key Components</h2>
 * <ul>
 *   <li>{@link fr.lapetina.streamflow.flow.Flow} - the pipeline engine</li>
 *   <li>{@link fr.lapetina.streamflow.handlers.Handlers} - retry, fallback, rate limiting,
 *       batching, timeouts and control handlers</li>
 *   <li>{@link fr.lapetina.streamflow.infrastructure.cache.ResponseCache} - TTL response cache</li>
 *   <li>{@link fr.lapetina.streamflow.FlowFactory} - middleware configured from YAML</li>
 * </ul>
 *
 * <h2>Quick Start</h2>
 * <pre>{@code
 * Flow flow = new Flow()
 *         .use(Handlers.retry(upstream, 3))
 *         .use((req, res) -> res.write(req.readString().toUpperCase()));
 *
 * String out = flow.run(FlowContext.background(), "hello");
 * }</pre>
 *
 * @see fr.lapetina.streamflow.FlowFactory
 * @see fr.lapetina.streamflow.flow.Flow
 */
package fr.lapetina.streamflow;
