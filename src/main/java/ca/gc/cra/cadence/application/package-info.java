/**
 * Application layer orchestration for CADENCE query resolution.
 * <p><strong>Role:</strong> Hosts the resolver pipeline, the default query implementation, and the ports that connect
 * them to resolvers and observers.</p>
 * <p><strong>Concurrency:</strong> The pipeline confines its mutable state to a single dispatcher thread; ports
 * document caller responsibilities.</p>
 * <p><strong>Metrics:</strong> Emits the {@code pipeline.*} namespace.</p>
 */
package ca.gc.cra.cadence.application;
