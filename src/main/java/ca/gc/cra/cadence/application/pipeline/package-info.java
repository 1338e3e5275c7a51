/**
 * The resolver pipeline: registry, pending queue, ledger, temporary query sweep, and the dispatcher that ties them
 * together.
 * <p>Everything except {@link ca.gc.cra.cadence.application.pipeline.ResolverPipeline} and
 * {@link ca.gc.cra.cadence.application.pipeline.PipelineSettings} is package-private and confined to the dispatcher
 * thread.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.cadence.application.pipeline;
