/**
 * <strong>Purpose:</strong> Use cases and stages of the block list pipeline.
 * <p><strong>Pipeline role:</strong> {@link ca.gc.cra.blocklist.application.pipeline.TldBootstrap} loads the
 * public-suffix data, {@link ca.gc.cra.blocklist.application.pipeline.CandidateStage} collects and filters every
 * source, {@link ca.gc.cra.blocklist.application.pipeline.VerificationStage} drops names the resolver reports as
 * nonexistent, and {@link ca.gc.cra.blocklist.application.pipeline.BlocklistUseCase} publishes the variants.</p>
 * <p><strong>Concurrency:</strong> Each stage completes before the next starts; see the stage classes for their
 * barriers.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.blocklist.application.pipeline;
