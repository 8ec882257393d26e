/**
 * Typestate app entity package.
 *
 * <p>The app is a sealed sum of five variants. Each variant exposes only the
 * operations that are legal in its state, so an illegal call sequence does not
 * compile. Transitions never mutate: they return a new variant that carries the
 * next snapshot and the single event produced.</p>
 *
 * <h2>Variants</h2>
 * <pre>
 * NewApp           selectInfrastructure(choice) → NotActivatedApp
 *                  delete()                     → DeletedApp
 * NotActivatedApp  activate()                   → ActiveApp
 *                  requestBuild(choice)         → NotActivatedApp
 *                  delete()                     → DeletedApp
 * ActiveApp        delete()                     → DeletedApp
 * DeletedApp       (none)
 * CorruptedApp     (none)
 * </pre>
 *
 * <h2>Usage Example</h2>
 * <pre>
 * DeletedApp deleted = App.create(AppId.of("u1"))
 *     .selectInfrastructure(InfrastructureChoice.aws(AwsRegion.of("us-east-1")))
 *     .activate()
 *     .delete();
 *
 * // Reconstruct from storage; narrow once, then call
 * App app = AppReconstructor.fromPersisted(snapshot);
 * if (app instanceof ActiveApp active) {
 *     DeletedApp result = active.delete();
 * }
 * </pre>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>Typestate:</strong> Operation availability is decided by the static variant</li>
 *   <li><strong>Single narrowing point:</strong> {@link com.ryuqq.provisioning.core.typestate.AppReconstructor}</li>
 *   <li><strong>Fail-Fast:</strong> A reducer result that does not fit the target variant throws IllegalStateException</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Provisioning Team
 */
package com.ryuqq.provisioning.core.typestate;
