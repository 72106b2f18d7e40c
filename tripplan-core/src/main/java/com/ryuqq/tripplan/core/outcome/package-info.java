/**
 * Command execution outcome package.
 *
 * <p>This package defines the sealed interface hierarchy for command results.
 * Every failure in the engine is returned as a value; nothing here is thrown.</p>
 *
 * <h2>Sealed Interface</h2>
 * <ul>
 *   <li>{@link com.ryuqq.tripplan.core.outcome.Outcome} - Sealed interface (permits Ok, Fail)</li>
 * </ul>
 *
 * <h2>Outcome Cases</h2>
 * <ul>
 *   <li>{@link com.ryuqq.tripplan.core.outcome.Ok} - Mutation applied (carries the mutated entity)</li>
 *   <li>{@link com.ryuqq.tripplan.core.outcome.Fail} - Nothing applied (carries an {@link com.ryuqq.tripplan.core.outcome.ErrorCode})</li>
 * </ul>
 *
 * <h2>Usage Example</h2>
 * <pre>
 * Outcome outcome = invoker.execute(command);
 * if (outcome instanceof Fail fail) {
 *     return ResponseEntity.badRequest().body(fail.message());
 * }
 * </pre>
 *
 * @since 1.0.0
 * @author Trip Planner Team
 */
package com.ryuqq.tripplan.core.outcome;
