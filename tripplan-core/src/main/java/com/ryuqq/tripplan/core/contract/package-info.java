/**
 * Command contract package.
 *
 * <p>This package defines the capability set every reversible mutation implements:</p>
 *
 * <h2>Types</h2>
 * <ul>
 *   <li>{@link com.ryuqq.tripplan.core.contract.Command} - execute / undo / describe contract</li>
 *   <li>{@link com.ryuqq.tripplan.core.contract.CommandKind} - Mutation kind tag</li>
 *   <li>{@link com.ryuqq.tripplan.core.contract.CommandDescription} - Read-only snapshot returned by history queries</li>
 * </ul>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>Flat variants:</strong> Each kind implements Command directly; shared bookkeeping is composed, not inherited</li>
 *   <li><strong>Values over exceptions:</strong> execute() returns an Outcome, undo() a boolean plus the recorded error</li>
 *   <li><strong>Self-contained inversion:</strong> A command captures exactly the state it needs to reverse itself</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Trip Planner Team
 */
package com.ryuqq.tripplan.core.contract;
