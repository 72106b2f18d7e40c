/**
 * Command status state machine package.
 *
 * <p>This package implements the transition rules for the Command lifecycle,
 * ensuring that history entries can only move along undo/redo edges.</p>
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.tripplan.core.statemachine.CommandStatus} - Command lifecycle states (enum)</li>
 *   <li>{@link com.ryuqq.tripplan.core.statemachine.StatusTransition} - Transition validation and execution</li>
 * </ul>
 *
 * <h2>Transition Rules</h2>
 * <pre>
 * PENDING → EXECUTED (execute)
 * PENDING → FAILED (execute failed)
 * EXECUTED → UNDONE (undo)
 * UNDONE → EXECUTED (redo)
 * UNDONE → FAILED (redo failed)
 *
 * Forbidden:
 * - FAILED → * (terminal state)
 * - * → PENDING
 * </pre>
 *
 * <h2>Usage Example</h2>
 * <pre>
 * CommandStatus status = CommandStatus.PENDING;
 * status = StatusTransition.transition(status, CommandStatus.EXECUTED);
 * status = StatusTransition.transition(status, CommandStatus.UNDONE);
 *
 * // This will throw IllegalStateException
 * StatusTransition.validate(CommandStatus.FAILED, CommandStatus.EXECUTED);
 * </pre>
 *
 * @since 1.0.0
 * @author Trip Planner Team
 */
package com.ryuqq.tripplan.core.statemachine;
