/**
 * Command invoker package.
 *
 * <p>Executes commands against a Receiver, records successful ones in a bounded history,
 * and exposes linear undo/redo over that history.</p>
 *
 * <h2>Main Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.tripplan.application.invoker.CommandInvoker} - Invoker contract</li>
 *   <li>{@link com.ryuqq.tripplan.application.invoker.HistoryCommandInvoker} - Synchronized implementation over CommandHistory</li>
 *   <li>{@link com.ryuqq.tripplan.application.invoker.HistoryStatistics} - Derived history counts</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Trip Planner Team
 */
package com.ryuqq.tripplan.application.invoker;
