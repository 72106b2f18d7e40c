/**
 * Bounded linear command history.
 *
 * <ul>
 *   <li>{@link com.ryuqq.tripplan.core.history.CommandHistory} - Ring buffer of commands plus the undo/redo cursor</li>
 *   <li>{@link com.ryuqq.tripplan.core.history.HistoryConfig} - History capacity settings</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Trip Planner Team
 */
package com.ryuqq.tripplan.core.history;
