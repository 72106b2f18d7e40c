/**
 * Concrete undoable commands.
 *
 * <p>Each command captures its inverse state while executing, so undo never needs a snapshot
 * of the whole store.</p>
 *
 * <h2>Commands</h2>
 * <ul>
 *   <li>{@link com.ryuqq.tripplan.core.command.CreateTripCommand} - Creates a trip, undo deletes it</li>
 *   <li>{@link com.ryuqq.tripplan.core.command.UpdateBudgetCommand} - Sets the trip budget, undo restores the previous one</li>
 *   <li>{@link com.ryuqq.tripplan.core.command.AddCollaboratorCommand} - Adds a collaborator, undo removes them</li>
 *   <li>{@link com.ryuqq.tripplan.core.command.AddFlightCommand},
 *       {@link com.ryuqq.tripplan.core.command.AddHotelCommand},
 *       {@link com.ryuqq.tripplan.core.command.AddActivityCommand},
 *       {@link com.ryuqq.tripplan.core.command.AddExpenseCommand} - Insert an itinerary item, undo deletes it</li>
 *   <li>{@link com.ryuqq.tripplan.core.command.UpdateItemStatusCommand} - Toggles the done flag of an item</li>
 * </ul>
 *
 * <h2>Redo</h2>
 * <p>Commands that allocate an id re-insert the captured entity under the same id.
 * The others re-run their forward mutation and capture a fresh inverse.</p>
 *
 * @since 1.0.0
 * @author Trip Planner Team
 */
package com.ryuqq.tripplan.core.command;
