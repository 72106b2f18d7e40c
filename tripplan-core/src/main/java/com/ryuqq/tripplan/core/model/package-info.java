/**
 * Core domain model package containing the entities the command engine mutates.
 *
 * <p>This package defines immutable records stored in a
 * {@link com.ryuqq.tripplan.core.spi.Receiver}:</p>
 *
 * <h2>Entities</h2>
 * <ul>
 *   <li>{@link com.ryuqq.tripplan.core.model.Trip} - Trip with owner, collaborators, budget and share code</li>
 *   <li>{@link com.ryuqq.tripplan.core.model.Flight} - Flight itinerary item</li>
 *   <li>{@link com.ryuqq.tripplan.core.model.Hotel} - Hotel stay itinerary item</li>
 *   <li>{@link com.ryuqq.tripplan.core.model.Activity} - Activity itinerary item</li>
 *   <li>{@link com.ryuqq.tripplan.core.model.Expense} - Expense itinerary item</li>
 * </ul>
 *
 * <h2>Supporting Types</h2>
 * <ul>
 *   <li>{@link com.ryuqq.tripplan.core.model.EntityKind} - Typed collection identifier</li>
 *   <li>{@link com.ryuqq.tripplan.core.model.Payload} - Immutable command input parameters</li>
 * </ul>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>Immutability:</strong> Entities are records; changes produce new instances via withXxx methods</li>
 *   <li><strong>Type Safety:</strong> EntityKind binds a collection name to its entity type</li>
 *   <li><strong>Pure Java:</strong> No external dependencies</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Trip Planner Team
 */
package com.ryuqq.tripplan.core.model;
