package com.ryuqq.tripplan.core.spi;

import com.ryuqq.tripplan.core.model.Entity;
import com.ryuqq.tripplan.core.model.EntityKind;
import com.ryuqq.tripplan.core.model.Trip;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Mutable entity store SPI driven by commands.
 *
 * <p>This interface is the only boundary between the command engine and the trip data.
 * Commands read and mutate entities exclusively through it, and capture whatever they need
 * to invert their own effect; the engine never caches Receiver state.</p>
 *
 * <p><strong>Collections:</strong></p>
 * <ul>
 *   <li>Identified by {@link EntityKind} constants (TRIPS, FLIGHTS, HOTELS, ACTIVITIES, EXPENSES)</li>
 *   <li>Each entity is addressable by a numeric id unique within its collection</li>
 *   <li>Ids are allocated by {@link #nextId(EntityKind)} and never reused, even after deletion</li>
 * </ul>
 *
 * <p><strong>Integrity Rules:</strong></p>
 * <ul>
 *   <li>Trip share codes are unique across the TRIPS collection</li>
 *   <li>Itinerary items can only be inserted under an existing trip</li>
 *   <li>A trip owner is never listed among its collaborators</li>
 * </ul>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Atomicity: every method is a single atomic step (read-modify-write of one entity)</li>
 *   <li>Thread-safe: a Receiver may be shared by several invokers and request threads, so it
 *       must hold its own lock, independent of any invoker lock</li>
 *   <li>No partial effects: a method that returns empty/false has not modified anything</li>
 * </ul>
 *
 * @author Trip Planner Team
 * @since 1.0.0
 */
public interface Receiver {

    /**
     * Allocates the next id for the given collection.
     *
     * <p>Ids are strictly increasing per collection and are never handed out twice,
     * regardless of later deletions.</p>
     *
     * @param kind the collection
     * @return a fresh positive id
     * @throws IllegalArgumentException if kind is null
     */
    long nextId(EntityKind<?> kind);

    /**
     * Inserts an entity, assigning it a fresh id from {@link #nextId(EntityKind)}.
     *
     * <p>The id carried by {@code entity} is ignored.</p>
     *
     * @param kind the collection
     * @param entity the entity to store
     * @param <E> entity type
     * @return the stored entity with its assigned id, or empty if an integrity rule rejects it
     * @throws IllegalArgumentException if kind or entity is null
     */
    <E extends Entity<E>> Optional<E> insert(EntityKind<E> kind, E entity);

    /**
     * Inserts an entity under the id it already carries.
     *
     * <p>Used by commands that allocate their id before mutating and by redo, which re-inserts
     * the exact entity that undo removed. The id must have been allocated by
     * {@link #nextId(EntityKind)} earlier.</p>
     *
     * @param kind the collection
     * @param entity the entity to store, with a positive id
     * @param <E> entity type
     * @return the stored entity, or empty if the id is occupied, the trip share code is taken,
     *         or the parent trip of an itinerary item does not exist
     * @throws IllegalArgumentException if kind or entity is null, or the id is not positive
     */
    <E extends Entity<E>> Optional<E> insertWithId(EntityKind<E> kind, E entity);

    /**
     * Finds an entity by id.
     *
     * @param kind the collection
     * @param id the entity id
     * @param <E> entity type
     * @return the entity, or empty if absent
     */
    <E extends Entity<E>> Optional<E> findById(EntityKind<E> kind, long id);

    /**
     * Returns a snapshot of every entity in the collection, ordered by id.
     *
     * @param kind the collection
     * @param <E> entity type
     * @return an immutable list (may be empty)
     */
    <E extends Entity<E>> List<E> findAll(EntityKind<E> kind);

    /**
     * Atomically replaces an entity with the result of {@code mutator}.
     *
     * <p>The mutator runs under the Receiver lock and receives the current entity. It must not
     * change the id and must not call back into the Receiver. Returning the same instance is a
     * valid no-op.</p>
     *
     * @param kind the collection
     * @param id the entity id
     * @param mutator function producing the new entity from the current one
     * @param <E> entity type
     * @return the updated entity, or empty if absent
     * @throws IllegalArgumentException if the mutator returns null or changes the id
     */
    <E extends Entity<E>> Optional<E> update(EntityKind<E> kind, long id, UnaryOperator<E> mutator);

    /**
     * Deletes an entity by id.
     *
     * @param kind the collection
     * @param id the entity id
     * @return true if an entity was removed
     */
    boolean delete(EntityKind<?> kind, long id);

    /**
     * Finds a trip by its share code.
     *
     * @param shareCode the share code
     * @return the trip, or empty if no trip uses the code
     */
    Optional<Trip> findTripByShareCode(String shareCode);

    /**
     * Sets the budget of a trip.
     *
     * @param tripId the trip id
     * @param budget the new budget
     * @return the updated trip, or empty if the trip is absent
     * @throws IllegalArgumentException if budget is null
     */
    Optional<Trip> updateBudget(long tripId, BigDecimal budget);

    /**
     * Adds a collaborator to a trip.
     *
     * @param tripId the trip id
     * @param userId the user id
     * @return true if the user was newly added; false if the trip is absent,
     *         the user owns the trip, or the user is already a collaborator
     */
    boolean addCollaborator(long tripId, long userId);

    /**
     * Removes a collaborator from a trip.
     *
     * @param tripId the trip id
     * @param userId the user id
     * @return true if the user was present and has been removed
     */
    boolean removeCollaborator(long tripId, long userId);
}
