package com.ryuqq.tripplan.adapter.inmemory.store;

import com.ryuqq.tripplan.core.model.Entity;
import com.ryuqq.tripplan.core.model.EntityKind;
import com.ryuqq.tripplan.core.model.ItineraryItem;
import com.ryuqq.tripplan.core.model.Trip;
import com.ryuqq.tripplan.core.spi.Receiver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.TreeMap;
import java.util.function.UnaryOperator;

/**
 * In-memory implementation of {@link Receiver} SPI for testing and reference purposes.
 *
 * <p>Every public method is {@code synchronized} on this instance, so each call is a single
 * atomic step even when several invokers share one receiver.</p>
 *
 * <p><strong>Data Structures:</strong></p>
 * <ul>
 *   <li><strong>collections:</strong> EntityKind → TreeMap&lt;Long, Entity&gt; - entities ordered by id</li>
 *   <li><strong>sequences:</strong> EntityKind → last allocated id (never decremented)</li>
 * </ul>
 *
 * <p><strong>Integrity Rules:</strong></p>
 * <ul>
 *   <li>Share codes are unique across trips (on insert and on update)</li>
 *   <li>Itinerary items require an existing parent trip on insert</li>
 *   <li>The owner is never added as a collaborator</li>
 * </ul>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>Data lost on process restart</li>
 *   <li>Deleting a trip does not cascade to its itinerary items</li>
 * </ul>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * Receiver receiver = new InMemoryReceiver();
 * CommandFactory factory = new CommandFactory(receiver);
 * invoker.execute(factory.createTrip(1L, "Porto", "Weekend", start, end, null));
 * </pre>
 *
 * @author Trip Planner Team
 * @since 1.0.0
 */
public class InMemoryReceiver implements Receiver {

    private static final Logger log = LoggerFactory.getLogger(InMemoryReceiver.class);

    private final Map<EntityKind<?>, NavigableMap<Long, Entity<?>>> collections = new HashMap<>();
    private final Map<EntityKind<?>, Long> sequences = new HashMap<>();

    /**
     * Creates a new InMemoryReceiver with empty collections.
     */
    public InMemoryReceiver() {
        for (EntityKind<?> kind : EntityKind.values()) {
            collections.put(kind, new TreeMap<>());
            sequences.put(kind, 0L);
        }
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public synchronized long nextId(EntityKind<?> kind) {
        requireKind(kind);
        long next = sequences.get(kind) + 1;
        sequences.put(kind, next);
        return next;
    }

    /**
     * {@inheritDoc}
     *
     * <p><strong>Implementation Notes:</strong> the id is consumed even when an integrity rule
     * rejects the entity.</p>
     */
    @Override
    public synchronized <E extends Entity<E>> Optional<E> insert(EntityKind<E> kind, E entity) {
        requireKind(kind);
        if (entity == null) {
            throw new IllegalArgumentException("entity cannot be null");
        }
        return insertWithId(kind, entity.withId(nextId(kind)));
    }

    /**
     * {@inheritDoc}
     *
     * <p><strong>Implementation Notes:</strong></p>
     * <ul>
     *   <li>Raises the id sequence to at least the inserted id, so {@link #nextId} never collides</li>
     * </ul>
     */
    @Override
    public synchronized <E extends Entity<E>> Optional<E> insertWithId(EntityKind<E> kind, E entity) {
        requireKind(kind);
        if (entity == null) {
            throw new IllegalArgumentException("entity cannot be null");
        }
        if (entity.id() <= 0) {
            throw new IllegalArgumentException("id must be positive, but was: " + entity.id());
        }

        NavigableMap<Long, Entity<?>> collection = collections.get(kind);
        if (collection.containsKey(entity.id())) {
            log.debug("Rejected {} {}: id already in use", kind.singularName(), entity.id());
            return Optional.empty();
        }
        if (entity instanceof Trip trip && shareCodeTaken(trip.shareCode(), trip.id())) {
            log.debug("Rejected trip {}: share code {} already in use", trip.id(), trip.shareCode());
            return Optional.empty();
        }
        if (entity instanceof ItineraryItem<?> item && !collections.get(EntityKind.TRIPS).containsKey(item.tripId())) {
            log.debug("Rejected {} {}: trip {} not found", kind.singularName(), entity.id(), item.tripId());
            return Optional.empty();
        }

        collection.put(entity.id(), entity);
        sequences.put(kind, Math.max(sequences.get(kind), entity.id()));
        log.debug("Inserted {} {}", kind.singularName(), entity.id());
        return Optional.of(entity);
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public synchronized <E extends Entity<E>> Optional<E> findById(EntityKind<E> kind, long id) {
        requireKind(kind);
        return Optional.ofNullable(collections.get(kind).get(id)).map(kind.type()::cast);
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public synchronized <E extends Entity<E>> List<E> findAll(EntityKind<E> kind) {
        requireKind(kind);
        return collections.get(kind).values().stream()
            .map(kind.type()::cast)
            .toList();
    }

    /**
     * {@inheritDoc}
     *
     * <p><strong>Implementation Notes:</strong></p>
     * <ul>
     *   <li>The mutator runs while this receiver's monitor is held</li>
     *   <li>A trip whose new share code belongs to another trip is rejected with IllegalArgumentException</li>
     * </ul>
     */
    @Override
    public synchronized <E extends Entity<E>> Optional<E> update(EntityKind<E> kind, long id, UnaryOperator<E> mutator) {
        requireKind(kind);
        if (mutator == null) {
            throw new IllegalArgumentException("mutator cannot be null");
        }

        Optional<E> current = findById(kind, id);
        if (current.isEmpty()) {
            return Optional.empty();
        }

        E updated = mutator.apply(current.get());
        if (updated == null) {
            throw new IllegalArgumentException("mutator cannot return null");
        }
        if (updated.id() != id) {
            throw new IllegalArgumentException(
                String.format("mutator cannot change the id of %s %d (returned %d)", kind.singularName(), id, updated.id()));
        }
        if (updated instanceof Trip trip && shareCodeTaken(trip.shareCode(), id)) {
            throw new IllegalArgumentException("share code already in use: " + trip.shareCode());
        }

        collections.get(kind).put(id, updated);
        return Optional.of(updated);
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public synchronized boolean delete(EntityKind<?> kind, long id) {
        requireKind(kind);
        boolean removed = collections.get(kind).remove(id) != null;
        if (removed) {
            log.debug("Deleted {} {}", kind.singularName(), id);
        }
        return removed;
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public synchronized Optional<Trip> findTripByShareCode(String shareCode) {
        if (shareCode == null) {
            return Optional.empty();
        }
        return findAll(EntityKind.TRIPS).stream()
            .filter(trip -> trip.shareCode().equals(shareCode))
            .findFirst();
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public synchronized Optional<Trip> updateBudget(long tripId, BigDecimal budget) {
        if (budget == null) {
            throw new IllegalArgumentException("budget cannot be null");
        }
        return update(EntityKind.TRIPS, tripId, trip -> trip.withBudget(budget));
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public synchronized boolean addCollaborator(long tripId, long userId) {
        Optional<Trip> trip = findById(EntityKind.TRIPS, tripId);
        if (trip.isEmpty() || trip.get().isOwner(userId) || trip.get().hasCollaborator(userId)) {
            return false;
        }
        collections.get(EntityKind.TRIPS).put(tripId, trip.get().withCollaborator(userId));
        log.debug("Added collaborator {} to trip {}", userId, tripId);
        return true;
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public synchronized boolean removeCollaborator(long tripId, long userId) {
        Optional<Trip> trip = findById(EntityKind.TRIPS, tripId);
        if (trip.isEmpty() || !trip.get().hasCollaborator(userId)) {
            return false;
        }
        collections.get(EntityKind.TRIPS).put(tripId, trip.get().withoutCollaborator(userId));
        log.debug("Removed collaborator {} from trip {}", userId, tripId);
        return true;
    }

    /**
     * Clears all stored entities.
     *
     * <p>Id sequences are kept, so ids are never reused. This method is used for test cleanup.</p>
     */
    public synchronized void clear() {
        collections.values().forEach(Map::clear);
    }

    /**
     * Returns the number of entities in a collection.
     *
     * <p>This method is used for test assertions.</p>
     *
     * @param kind the collection
     * @return entity count
     */
    public synchronized int count(EntityKind<?> kind) {
        requireKind(kind);
        return collections.get(kind).size();
    }

    private boolean shareCodeTaken(String shareCode, long exceptTripId) {
        return collections.get(EntityKind.TRIPS).values().stream()
            .map(Trip.class::cast)
            .anyMatch(other -> other.id() != exceptTripId && other.shareCode().equals(shareCode));
    }

    private static void requireKind(EntityKind<?> kind) {
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
    }
}
