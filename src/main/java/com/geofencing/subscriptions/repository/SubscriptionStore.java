package com.geofencing.subscriptions.repository;

import com.geofencing.subscriptions.entity.Subscription;
import com.geofencing.subscriptions.entity.SubscriptionRuntimeState;
import com.geofencing.subscriptions.enums.SubscriptionStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Function;

/**
 * In-memory store of active subscriptions and their runtime state.
 *
 * Concurrency Model:
 * - One entry per subscription id, holding the subscription and its runtime state
 * - Every read-modify-write of an entry runs while holding that entry's monitor
 * - Removal marks the entry as removed before unlinking it, under the same monitor,
 *   so a monitor pass still holding an old reference can never mutate or resurrect it
 * - {@link #findAll()} returns a snapshot list; scans never iterate the live map
 *
 * Subscriptions are not persisted: a restart starts with an empty store.
 */
@Repository
@Slf4j
public class SubscriptionStore {

    private final ConcurrentMap<String, Entry> entries = new ConcurrentHashMap<>();

    /**
     * Stores a new subscription together with a fresh runtime state.
     *
     * @throws IllegalStateException if the id is already in use
     */
    public Subscription save(Subscription subscription) {
        Entry previous = entries.putIfAbsent(subscription.getId(), new Entry(subscription));
        if (previous != null) {
            throw new IllegalStateException("Subscription id already in use: " + subscription.getId());
        }
        log.debug("Stored subscription {}", subscription.getId());
        return subscription;
    }

    public Optional<Subscription> findById(String id) {
        Entry entry = entries.get(id);
        if (entry == null) {
            return Optional.empty();
        }
        synchronized (entry) {
            return entry.removed ? Optional.empty() : Optional.of(entry.subscription);
        }
    }

    /**
     * Snapshot of all stored subscriptions. Order is not significant.
     */
    public List<Subscription> findAll() {
        List<Subscription> snapshot = new ArrayList<>(entries.size());
        for (Entry entry : entries.values()) {
            synchronized (entry) {
                if (!entry.removed) {
                    snapshot.add(entry.subscription);
                }
            }
        }
        return snapshot;
    }

    /**
     * Detached copy of a subscription's runtime state.
     */
    public Optional<SubscriptionRuntimeState> findState(String id) {
        return update(id, SubscriptionRuntimeState::copy);
    }

    /**
     * Applies {@code action} to the runtime state of a live subscription, holding the entry lock.
     *
     * @return the action's result, or empty if the subscription is gone
     */
    public <T> Optional<T> update(String id, Function<SubscriptionRuntimeState, T> action) {
        Entry entry = entries.get(id);
        if (entry == null) {
            return Optional.empty();
        }
        synchronized (entry) {
            if (entry.removed) {
                return Optional.empty();
            }
            return Optional.ofNullable(action.apply(entry.state));
        }
    }

    /**
     * Removes a subscription and its runtime state atomically.
     *
     * Only one caller can win the removal of a given id; all others get empty.
     *
     * @return the removed subscription with status EXPIRED, or empty if it was not present
     */
    public Optional<Subscription> remove(String id) {
        Entry entry = entries.get(id);
        if (entry == null) {
            return Optional.empty();
        }
        synchronized (entry) {
            if (entry.removed) {
                return Optional.empty();
            }
            entry.removed = true;
            entries.remove(id, entry);
            log.debug("Removed subscription {}", id);
            return Optional.of(entry.subscription.withStatus(SubscriptionStatus.EXPIRED));
        }
    }

    public int count() {
        return entries.size();
    }

    private static final class Entry {

        private final Subscription subscription;
        private final SubscriptionRuntimeState state = new SubscriptionRuntimeState();
        private boolean removed;

        private Entry(Subscription subscription) {
            this.subscription = subscription;
        }
    }
}
