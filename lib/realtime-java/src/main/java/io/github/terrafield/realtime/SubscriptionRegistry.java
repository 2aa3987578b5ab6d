package io.github.terrafield.realtime;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Mapping from subscription id to its binding: the single record of what is watched.
 * <p>
 * Writes are serialized under one lock; readers take snapshots so a dispatch pass
 * never sees a half-applied update. Entries survive transport changes and are only
 * removed by {@link #remove(String)} or {@link #clear()}.
 */
final class SubscriptionRegistry {

    private final Object lock = new Object();
    private final Map<String, Subscription> entries = new HashMap<>();

    /**
     * Stores a subscription, replacing any entry with the same id.
     *
     * @return the replaced entry, or null
     */
    Subscription put(Subscription subscription) {
        synchronized (lock) {
            return entries.put(subscription.getId(), subscription);
        }
    }

    /**
     * @return the removed entry, or null if the id was unknown
     */
    Subscription remove(String id) {
        synchronized (lock) {
            return entries.remove(id);
        }
    }

    Subscription get(String id) {
        synchronized (lock) {
            return entries.get(id);
        }
    }

    /**
     * Checks that {@code subscription} is still the live entry for its id.
     */
    boolean isCurrent(Subscription subscription) {
        synchronized (lock) {
            return entries.get(subscription.getId()) == subscription;
        }
    }

    List<Subscription> snapshot() {
        synchronized (lock) {
            return new ArrayList<>(entries.values());
        }
    }

    List<Subscription> snapshotForEvent(String event) {
        List<Subscription> matching = new ArrayList<>();
        synchronized (lock) {
            for (Subscription subscription : entries.values()) {
                if (subscription.matches(event)) {
                    matching.add(subscription);
                }
            }
        }
        return matching;
    }

    Set<String> ids() {
        synchronized (lock) {
            return new LinkedHashSet<>(entries.keySet());
        }
    }

    int size() {
        synchronized (lock) {
            return entries.size();
        }
    }

    void clear() {
        synchronized (lock) {
            entries.clear();
        }
    }
}
