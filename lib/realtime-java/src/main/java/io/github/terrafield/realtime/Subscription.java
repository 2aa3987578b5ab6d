package io.github.terrafield.realtime;

import java.util.Objects;

/**
 * Registry entry: a binding stored under its subscription id.
 * <p>
 * Entries are compared by identity, so a replaced binding under the same id is a
 * different entry and late results addressed to the old one can be recognized.
 */
final class Subscription {

    private final String id;
    private final SubscriptionBinding binding;

    Subscription(String id, SubscriptionBinding binding) {
        this.id = Objects.requireNonNull(id, "id");
        this.binding = Objects.requireNonNull(binding, "binding");
    }

    String getId() {
        return id;
    }

    SubscriptionBinding getBinding() {
        return binding;
    }

    boolean matches(String event) {
        return event != null && event.equals(binding.getEvent());
    }

    @Override
    public String toString() {
        return "Subscription{" +
                "id='" + id + '\'' +
                ", binding=" + binding +
                '}';
    }
}
