package io.github.terrafield.realtime;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class SubscriptionRegistryTest {

    private SubscriptionRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new SubscriptionRegistry();
    }

    private static Subscription subscription(String id, String event) {
        return new Subscription(id, SubscriptionBinding.builder()
                .event(event)
                .endpoint("/api/" + id)
                .callback(payload -> { })
                .build());
    }

    @Test
    void putReplacesEntryWithSameId() {
        Subscription first = subscription("props", "property-update");
        Subscription second = subscription("props", "property-update");

        assertThat(registry.put(first)).isNull();
        assertThat(registry.put(second)).isSameAs(first);
        assertThat(registry.size()).isEqualTo(1);
        assertThat(registry.get("props")).isSameAs(second);
    }

    @Test
    void isCurrentComparesIdentity() {
        Subscription first = subscription("props", "property-update");
        Subscription second = subscription("props", "property-update");
        registry.put(first);
        registry.put(second);

        assertThat(registry.isCurrent(first)).isFalse();
        assertThat(registry.isCurrent(second)).isTrue();

        registry.remove("props");
        assertThat(registry.isCurrent(second)).isFalse();
    }

    @Test
    void removeUnknownIdReturnsNull() {
        assertThat(registry.remove("missing")).isNull();
    }

    @Test
    void snapshotForEventSelectsMatchingEntries() {
        registry.put(subscription("a", "property-update"));
        registry.put(subscription("b", "property-update"));
        registry.put(subscription("c", "comparable-update"));
        registry.put(subscription("d", null));

        assertThat(registry.snapshotForEvent("property-update"))
                .extracting(Subscription::getId)
                .containsExactlyInAnyOrder("a", "b");
        assertThat(registry.snapshotForEvent("unknown")).isEmpty();
        assertThat(registry.snapshotForEvent(null)).isEmpty();
    }

    @Test
    void snapshotsAreDetached() {
        registry.put(subscription("a", "property-update"));

        List<Subscription> snapshot = registry.snapshot();
        Set<String> ids = registry.ids();
        registry.put(subscription("b", "property-update"));
        registry.clear();

        assertThat(snapshot).hasSize(1);
        assertThat(ids).containsExactly("a");
        assertThat(registry.size()).isZero();
    }
}
