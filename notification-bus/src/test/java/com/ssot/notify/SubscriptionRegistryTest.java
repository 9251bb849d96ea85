package com.ssot.notify;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.*;

@DisplayName("SubscriptionRegistry Tests")
class SubscriptionRegistryTest {

    private ManualScheduler.MutableClock clock;
    private SubscriptionRegistry registry;

    @BeforeEach
    void setUp() {
        clock = new ManualScheduler.MutableClock(1_700_000_000_000L);
        registry = new SubscriptionRegistry(new PatternMatcher(), clock, false);
    }

    private static ChangeEvent event(String entityId, String attributeName) {
        return ChangeEvent.builder().entityId(entityId).attributeName(attributeName).newValue("v").build().enrich(0L);
    }

    @Test
    @DisplayName("Should assign increasing unique ids")
    void shouldAssignIncreasingIds() {
        String first = registry.subscribe(SubscriptionPattern.all(), e -> { });
        String second = registry.subscribe(SubscriptionPattern.all(), e -> { });

        assertThat(first).isEqualTo("sub_1");
        assertThat(second).isEqualTo("sub_2");
        assertThat(registry.size()).isEqualTo(2);
    }

    @Test
    @DisplayName("Should never reuse an id after unsubscribe")
    void shouldNotReuseIds() {
        String first = registry.subscribe(SubscriptionPattern.all(), e -> { });
        registry.unsubscribe(first);

        String second = registry.subscribe(SubscriptionPattern.all(), e -> { });

        assertThat(second).isNotEqualTo(first);
    }

    @Test
    @DisplayName("Should reject a null callback or pattern")
    void shouldRejectInvalidArguments() {
        assertThatThrownBy(() -> registry.subscribe(SubscriptionPattern.all(), null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("callback");
        assertThatThrownBy(() -> registry.subscribe(null, e -> { }))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("pattern");
        assertThat(registry.getTotalSubscriptions()).isZero();
    }

    @Test
    @DisplayName("Should report matches in insertion order")
    void shouldFindMatchingInInsertionOrder() {
        String byEntity = registry.subscribe(SubscriptionPattern.builder().entityId("e-1").build(), e -> { });
        registry.subscribe(SubscriptionPattern.builder().entityId("e-2").build(), e -> { });
        String byAttribute = registry.subscribe(SubscriptionPattern.builder().attributeName("nome").build(), e -> { });
        String everything = registry.subscribe(SubscriptionPattern.all(), e -> { });

        List<String> ids = registry.findMatching(event("e-1", "nome")).stream()
            .map(Subscription::getId)
            .collect(Collectors.toList());

        assertThat(ids).containsExactly(byEntity, byAttribute, everything);
    }

    @Test
    @DisplayName("Should not count a match until the subscription is invoked")
    void shouldNotIncrementMatchCountWhenFinding() {
        registry.subscribe(SubscriptionPattern.all(), e -> { });

        List<Subscription> matches = registry.findMatching(event("e-1", "nome"));

        assertThat(matches.get(0).getMatchCount()).isZero();
        matches.get(0).invoke(event("e-1", "nome"));
        assertThat(registry.snapshot().get(0).getMatchCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should make unsubscribe idempotent")
    void shouldUnsubscribeIdempotently() {
        String id = registry.subscribe(SubscriptionPattern.all(), e -> { });

        assertThat(registry.unsubscribe(id)).isTrue();
        assertThat(registry.unsubscribe(id)).isFalse();
        assertThat(registry.unsubscribe("sub_999")).isFalse();
        assertThat(registry.unsubscribe(null)).isFalse();
        assertThat(registry.findMatching(event("e-1", "nome"))).isEmpty();
    }

    @Test
    @DisplayName("Should keep the lifetime counter after unsubscribe and clear")
    void shouldKeepLifetimeCounter() {
        registry.subscribe(SubscriptionPattern.all(), e -> { });
        String id = registry.subscribe(SubscriptionPattern.all(), e -> { });
        registry.subscribe(SubscriptionPattern.all(), e -> { });

        registry.unsubscribe(id);
        int removed = registry.clear();

        assertThat(removed).isEqualTo(2);
        assertThat(registry.size()).isZero();
        assertThat(registry.getTotalSubscriptions()).isEqualTo(3);
    }

    @Test
    @DisplayName("Should capture callback failures without throwing")
    void shouldCaptureCallbackFailure() {
        List<String> seen = new ArrayList<>();
        registry.subscribe(SubscriptionPattern.all(), e -> {
            seen.add(e.getAttributeName());
            throw new IllegalStateException("boom");
        });

        Subscription subscription = registry.findMatching(event("e-1", "nome")).get(0);

        assertThat(subscription.invoke(event("e-1", "nome"))).isFalse();
        assertThat(seen).containsExactly("nome");
        assertThat(registry.snapshot().get(0).getFailureCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should expose read-only snapshots with creation time")
    void shouldSnapshotSubscriptions() {
        SubscriptionPattern pattern = SubscriptionPattern.builder().entityType("Cliente").build();
        String id = registry.subscribe(pattern, e -> { });

        List<SubscriptionInfo> snapshot = registry.snapshot();

        assertThat(snapshot).hasSize(1);
        assertThat(snapshot.get(0).getId()).isEqualTo(id);
        assertThat(snapshot.get(0).getPattern()).isSameAs(pattern);
        assertThat(snapshot.get(0).getCreated()).isEqualTo(Instant.ofEpochMilli(1_700_000_000_000L));
        assertThatThrownBy(() -> snapshot.add(snapshot.get(0)))
            .isInstanceOf(UnsupportedOperationException.class);
    }
}
