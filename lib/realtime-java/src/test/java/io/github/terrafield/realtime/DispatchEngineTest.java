package io.github.terrafield.realtime;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import com.google.gson.JsonElement;
import com.google.gson.JsonParser;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DispatchEngineTest {

    private ManualTaskScheduler scheduler;
    private RecordingFetcher fetcher;
    private SubscriptionRegistry registry;
    private ConnectionStateMachine machine;
    private DispatchEngine engine;

    private Logger engineLogger;
    private ListAppender<ILoggingEvent> appender;

    @BeforeEach
    void setUp() {
        scheduler = new ManualTaskScheduler();
        fetcher = new RecordingFetcher(scheduler);
        registry = new SubscriptionRegistry();
        machine = new ConnectionStateMachine();
        engine = new DispatchEngine(registry, machine, new MessageCodec(Collections.emptyMap()), fetcher, scheduler);

        engineLogger = (Logger) LoggerFactory.getLogger(DispatchEngine.class);
        appender = new ListAppender<>();
        appender.start();
        engineLogger.addAppender(appender);
    }

    @AfterEach
    void tearDown() {
        engineLogger.detachAppender(appender);
    }

    private Subscription register(String id, String event, Long intervalMs, List<JsonElement> sink) {
        SubscriptionBinding.Builder builder = SubscriptionBinding.builder()
                .event(event)
                .endpoint("/api/" + id)
                .callback(sink::add);
        if (intervalMs != null) {
            builder.intervalMs(intervalMs);
        }
        Subscription subscription = new Subscription(id, builder.build());
        registry.put(subscription);
        return subscription;
    }

    @Test
    void deliverFansOutToMatchingEvent() {
        List<JsonElement> a = new ArrayList<>();
        List<JsonElement> b = new ArrayList<>();
        register("a", "property-update", null, a);
        register("b", "comparable-update", null, b);
        machine.beginPush();
        machine.pushConnected();

        int delivered = engine.deliver(new RealtimeMessage("property-update", JsonParser.parseString("{\"id\":1}")));

        assertThat(delivered).isEqualTo(1);
        assertThat(a).hasSize(1);
        assertThat(b).isEmpty();
    }

    @Test
    void deliverDropsMessagesWhilePolling() {
        List<JsonElement> a = new ArrayList<>();
        register("a", "property-update", null, a);
        machine.enterPolling();

        assertThat(engine.deliver(new RealtimeMessage("property-update", null))).isZero();
        assertThat(a).isEmpty();
    }

    @Test
    void armOnlyWhilePollingAndWithInterval() {
        Subscription pollable = register("props", "property-update", 1000L, new ArrayList<>());
        Subscription inert = register("notes", "note-added", null, new ArrayList<>());

        engine.arm(pollable);
        assertThat(engine.isArmed("props")).isFalse();

        machine.enterPolling();
        engine.arm(pollable);
        engine.arm(inert);

        assertThat(engine.isArmed("props")).isTrue();
        assertThat(engine.isArmed("notes")).isFalse();
        assertThat(engine.armedCount()).isEqualTo(1);
    }

    @Test
    void armAllAndDisarmAll() {
        register("a", "property-update", 1000L, new ArrayList<>());
        register("b", "property-update", 2000L, new ArrayList<>());
        machine.enterPolling();

        engine.armAll();
        scheduler.runPending();
        assertThat(engine.armedCount()).isEqualTo(2);
        assertThat(fetcher.calls).hasSize(2);

        engine.disarmAll();
        scheduler.advanceBy(Duration.ofSeconds(10));
        assertThat(engine.armedCount()).isZero();
        assertThat(fetcher.calls).hasSize(2);
    }

    @Test
    void eachSubscriptionPollsAtItsOwnInterval() {
        register("fast", "a", 1000L, new ArrayList<>());
        register("slow", "b", 3000L, new ArrayList<>());
        machine.enterPolling();

        engine.armAll();
        scheduler.advanceBy(Duration.ofMillis(3000));

        long fast = fetcher.calls.stream().filter(c -> c.endpoint.equals("/api/fast")).count();
        long slow = fetcher.calls.stream().filter(c -> c.endpoint.equals("/api/slow")).count();
        assertThat(fast).isEqualTo(4);
        assertThat(slow).isEqualTo(2);
    }

    @Test
    void fetchFailureIsLoggedAndTimerKept() {
        fetcher.failNext(500);
        List<JsonElement> sink = new ArrayList<>();
        Subscription subscription = register("props", "property-update", 1000L, sink);
        machine.enterPolling();

        engine.arm(subscription);
        scheduler.runPending();

        assertThat(sink).isEmpty();
        assertThat(engine.isArmed("props")).isTrue();
        assertThat(appender.list)
                .anySatisfy(event -> {
                    assertThat(event.getLevel()).isEqualTo(Level.WARN);
                    assertThat(event.getFormattedMessage())
                            .contains("/api/props")
                            .contains("props")
                            .contains("HTTP 500");
                });
    }

    @Test
    void callbackFailureIsLogged() {
        Subscription subscription = new Subscription("bad", SubscriptionBinding.builder()
                .event("property-update")
                .endpoint("/api/bad")
                .callback(payload -> {
                    throw new IllegalStateException("boom");
                })
                .build());
        registry.put(subscription);
        machine.beginPush();
        machine.pushConnected();

        engine.deliver(new RealtimeMessage("property-update", null));

        assertThat(appender.list)
                .anySatisfy(event -> {
                    assertThat(event.getLevel()).isEqualTo(Level.ERROR);
                    assertThat(event.getFormattedMessage()).contains("bad");
                });
    }

    @Test
    void failedSchedulingLeavesSubscriptionUnarmed() {
        TaskScheduler rejecting = new TaskScheduler() {
            @Override
            public void execute(Runnable task) {
                scheduler.execute(task);
            }

            @Override
            public Cancellable scheduleAtFixedRate(Runnable task, Duration initialDelay, Duration period) {
                throw new IllegalArgumentException("period must be positive");
            }

            @Override
            public void shutdown() {
                scheduler.shutdown();
            }
        };
        engine = new DispatchEngine(registry, machine, new MessageCodec(Collections.emptyMap()), fetcher, rejecting);
        Subscription subscription = register("props", "property-update", 1000L, new ArrayList<>());
        machine.enterPolling();

        assertThatThrownBy(() -> engine.arm(subscription)).isInstanceOf(IllegalArgumentException.class);

        assertThat(engine.isArmed("props")).isFalse();
        assertThat(engine.armedCount()).isZero();
    }

    @Test
    void replacementPollsOnceOutstandingFetchSettles() {
        fetcher.hold();
        Subscription old = register("props", "property-update", 1000L, new ArrayList<>());
        machine.enterPolling();
        engine.arm(old);
        scheduler.runPending();

        List<JsonElement> sink = new ArrayList<>();
        Subscription replacement = register("props", "property-update", 1000L, sink);
        engine.arm(replacement);
        scheduler.runPending();
        assertThat(fetcher.calls).hasSize(1);

        fetcher.last().future.complete("{\"stale\":true}");
        scheduler.runPending();
        assertThat(fetcher.callTimes()).containsExactly(0L, 0L);

        fetcher.last().future.complete("{\"id\":2}");
        scheduler.runPending();
        assertThat(sink).containsExactly(JsonParser.parseString("{\"id\":2}"));
    }

    @Test
    void laterTicksAreSkippedNotDeferred() {
        fetcher.hold();
        Subscription subscription = register("props", "property-update", 1000L, new ArrayList<>());
        machine.enterPolling();
        engine.arm(subscription);
        scheduler.advanceBy(Duration.ofMillis(2500));

        fetcher.last().future.complete("{}");
        scheduler.runPending();

        assertThat(fetcher.callTimes()).containsExactly(0L);
    }

    @Test
    void resultForDisarmedSubscriptionIsDiscarded() {
        fetcher.hold();
        List<JsonElement> sink = new ArrayList<>();
        Subscription subscription = register("props", "property-update", 1000L, sink);
        machine.enterPolling();
        engine.arm(subscription);
        scheduler.runPending();

        engine.disarm("props");
        fetcher.last().future.complete("{\"id\":1}");
        scheduler.runPending();

        assertThat(sink).isEmpty();
    }

    @Test
    void resultForReplacedSubscriptionIsDiscarded() {
        fetcher.hold();
        List<JsonElement> oldSink = new ArrayList<>();
        Subscription old = register("props", "property-update", 1000L, oldSink);
        machine.enterPolling();
        engine.arm(old);
        scheduler.runPending();

        // replaced in the registry but the old timer was never disarmed
        register("props", "property-update", 1000L, new ArrayList<>());
        fetcher.last().future.complete("{\"id\":1}");
        scheduler.runPending();

        assertThat(oldSink).isEmpty();
    }
}
