package com.bbthechange.matchtracker.service;

import com.bbthechange.matchtracker.config.TrackerProperties;
import com.bbthechange.matchtracker.dto.GateOutcome;
import com.bbthechange.matchtracker.model.MapDetail;
import com.bbthechange.matchtracker.model.MapScore;
import com.bbthechange.matchtracker.model.Match;
import com.bbthechange.matchtracker.model.MatchResult;
import com.bbthechange.matchtracker.model.NotificationCategory;
import com.bbthechange.matchtracker.model.TrackedEvent;
import com.bbthechange.matchtracker.testutil.InMemoryNotifiedMatchRepository;
import com.bbthechange.matchtracker.testutil.RecordingNotificationSink;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Supplier;

import static com.bbthechange.matchtracker.testutil.MatchTestBuilder.completeResult;
import static com.bbthechange.matchtracker.testutil.MatchTestBuilder.hiddenTimeMatch;
import static com.bbthechange.matchtracker.testutil.MatchTestBuilder.liveMatch;
import static com.bbthechange.matchtracker.testutil.MatchTestBuilder.scheduledMatch;
import static com.bbthechange.matchtracker.testutil.MatchTestBuilder.seriesResult;
import static com.bbthechange.matchtracker.testutil.MatchTestBuilder.tbdMatch;
import static org.assertj.core.api.Assertions.assertThat;

class NotificationGateTest {

    private static final Instant NOW = Instant.parse("2026-06-10T04:00:00Z");
    private static final String EVENT_ID = "evt-7148";

    private InMemoryNotifiedMatchRepository notifiedRepository;
    private RecordingNotificationSink sink;
    private MeterRegistry meterRegistry;
    private TrackerProperties properties;
    private NotificationGate gate;
    private TrackedEvent event;
    private Set<String> groups;
    private Supplier<Set<String>> recipients;

    @BeforeEach
    void setUp() {
        notifiedRepository = new InMemoryNotifiedMatchRepository();
        sink = new RecordingNotificationSink();
        meterRegistry = new SimpleMeterRegistry();
        properties = new TrackerProperties();
        gate = newGate();
        groups = new LinkedHashSet<>(List.of("group-1", "group-2"));
        event = new TrackedEvent(EVENT_ID, "IEM Cologne", "06-09", "06-12", groups);
        recipients = () -> groups;
    }

    private NotificationGate newGate() {
        return new NotificationGate(notifiedRepository, sink, new NotificationTextGenerator(), meterRegistry, properties);
    }

    @Nested
    @DisplayName("startStage")
    class StartStageTests {

        @Test
        void liveMatch_IsLiveStage() {
            assertThat(gate.startStage(liveMatch("m1"), NOW)).contains(NotificationGate.StartStage.LIVE);
        }

        @Test
        void hiddenTime_IsTimeHiddenStage() {
            assertThat(gate.startStage(hiddenTimeMatch("m1"), NOW)).contains(NotificationGate.StartStage.TIME_HIDDEN);
        }

        @Test
        void scheduledTimeReached_IsOverdueStageUntilThreshold() {
            Match match = scheduledMatch("m1", NOW.minus(Duration.ofMinutes(10)));

            assertThat(gate.startStage(match, NOW)).contains(NotificationGate.StartStage.OVERDUE);
            assertThat(gate.startStage(match, NOW.plus(Duration.ofMinutes(20)))).contains(NotificationGate.StartStage.OVERDUE);
            assertThat(gate.startStage(match, NOW.plus(Duration.ofMinutes(21)))).isEmpty();
        }

        @Test
        void futureMatch_HasNoStage() {
            assertThat(gate.startStage(scheduledMatch("m1", NOW.plus(Duration.ofMinutes(1))), NOW)).isEmpty();
        }

        @Test
        void tbdMatch_HasNoStage() {
            assertThat(gate.startStage(tbdMatch("m1"), NOW)).isEmpty();
        }
    }

    @Nested
    @DisplayName("processStarts")
    class ProcessStarts {

        @Test
        void eligibleMatch_NotifiesEveryGroupOnce() {
            // When
            GateOutcome first = gate.processStarts(event, List.of(liveMatch("m1")), NOW, recipients);
            GateOutcome replay = gate.processStarts(event, List.of(liveMatch("m1")), NOW, recipients);

            // Then
            assertThat(first.notified()).isEqualTo(1);
            assertThat(replay.notified()).isZero();
            assertThat(sink.deliveriesOf(NotificationCategory.START))
                    .extracting(RecordingNotificationSink.Delivery::groupId)
                    .containsExactly("group-1", "group-2");
            assertThat(notifiedRepository.isNotified(EVENT_ID, NotificationCategory.START, "m1")).isTrue();
        }

        @Test
        void sameMatchThroughDifferentStages_NotifiesEachGroupOnce() {
            Match hidden = hiddenTimeMatch("m1");
            Match live = liveMatch("m1");

            gate.processStarts(event, List.of(hidden), NOW, recipients);
            gate.processStarts(event, List.of(live), NOW.plus(Duration.ofMinutes(5)), recipients);

            assertThat(sink.deliveriesOf(NotificationCategory.START)).hasSize(2);
        }

        @Test
        void payload_CarriesTitleAndBody() {
            gate.processStarts(event, List.of(liveMatch("m1")), NOW, recipients);

            RecordingNotificationSink.Delivery delivery = sink.getDeliveries().get(0);
            assertThat(delivery.payload().getTitle()).isEqualTo(NotificationTextGenerator.MATCH_STARTING_TITLE);
            assertThat(delivery.payload().getBody()).isEqualTo("Vitality vs NAVI (BO3) is starting at IEM Cologne");
            assertThat(delivery.payload().getEventId()).isEqualTo(EVENT_ID);
            assertThat(delivery.payload().getMatchId()).isEqualTo("m1");
        }

        @Test
        void failedDelivery_IsNotRetried() {
            // Given
            sink.failFor("group-2");

            // When
            gate.processStarts(event, List.of(liveMatch("m1")), NOW, recipients);
            sink.recover("group-2");
            gate.processStarts(event, List.of(liveMatch("m1")), NOW, recipients);

            // Then
            assertThat(sink.getDeliveries())
                    .extracting(RecordingNotificationSink.Delivery::groupId)
                    .containsExactly("group-1");
        }

        @Test
        void noRemainingGroups_DoesNotClaimMatch() {
            groups.clear();

            GateOutcome outcome = gate.processStarts(event, List.of(liveMatch("m1")), NOW, recipients);

            assertThat(outcome.notified()).isZero();
            assertThat(notifiedRepository.size()).isZero();
        }

        @Test
        void ineligibleMatches_AreSkippedWithoutLookingUpRecipients() {
            Supplier<Set<String>> failingRecipients = () -> {
                throw new AssertionError("recipients should not be loaded");
            };

            GateOutcome outcome = gate.processStarts(event,
                    List.of(tbdMatch("m1"), scheduledMatch("m2", NOW.plus(Duration.ofHours(2)))),
                    NOW, failingRecipients);

            assertThat(outcome.notified()).isZero();
            assertThat(sink.getDeliveries()).isEmpty();
        }
    }

    @Nested
    @DisplayName("processResults")
    class ProcessResults {

        @Test
        void incompleteResult_IsWithheldUntilComplete() {
            // Given: 2-1 series with detail for only two of the three maps
            MatchResult partial = seriesResult("m1", 2, 1, 2);

            // When
            GateOutcome withheld = gate.processResults(event, List.of(partial), recipients);

            // Then
            assertThat(withheld.withheld()).isEqualTo(1);
            assertThat(sink.getDeliveries()).isEmpty();
            assertThat(notifiedRepository.isNotified(EVENT_ID, NotificationCategory.RESULT, "m1")).isFalse();

            // When the third map detail arrives
            GateOutcome complete = gate.processResults(event, List.of(seriesResult("m1", 2, 1, 3)), recipients);
            GateOutcome replay = gate.processResults(event, List.of(seriesResult("m1", 2, 1, 3)), recipients);

            // Then
            assertThat(complete.notified()).isEqualTo(1);
            assertThat(replay.notified()).isZero();
            assertThat(sink.deliveriesOf(NotificationCategory.RESULT)).hasSize(2);
        }

        @Test
        void resultBody_ListsMapScoresAndWinner() {
            gate.processResults(event, List.of(completeResult("m1")), recipients);

            assertThat(sink.getDeliveries().get(0).payload().getBody())
                    .isEqualTo("Vitality 2-1 NAVI (Mirage 13-9, Inferno 13-9, Nuke 13-9). Vitality wins at IEM Cologne");
        }

        @Test
        void unacknowledgedGroup_IsRetriedUntilItAcknowledges() {
            // Given
            sink.failFor("group-2");

            // When
            GateOutcome first = gate.processResults(event, List.of(completeResult("m1")), recipients);

            // Then
            assertThat(first.deliveryPending()).isEqualTo(1);
            assertThat(notifiedRepository.isNotified(EVENT_ID, NotificationCategory.RESULT, "m1")).isFalse();
            assertThat(gate.pendingResultCount()).isEqualTo(1);

            // When the group recovers
            sink.recover("group-2");
            GateOutcome second = gate.processResults(event, List.of(completeResult("m1")), recipients);

            // Then only the missing group is sent the result again
            assertThat(second.notified()).isEqualTo(1);
            assertThat(sink.getDeliveries())
                    .extracting(RecordingNotificationSink.Delivery::groupId)
                    .containsExactly("group-1", "group-2");
            assertThat(notifiedRepository.isNotified(EVENT_ID, NotificationCategory.RESULT, "m1")).isTrue();
            assertThat(gate.pendingResultCount()).isZero();
        }

        @Test
        void partiallyAcknowledgedResult_IsAbandonedAfterMaxAttempts() {
            // Given: group-1 accepts, group-2 keeps failing
            properties.getNotifications().setMaxResultAttempts(3);
            gate = newGate();
            sink.failFor("group-2");

            // When
            gate.processResults(event, List.of(completeResult("m1")), recipients);
            gate.processResults(event, List.of(completeResult("m1")), recipients);
            GateOutcome third = gate.processResults(event, List.of(completeResult("m1")), recipients);

            // Then
            assertThat(third.notified()).isEqualTo(1);
            assertThat(notifiedRepository.isNotified(EVENT_ID, NotificationCategory.RESULT, "m1")).isTrue();
            assertThat(meterRegistry.counter("tracker_notification_total",
                    "category", "result", "stage", "abandoned").count()).isEqualTo(1.0);
        }

        @Test
        void resultNoGroupAccepted_StaysUnmarkedPastMaxAttempts() {
            // Given: the only group fails for more passes than the attempt limit
            properties.getNotifications().setMaxResultAttempts(3);
            gate = newGate();
            groups.remove("group-2");
            sink.failFor("group-1");

            for (int pass = 0; pass < 12; pass++) {
                GateOutcome outcome = gate.processResults(event, List.of(completeResult("m1")), recipients);
                assertThat(outcome.notified()).isZero();
                assertThat(outcome.deliveryPending()).isEqualTo(1);
            }
            assertThat(notifiedRepository.isNotified(EVENT_ID, NotificationCategory.RESULT, "m1")).isFalse();

            // When the group recovers
            sink.recover("group-1");
            GateOutcome recovered = gate.processResults(event, List.of(completeResult("m1")), recipients);

            // Then
            assertThat(recovered.notified()).isEqualTo(1);
            assertThat(sink.deliveriesOf(NotificationCategory.RESULT)).hasSize(1);
            assertThat(notifiedRepository.isNotified(EVENT_ID, NotificationCategory.RESULT, "m1")).isTrue();
            assertThat(meterRegistry.counter("tracker_notification_total",
                    "category", "result", "stage", "abandoned").count()).isZero();
        }

        @Test
        void pendingResultLeavingFeedWindow_IsDropped() {
            // Given
            sink.failFor("group-2");
            gate.processResults(event, List.of(completeResult("m1"), completeResult("m2")), recipients);
            assertThat(gate.pendingResultCount()).isEqualTo(2);

            // When m1 is no longer in the feed
            gate.processResults(event, List.of(completeResult("m2")), recipients);

            // Then
            assertThat(gate.pendingResultCount()).isEqualTo(1);

            // When the feed returns nothing for the event
            gate.processResults(event, List.of(), recipients);

            // Then
            assertThat(gate.pendingResultCount()).isZero();
        }

        @Test
        void pendingResultsOfOtherEvents_AreKept() {
            // Given
            sink.failFor("group-2");
            TrackedEvent other = new TrackedEvent("evt-7200", "PGL Astana", "06-09", "06-12", groups);
            gate.processResults(other, List.of(completeResult("m1")), recipients);

            // When
            gate.processResults(event, List.of(), recipients);

            // Then
            assertThat(gate.pendingResultCount()).isEqualTo(1);
        }

        @Test
        void singleMapResult_NeedsOneMapOfDetail() {
            // 16-12 is a map score, so one map is expected
            MatchResult result = MatchResult.builder()
                    .id("m9")
                    .teamA("FaZe")
                    .teamB("G2")
                    .scoreA(16)
                    .scoreB(12)
                    .mapScores(List.of(new MapScore("Dust2", 16, 12)))
                    .mapDetails(List.of(new MapDetail("Dust2", "stats-1")))
                    .build();

            GateOutcome outcome = gate.processResults(event, List.of(result), recipients);

            assertThat(outcome.notified()).isEqualTo(1);
        }
    }

    @Nested
    @DisplayName("baseline / forget")
    class BaselineAndForget {

        @Test
        void baselineResults_MarksWithoutDelivering() {
            int marked = gate.baselineResults(EVENT_ID, List.of(completeResult("m1"), seriesResult("m2", 1, 0, 0)));

            assertThat(marked).isEqualTo(2);
            assertThat(sink.getDeliveries()).isEmpty();

            GateOutcome outcome = gate.processResults(event, List.of(completeResult("m1")), recipients);
            assertThat(outcome.notified()).isZero();
            assertThat(sink.getDeliveries()).isEmpty();
        }

        @Test
        void forgetEvent_ClearsDurableAndPendingState() {
            // Given
            gate.processStarts(event, List.of(liveMatch("m1")), NOW, recipients);
            sink.failFor("group-2");
            gate.processResults(event, List.of(completeResult("m2")), recipients);

            // When
            int removed = gate.forgetEvent(EVENT_ID);

            // Then
            assertThat(removed).isEqualTo(1);
            assertThat(gate.pendingResultCount()).isZero();
            assertThat(notifiedRepository.isNotified(EVENT_ID, NotificationCategory.START, "m1")).isFalse();
        }
    }
}
