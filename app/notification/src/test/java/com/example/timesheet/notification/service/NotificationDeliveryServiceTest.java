/*
 * どこで: Notification 配信サービスのユニットテスト
 * 何を: バッチ取得ループ・同時送信・失敗の分離・結果の記録を検証する
 * なぜ: 1 件の失敗でランが止まらず、1 ランの処理量が上限で抑えられることを担保するため
 */
package com.example.timesheet.notification.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.example.timesheet.notification.config.NotificationDeliveryProperties;
import com.example.timesheet.notification.model.NotificationStatus;
import com.example.timesheet.notification.model.NotificationType;
import com.example.timesheet.notification.model.ScheduledNotification;
import com.example.timesheet.notification.repository.ScheduledNotificationRepository;
import com.example.timesheet.notification.transport.EmailTransport;
import com.example.timesheet.notification.transport.EmailTransportException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

@ExtendWith(MockitoExtension.class)
class NotificationDeliveryServiceTest {

  private static final Instant FIXED_NOW = Instant.parse("2026-01-05T03:30:00Z");
  private static final String WORKER_ID = "worker-1";
  private static final String RUN_ID = "run-1";
  private static final String CLAIM_TOKEN = WORKER_ID + "/" + RUN_ID;

  @Mock private ScheduledNotificationRepository notificationRepository;
  @Mock private EmailTransport transport;
  @Mock private NotificationMetrics metrics;

  private ExecutorService executor;

  @BeforeEach
  void setUp() {
    executor = Executors.newFixedThreadPool(10);
  }

  @AfterEach
  void tearDown() throws InterruptedException {
    executor.shutdownNow();
    executor.awaitTermination(5, TimeUnit.SECONDS);
  }

  @Test
  void twentyFiveDueRecordsAreClaimedInBatchesOfTenTenFive() {
    final NotificationDeliveryService service = service(properties(10, 500, 1000));
    when(notificationRepository.claimDue(10, FIXED_NOW, CLAIM_TOKEN))
        .thenReturn(records(10), records(10), records(5));
    when(notificationRepository.markSent(any(UUID.class), eq(FIXED_NOW), eq(CLAIM_TOKEN)))
        .thenReturn(1);

    final DeliveryRunSummary summary = service.runOnce(RUN_ID);

    assertThat(summary).isEqualTo(new DeliveryRunSummary(3, 25, 25, 0, false));
    verify(notificationRepository, times(3)).claimDue(10, FIXED_NOW, CLAIM_TOKEN);
    verify(transport, times(25)).send(anyString(), anyString(), anyString(), anyString());
    verify(metrics, times(25)).recordDeliveryResult("sent");
    verify(metrics, never()).recordRunCapped();
  }

  @Test
  void emptyQueueClaimsOnceAndStops() {
    final NotificationDeliveryService service = service(properties(10, 500, 1000));
    when(notificationRepository.claimDue(10, FIXED_NOW, CLAIM_TOKEN)).thenReturn(List.of());

    final DeliveryRunSummary summary = service.runOnce(RUN_ID);

    assertThat(summary).isEqualTo(new DeliveryRunSummary(0, 0, 0, 0, false));
    verify(notificationRepository, times(1)).claimDue(anyInt(), any(Instant.class), anyString());
  }

  @Test
  void runStopsAtMaxNotificationsPerRunAndShrinksTheLastClaim() {
    final NotificationDeliveryService service = service(properties(10, 25, 1000));
    when(notificationRepository.claimDue(10, FIXED_NOW, CLAIM_TOKEN))
        .thenReturn(records(10), records(10));
    when(notificationRepository.claimDue(5, FIXED_NOW, CLAIM_TOKEN)).thenReturn(records(5));
    when(notificationRepository.markSent(any(UUID.class), eq(FIXED_NOW), eq(CLAIM_TOKEN)))
        .thenReturn(1);

    final DeliveryRunSummary summary = service.runOnce(RUN_ID);

    assertThat(summary).isEqualTo(new DeliveryRunSummary(3, 25, 25, 0, true));
    verify(notificationRepository, times(3)).claimDue(anyInt(), any(Instant.class), anyString());
    verify(metrics).recordRunCapped();
  }

  @Test
  void failedSendIsRecordedAndDoesNotAbortTheBatch() {
    final NotificationDeliveryService service = service(properties(10, 500, 1000));
    final ScheduledNotification ok1 = record("ok1@example.com");
    final ScheduledNotification bad = record("bad@example.com");
    final ScheduledNotification ok2 = record("ok2@example.com");
    when(notificationRepository.claimDue(10, FIXED_NOW, CLAIM_TOKEN))
        .thenReturn(List.of(ok1, bad, ok2));
    lenient()
        .doThrow(new EmailTransportException("550 mailbox unavailable"))
        .when(transport)
        .send(eq("bad@example.com"), anyString(), anyString(), anyString());
    when(notificationRepository.markSent(any(UUID.class), eq(FIXED_NOW), eq(CLAIM_TOKEN)))
        .thenReturn(1);
    when(notificationRepository.markFailed(
            bad.notificationId(), "550 mailbox unavailable", FIXED_NOW, CLAIM_TOKEN))
        .thenReturn(1);

    final DeliveryRunSummary summary = service.runOnce(RUN_ID);

    assertThat(summary).isEqualTo(new DeliveryRunSummary(1, 3, 2, 1, false));
    verify(notificationRepository).markSent(ok1.notificationId(), FIXED_NOW, CLAIM_TOKEN);
    verify(notificationRepository).markSent(ok2.notificationId(), FIXED_NOW, CLAIM_TOKEN);
    verify(notificationRepository, never())
        .markSent(bad.notificationId(), FIXED_NOW, CLAIM_TOKEN);
    verify(metrics).recordDeliveryResult("failed");
  }

  @Test
  void unexpectedTransportExceptionAlsoCountsAsFailure() {
    final NotificationDeliveryService service = service(properties(10, 500, 1000));
    final ScheduledNotification record = record("npe@example.com");
    when(notificationRepository.claimDue(10, FIXED_NOW, CLAIM_TOKEN)).thenReturn(List.of(record));
    doThrow(new IllegalStateException())
        .when(transport)
        .send(anyString(), anyString(), anyString(), anyString());
    when(notificationRepository.markFailed(
            record.notificationId(), "IllegalStateException", FIXED_NOW, CLAIM_TOKEN))
        .thenReturn(1);

    final DeliveryRunSummary summary = service.runOnce(RUN_ID);

    assertThat(summary.failed()).isEqualTo(1);
  }

  @Test
  void longErrorMessageIsTruncated() {
    final NotificationDeliveryService service = service(properties(10, 500, 8));
    final ScheduledNotification record = record("slow@example.com");
    when(notificationRepository.claimDue(10, FIXED_NOW, CLAIM_TOKEN)).thenReturn(List.of(record));
    doThrow(new EmailTransportException("connect timed out after 10000ms"))
        .when(transport)
        .send(anyString(), anyString(), anyString(), anyString());
    when(notificationRepository.markFailed(
            record.notificationId(), "connect ", FIXED_NOW, CLAIM_TOKEN))
        .thenReturn(1);

    service.runOnce(RUN_ID);

    verify(notificationRepository)
        .markFailed(record.notificationId(), "connect ", FIXED_NOW, CLAIM_TOKEN);
  }

  @Test
  void persistenceFailureAfterSendDoesNotStopOtherRecords() {
    final NotificationDeliveryService service = service(properties(10, 500, 1000));
    final ScheduledNotification first = record("first@example.com");
    final ScheduledNotification second = record("second@example.com");
    when(notificationRepository.claimDue(10, FIXED_NOW, CLAIM_TOKEN))
        .thenReturn(List.of(first, second));
    when(notificationRepository.markSent(first.notificationId(), FIXED_NOW, CLAIM_TOKEN))
        .thenThrow(new DataAccessResourceFailureException("connection reset"));
    when(notificationRepository.markSent(second.notificationId(), FIXED_NOW, CLAIM_TOKEN))
        .thenReturn(1);

    final DeliveryRunSummary summary = service.runOnce(RUN_ID);

    assertThat(summary).isEqualTo(new DeliveryRunSummary(1, 2, 2, 0, false));
    verify(notificationRepository).markSent(second.notificationId(), FIXED_NOW, CLAIM_TOKEN);
  }

  @Test
  void lostClaimIsToleratedWithoutException() {
    final NotificationDeliveryService service = service(properties(10, 500, 1000));
    final ScheduledNotification record = record("lost@example.com");
    when(notificationRepository.claimDue(10, FIXED_NOW, CLAIM_TOKEN)).thenReturn(List.of(record));
    when(notificationRepository.markSent(record.notificationId(), FIXED_NOW, CLAIM_TOKEN))
        .thenReturn(0);

    final DeliveryRunSummary summary = service.runOnce(RUN_ID);

    assertThat(summary.sent()).isEqualTo(1);
  }

  @Test
  void claimFailureEndsTheRunWithoutThrowing() {
    final NotificationDeliveryService service = service(properties(10, 500, 1000));
    when(notificationRepository.claimDue(10, FIXED_NOW, CLAIM_TOKEN))
        .thenThrow(new DataAccessResourceFailureException("database unavailable"));

    final DeliveryRunSummary summary = service.runOnce(RUN_ID);

    assertThat(summary).isEqualTo(new DeliveryRunSummary(0, 0, 0, 0, false));
    verify(transport, never()).send(anyString(), anyString(), anyString(), anyString());
  }

  @Test
  void sendsOfOneBatchRunConcurrently() throws InterruptedException {
    final NotificationDeliveryService service = service(properties(3, 500, 1000));
    when(notificationRepository.claimDue(3, FIXED_NOW, CLAIM_TOKEN)).thenReturn(records(2));
    // 2 件が同時に send 中でなければラッチが開かない
    final CountDownLatch bothSending = new CountDownLatch(2);
    final List<Boolean> released = new CopyOnWriteArrayList<>();
    doAnswer(
            invocation -> {
              bothSending.countDown();
              released.add(bothSending.await(5, TimeUnit.SECONDS));
              return null;
            })
        .when(transport)
        .send(anyString(), anyString(), anyString(), anyString());
    when(notificationRepository.markSent(any(UUID.class), eq(FIXED_NOW), eq(CLAIM_TOKEN)))
        .thenReturn(1);

    final DeliveryRunSummary summary = service.runOnce(RUN_ID);

    assertThat(released).containsExactly(true, true);
    assertThat(summary.sent()).isEqualTo(2);
  }

  @Test
  void sendsHtmlDerivedFromTheStoredMessageAndTheMessageAsText() {
    final NotificationDeliveryService service = service(properties(10, 500, 1000));
    final ScheduledNotification record =
        ScheduledNotification.pending(
            UUID.randomUUID(),
            "employer-1",
            "html@example.com",
            "Weekly summary",
            "Hours < 40\nPlease review",
            NotificationType.DAILY_SUMMARY,
            null,
            FIXED_NOW,
            FIXED_NOW);
    when(notificationRepository.claimDue(10, FIXED_NOW, CLAIM_TOKEN)).thenReturn(List.of(record));
    when(notificationRepository.markSent(record.notificationId(), FIXED_NOW, CLAIM_TOKEN))
        .thenReturn(1);

    service.runOnce(RUN_ID);

    verify(transport)
        .send(
            "html@example.com",
            "Weekly summary",
            "Hours &lt; 40<br/>Please review",
            "Hours < 40\nPlease review");
    verify(metrics).recordDeliveryDelay(FIXED_NOW, FIXED_NOW);
  }

  @Test
  void workerIdFallsBackWhenNotConfigured() {
    assertThat(NotificationDeliveryService.resolveWorkerId("configured-worker"))
        .isEqualTo("configured-worker");
    assertThat(NotificationDeliveryService.resolveWorkerId(" ")).isNotBlank();
    assertThat(service(properties(10, 500, 1000)).workerId()).isEqualTo(WORKER_ID);
  }

  @Test
  void generatedRunIdsProduceDistinctClaimTokens() {
    final NotificationDeliveryService service = service(properties(10, 500, 1000));
    when(notificationRepository.claimDue(anyInt(), any(Instant.class), anyString()))
        .thenReturn(List.of());

    service.runOnce();
    service.runOnce();

    final ArgumentCaptor<String> tokens = ArgumentCaptor.forClass(String.class);
    verify(notificationRepository, times(2))
        .claimDue(anyInt(), any(Instant.class), tokens.capture());
    assertThat(tokens.getAllValues()).allMatch(token -> token.startsWith(WORKER_ID + "/"));
    assertThat(tokens.getAllValues().get(0)).isNotEqualTo(tokens.getAllValues().get(1));
  }

  private NotificationDeliveryService service(NotificationDeliveryProperties properties) {
    return new NotificationDeliveryService(
        notificationRepository,
        transport,
        properties,
        metrics,
        Clock.fixed(FIXED_NOW, ZoneOffset.UTC),
        executor);
  }

  private NotificationDeliveryProperties properties(
      int batchSize, int maxPerRun, int errorMessageMaxLength) {
    return new NotificationDeliveryProperties(
        true,
        "0 * * * * *",
        batchSize,
        maxPerRun,
        errorMessageMaxLength,
        Duration.ofSeconds(30),
        WORKER_ID);
  }

  private List<ScheduledNotification> records(int count) {
    final List<ScheduledNotification> records = new ArrayList<>(count);
    for (int i = 0; i < count; i++) {
      records.add(record("employee" + i + "@example.com"));
    }
    return records;
  }

  private ScheduledNotification record(String recipient) {
    final ScheduledNotification pending =
        ScheduledNotification.pending(
            UUID.randomUUID(),
            "employer-1",
            recipient,
            "Timesheet reminder",
            "Please submit your timesheet",
            NotificationType.ACTION_ALERT,
            null,
            FIXED_NOW.minusSeconds(60),
            FIXED_NOW.minusSeconds(3600));
    return new ScheduledNotification(
        pending.notificationId(),
        pending.employerId(),
        pending.recipientEmail(),
        pending.subject(),
        pending.messageBody(),
        pending.notificationType(),
        pending.referenceDayOfWeek(),
        pending.scheduledTimeUtc(),
        NotificationStatus.PROCESSING,
        0,
        null,
        CLAIM_TOKEN,
        FIXED_NOW,
        null,
        pending.createdAt(),
        FIXED_NOW);
  }
}
