/*
 * どこで: Notification API
 * 何を: 通知の登録と雇用主ごとの一覧取得
 * なぜ: 上流サービスからの登録窓口と運用時の可視化のため
 */
package com.example.timesheet.notification.api;

import com.example.timesheet.notification.service.ScheduledNotificationService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/employers/{employerId}/notifications")
@RequiredArgsConstructor
public class ScheduledNotificationController {

  private final ScheduledNotificationService notificationService;

  @PostMapping
  @ResponseStatus(HttpStatus.CREATED)
  public NotificationSummary enqueue(
      @PathVariable("employerId") String employerId,
      @Valid @RequestBody EnqueueNotificationRequest request) {
    return notificationService.enqueue(employerId, request);
  }

  @GetMapping
  public NotificationListResponse list(@PathVariable("employerId") String employerId) {
    return notificationService.list(employerId);
  }
}
