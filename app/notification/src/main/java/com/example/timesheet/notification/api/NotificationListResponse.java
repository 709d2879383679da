/*
 * どこで: Notification API
 * 何を: 雇用主の通知一覧レスポンス
 * なぜ: 登録済み・送信済み・失敗・キャンセルの状況を運用から確認するため
 */
package com.example.timesheet.notification.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record NotificationListResponse(String employerId, List<NotificationSummary> notifications) {
  public NotificationListResponse {
    // SpotBugs EI_EXPOSE_REP: keep an unmodifiable copy of the caller's list
    if (notifications != null) {
      notifications = Collections.unmodifiableList(new ArrayList<>(notifications));
    }
  }

  @Override
  public List<NotificationSummary> notifications() {
    if (notifications == null) {
      return null;
    }
    return Collections.unmodifiableList(new ArrayList<>(notifications));
  }
}
