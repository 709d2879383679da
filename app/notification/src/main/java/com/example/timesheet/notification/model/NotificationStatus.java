/*
 * どこで: Notification ドメインモデル
 * 何を: 予約通知の配信状態
 * なぜ: DB の status 列と遷移ルールを 1 つの閉じた型にまとめるため
 */
package com.example.timesheet.notification.model;

public enum NotificationStatus {
  PENDING,
  PROCESSING,
  SENT,
  FAILED,
  CANCELLED_BY_SETTING_CHANGE;

  public boolean isTerminal() {
    return switch (this) {
      case PENDING, PROCESSING -> false;
      case SENT, FAILED, CANCELLED_BY_SETTING_CHANGE -> true;
    };
  }

  /**
   * PENDING -> PROCESSING | CANCELLED_BY_SETTING_CHANGE, PROCESSING -> SENT | FAILED. Terminal
   * states never move.
   */
  public boolean canTransitionTo(NotificationStatus next) {
    return switch (this) {
      case PENDING -> next == PROCESSING || next == CANCELLED_BY_SETTING_CHANGE;
      case PROCESSING -> next == SENT || next == FAILED;
      case SENT, FAILED, CANCELLED_BY_SETTING_CHANGE -> false;
    };
  }
}
