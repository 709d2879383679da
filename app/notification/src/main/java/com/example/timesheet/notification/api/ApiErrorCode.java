/*
 * どこで: Notification API
 * 何を: エラーレスポンスに載せるエラーコード
 * なぜ: 同じ HTTP ステータスでも原因を呼び出し側で区別できるようにするため
 */
package com.example.timesheet.notification.api;

public enum ApiErrorCode {
  BAD_REQUEST,
  SETTINGS_NOT_FOUND,
  SCHEDULE_DISABLED
}
