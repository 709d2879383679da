package com.example.timesheet.notification.model;

public enum NotificationType {
  DAILY_SUMMARY,
  ACTION_ALERT,
  OTHER
}
