package com.example.timesheet.notification.api;

public class EmployerSettingsNotFoundException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  public EmployerSettingsNotFoundException(String employerId) {
    super("schedule settings not found for employer_id=" + employerId);
  }
}
