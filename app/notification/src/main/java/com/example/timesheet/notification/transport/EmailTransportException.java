package com.example.timesheet.notification.transport;

public class EmailTransportException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  public EmailTransportException(String message) {
    super(message);
  }

  public EmailTransportException(String message, Throwable cause) {
    super(message, cause);
  }
}
