package com.example.timesheet.notification.service;

/**
 * Counts of one delivery run.
 *
 * @param capped true when the run stopped because it reached max-notifications-per-run
 */
public record DeliveryRunSummary(int batches, int processed, int sent, int failed, boolean capped) {}
