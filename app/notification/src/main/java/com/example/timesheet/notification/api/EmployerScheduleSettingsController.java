/*
 * どこで: Notification API
 * 何を: 雇用主ごとの通知スケジュール設定を参照・更新する
 * なぜ: 設定変更と同時に PENDING 通知を再スケジュールするため
 */
package com.example.timesheet.notification.api;

import com.example.timesheet.notification.service.EmployerScheduleSettingsService;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/employers/{employerId}/schedule-settings")
@RequiredArgsConstructor
public class EmployerScheduleSettingsController {

  private final EmployerScheduleSettingsService settingsService;

  @GetMapping
  public ScheduleSettingsResponse get(@PathVariable("employerId") String employerId) {
    return settingsService.get(employerId);
  }

  @PutMapping
  public ScheduleSettingsUpdateResponse update(
      @PathVariable("employerId") String employerId,
      @RequestBody ScheduleSettingsUpdateRequest request) {
    return settingsService.update(employerId, request);
  }
}
