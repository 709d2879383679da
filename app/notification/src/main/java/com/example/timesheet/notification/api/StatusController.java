/*
 * どこで: Notification API
 * 何を: ルートの簡易ヘルスレスポンスを返す
 * なぜ: ロードバランサからの疎通確認に使うため
 */
package com.example.timesheet.notification.api;

import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class StatusController {

  @GetMapping("/")
  public String home() {
    return "notification: ok";
  }
}
