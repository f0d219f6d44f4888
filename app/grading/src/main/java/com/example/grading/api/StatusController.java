/*
 * どこで: Grading API
 * 何を: ルートの簡易ヘルスレスポンスを返す
 * なぜ: ロードバランサからの疎通確認を actuator と分けて軽量に行うため
 */
package com.example.grading.api;

import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class StatusController {

  @GetMapping("/")
  public String home() {
    return "grading: ok";
  }
}
