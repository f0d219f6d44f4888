/*
 * どこで: Grading アプリのエントリポイント
 * 何を: Spring Boot の起動と設定スキャンを行う
 * なぜ: Webhook 受信・再処理ワーカー・設定クラスをまとめて有効化するため
 */
package com.example.grading;

import com.example.common.config.TimeConfig;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.context.annotation.Import;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
@ConfigurationPropertiesScan
@Import(TimeConfig.class)
public class GradingApplication {

	public static void main(String[] args) {
		SpringApplication.run(GradingApplication.class, args);
	}
}
