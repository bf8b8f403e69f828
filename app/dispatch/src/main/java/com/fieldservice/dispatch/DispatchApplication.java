/*
 * どこで: Dispatch アプリのエントリポイント
 * 何を: Spring Boot の起動と設定スキャンを行う
 * なぜ: マッチング/状態遷移/イベント発行を単一アプリとして起動するため
 */
package com.fieldservice.dispatch;

import com.fieldservice.common.config.TimeConfig;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.context.annotation.Import;

@SpringBootApplication
@ConfigurationPropertiesScan
@Import(TimeConfig.class)
public class DispatchApplication {

  public static void main(String[] args) {
    SpringApplication.run(DispatchApplication.class, args);
  }
}
