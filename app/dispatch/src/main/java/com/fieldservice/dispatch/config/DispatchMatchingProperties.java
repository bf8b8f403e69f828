/*
 * どこで: Dispatch 設定
 * 何を: 近傍検索の既定半径/上限半径/件数上限を保持する
 * なぜ: 検索半径をコード外で調整し、過大な半径による全件走査を防ぐため
 */
package com.fieldservice.dispatch.config;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "dispatch.matching")
public record DispatchMatchingProperties(
    @DecimalMin("1.0") double defaultRadiusKm,
    @DecimalMin("1.0") double maxRadiusKm,
    @Min(1) @Max(500) int maxResults,
    @Min(1) @Max(50) int topWorkers) {

  @AssertTrue(message = "default-radius-km must not exceed max-radius-km")
  public boolean isDefaultRadiusWithinMax() {
    return defaultRadiusKm <= maxRadiusKm;
  }

  /** 指定半径を maxRadiusKm 以下に丸める。正の値であることは呼び出し側で検証する。 */
  public double clampRadius(double radiusKm) {
    return Math.min(maxRadiusKm, radiusKm);
  }
}
