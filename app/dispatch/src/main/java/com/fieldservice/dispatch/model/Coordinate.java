/*
 * どこで: Dispatch ドメインモデル
 * 何を: 緯度経度 (度) の組を表す
 * なぜ: 範囲外の座標を生成時点で弾き、距離計算側で検証を不要にするため
 */
package com.fieldservice.dispatch.model;

import com.fieldservice.dispatch.exception.InvalidDispatchRequestException;

public record Coordinate(double latitude, double longitude) {

  public Coordinate {
    if (Double.isNaN(latitude) || latitude < -90.0 || latitude > 90.0) {
      throw new InvalidDispatchRequestException("latitude must be within [-90, 90]: " + latitude);
    }
    if (Double.isNaN(longitude) || longitude < -180.0 || longitude > 180.0) {
      throw new InvalidDispatchRequestException(
          "longitude must be within [-180, 180]: " + longitude);
    }
  }

  public static Coordinate of(double latitude, double longitude) {
    return new Coordinate(latitude, longitude);
  }
}
