package com.fieldservice.dispatch.geo;

/** 範囲クエリ用の緯度経度の矩形。日付変更線や極をまたぐ場合は経度を全域にする。 */
public record BoundingBox(
    double minLatitude, double maxLatitude, double minLongitude, double maxLongitude) {

  public boolean contains(double latitude, double longitude) {
    return latitude >= minLatitude
        && latitude <= maxLatitude
        && longitude >= minLongitude
        && longitude <= maxLongitude;
  }
}
