/*
 * どこで: Dispatch の地理計算
 * 何を: 2 点間の大圏距離 (haversine) と検索用の外接矩形を計算する
 * なぜ: 距離はランキングにのみ使い、正しさの判定には使わないため直線距離で十分
 */
package com.fieldservice.dispatch.geo;

import com.fieldservice.dispatch.model.Coordinate;

public final class GeoDistance {

  public static final double EARTH_RADIUS_KM = 6371.0;

  private static final double KM_PER_DEGREE_LATITUDE = Math.PI * EARTH_RADIUS_KM / 180.0;

  private GeoDistance() {}

  /**
   * 役割: 2 点間の距離 (km) を返す。
   * 動作: haversine 式。対称で、同一座標なら 0。
   * 前提: Coordinate の範囲検証は生成時に済んでいる。
   */
  public static double distanceKm(Coordinate a, Coordinate b) {
    if (a.equals(b)) {
      return 0.0;
    }
    final double lat1 = Math.toRadians(a.latitude());
    final double lat2 = Math.toRadians(b.latitude());
    final double deltaLat = lat2 - lat1;
    final double deltaLon = Math.toRadians(b.longitude() - a.longitude());
    final double sinLat = Math.sin(deltaLat / 2);
    final double sinLon = Math.sin(deltaLon / 2);
    final double h = sinLat * sinLat + Math.cos(lat1) * Math.cos(lat2) * sinLon * sinLon;
    // 丸め誤差で 1 をわずかに超えると asin が NaN になる
    final double c = 2 * Math.asin(Math.sqrt(Math.min(1.0, h)));
    return EARTH_RADIUS_KM * c;
  }

  /**
   * 役割: center から radiusKm 以内の点を必ず含む矩形を返す。
   * 動作: 緯度方向は度あたり距離で、経度方向は cos(緯度) で補正して広げる。
   * 前提: 矩形は候補の絞り込み専用で、最終判定は distanceKm で行う。
   */
  public static BoundingBox boundingBox(Coordinate center, double radiusKm) {
    final double deltaLat = radiusKm / KM_PER_DEGREE_LATITUDE;
    final double minLat = center.latitude() - deltaLat;
    final double maxLat = center.latitude() + deltaLat;
    if (minLat <= -90.0 || maxLat >= 90.0) {
      return new BoundingBox(Math.max(-90.0, minLat), Math.min(90.0, maxLat), -180.0, 180.0);
    }
    // 矩形内で最も極に近い緯度で経度幅を見積もる
    final double widestLat = Math.max(Math.abs(minLat), Math.abs(maxLat));
    final double deltaLon = deltaLat / Math.cos(Math.toRadians(widestLat));
    final double minLon = center.longitude() - deltaLon;
    final double maxLon = center.longitude() + deltaLon;
    if (minLon < -180.0 || maxLon > 180.0) {
      return new BoundingBox(minLat, maxLat, -180.0, 180.0);
    }
    return new BoundingBox(minLat, maxLat, minLon, maxLon);
  }
}
