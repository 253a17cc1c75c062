package com.sparta.redemption.domain.fraud.vo;

/**
 * 위경도 좌표 Value Object
 */
public record GeoPoint(double lat, double lng) {

    private static final double EARTH_RADIUS_KM = 6371.0;

    /**
     * Compact constructor - 유효성 검증
     */
    public GeoPoint {
        if (Double.isNaN(lat) || lat < -90.0 || lat > 90.0) {
            throw new IllegalArgumentException("위도는 -90 ~ 90 범위여야 합니다");
        }
        if (Double.isNaN(lng) || lng < -180.0 || lng > 180.0) {
            throw new IllegalArgumentException("경도는 -180 ~ 180 범위여야 합니다");
        }
    }

    /**
     * 두 좌표 사이의 대권 거리 (Haversine)
     * @return 거리 (km)
     */
    public double distanceKmTo(GeoPoint other) {
        double latDistance = Math.toRadians(other.lat - this.lat);
        double lngDistance = Math.toRadians(other.lng - this.lng);

        double a = Math.sin(latDistance / 2) * Math.sin(latDistance / 2)
                + Math.cos(Math.toRadians(this.lat)) * Math.cos(Math.toRadians(other.lat))
                * Math.sin(lngDistance / 2) * Math.sin(lngDistance / 2);

        double c = 2 * Math.atan2(Math.sqrt(a), Math.sqrt(1 - a));

        return EARTH_RADIUS_KM * c;
    }
}
