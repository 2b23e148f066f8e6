package com.fieldservice.jobs.query;

import com.fieldservice.jobs.entity.JobEntity;
import com.fieldservice.jobs.entity.JobLocation;

/** Great-circle distance on a spherical Earth */
public final class GeoDistance {

  public static final double EARTH_RADIUS_KM = 6371.0;

  private GeoDistance() {}

  /**
   * Haversine distance between two points given in degrees
   *
   * @return distance in kilometres
   */
  public static double haversineKm(double lat1, double lon1, double lat2, double lon2) {
    double dLat = Math.toRadians(lat2 - lat1);
    double dLon = Math.toRadians(lon2 - lon1);
    double a =
        Math.sin(dLat / 2) * Math.sin(dLat / 2)
            + Math.cos(Math.toRadians(lat1))
                * Math.cos(Math.toRadians(lat2))
                * Math.sin(dLon / 2)
                * Math.sin(dLon / 2);
    return EARTH_RADIUS_KM * 2 * Math.atan2(Math.sqrt(a), Math.sqrt(1 - a));
  }

  /** Distance from a point to a job's location, or null when the job has no coordinates */
  public static Double toJobKm(double latitude, double longitude, JobEntity job) {
    JobLocation location = job.location();
    if (location == null || !location.hasCoordinates()) {
      return null;
    }
    return haversineKm(latitude, longitude, location.latitude(), location.longitude());
  }
}
