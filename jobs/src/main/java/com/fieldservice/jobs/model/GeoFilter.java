package com.fieldservice.jobs.model;

/** Center point and radius for proximity filtering */
public record GeoFilter(double latitude, double longitude, double radiusKm) {}
