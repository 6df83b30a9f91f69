package io.interviews.core.interview;

/// Caller-supplied position, passed through untouched.
///
/// @param latitude degrees
/// @param longitude degrees
public record Geolocation(double latitude, double longitude) {}
