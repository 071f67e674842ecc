package sensormonitor.domain;

/**
 * A decoded inbound message addressed to one device.
 */
public record RoutedMessage(String deviceId, Sample sample) {}
