package com.questrail.pype.stats;

/**
 * Point-in-time estimates of one tracker.
 *
 * @param latencySeconds  average one-way latency
 * @param framerate       accepted units per second
 * @param bitrate         accepted payload bits per second
 * @param framedrop       lost / (lost + received), between 0 and 1
 */
public record TrackerSnapshot(double latencySeconds, double framerate, double bitrate, double framedrop) {
}
