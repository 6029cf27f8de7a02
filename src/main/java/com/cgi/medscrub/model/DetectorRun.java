package com.cgi.medscrub.model;

import lombok.Value;

import java.util.List;

/**
 * Detections produced by one invocation of a detector, with its timing.
 */
@Value
public class DetectorRun {
    String detectorName;
    String patternOrLabel;
    List<Detection> detections;
    long elapsedMs;
}
