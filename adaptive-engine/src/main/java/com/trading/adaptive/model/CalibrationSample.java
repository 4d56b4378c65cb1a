package com.trading.adaptive.model;

/**
 * One historical (raw confidence, outcome) pair used to fit a calibration curve.
 */
public record CalibrationSample(double rawConfidence, boolean win) {
}
