package com.phillippitts.vibedj.service.weights;

import com.phillippitts.vibedj.domain.WeightScope;

/**
 * Result of an override adjustment.
 */
public record WeightChange(WeightScope scope, String key, double oldFactor, double newFactor) {
}
