package com.milestake.node.connector;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Distance covered in a window, in miles at two decimal places.
 */
public record MileageReading(BigDecimal miles, int sampleCount) {

    public MileageReading {
        if (miles == null || miles.signum() < 0) {
            throw new IllegalArgumentException("Miles must be zero or positive");
        }
        if (sampleCount < 0) {
            throw new IllegalArgumentException("Sample count cannot be negative");
        }
        miles = miles.setScale(2, RoundingMode.HALF_UP);
    }

    public static MileageReading none() {
        return new MileageReading(BigDecimal.ZERO, 0);
    }
}
