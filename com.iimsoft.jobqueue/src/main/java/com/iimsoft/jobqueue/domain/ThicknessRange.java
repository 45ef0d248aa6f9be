package com.iimsoft.jobqueue.domain;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Inclusive material thickness range a machine can cut, in millimetres.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ThicknessRange {
    private double min;
    private double max;

    public boolean contains(double thickness) {
        return thickness >= min && thickness <= max;
    }
}
