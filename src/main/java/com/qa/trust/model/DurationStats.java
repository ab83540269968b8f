package com.qa.trust.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DurationStats {
    private int samples;
    private double mean;
    private double median;
    // sample standard deviation; 0 for a single sample
    private double stdDev;
    private double min;
    private double max;
}
