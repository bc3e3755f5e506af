package com.dview.profiler.dto.profile;

/**
 * Type-specific statistics block of a column profile. One implementation exists per {@link
 * DataType} family.
 */
public interface ColumnStatistics {}
