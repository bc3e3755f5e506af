package com.dview.profiler.dto.profile;

/**
 * Entry of {@link TableProfile#getColumns()}: either a {@link ColumnProfile} or a {@link
 * ProfileError}.
 */
public interface ColumnResult {}
