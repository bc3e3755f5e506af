package com.dview.profiler.dto.profile;

/** Entry of a {@link ProfileReport}: either a {@link TableProfile} or a {@link ProfileError}. */
public interface TableResult {}
