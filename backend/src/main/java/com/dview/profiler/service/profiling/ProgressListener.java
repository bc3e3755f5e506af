package com.dview.profiler.service.profiling;

/** Receives batch progress as a percentage. May be called from any worker thread. */
@FunctionalInterface
public interface ProgressListener {

  ProgressListener NONE = percent -> {};

  void onProgress(int percent);
}
