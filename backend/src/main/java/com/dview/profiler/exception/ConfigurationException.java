package com.dview.profiler.exception;

/** Invalid profiling settings such as a non-positive concurrency or row cap. */
public class ConfigurationException extends RuntimeException {

  public ConfigurationException(String message) {
    super(message);
  }
}
