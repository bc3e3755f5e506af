package com.dview.profiler.dto.table;

/** Native storage tag a data source attaches to a column before any inference runs. */
public enum StorageType {
  INTEGER,
  FLOAT,
  DATETIME,
  BOOLEAN,
  TEXT
}
