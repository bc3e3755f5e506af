package com.dview.profiler.service.source;

import java.sql.Connection;
import java.sql.SQLException;

/** Opens a fresh JDBC connection for each unit of work. */
@FunctionalInterface
public interface ConnectionFactory {

  Connection open() throws SQLException;
}
