package org.jwtauth.registry;

public enum ExecutorType {
  // Runs on every inbound request before it is handled.
  REQUEST_HANDLER,
  // Called explicitly by other executors or application code.
  SERVICE
}
