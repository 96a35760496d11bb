package org.jwtauth.registry;

// A named unit that the host pipeline can construct through the ExecutorRegistry.
public interface Executor {

  String getName();

  ExecutorType getType();
}
