package org.jwtauth.registry;

import java.util.Map;
import java.util.Optional;
import lombok.Builder;
import lombok.Singular;
import lombok.ToString;
import lombok.Value;

// Per-instance configuration bag handed to an executor constructor. Values present here take
// precedence over the host configuration.
@Value
@Builder
public class ExecutorConfig {

  @Singular
  @ToString.Exclude
  Map<String, Object> values;

  public static ExecutorConfig empty() {
    return ExecutorConfig.builder().build();
  }

  public static ExecutorConfig of(Map<String, ?> values) {
    return ExecutorConfig.builder().values(values).build();
  }

  public Optional<Object> get(String key) {
    return Optional.ofNullable(values.get(key));
  }
}
