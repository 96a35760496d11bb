package org.jwtauth.registry;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import org.jwtauth.auth.JwtAuthenticator;
import org.jwtauth.config.ConfigProvider;
import org.jwtauth.sign.JwtSigner;

// Maps executor names to their constructors. Every constructed executor shares the host
// ConfigProvider.
public class ExecutorRegistry {

  private final Map<String, ExecutorType> executorInfos = new LinkedHashMap<>();
  private final Map<String, Function<ExecutorConfig, Executor>> constructors =
      new LinkedHashMap<>();

  public ExecutorRegistry(ConfigProvider configProvider) {
    register(JwtAuthenticator.NAME, ExecutorType.REQUEST_HANDLER,
        config -> new JwtAuthenticator(config, configProvider));
    register(JwtSigner.NAME, ExecutorType.SERVICE,
        config -> new JwtSigner(config, configProvider));
  }

  // Returns a new executor for `name`, or empty if no executor of that name is known.
  public Optional<Executor> getExecutor(String name, ExecutorConfig config) {
    return Optional.ofNullable(constructors.get(name))
        .map(constructor -> constructor.apply(config));
  }

  public Map<String, ExecutorType> getExecutorInfos() {
    return Map.copyOf(executorInfos);
  }

  private void register(String name, ExecutorType type,
      Function<ExecutorConfig, Executor> constructor) {
    executorInfos.put(name, type);
    constructors.put(name, constructor);
  }
}
