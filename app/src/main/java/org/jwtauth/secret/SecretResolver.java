package org.jwtauth.secret;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.atomic.AtomicReference;
import javax.annotation.Nullable;
import lombok.extern.slf4j.Slf4j;
import org.jwtauth.config.ConfigProvider;
import org.jwtauth.exception.JwtErrorKind;
import org.jwtauth.exception.JwtException;
import org.jwtauth.registry.ExecutorConfig;

/**
 * Resolves the key material and options of one executor instance.
 *
 * <p>The secret is taken from the first source that yields a non-empty value:
 *
 * <ol>
 *   <li>{@code jwtSecret} of the executor configuration,
 *   <li>the key file named by {@code jwtCert}, from the executor configuration or else from the
 *       host configuration,
 *   <li>{@code jwtSecret} of the host configuration.
 * </ol>
 *
 * <p>A resolved secret is cached for the lifetime of the instance. Concurrent callers that arrive
 * while a resolution is running wait for it and get its outcome; a failed resolution is not cached
 * and is attempted again by the next caller.
 *
 * @param <O> options type, verification or signing options
 */
@Slf4j
public class SecretResolver<O> {

  private final ConfigProvider configProvider;
  private final String optionsKey;
  private final Class<O> optionsType;
  private final O defaultOptions;

  // Executor config values, converted on first use.
  @Nullable
  private final Object inlineSecret;
  @Nullable
  private final Object inlineOptions;
  // Cleared once the file has been read, so it is never read again.
  @Nullable
  private Object certPath;

  private volatile byte[] resolvedSecret;
  private final AtomicReference<CompletableFuture<byte[]>> inFlight = new AtomicReference<>();

  private final Object optionsLock = new Object();
  private volatile O resolvedOptions;

  public SecretResolver(ExecutorConfig executorConfig, ConfigProvider configProvider,
      String optionsKey, Class<O> optionsType, O defaultOptions) {
    this.configProvider = configProvider;
    this.optionsKey = optionsKey;
    this.optionsType = optionsType;
    this.defaultOptions = defaultOptions;
    this.inlineSecret = executorConfig.get(ConfigProvider.JWT_SECRET).orElse(null);
    this.certPath = executorConfig.get(ConfigProvider.JWT_CERT).orElse(null);
    this.inlineOptions = executorConfig.get(optionsKey).orElse(null);
  }

  public ResolvedSecret<O> resolve() {
    byte[] secret = resolveSecret();
    return new ResolvedSecret<>(secret, resolveOptions());
  }

  /**
   * Returns the options of the executor config, or else looks them up in the host configuration.
   * Converted options are cached; a conversion failure is not.
   *
   * @throws IllegalArgumentException if the configured options cannot be converted
   */
  public O resolveOptions() {
    O options = resolvedOptions;
    if (options != null) {
      return options;
    }
    synchronized (optionsLock) {
      if (resolvedOptions == null) {
        // Explicit options never need a lookup.
        Optional<Object> configured = inlineOptions != null
            ? Optional.of(inlineOptions)
            : configProvider.getConfig(optionsKey);
        resolvedOptions = configured
            .map(value -> OptionsConverter.convert(value, optionsType))
            .orElse(defaultOptions);
      }
      return resolvedOptions;
    }
  }

  /**
   * Returns the secret, resolving it on first use.
   *
   * @throws JwtException {@code NO_SECRET_CONFIGURED} or {@code SECRET_FILE_UNREADABLE}
   * @throws IllegalArgumentException if a configured secret or cert has an unsupported type
   */
  public byte[] resolveSecret() {
    byte[] cached = resolvedSecret;
    if (cached != null) {
      return cached;
    }

    CompletableFuture<byte[]> resolution = new CompletableFuture<>();
    CompletableFuture<byte[]> running = inFlight.compareAndExchange(null, resolution);
    if (running != null) {
      return await(running);
    }

    try {
      // A resolution may have completed between the cache check and taking the slot.
      byte[] secret = resolvedSecret != null ? resolvedSecret : loadSecret();
      resolvedSecret = secret;
      resolution.complete(secret);
      return secret;
    } catch (RuntimeException e) {
      resolution.completeExceptionally(e);
      throw e;
    } finally {
      inFlight.compareAndSet(resolution, null);
    }
  }

  private byte[] loadSecret() {
    byte[] inline = inlineSecret != null ? toSecretBytes(inlineSecret) : null;
    if (inline != null) {
      return inline;
    }

    String path = certPath != null ? toCertPath(certPath) : null;
    if (path == null) {
      path = configProvider.getConfig(ConfigProvider.JWT_CERT).map(SecretResolver::toCertPath)
          .orElse(null);
    }
    if (path != null) {
      byte[] fileContent = readKeyFile(path);
      certPath = null;
      if (fileContent.length > 0) {
        return fileContent;
      }
      log.warn("Key file {} is empty, falling back to configured {}", path,
          ConfigProvider.JWT_SECRET);
    }

    Optional<byte[]> configured = configProvider.getConfig(ConfigProvider.JWT_SECRET)
        .map(SecretResolver::toSecretBytes);
    return configured.orElseThrow(() -> new JwtException(JwtErrorKind.NO_SECRET_CONFIGURED,
        "No jwt secret or cert provided."));
  }

  private static byte[] readKeyFile(String path) {
    try {
      byte[] content = Files.readAllBytes(Path.of(path));
      log.info("Read jwt key material from {}", path);
      return content;
    } catch (IOException | InvalidPathException | SecurityException e) {
      throw new JwtException(JwtErrorKind.SECRET_FILE_UNREADABLE,
          "Unable to read jwt key file " + path, e);
    }
  }

  private static byte[] await(CompletableFuture<byte[]> running) {
    try {
      return running.join();
    } catch (CompletionException e) {
      if (e.getCause() instanceof RuntimeException) {
        throw (RuntimeException) e.getCause();
      }
      throw e;
    }
  }

  @Nullable
  private static byte[] toSecretBytes(Object value) {
    byte[] bytes;
    if (value instanceof byte[]) {
      bytes = ((byte[]) value).clone();
    } else if (value instanceof String) {
      bytes = ((String) value).getBytes(StandardCharsets.UTF_8);
    } else {
      throw new IllegalArgumentException(
          "Unsupported jwt secret type: " + value.getClass().getName());
    }
    return bytes.length == 0 ? null : bytes;
  }

  @Nullable
  private static String toCertPath(Object value) {
    if (value instanceof Path) {
      return value.toString();
    }
    if (value instanceof String) {
      String path = ((String) value).trim();
      return path.isEmpty() ? null : path;
    }
    throw new IllegalArgumentException("Unsupported jwt cert type: " + value.getClass().getName());
  }
}
