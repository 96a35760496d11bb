package org.jwtauth.config;

import jakarta.inject.Inject;
import java.io.IOException;
import java.io.InputStream;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Properties;
import java.util.function.Function;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;

// Reads configuration from environment variables, falling back to `application.properties` on the
// classpath.
//
// Besides plain keys, a key can be given as a group of `<key>.<field>` properties, e.g.
// `jwtVerifyOptions.algorithms=HS256,HS512`. The group is returned as a map; comma separated values
// become lists.
@Slf4j
public class PropertiesConfigProvider implements ConfigProvider {

  private static final String APPLICATION_PROPERTIES = "application.properties";

  private final Properties applicationProperties;
  private final Function<String, String> environment;

  @Inject
  public PropertiesConfigProvider() {
    this(loadApplicationProperties(), System::getenv);
  }

  public PropertiesConfigProvider(Properties applicationProperties,
      Function<String, String> environment) {
    this.applicationProperties = applicationProperties;
    this.environment = environment;
  }

  @Override
  public Optional<Object> getConfig(String key) {
    String value = getEnvOrConfigProperty(key);
    if (!isBlank(value)) {
      return Optional.of(value);
    }

    Map<String, Object> group = getPropertyGroup(key);
    if (!group.isEmpty()) {
      return Optional.of(group);
    }
    return Optional.empty();
  }

  // Retrieves the value of a specified property, first checking environment variables,
  // then falling back to application properties if the environment variable is not set.
  private String getEnvOrConfigProperty(String key) {
    String propertyValue = environment.apply(key);
    if (isBlank(propertyValue)) {
      propertyValue = applicationProperties.getProperty(key);
    }
    return propertyValue;
  }

  private Map<String, Object> getPropertyGroup(String key) {
    String prefix = key + ".";
    Map<String, Object> group = new LinkedHashMap<>();
    for (String name : applicationProperties.stringPropertyNames()) {
      if (!name.startsWith(prefix)) {
        continue;
      }
      String field = name.substring(prefix.length());
      String value = getEnvOrConfigProperty(name);
      if (!field.isEmpty() && !isBlank(value)) {
        group.put(field, toValue(value));
      }
    }
    return group;
  }

  private static Object toValue(String value) {
    if (!value.contains(",")) {
      return value.trim();
    }
    return Arrays.stream(value.split(","))
        .map(String::trim)
        .filter(v -> !v.isEmpty())
        .collect(Collectors.toList());
  }

  private static boolean isBlank(String value) {
    return value == null || value.isBlank();
  }

  private static Properties loadApplicationProperties() {
    try (InputStream input = PropertiesConfigProvider.class.getClassLoader()
        .getResourceAsStream(APPLICATION_PROPERTIES)) {
      if (input == null) {
        throw new IllegalStateException(
            "Unable to find " + APPLICATION_PROPERTIES + " in resources");
      }
      Properties properties = new Properties();
      properties.load(input);
      log.debug("Loaded {} keys from {}", properties.size(), APPLICATION_PROPERTIES);
      return properties;
    } catch (IOException e) {
      throw new IllegalStateException(
          "Unable to read " + APPLICATION_PROPERTIES + " from resources", e);
    }
  }
}
