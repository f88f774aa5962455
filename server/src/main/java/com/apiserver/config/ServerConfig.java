package com.apiserver.config;

import com.apiserver.hal.CollectionMetadata;
import com.google.common.base.MoreObjects;
import com.google.common.base.Strings;
import com.google.common.primitives.Ints;
import java.util.Map;
import org.tinylog.Logger;

/**
 * Configuration record for the REST server.
 *
 * @param port The port the HTTP server listens on
 * @param pageSize The default number of entities per collection page
 */
public record ServerConfig(int port, int pageSize) {

  public static final String PORT_VARIABLE = "API_PORT";
  public static final String PAGE_SIZE_VARIABLE = "API_PAGE_SIZE";
  public static final int DEFAULT_PORT = 8080;

  public ServerConfig {
    if (port < 0 || port > 65535) {
      throw new IllegalArgumentException("port out of range: " + port);
    }
    if (pageSize < 1) {
      throw new IllegalArgumentException("pageSize must be >= 1: " + pageSize);
    }
  }

  /** Reads the configuration from the process environment. */
  public static ServerConfig fromEnvironment() {
    return fromVariables(System.getenv());
  }

  /**
   * Reads the configuration from the given variables. Missing or malformed values fall back to
   * their defaults.
   */
  public static ServerConfig fromVariables(Map<String, String> variables) {
    return new ServerConfig(
        readInt(variables, PORT_VARIABLE, DEFAULT_PORT, 0, 65535),
        readInt(
            variables,
            PAGE_SIZE_VARIABLE,
            CollectionMetadata.DEFAULT_PAGE_SIZE,
            1,
            Integer.MAX_VALUE));
  }

  private static int readInt(
      Map<String, String> variables, String name, int defaultValue, int min, int max) {
    String raw = variables.get(name);
    if (Strings.isNullOrEmpty(raw)) {
      return defaultValue;
    }
    Integer value = Ints.tryParse(raw.trim());
    if (value == null || value < min || value > max) {
      Logger.warn("Invalid {} value: {}, using {}", name, raw, defaultValue);
      return defaultValue;
    }
    return value;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("port", port)
        .add("pageSize", pageSize)
        .toString();
  }
}
