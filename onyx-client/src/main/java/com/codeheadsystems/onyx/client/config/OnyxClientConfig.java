package com.codeheadsystems.onyx.client.config;

import com.codeheadsystems.onyx.crypto.config.OnyxCryptoConfig;

/**
 * Client-side configuration: where the relay is and how keys are generated.
 * <p>
 * The relay address comes from local configuration only; nothing is negotiated.
 *
 * @param host                 relay host name or address
 * @param port                 relay TCP port
 * @param connectTimeoutMillis TCP connect timeout; 0 waits indefinitely
 * @param cryptoConfig         key size and random source
 */
public record OnyxClientConfig(String host, int port, int connectTimeoutMillis, OnyxCryptoConfig cryptoConfig) {

  public static final String DEFAULT_HOST = "127.0.0.1";
  public static final int DEFAULT_PORT = 8888;
  public static final int DEFAULT_CONNECT_TIMEOUT_MILLIS = 5000;

  /**
   * Local relay on the default port.
   */
  public static final OnyxClientConfig DEFAULT = new OnyxClientConfig(
      DEFAULT_HOST, DEFAULT_PORT, DEFAULT_CONNECT_TIMEOUT_MILLIS, OnyxCryptoConfig.DEFAULT);

  /**
   * Validates host, port and timeout.
   */
  public OnyxClientConfig {
    if (host == null || host.isBlank()) {
      throw new IllegalArgumentException("Relay host is required");
    }
    if (port < 1 || port > 65535) {
      throw new IllegalArgumentException("Relay port out of range: " + port);
    }
    if (connectTimeoutMillis < 0) {
      throw new IllegalArgumentException("Connect timeout must not be negative: " + connectTimeoutMillis);
    }
    if (cryptoConfig == null) {
      throw new IllegalArgumentException("cryptoConfig is required");
    }
  }

  /**
   * Convenience constructor with the default timeout and crypto settings.
   *
   * @param host the host
   * @param port the port
   */
  public OnyxClientConfig(String host, int port) {
    this(host, port, DEFAULT_CONNECT_TIMEOUT_MILLIS, OnyxCryptoConfig.DEFAULT);
  }

  /**
   * Builds a config from {@code --host <h>} and {@code --port <p>} arguments. Other arguments are
   * ignored.
   *
   * @param args the command-line arguments
   * @return the onyx client config
   * @throws IllegalArgumentException if the port is not a number or out of range
   */
  public static OnyxClientConfig fromArgs(String[] args) {
    String host = DEFAULT_HOST;
    int port = DEFAULT_PORT;
    for (int i = 0; i < args.length; i++) {
      if ("--host".equals(args[i]) && i + 1 < args.length) {
        host = args[++i];
      } else if ("--port".equals(args[i]) && i + 1 < args.length) {
        String value = args[++i];
        try {
          port = Integer.parseInt(value);
        } catch (NumberFormatException e) {
          throw new IllegalArgumentException("Invalid port: " + value, e);
        }
      }
    }
    return new OnyxClientConfig(host, port);
  }
}
