package com.codeheadsystems.onyx.client.accessor;

import com.codeheadsystems.onyx.client.config.OnyxClientConfig;
import com.codeheadsystems.onyx.client.exceptions.RelayAccessorException;
import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.atomic.AtomicBoolean;
import javax.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link RelayAccessor} over a plain TCP socket carrying newline-delimited UTF-8 frames.
 * A daemon thread reads lines and hands them to the listener one at a time.
 */
public class SocketRelayAccessor implements RelayAccessor {
  private static final Logger log = LoggerFactory.getLogger(SocketRelayAccessor.class);

  private final OnyxClientConfig config;
  private final AtomicBoolean open = new AtomicBoolean(false);
  private final AtomicBoolean closeReported = new AtomicBoolean(false);

  private volatile Socket socket;
  private BufferedWriter writer;

  /**
   * Instantiates a new Socket relay accessor.
   *
   * @param config the client config holding the relay address
   */
  @Inject
  public SocketRelayAccessor(final OnyxClientConfig config) {
    log.info("SocketRelayAccessor({}:{})", config.host(), config.port());
    this.config = config;
  }

  @Override
  public void open(final Listener listener) {
    if (socket != null) {
      throw new IllegalStateException("Relay connection already opened");
    }
    final Socket connection = new Socket();
    final BufferedReader reader;
    try {
      connection.connect(new InetSocketAddress(config.host(), config.port()), config.connectTimeoutMillis());
      reader = new BufferedReader(new InputStreamReader(connection.getInputStream(), StandardCharsets.UTF_8));
      writer = new BufferedWriter(new OutputStreamWriter(connection.getOutputStream(), StandardCharsets.UTF_8));
    } catch (IOException e) {
      closeQuietly(connection);
      throw new RelayAccessorException("Unable to connect to relay " + config.host() + ":" + config.port(), e);
    }
    socket = connection;
    open.set(true);
    log.info("Connected to relay {}", connection.getRemoteSocketAddress());

    final Thread readerThread = new Thread(() -> readLoop(reader, listener), "onyx-relay-reader");
    readerThread.setDaemon(true);
    readerThread.start();
  }

  private void readLoop(final BufferedReader reader, final Listener listener) {
    Throwable cause = null;
    try {
      String line;
      while ((line = reader.readLine()) != null) {
        log.trace("received {} chars", line.length());
        listener.onLine(line);
      }
      log.info("Relay closed the connection");
    } catch (IOException e) {
      if (open.get()) {
        log.warn("Relay read failed: {}", e.getMessage());
        cause = e;
      }
    } finally {
      open.set(false);
      closeQuietly(socket);
      if (closeReported.compareAndSet(false, true)) {
        listener.onClosed(cause);
      }
    }
  }

  @Override
  public synchronized void send(final String line) {
    if (!open.get()) {
      throw new RelayAccessorException("Relay connection is closed", null);
    }
    try {
      writer.write(line);
      writer.write('\n');
      writer.flush();
    } catch (IOException e) {
      open.set(false);
      closeQuietly(socket);
      throw new RelayAccessorException("Write to relay failed", e);
    }
  }

  @Override
  public boolean isOpen() {
    return open.get();
  }

  @Override
  public void close() {
    if (open.compareAndSet(true, false)) {
      log.info("Closing relay connection");
      closeQuietly(socket);
    }
  }

  private static void closeQuietly(final Socket target) {
    if (target == null) {
      return;
    }
    try {
      target.close();
    } catch (IOException e) {
      log.debug("Error closing relay socket", e);
    }
  }
}
