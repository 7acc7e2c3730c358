package com.codeheadsystems.onyx.testserver;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.net.InetAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.net.SocketException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Line-based broadcast relay for local runs and tests.
 * <p>
 * Every line received from any client is written, unchanged, to every connected client including
 * the one that sent it. Lines are never parsed, so the relay learns nothing but who is connected.
 * A client whose write fails is dropped.
 */
public class RelayServer implements AutoCloseable {

  private static final Logger log = LoggerFactory.getLogger(RelayServer.class);

  /**
   * The default relay port.
   */
  public static final int DEFAULT_PORT = 8888;

  private static final int BACKLOG = 50;

  private final String host;
  private final int requestedPort;
  private final List<Connection> connections = new CopyOnWriteArrayList<>();
  private final AtomicInteger connectionCounter = new AtomicInteger();

  private volatile ServerSocket serverSocket;

  /**
   * Instantiates a new Relay server.
   *
   * @param host the bind address
   * @param port the port; 0 picks an ephemeral port
   */
  public RelayServer(final String host, final int port) {
    log.info("RelayServer({}:{})", host, port);
    this.host = host;
    this.requestedPort = port;
  }

  /**
   * Binds and starts accepting clients on a background thread.
   *
   * @return this relay server
   * @throws IOException if the address cannot be bound
   */
  public RelayServer start() throws IOException {
    if (serverSocket != null) {
      throw new IllegalStateException("Relay already started");
    }
    serverSocket = new ServerSocket(requestedPort, BACKLOG, InetAddress.getByName(host));
    log.info("Relay serving on {}:{}", host, serverSocket.getLocalPort());
    final Thread acceptThread = new Thread(this::acceptLoop, "onyx-relay-accept");
    acceptThread.setDaemon(true);
    acceptThread.start();
    return this;
  }

  /**
   * The bound port.
   *
   * @return the port
   */
  public int port() {
    if (serverSocket == null) {
      throw new IllegalStateException("Relay not started");
    }
    return serverSocket.getLocalPort();
  }

  /**
   * Clients currently connected.
   *
   * @return the count
   */
  public int clientCount() {
    return connections.size();
  }

  private void acceptLoop() {
    final ServerSocket listening = serverSocket;
    while (!listening.isClosed()) {
      try {
        final Socket socket = listening.accept();
        final Connection connection = new Connection(connectionCounter.incrementAndGet(), socket);
        connections.add(connection);
        log.info("[+] client {} from {} ({} connected)", connection.number, socket.getRemoteSocketAddress(),
            connections.size());
        final Thread readerThread = new Thread(() -> readLoop(connection), "onyx-relay-client-" + connection.number);
        readerThread.setDaemon(true);
        readerThread.start();
      } catch (SocketException e) {
        log.debug("Accept loop ending: {}", e.getMessage());
      } catch (IOException e) {
        log.warn("Accept failed: {}", e.getMessage());
      }
    }
  }

  private void readLoop(final Connection connection) {
    try (BufferedReader reader = new BufferedReader(
        new InputStreamReader(connection.socket.getInputStream(), StandardCharsets.UTF_8))) {
      String line;
      while ((line = reader.readLine()) != null) {
        broadcast(line);
      }
    } catch (IOException e) {
      log.debug("client {} read ended: {}", connection.number, e.getMessage());
    } finally {
      drop(connection);
    }
  }

  private void broadcast(final String line) {
    log.trace("broadcast {} chars to {} clients", line.length(), connections.size());
    for (Connection connection : connections) {
      if (!connection.write(line)) {
        drop(connection);
      }
    }
  }

  private void drop(final Connection connection) {
    if (connections.remove(connection)) {
      log.info("[-] client {} ({} connected)", connection.number, connections.size());
    }
    connection.close();
  }

  /**
   * Stops accepting and disconnects every client.
   */
  @Override
  public void close() {
    final ServerSocket listening = serverSocket;
    if (listening == null || listening.isClosed()) {
      return;
    }
    log.info("Relay stopping");
    try {
      listening.close();
    } catch (IOException e) {
      log.warn("Error closing relay socket: {}", e.getMessage());
    }
    connections.forEach(this::drop);
  }

  private static final class Connection {
    private final int number;
    private final Socket socket;
    private final BufferedWriter writer;

    private Connection(final int number, final Socket socket) throws IOException {
      this.number = number;
      this.socket = socket;
      this.writer = new BufferedWriter(new OutputStreamWriter(socket.getOutputStream(), StandardCharsets.UTF_8));
    }

    private synchronized boolean write(final String line) {
      try {
        writer.write(line);
        writer.write('\n');
        writer.flush();
        return true;
      } catch (IOException e) {
        log.debug("client {} write failed: {}", number, e.getMessage());
        return false;
      }
    }

    private void close() {
      try {
        socket.close();
      } catch (IOException e) {
        log.debug("client {} close failed: {}", number, e.getMessage());
      }
    }
  }
}
