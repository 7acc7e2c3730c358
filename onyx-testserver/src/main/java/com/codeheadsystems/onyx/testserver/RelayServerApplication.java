package com.codeheadsystems.onyx.testserver;

import java.util.concurrent.CountDownLatch;

/**
 * Runs a {@link RelayServer} until the process is stopped.
 *
 * <pre>
 * Usage:
 *   RelayServerApplication [--host &lt;address&gt;] [--port &lt;port&gt;]
 * </pre>
 * Defaults to 127.0.0.1:8888. Bind to 0.0.0.0 to accept peers from the LAN.
 */
public class RelayServerApplication {

  private static final String DEFAULT_HOST = "127.0.0.1";

  /**
   * The entry point of application.
   *
   * @param args the input arguments
   * @throws Exception the exception
   */
  public static void main(String[] args) throws Exception {
    String host = DEFAULT_HOST;
    int port = RelayServer.DEFAULT_PORT;
    for (int i = 0; i < args.length; i++) {
      if ("--host".equals(args[i]) && i + 1 < args.length) {
        host = args[++i];
      } else if ("--port".equals(args[i]) && i + 1 < args.length) {
        port = Integer.parseInt(args[++i]);
      } else {
        System.err.println("Usage: RelayServerApplication [--host <address>] [--port <port>]");
        System.exit(1);
      }
    }

    RelayServer server = new RelayServer(host, port).start();
    CountDownLatch stopped = new CountDownLatch(1);
    Runtime.getRuntime().addShutdownHook(new Thread(() -> {
      server.close();
      stopped.countDown();
    }, "onyx-relay-shutdown"));
    System.out.println("Onyx relay serving on " + host + ":" + server.port());
    stopped.await();
  }
}
