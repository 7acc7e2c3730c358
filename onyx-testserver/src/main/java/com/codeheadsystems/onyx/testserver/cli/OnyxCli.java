package com.codeheadsystems.onyx.testserver.cli;

import com.codeheadsystems.onyx.client.OnyxSession;
import com.codeheadsystems.onyx.client.config.OnyxClientConfig;
import com.codeheadsystems.onyx.client.model.ConnectionState;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Console chat client against a running relay.
 *
 * <pre>
 * Usage:
 *   OnyxCli [--host &lt;address&gt;] [--port &lt;port&gt;]
 * </pre>
 *
 * <p>Each line typed is encrypted for every peer known at that moment and sent. {@code /quit},
 * {@code /exit} or end of input closes the session.
 */
public class OnyxCli {

  private static final Logger log = LoggerFactory.getLogger(OnyxCli.class);

  private static final Set<String> QUIT_COMMANDS = Set.of("/quit", "/exit");

  private final OnyxSession session;
  private final BufferedReader input;
  private final PrintStream out;

  /**
   * Instantiates a new Onyx cli.
   *
   * @param session the session, not yet started
   * @param input   operator input
   * @param out     console output
   */
  public OnyxCli(final OnyxSession session, final BufferedReader input, final PrintStream out) {
    this.session = session;
    this.input = input;
    this.out = out;
  }

  /**
   * Main entry point.
   *
   * @param args command-line arguments
   */
  public static void main(String[] args) {
    final OnyxClientConfig config;
    try {
      config = OnyxClientConfig.fromArgs(args);
    } catch (IllegalArgumentException e) {
      System.err.println("Error: " + e.getMessage());
      System.err.println("Usage: OnyxCli [--host <address>] [--port <port>]");
      System.exit(1);
      return;
    }

    System.out.println("Relay : " + config.host() + ":" + config.port());
    final OnyxSession session = OnyxSession.create(config, new ConsoleSessionListener(System.out));
    System.out.println("ID    : " + session.identity().id());
    System.out.println();

    final BufferedReader stdin = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
    System.exit(new OnyxCli(session, stdin, System.out).run());
  }

  /**
   * Starts the session and submits input lines until quit or end of input, then closes it.
   *
   * @return the process exit code: 0, or 1 if the relay could not be reached
   */
  public int run() {
    try (OnyxSession s = session) {
      if (s.start().get() != ConnectionState.CONNECTED) {
        return 1;
      }
      String line;
      while ((line = input.readLine()) != null) {
        final String trimmed = line.trim();
        if (QUIT_COMMANDS.contains(trimmed)) {
          break;
        }
        if (trimmed.isEmpty()) {
          continue;
        }
        if (s.submit(line).get()) {
          out.println("[Me] " + line);
        }
      }
      return 0;
    } catch (IOException e) {
      log.error("Reading input failed", e);
      out.println("[ERROR] " + e.getMessage());
      return 1;
    } catch (ExecutionException e) {
      log.error("Session task failed", e.getCause());
      out.println("[ERROR] " + e.getCause().getMessage());
      return 1;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return 1;
    }
  }
}
