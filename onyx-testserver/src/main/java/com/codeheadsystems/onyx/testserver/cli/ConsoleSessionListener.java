package com.codeheadsystems.onyx.testserver.cli;

import com.codeheadsystems.onyx.client.SessionListener;
import com.codeheadsystems.onyx.client.model.ConnectionState;
import com.codeheadsystems.onyx.client.model.NoticeSeverity;
import com.codeheadsystems.onyx.crypto.Identity;
import java.io.PrintStream;

/**
 * Prints session events as tagged console lines: {@code [SYSTEM]}, {@code [WARN]}, {@code [ERROR]}
 * for notices and {@code [<short id>]} for peer messages.
 */
public class ConsoleSessionListener implements SessionListener {

  private final PrintStream out;

  /**
   * Instantiates a new Console session listener.
   *
   * @param out where to print
   */
  public ConsoleSessionListener(final PrintStream out) {
    this.out = out;
  }

  @Override
  public void onSystemNotice(final NoticeSeverity severity, final String text) {
    out.println(tag(severity) + " " + text);
  }

  @Override
  public void onPeerMessage(final String senderId, final String plaintext) {
    out.println("[" + Identity.shortId(senderId) + "] " + plaintext);
  }

  @Override
  public void onConnectionStateChange(final ConnectionState state) {
    switch (state) {
      case CONNECTED -> out.println("[SYSTEM] Connected.");
      case DISCONNECTED -> out.println("[SYSTEM] Disconnected.");
      case FAILED -> out.println("[ERROR] Connection refused.");
      default -> out.println("[SYSTEM] Connecting...");
    }
  }

  private static String tag(final NoticeSeverity severity) {
    return switch (severity) {
      case WARNING -> "[WARN]";
      case ERROR -> "[ERROR]";
      default -> "[SYSTEM]";
    };
  }
}
