package com.codeheadsystems.onyx.testserver.cli;

import static org.assertj.core.api.Assertions.assertThat;

import com.codeheadsystems.onyx.client.model.ConnectionState;
import com.codeheadsystems.onyx.client.model.NoticeSeverity;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ConsoleSessionListenerTest {

  private ByteArrayOutputStream output;
  private ConsoleSessionListener listener;

  @BeforeEach
  void setUp() {
    output = new ByteArrayOutputStream();
    listener = new ConsoleSessionListener(new PrintStream(output, true, StandardCharsets.UTF_8));
  }

  private String printed() {
    return output.toString(StandardCharsets.UTF_8);
  }

  @Test
  void notices_taggedBySeverity() {
    listener.onSystemNotice(NoticeSeverity.INFO, "New Peer: 1a2b3c4d");
    listener.onSystemNotice(NoticeSeverity.MUTED, "Unreadable msg from 1a2b3c4d");
    listener.onSystemNotice(NoticeSeverity.WARNING, "No peers connected.");
    listener.onSystemNotice(NoticeSeverity.ERROR, "Send failed");

    assertThat(printed().lines()).containsExactly(
        "[SYSTEM] New Peer: 1a2b3c4d",
        "[SYSTEM] Unreadable msg from 1a2b3c4d",
        "[WARN] No peers connected.",
        "[ERROR] Send failed");
  }

  @Test
  void peerMessage_prefixedWithShortId() {
    listener.onPeerMessage("1a2b3c4d-0000-4000-8000-000000000000", "hello");

    assertThat(printed().lines()).containsExactly("[1a2b3c4d] hello");
  }

  @Test
  void connectionStates() {
    listener.onConnectionStateChange(ConnectionState.CONNECTING);
    listener.onConnectionStateChange(ConnectionState.CONNECTED);
    listener.onConnectionStateChange(ConnectionState.DISCONNECTED);
    listener.onConnectionStateChange(ConnectionState.FAILED);

    assertThat(printed().lines()).containsExactly(
        "[SYSTEM] Connecting...",
        "[SYSTEM] Connected.",
        "[SYSTEM] Disconnected.",
        "[ERROR] Connection refused.");
  }
}
