package com.codeheadsystems.onyx.integration;

import static com.codeheadsystems.onyx.integration.RecordingSessionListener.awaitCondition;
import static org.assertj.core.api.Assertions.assertThat;

import com.codeheadsystems.onyx.client.OnyxSession;
import com.codeheadsystems.onyx.client.config.OnyxClientConfig;
import com.codeheadsystems.onyx.client.model.ConnectionState;
import com.codeheadsystems.onyx.client.model.NoticeSeverity;
import com.codeheadsystems.onyx.crypto.EnvelopeEngine;
import com.codeheadsystems.onyx.crypto.Identity;
import com.codeheadsystems.onyx.crypto.PeerDirectory;
import com.codeheadsystems.onyx.crypto.config.OnyxCryptoConfig;
import com.codeheadsystems.onyx.model.ChatFrame;
import com.codeheadsystems.onyx.model.EnvelopePayload;
import com.codeheadsystems.onyx.model.FrameCodec;
import com.codeheadsystems.onyx.testserver.RelayServer;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/**
 * Real sessions talking through a real relay on an ephemeral port.
 */
class GroupChatIntegrationTest {

  private static final FrameCodec CODEC = new FrameCodec(new ObjectMapper());

  private RelayServer relay;
  private final List<OnyxSession> sessions = new ArrayList<>();

  @BeforeEach
  void setUp() throws IOException {
    relay = new RelayServer("127.0.0.1", 0).start();
  }

  @AfterEach
  void tearDown() {
    sessions.forEach(OnyxSession::close);
    relay.close();
  }

  private OnyxSession join(RecordingSessionListener listener) throws Exception {
    OnyxSession session = OnyxSession.create(new OnyxClientConfig("127.0.0.1", relay.port()), listener);
    sessions.add(session);
    assertThat(session.start().get(10, TimeUnit.SECONDS)).isEqualTo(ConnectionState.CONNECTED);
    return session;
  }

  @Test
  void twoPeers_exchangeKeysAndMessages() throws Exception {
    RecordingSessionListener aliceEvents = new RecordingSessionListener();
    RecordingSessionListener bobEvents = new RecordingSessionListener();
    OnyxSession alice = join(aliceEvents);
    OnyxSession bob = join(bobEvents);

    awaitCondition("alice knows bob", () -> alice.directory().has(bob.identity().id()));
    awaitCondition("bob knows alice", () -> bob.directory().has(alice.identity().id()));

    assertThat(aliceEvents.hasNotice(NoticeSeverity.INFO, "New Peer: " + bob.identity().shortId())).isTrue();
    assertThat(bobEvents.hasNotice(NoticeSeverity.INFO, "New Peer: " + alice.identity().shortId())).isTrue();

    assertThat(alice.submit("hello").get(10, TimeUnit.SECONDS)).isTrue();
    awaitCondition("bob reads hello", () -> bobEvents.hasMessage(alice.identity().id(), "hello"));

    assertThat(bob.submit("hi alice").get(10, TimeUnit.SECONDS)).isTrue();
    awaitCondition("alice reads reply", () -> aliceEvents.hasMessage(bob.identity().id(), "hi alice"));

    assertThat(alice.directory().size()).isEqualTo(1);
    assertThat(bob.directory().size()).isEqualTo(1);
    assertThat(alice.participantCount()).isEqualTo(2);
    assertThat(aliceEvents.messages).extracting(RecordingSessionListener.PeerMessage::plaintext)
        .containsExactly("hi alice");
    assertThat(bobEvents.messages).extracting(RecordingSessionListener.PeerMessage::plaintext)
        .containsExactly("hello");
  }

  @Test
  void threePeers_everyoneReadsEveryone() throws Exception {
    RecordingSessionListener aliceEvents = new RecordingSessionListener();
    RecordingSessionListener bobEvents = new RecordingSessionListener();
    RecordingSessionListener carolEvents = new RecordingSessionListener();
    OnyxSession alice = join(aliceEvents);
    OnyxSession bob = join(bobEvents);
    OnyxSession carol = join(carolEvents);

    awaitCondition("full mesh", () -> alice.directory().size() == 2
        && bob.directory().size() == 2
        && carol.directory().size() == 2);

    carol.submit("ünïcödé ✓").get(10, TimeUnit.SECONDS);

    awaitCondition("alice reads carol", () -> aliceEvents.hasMessage(carol.identity().id(), "ünïcödé ✓"));
    awaitCondition("bob reads carol", () -> bobEvents.hasMessage(carol.identity().id(), "ünïcödé ✓"));
    assertThat(carolEvents.messages).isEmpty();
  }

  @Test
  void alone_messageStillSentWithWarning() throws Exception {
    RecordingSessionListener events = new RecordingSessionListener();
    OnyxSession alone = join(events);

    assertThat(alone.submit("anyone?").get(10, TimeUnit.SECONDS)).isTrue();

    assertThat(events.hasNotice(NoticeSeverity.WARNING,
        "No peers connected. Message sent but no one can decrypt.")).isTrue();
    assertThat(alone.participantCount()).isEqualTo(1);
  }

  @Test
  void foreignAndGarbageFrames_doNotBreakTheSession() throws Exception {
    RecordingSessionListener aliceEvents = new RecordingSessionListener();
    RecordingSessionListener bobEvents = new RecordingSessionListener();
    OnyxSession alice = join(aliceEvents);
    OnyxSession bob = join(bobEvents);
    awaitCondition("alice knows bob", () -> alice.directory().has(bob.identity().id()));

    Identity mallory = Identity.generate(OnyxCryptoConfig.DEFAULT);
    Identity stranger = Identity.generate(OnyxCryptoConfig.DEFAULT);
    PeerDirectory strangerOnly = new PeerDirectory();
    strangerOnly.importAndInsert(stranger.id(), stranger.publicKeyPem());
    ChatFrame notForAlice = new ChatFrame(mallory.id(),
        new EnvelopePayload(new EnvelopeEngine(OnyxCryptoConfig.DEFAULT).encrypt("secret", strangerOnly)));

    try (Socket raw = new Socket("127.0.0.1", relay.port());
         Writer writer = new OutputStreamWriter(raw.getOutputStream(), StandardCharsets.UTF_8)) {
      writer.write("this is not json\n");
      writer.write("{\"type\":\"presence\"}\n");
      writer.write(CODEC.encode(notForAlice) + "\n");
      writer.flush();

      String unreadable = "Unreadable msg from " + mallory.shortId();
      awaitCondition("alice muted notice", () -> aliceEvents.hasNotice(NoticeSeverity.MUTED, unreadable));
    }

    bob.submit("still working").get(10, TimeUnit.SECONDS);
    awaitCondition("alice reads bob", () -> aliceEvents.hasMessage(bob.identity().id(), "still working"));
    assertThat(aliceEvents.messages).extracting(RecordingSessionListener.PeerMessage::plaintext)
        .doesNotContain("secret");
  }

  @Test
  void relayStops_sessionsDisconnect() throws Exception {
    RecordingSessionListener events = new RecordingSessionListener();
    OnyxSession alice = join(events);

    relay.close();

    awaitCondition("disconnected", () -> alice.state() == ConnectionState.DISCONNECTED);
    assertThat(events.states).containsExactly(
        ConnectionState.CONNECTING, ConnectionState.CONNECTED, ConnectionState.DISCONNECTED);
    assertThat(alice.submit("into the void").get(10, TimeUnit.SECONDS)).isFalse();
    assertThat(events.hasNotice(NoticeSeverity.ERROR, "Not connected. Message not sent.")).isTrue();
  }
}
