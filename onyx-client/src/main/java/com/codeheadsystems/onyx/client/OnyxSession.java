package com.codeheadsystems.onyx.client;

import com.codeheadsystems.onyx.client.accessor.RelayAccessor;
import com.codeheadsystems.onyx.client.accessor.SocketRelayAccessor;
import com.codeheadsystems.onyx.client.config.OnyxClientConfig;
import com.codeheadsystems.onyx.client.exceptions.RelayAccessorException;
import com.codeheadsystems.onyx.client.manager.HandshakeManager;
import com.codeheadsystems.onyx.client.manager.MessageManager;
import com.codeheadsystems.onyx.client.model.ConnectionState;
import com.codeheadsystems.onyx.client.model.NoticeSeverity;
import com.codeheadsystems.onyx.crypto.EnvelopeEngine;
import com.codeheadsystems.onyx.crypto.Identity;
import com.codeheadsystems.onyx.crypto.PeerDirectory;
import com.codeheadsystems.onyx.crypto.exceptions.EnvelopeException;
import com.codeheadsystems.onyx.model.ChatFrame;
import com.codeheadsystems.onyx.model.Frame;
import com.codeheadsystems.onyx.model.FrameCodec;
import com.codeheadsystems.onyx.model.HandshakeFrame;
import com.codeheadsystems.onyx.model.UnknownFrame;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One participant's chat session against the relay.
 * <p>
 * Connection events, received lines and local submits are all queued onto a single worker thread
 * and each runs to completion before the next starts, so the peer directory is only ever touched
 * from that thread and every {@link SessionListener} callback arrives there too. On connect the
 * session announces itself; handshakes go to the {@link HandshakeManager}, chat frames to the
 * {@link MessageManager}, anything else is logged and dropped.
 */
@Singleton
public class OnyxSession implements RelayAccessor.Listener, AutoCloseable {

  private static final Logger log = LoggerFactory.getLogger(OnyxSession.class);

  private static final long SHUTDOWN_TIMEOUT_SECONDS = 5;

  private final Identity identity;
  private final PeerDirectory directory;
  private final FrameCodec frameCodec;
  private final HandshakeManager handshakeManager;
  private final MessageManager messageManager;
  private final RelayAccessor relayAccessor;
  private final SessionListener listener;
  private final ExecutorService executor;
  private final AtomicReference<ConnectionState> state = new AtomicReference<>(ConnectionState.DISCONNECTED);
  private final AtomicBoolean started = new AtomicBoolean(false);
  private final AtomicBoolean closed = new AtomicBoolean(false);

  /**
   * Instantiates a new Onyx session.
   *
   * @param identity         this participant's identity
   * @param directory        the peer directory
   * @param frameCodec       the frame codec
   * @param handshakeManager the handshake manager
   * @param messageManager   the message manager
   * @param relayAccessor    the relay transport
   * @param listener         the host hooks
   */
  @Inject
  public OnyxSession(final Identity identity,
                     final PeerDirectory directory,
                     final FrameCodec frameCodec,
                     final HandshakeManager handshakeManager,
                     final MessageManager messageManager,
                     final RelayAccessor relayAccessor,
                     final SessionListener listener) {
    log.info("OnyxSession({})", identity.id());
    this.identity = identity;
    this.directory = directory;
    this.frameCodec = frameCodec;
    this.handshakeManager = handshakeManager;
    this.messageManager = messageManager;
    this.relayAccessor = relayAccessor;
    this.listener = listener;
    this.executor = Executors.newSingleThreadExecutor(runnable -> {
      final Thread thread = new Thread(runnable, "onyx-session-" + identity.shortId());
      thread.setDaemon(true);
      return thread;
    });
  }

  /**
   * Wires a session by hand: a fresh identity, an empty directory and a socket transport to the
   * configured relay. Nothing is connected until {@link #start()}.
   *
   * @param config   the client config
   * @param listener the host hooks
   * @return the onyx session
   * @throws com.codeheadsystems.onyx.crypto.exceptions.KeyGenerationException if the identity cannot be created
   */
  public static OnyxSession create(final OnyxClientConfig config, final SessionListener listener) {
    final Identity identity = Identity.generate(config.cryptoConfig());
    final PeerDirectory directory = new PeerDirectory();
    final EnvelopeEngine envelopeEngine = new EnvelopeEngine(config.cryptoConfig());
    return new OnyxSession(
        identity,
        directory,
        new FrameCodec(new ObjectMapper()),
        new HandshakeManager(identity, directory, listener),
        new MessageManager(identity, directory, envelopeEngine, listener),
        new SocketRelayAccessor(config),
        listener);
  }

  /**
   * Connects to the relay and announces this participant. Received lines queue up behind the
   * announcement.
   *
   * @return the state reached: CONNECTED, or FAILED if the relay could not be reached
   */
  public Future<ConnectionState> start() {
    if (!started.compareAndSet(false, true)) {
      throw new IllegalStateException("Session already started");
    }
    return executor.submit(() -> {
      changeState(ConnectionState.CONNECTING);
      try {
        relayAccessor.open(this);
      } catch (RelayAccessorException e) {
        log.error("start: {}", e.getMessage(), e);
        listener.onSystemNotice(NoticeSeverity.ERROR, "Connection failed: " + e.getMessage());
        changeState(ConnectionState.FAILED);
        return ConnectionState.FAILED;
      }
      changeState(ConnectionState.CONNECTED);
      listener.onSystemNotice(NoticeSeverity.INFO, "Connected as " + identity.shortId());
      sendFrame(handshakeManager.announcement());
      return ConnectionState.CONNECTED;
    });
  }

  /**
   * Encrypts and sends a line typed by the operator. Blank input is ignored.
   *
   * @param plaintext the plaintext
   * @return true once the frame is handed to an open transport, false if nothing was sent
   */
  public Future<Boolean> submit(final String plaintext) {
    if (plaintext == null || plaintext.isBlank()) {
      return CompletableFuture.completedFuture(false);
    }
    try {
      return executor.submit(() -> send(plaintext));
    } catch (RejectedExecutionException e) {
      log.warn("submit: session closed, message dropped");
      return CompletableFuture.completedFuture(false);
    }
  }

  private boolean send(final String plaintext) {
    final ChatFrame frame;
    try {
      frame = messageManager.compose(plaintext);
    } catch (EnvelopeException e) {
      log.warn("send: unable to encrypt: {}", e.getMessage());
      listener.onSystemNotice(NoticeSeverity.ERROR, "Encryption failed: " + e.getMessage());
      return false;
    }
    return sendFrame(frame);
  }

  @Override
  public void onLine(final String line) {
    enqueue(() -> process(line));
  }

  @Override
  public void onClosed(final Throwable cause) {
    enqueue(() -> {
      if (changeState(ConnectionState.DISCONNECTED)) {
        if (cause == null) {
          listener.onSystemNotice(NoticeSeverity.INFO, "Disconnected from relay");
        } else {
          listener.onSystemNotice(NoticeSeverity.ERROR, "Connection lost: " + cause.getMessage());
        }
      }
    });
  }

  void process(final String line) {
    final Frame frame = frameCodec.decode(line);
    try {
      if (frame instanceof HandshakeFrame handshake) {
        log.debug("process: {}", handshakeManager.handle(handshake, this::sendFrame));
      } else if (frame instanceof ChatFrame chat) {
        log.debug("process: {}", messageManager.receive(chat));
      } else if (frame instanceof UnknownFrame unknown) {
        log.debug("process: discarding frame of type {}: {}", unknown.type(), unknown.reason());
      }
    } catch (RuntimeException e) {
      log.error("process: unexpected failure on {} frame", frame.type(), e);
      listener.onSystemNotice(NoticeSeverity.ERROR, "Failed to process " + frame.type() + " frame");
    }
  }

  /**
   * Hands a frame to the transport. Only chat frames, which the operator typed, produce notices;
   * a handshake that cannot go out is logged.
   */
  private boolean sendFrame(final Frame frame) {
    final boolean operatorMessage = frame instanceof ChatFrame;
    if (!relayAccessor.isOpen()) {
      log.warn("sendFrame: not connected, dropping {} frame", frame.type());
      if (operatorMessage) {
        listener.onSystemNotice(NoticeSeverity.ERROR, "Not connected. Message not sent.");
      }
      return false;
    }
    try {
      relayAccessor.send(frameCodec.encode(frame));
      return true;
    } catch (RelayAccessorException e) {
      log.warn("sendFrame: {} frame: {}", frame.type(), e.getMessage());
      if (operatorMessage) {
        listener.onSystemNotice(NoticeSeverity.ERROR, "Send failed: " + e.getMessage());
      }
      return false;
    }
  }

  private boolean changeState(final ConnectionState next) {
    final ConnectionState previous = state.getAndSet(next);
    if (previous == next) {
      return false;
    }
    log.info("Connection {} -> {}", previous, next);
    listener.onConnectionStateChange(next);
    return true;
  }

  private void enqueue(final Runnable task) {
    try {
      executor.execute(task);
    } catch (RejectedExecutionException e) {
      log.debug("Session closed; dropping event");
    }
  }

  /**
   * Completes once every task queued so far has run.
   *
   * @return the future
   */
  Future<?> drain() {
    return executor.submit(() -> { });
  }

  /**
   * This participant's identity.
   *
   * @return the identity
   */
  public Identity identity() {
    return identity;
  }

  /**
   * The peer directory.
   *
   * @return the peer directory
   */
  public PeerDirectory directory() {
    return directory;
  }

  /**
   * Peers known plus this participant.
   *
   * @return the int
   */
  public int participantCount() {
    return directory.size() + 1;
  }

  /**
   * The last connection state reported.
   *
   * @return the connection state
   */
  public ConnectionState state() {
    return state.get();
  }

  /**
   * Closes the transport, lets queued tasks finish and stops the worker thread.
   */
  @Override
  public void close() {
    if (!closed.compareAndSet(false, true)) {
      return;
    }
    log.info("close()");
    relayAccessor.close();
    enqueue(() -> changeState(ConnectionState.DISCONNECTED));
    executor.shutdown();
    try {
      if (!executor.awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
        log.warn("close: tasks still running after {}s", SHUTDOWN_TIMEOUT_SECONDS);
        executor.shutdownNow();
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      executor.shutdownNow();
    }
  }
}
