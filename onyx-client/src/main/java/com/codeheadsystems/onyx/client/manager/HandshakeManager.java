package com.codeheadsystems.onyx.client.manager;

import com.codeheadsystems.onyx.client.SessionListener;
import com.codeheadsystems.onyx.client.model.HandshakeOutcome;
import com.codeheadsystems.onyx.client.model.NoticeSeverity;
import com.codeheadsystems.onyx.crypto.Identity;
import com.codeheadsystems.onyx.crypto.PeerDirectory;
import com.codeheadsystems.onyx.crypto.exceptions.KeyImportException;
import com.codeheadsystems.onyx.model.HandshakeFrame;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Key exchange by self-announcement.
 * <p>
 * Every client announces itself when it connects. The relay broadcasts to everyone, including the
 * sender, so for each inbound handshake:
 * <ol>
 *   <li>our own echo is dropped;</li>
 *   <li>an already-known sender is dropped, with no re-import and no reply, so repeated
 *       handshakes cannot trigger unbounded reply traffic;</li>
 *   <li>a new sender's key is imported, the host is told, and we announce ourselves once more so
 *       a peer that connected after us learns our key too.</li>
 * </ol>
 * All state lives in the {@link PeerDirectory}. Handshakes are never retried or timed out.
 */
@Singleton
public class HandshakeManager {

  private static final Logger log = LoggerFactory.getLogger(HandshakeManager.class);

  private final Identity identity;
  private final PeerDirectory directory;
  private final SessionListener listener;

  /**
   * Instantiates a new Handshake manager.
   *
   * @param identity  this participant's identity
   * @param directory the peer directory
   * @param listener  the host hooks
   */
  @Inject
  public HandshakeManager(final Identity identity,
                          final PeerDirectory directory,
                          final SessionListener listener) {
    log.info("HandshakeManager({})", identity.id());
    this.identity = identity;
    this.directory = directory;
    this.listener = listener;
  }

  /**
   * This participant's announcement: own id and public key PEM.
   *
   * @return the handshake frame
   */
  public HandshakeFrame announcement() {
    return new HandshakeFrame(identity.id(), identity.publicKeyPem());
  }

  /**
   * Applies one inbound handshake.
   *
   * @param frame  the handshake
   * @param sender used to send the reply announcement for a new peer
   * @return what happened
   */
  public HandshakeOutcome handle(final HandshakeFrame frame, final FrameSender sender) {
    final String peerId = frame.senderId();
    if (identity.id().equals(peerId)) {
      log.trace("handle: own echo");
      return HandshakeOutcome.SELF_ECHO;
    }
    if (directory.has(peerId)) {
      log.trace("handle: {} already known", peerId);
      return HandshakeOutcome.ALREADY_KNOWN;
    }
    try {
      directory.importAndInsert(peerId, frame.publicKeyPem());
    } catch (KeyImportException e) {
      log.warn("Rejected key from {}: {}", peerId, e.getMessage());
      listener.onSystemNotice(NoticeSeverity.ERROR,
          "Could not import key from " + Identity.shortId(peerId) + ": " + e.getMessage());
      return HandshakeOutcome.IMPORT_FAILED;
    }
    log.info("New peer {} ({} known)", peerId, directory.size());
    listener.onSystemNotice(NoticeSeverity.INFO, "New Peer: " + Identity.shortId(peerId));
    sender.send(announcement());
    return HandshakeOutcome.NEW_PEER;
  }
}
