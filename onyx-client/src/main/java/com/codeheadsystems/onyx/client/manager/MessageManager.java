package com.codeheadsystems.onyx.client.manager;

import com.codeheadsystems.onyx.client.SessionListener;
import com.codeheadsystems.onyx.client.model.NoticeSeverity;
import com.codeheadsystems.onyx.client.model.ReceiveOutcome;
import com.codeheadsystems.onyx.crypto.EnvelopeEngine;
import com.codeheadsystems.onyx.crypto.Identity;
import com.codeheadsystems.onyx.crypto.PeerDirectory;
import com.codeheadsystems.onyx.crypto.exceptions.EnvelopeException;
import com.codeheadsystems.onyx.crypto.exceptions.NoKeyForRecipientException;
import com.codeheadsystems.onyx.crypto.model.Envelope;
import com.codeheadsystems.onyx.crypto.model.PeerPublicKey;
import com.codeheadsystems.onyx.model.ChatFrame;
import com.codeheadsystems.onyx.model.EnvelopePayload;
import java.util.Map;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns local plaintext into chat frames and inbound chat frames into peer messages.
 * <p>
 * Decrypt failures never escape: a message not addressed to us is reported as a muted notice,
 * anything else unreadable as an error notice. Both read "Unreadable msg from ..." to the user.
 */
@Singleton
public class MessageManager {

  private static final Logger log = LoggerFactory.getLogger(MessageManager.class);

  static final String NO_PEERS_WARNING = "No peers connected. Message sent but no one can decrypt.";

  private final Identity identity;
  private final PeerDirectory directory;
  private final EnvelopeEngine envelopeEngine;
  private final SessionListener listener;

  /**
   * Instantiates a new Message manager.
   *
   * @param identity       this participant's identity
   * @param directory      the peer directory, read for the recipient set
   * @param envelopeEngine the envelope engine
   * @param listener       the host hooks
   */
  @Inject
  public MessageManager(final Identity identity,
                        final PeerDirectory directory,
                        final EnvelopeEngine envelopeEngine,
                        final SessionListener listener) {
    log.info("MessageManager({})", identity.id());
    this.identity = identity;
    this.directory = directory;
    this.envelopeEngine = envelopeEngine;
    this.listener = listener;
  }

  /**
   * Encrypts the plaintext for every peer known right now. With no peers the frame is still built,
   * and the operator is warned.
   *
   * @param plaintext the plaintext
   * @return the chat frame
   * @throws com.codeheadsystems.onyx.crypto.exceptions.EnvelopeEncryptionException if sealing fails
   */
  public ChatFrame compose(final String plaintext) {
    final Map<String, PeerPublicKey> recipients = directory.snapshot();
    if (recipients.isEmpty()) {
      log.warn("compose: no known peers");
      listener.onSystemNotice(NoticeSeverity.WARNING, NO_PEERS_WARNING);
    }
    final Envelope envelope = envelopeEngine.encrypt(plaintext, recipients);
    log.debug("compose: sealed for {} recipient(s)", recipients.size());
    return new ChatFrame(identity.id(), new EnvelopePayload(envelope));
  }

  /**
   * Opens one inbound chat frame. Our own echoed frames are dropped before any decrypt attempt.
   *
   * @param frame the chat frame
   * @return what happened
   */
  public ReceiveOutcome receive(final ChatFrame frame) {
    final String senderId = frame.senderId();
    if (identity.id().equals(senderId)) {
      log.trace("receive: own echo");
      return ReceiveOutcome.SELF_ECHO;
    }
    final String unreadable = "Unreadable msg from " + Identity.shortId(senderId);
    try {
      final Envelope envelope = frame.payload().envelope();
      final String plaintext = envelopeEngine.decrypt(envelope, identity);
      listener.onPeerMessage(senderId, plaintext);
      return ReceiveOutcome.DELIVERED;
    } catch (NoKeyForRecipientException e) {
      log.debug("receive: msg from {} not addressed to us", senderId);
      listener.onSystemNotice(NoticeSeverity.MUTED, unreadable);
      return ReceiveOutcome.NOT_ADDRESSED;
    } catch (EnvelopeException | IllegalArgumentException e) {
      log.warn("receive: msg from {} unreadable ({}): {}", senderId, e.getClass().getSimpleName(), e.getMessage());
      listener.onSystemNotice(NoticeSeverity.ERROR, unreadable);
      return ReceiveOutcome.UNREADABLE;
    }
  }
}
