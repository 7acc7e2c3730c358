package com.codeheadsystems.onyx.crypto;

import com.codeheadsystems.onyx.crypto.exceptions.KeyImportException;
import com.codeheadsystems.onyx.crypto.internal.PemCodec;
import com.codeheadsystems.onyx.crypto.model.PeerPublicKey;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Peer id to imported public key, for the lifetime of one session.
 * <p>
 * An id is bound at most once. A later import for a known id is ignored, never an overwrite, so a
 * relay or colluding peer cannot rebind a known identity to a different key mid-session. A peer
 * that rejoins under the same id with a fresh key pair therefore keeps its stale key here.
 */
public class PeerDirectory {

  private static final Logger log = LoggerFactory.getLogger(PeerDirectory.class);

  private final ConcurrentHashMap<String, PeerPublicKey> peers = new ConcurrentHashMap<>();

  /**
   * Whether the peer id is known.
   *
   * @param peerId the peer id
   * @return true if present
   */
  public boolean has(String peerId) {
    return peerId != null && peers.containsKey(peerId);
  }

  /**
   * Parses the PEM and binds it to the peer id if the id is not already bound.
   *
   * @param peerId the peer id
   * @param pem    the peer's SPKI public key in PEM form
   * @throws KeyImportException if the PEM is not a valid RSA public key; the peer is not added
   */
  public void importAndInsert(String peerId, String pem) {
    if (peerId == null || peerId.isBlank()) {
      throw new IllegalArgumentException("peerId is required");
    }
    PeerPublicKey key = PemCodec.decode(pem);
    if (peers.putIfAbsent(peerId, key) != null) {
      log.warn("importAndInsert({}): already bound, keeping the existing key", peerId);
      return;
    }
    log.debug("importAndInsert({}): {}-bit key", peerId, key.bitLength());
  }

  /**
   * The key bound to a peer id.
   *
   * @param peerId the peer id
   * @return the key, if known
   */
  public Optional<PeerPublicKey> publicKey(String peerId) {
    return peerId == null ? Optional.empty() : Optional.ofNullable(peers.get(peerId));
  }

  /**
   * Currently known peer ids. Order is not stable across calls.
   *
   * @return the list
   */
  public List<String> knownIds() {
    return List.copyOf(peers.keySet());
  }

  /**
   * Immutable copy of the directory, used as the recipient set of one encryption.
   *
   * @return the map
   */
  public Map<String, PeerPublicKey> snapshot() {
    return Map.copyOf(peers);
  }

  public int size() {
    return peers.size();
  }
}
