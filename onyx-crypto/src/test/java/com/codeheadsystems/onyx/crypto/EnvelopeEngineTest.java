package com.codeheadsystems.onyx.crypto;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.codeheadsystems.onyx.crypto.config.OnyxCryptoConfig;
import com.codeheadsystems.onyx.crypto.exceptions.EnvelopeAuthenticationException;
import com.codeheadsystems.onyx.crypto.exceptions.KeyUnwrapException;
import com.codeheadsystems.onyx.crypto.exceptions.NoKeyForRecipientException;
import com.codeheadsystems.onyx.crypto.model.Envelope;
import com.codeheadsystems.onyx.crypto.model.PeerPublicKey;
import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/**
 * Hybrid encryption round trips with real RSA-2048 identities.
 */
class EnvelopeEngineTest {

  private static final String PLAINTEXT = "hello";

  private static Identity alice;
  private static Identity bob;
  private static Identity carol;
  private static Identity eve;

  private EnvelopeEngine engine;

  @BeforeAll
  static void generateIdentities() {
    alice = Identity.generate(OnyxCryptoConfig.DEFAULT);
    bob = Identity.generate(OnyxCryptoConfig.DEFAULT);
    carol = Identity.generate(OnyxCryptoConfig.DEFAULT);
    eve = Identity.generate(OnyxCryptoConfig.DEFAULT);
  }

  @BeforeEach
  void setUp() {
    engine = new EnvelopeEngine(OnyxCryptoConfig.DEFAULT);
  }

  private static Map<String, PeerPublicKey> recipients(Identity... identities) {
    Map<String, PeerPublicKey> map = new HashMap<>();
    for (Identity identity : identities) {
      map.put(identity.id(), identity.publicKey());
    }
    return map;
  }

  // ─── Round trip ───────────────────────────────────────────────────────────

  @Test
  void roundTrip_everyRecipientRecoversPlaintext() {
    Envelope envelope = engine.encrypt(PLAINTEXT, recipients(alice, bob, carol));

    assertThat(envelope.recipients()).containsExactlyInAnyOrder(alice.id(), bob.id(), carol.id());
    assertThat(engine.decrypt(envelope, alice)).isEqualTo(PLAINTEXT);
    assertThat(engine.decrypt(envelope, bob)).isEqualTo(PLAINTEXT);
    assertThat(engine.decrypt(envelope, carol)).isEqualTo(PLAINTEXT);
  }

  @Test
  void roundTrip_unicodeAndEmptyPlaintext() {
    String unicode = "güten Tag — 🔒";
    assertThat(engine.decrypt(engine.encrypt(unicode, recipients(bob)), bob)).isEqualTo(unicode);

    Envelope empty = engine.encrypt("", recipients(bob));
    assertThat(empty.ciphertext()).isEmpty();
    assertThat(engine.decrypt(empty, bob)).isEmpty();
  }

  @Test
  void roundTrip_fromDirectorySnapshot() {
    PeerDirectory directory = new PeerDirectory();
    directory.importAndInsert(bob.id(), bob.publicKeyPem());

    Envelope envelope = engine.encrypt(PLAINTEXT, directory);

    assertThat(envelope.recipients()).containsExactly(bob.id());
    assertThat(engine.decrypt(envelope, bob)).isEqualTo(PLAINTEXT);
  }

  @Test
  void encrypt_fieldSizes() {
    Envelope envelope = engine.encrypt(PLAINTEXT, recipients(bob));

    assertThat(envelope.iv()).hasSize(OnyxCryptoConfig.IV_LENGTH);
    assertThat(envelope.tag()).hasSize(OnyxCryptoConfig.TAG_LENGTH);
    assertThat(envelope.ciphertext()).hasSize(PLAINTEXT.length());
    assertThat(envelope.wrappedKeys().get(bob.id())).hasSize(256);
  }

  @Test
  void encrypt_freshKeyAndIvPerCall() {
    Envelope first = engine.encrypt(PLAINTEXT, recipients(bob));
    Envelope second = engine.encrypt(PLAINTEXT, recipients(bob));

    assertThat(first.iv()).isNotEqualTo(second.iv());
    assertThat(first.ciphertext()).isNotEqualTo(second.ciphertext());
    assertThat(first.wrappedKeys().get(bob.id())).isNotEqualTo(second.wrappedKeys().get(bob.id()));
  }

  @Test
  void encrypt_noRecipients_returnsEnvelopeWithEmptyKeys() {
    Envelope envelope = engine.encrypt(PLAINTEXT, Map.of());

    assertThat(envelope.wrappedKeys()).isEmpty();
    assertThat(envelope.tag()).hasSize(16);
    assertThatThrownBy(() -> engine.decrypt(envelope, bob))
        .isInstanceOf(NoKeyForRecipientException.class);
  }

  // ─── Exclusivity and tampering ───────────────────────────────────────────

  @Test
  void decrypt_nonRecipient_throwsNoKeyForRecipient() {
    Envelope envelope = engine.encrypt(PLAINTEXT, recipients(alice, bob));

    assertThatThrownBy(() -> engine.decrypt(envelope, eve))
        .isInstanceOf(NoKeyForRecipientException.class)
        .hasMessageContaining(eve.shortId());
  }

  @Test
  void decrypt_keyWrappedForSomeoneElse_throwsKeyUnwrap() {
    Envelope original = engine.encrypt(PLAINTEXT, recipients(bob));
    // Relay rewrites the key map so eve's id points at bob's wrapped key.
    Envelope forged = new Envelope(original.iv(), original.tag(), original.ciphertext(),
        Map.of(eve.id(), original.wrappedKeys().get(bob.id())));

    assertThatThrownBy(() -> engine.decrypt(forged, eve))
        .isInstanceOf(KeyUnwrapException.class);
  }

  @Test
  void decrypt_truncatedWrappedKey_throwsKeyUnwrap() {
    Envelope original = engine.encrypt(PLAINTEXT, recipients(bob));
    Envelope forged = new Envelope(original.iv(), original.tag(), original.ciphertext(),
        Map.of(bob.id(), new byte[]{1, 2, 3}));

    assertThatThrownBy(() -> engine.decrypt(forged, bob))
        .isInstanceOf(KeyUnwrapException.class);
  }

  @Test
  void decrypt_anyFlippedCiphertextBit_throwsAuthentication() {
    Envelope original = engine.encrypt(PLAINTEXT, recipients(bob));
    for (int bit = 0; bit < original.ciphertext().length * 8; bit++) {
      byte[] ciphertext = original.ciphertext().clone();
      ciphertext[bit / 8] ^= (byte) (1 << (bit % 8));
      Envelope tampered = new Envelope(original.iv(), original.tag(), ciphertext, original.wrappedKeys());

      assertThatThrownBy(() -> engine.decrypt(tampered, bob))
          .isInstanceOf(EnvelopeAuthenticationException.class);
    }
  }

  @Test
  void decrypt_anyFlippedTagBit_throwsAuthentication() {
    Envelope original = engine.encrypt(PLAINTEXT, recipients(bob));
    for (int bit = 0; bit < original.tag().length * 8; bit++) {
      byte[] tag = original.tag().clone();
      tag[bit / 8] ^= (byte) (1 << (bit % 8));
      Envelope tampered = new Envelope(original.iv(), tag, original.ciphertext(), original.wrappedKeys());

      assertThatThrownBy(() -> engine.decrypt(tampered, bob))
          .isInstanceOf(EnvelopeAuthenticationException.class);
    }
  }

  @Test
  void decrypt_alteredIv_throwsAuthentication() {
    Envelope original = engine.encrypt(PLAINTEXT, recipients(bob));
    byte[] iv = original.iv().clone();
    iv[0] ^= 0x01;

    assertThatThrownBy(() -> engine.decrypt(
        new Envelope(iv, original.tag(), original.ciphertext(), original.wrappedKeys()), bob))
        .isInstanceOf(EnvelopeAuthenticationException.class);
  }

  @Test
  void decrypt_wrongLengthIvOrTag_throwsAuthentication() {
    Envelope original = engine.encrypt(PLAINTEXT, recipients(bob));

    assertThatThrownBy(() -> engine.decrypt(
        new Envelope(new byte[8], original.tag(), original.ciphertext(), original.wrappedKeys()), bob))
        .isInstanceOf(EnvelopeAuthenticationException.class);
    assertThatThrownBy(() -> engine.decrypt(
        new Envelope(original.iv(), new byte[12], original.ciphertext(), original.wrappedKeys()), bob))
        .isInstanceOf(EnvelopeAuthenticationException.class);
  }
}
