package com.codeheadsystems.onyx.crypto;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doNothing;
import static org.mockito.Mockito.mock;

import com.codeheadsystems.onyx.crypto.common.RandomProvider;
import com.codeheadsystems.onyx.crypto.config.OnyxCryptoConfig;
import com.codeheadsystems.onyx.crypto.exceptions.KeyGenerationException;
import com.codeheadsystems.onyx.crypto.internal.PemCodec;
import java.security.SecureRandom;
import org.junit.jupiter.api.Test;

class IdentityTest {

  @Test
  void generate_producesUuidAndMatchingKeys() {
    Identity identity = Identity.generate(OnyxCryptoConfig.DEFAULT);

    assertThat(identity.id()).matches("[0-9a-f]{8}-[0-9a-f]{4}-4[0-9a-f]{3}-[89ab][0-9a-f]{3}-[0-9a-f]{12}");
    assertThat(identity.shortId()).isEqualTo(identity.id().substring(0, 8));
    assertThat(identity.privateKey().isPrivate()).isTrue();
    assertThat(identity.privateKey().getModulus()).isEqualTo(identity.publicKey().keyParameters().getModulus());
    assertThat(PemCodec.decode(identity.publicKeyPem()).keyParameters().getModulus())
        .isEqualTo(identity.privateKey().getModulus());
  }

  @Test
  void generate_twice_yieldsUnrelatedIdentities() {
    Identity first = Identity.generate(OnyxCryptoConfig.DEFAULT);
    Identity second = Identity.generate(OnyxCryptoConfig.DEFAULT);

    assertThat(first.id()).isNotEqualTo(second.id());
    assertThat(first.publicKeyPem()).isNotEqualTo(second.publicKeyPem());
  }

  @Test
  void publicKeyPem_stableAcrossCalls() {
    Identity identity = Identity.generate(OnyxCryptoConfig.DEFAULT);
    assertThat(identity.publicKeyPem()).isSameAs(identity.publicKeyPem());
  }

  @Test
  void generate_randomFailure_isKeyGenerationException() {
    SecureRandom broken = mock(SecureRandom.class);
    // First draw (the session id) succeeds with zeros, prime generation then fails.
    doNothing().doThrow(new IllegalStateException("entropy source unavailable"))
        .when(broken).nextBytes(any(byte[].class));
    OnyxCryptoConfig config = OnyxCryptoConfig.DEFAULT.withRandomProvider(new RandomProvider(broken));

    assertThatThrownBy(() -> Identity.generate(config))
        .isInstanceOf(KeyGenerationException.class)
        .hasMessageContaining("00000000-0000-4000-8000-000000000000")
        .hasRootCauseMessage("entropy source unavailable");
  }

  @Test
  void shortId_handlesShortAndNull() {
    assertThat(Identity.shortId("abc")).isEqualTo("abc");
    assertThat(Identity.shortId(null)).isEqualTo("unknown");
    assertThat(Identity.shortId("1234567890")).isEqualTo("12345678");
  }

  @Test
  void config_rejectsWeakModulus() {
    assertThatThrownBy(() -> new OnyxCryptoConfig(1024, new RandomProvider()))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
