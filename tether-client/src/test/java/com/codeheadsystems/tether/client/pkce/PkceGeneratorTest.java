package com.codeheadsystems.tether.client.pkce;

import static org.assertj.core.api.Assertions.assertThat;

import com.codeheadsystems.tether.model.Provider;
import java.util.Random;
import java.util.UUID;
import org.junit.jupiter.api.Test;

/**
 * Vectors from RFC 7636 Appendix B.
 */
class PkceGeneratorTest {

  private static final byte[] RFC_VERIFIER_BYTES = {
      116, 24, (byte) 223, (byte) 180, (byte) 151, (byte) 153, (byte) 224, 37, 79, (byte) 250, 96,
      125, (byte) 216, (byte) 173, (byte) 187, (byte) 186, 22, (byte) 212, 37, 77, 105, (byte) 214,
      (byte) 191, (byte) 240, 91, 88, 5, 88, 83, (byte) 132, (byte) 141, 121};
  private static final String RFC_VERIFIER = "dBjftJeZ4CVP-mB92K27uhbUJU1p1r_wW1gFWFOEjXk";
  private static final String RFC_CHALLENGE = "E9Melhoa2OwvFrEMTJguCHaoeK1t8URWbuGJSstw-cM";

  @Test
  void generatePkce_rfcBytes_matchesRfcVectors() {
    RandomProvider fixed = new RandomProvider() {
      @Override
      public byte[] randomBytes(int length) {
        return RFC_VERIFIER_BYTES.clone();
      }
    };

    PkcePair pair = new PkceGenerator(fixed).generatePkce();

    assertThat(pair.verifier()).isEqualTo(RFC_VERIFIER);
    assertThat(pair.challenge()).isEqualTo(RFC_CHALLENGE);
  }

  @Test
  void generatePkce_lengthsAre43() {
    PkceGenerator generator = new PkceGenerator();
    for (int i = 0; i < 50; i++) {
      PkcePair pair = generator.generatePkce();
      assertThat(pair.verifier()).hasSize(43).matches("^[A-Za-z0-9_-]+$");
      assertThat(pair.challenge()).hasSize(43).matches("^[A-Za-z0-9_-]+$");
      assertThat(pair.challenge()).isEqualTo(PkceGenerator.challengeFor(pair.verifier()));
    }
  }

  @Test
  void generatePkce_verifiersDiffer() {
    PkceGenerator generator = new PkceGenerator();
    assertThat(generator.generatePkce().verifier()).isNotEqualTo(generator.generatePkce().verifier());
  }

  @Test
  void base64Url_emptyInput_returnsEmpty() {
    assertThat(PkceGenerator.base64Url(new byte[0])).isEmpty();
  }

  @Test
  void base64Url_neverUsesStandardAlphabetOrPadding() {
    Random random = new Random(42);
    for (int length = 1; length <= 70; length++) {
      byte[] bytes = new byte[length];
      random.nextBytes(bytes);
      assertThat(PkceGenerator.base64Url(bytes))
          .matches("^[A-Za-z0-9_-]*$")
          .doesNotContain("+", "/", "=");
    }
  }

  @Test
  void base64Url_bytesThatMapToPlusAndSlash_areTranslated() {
    // 0xfb 0xff 0xbf is "+/+/" in standard base64
    assertThat(PkceGenerator.base64Url(new byte[]{(byte) 0xfb, (byte) 0xff, (byte) 0xbf}))
        .isEqualTo("-_-_");
  }

  @Test
  void newState_isProviderPrefixedUuid() {
    String state = new PkceGenerator().newState(Provider.SPOTIFY);

    assertThat(state).startsWith("SPOTIFY:");
    UUID.fromString(state.substring("SPOTIFY:".length()));
  }
}
