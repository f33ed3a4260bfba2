package com.codeheadsystems.pqsession.common;

import static org.assertj.core.api.Assertions.assertThat;

import java.security.SecureRandom;
import org.junit.jupiter.api.Test;

class RandomProviderTest {

  @Test
  void customRandom_isPreserved() {
    SecureRandom custom = new SecureRandom();
    RandomProvider rp = new RandomProvider(custom);
    assertThat(rp.random()).isSameAs(custom);
  }

  @Test
  void randomBytes_returnsCorrectLength() {
    RandomProvider rp = new RandomProvider();
    assertThat(rp.randomBytes(0)).hasSize(0);
    assertThat(rp.randomBytes(32)).hasSize(32);
  }

  @Test
  void randomBytes_returnsDifferentValues() {
    RandomProvider rp = new RandomProvider();
    // Extremely unlikely to collide
    assertThat(rp.randomBytes(32)).isNotEqualTo(rp.randomBytes(32));
  }

  @Test
  void randomHex_isLowercaseHexOfDoubleLength() {
    String hex = new RandomProvider().randomHex(8);
    assertThat(hex).hasSize(16).matches("[0-9a-f]+");
  }
}
