package com.codeheadsystems.pqsession.model.keys;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.List;
import org.junit.jupiter.api.Test;

class PublicKeysResponseTest {

  private final ObjectMapper mapper = new ObjectMapper();

  private static PublicKeyEntry sig(int version, String validUntil) {
    return new PublicKeyEntry("SIGNATURE", "ML-DSA-65", "sig-" + version, version, "AQ==",
        "2026-01-01T00:00:00Z", validUntil);
  }

  @Test
  void signatureKey_findsCurrentAndRetiring() {
    PublicKeysResponse response = new PublicKeysResponse(null, sig(2, null),
        List.of(sig(1, "2026-01-01T00:00:30Z")), List.of("ML-KEM-768"));

    assertThat(response.signatureKey(2)).contains(sig(2, null));
    assertThat(response.signatureKey(1)).map(PublicKeyEntry::keyId).contains("sig-1");
    assertThat(response.signatureKey(3)).isEmpty();
  }

  @Test
  void json_omitsValidUntilForCurrentKeys() throws Exception {
    String json = mapper.writeValueAsString(sig(1, null));
    assertThat(json).doesNotContain("validUntil");
    assertThat(mapper.readValue(json, PublicKeyEntry.class)).isEqualTo(sig(1, null));
  }
}
