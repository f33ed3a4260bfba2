package com.codeheadsystems.pqsession.model.handshake;

import static org.assertj.core.api.Assertions.assertThat;

import com.codeheadsystems.pqsession.handshake.ServerFinished;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Instant;
import org.junit.jupiter.api.Test;

class ServerFinishedResponseTest {

  private final ObjectMapper mapper = new ObjectMapper();

  @Test
  void jsonRoundTrip() throws Exception {
    ServerFinished finished = new ServerFinished("sid", new byte[]{7}, new byte[]{8}, 2,
        Instant.parse("2026-01-01T01:00:00Z"));
    String json = mapper.writeValueAsString(new ServerFinishedResponse(finished));

    ServerFinishedResponse response = mapper.readValue(json, ServerFinishedResponse.class);

    assertThat(response.status()).isEqualTo("established");
    ServerFinished restored = response.serverFinished();
    assertThat(restored.sessionId()).isEqualTo("sid");
    assertThat(restored.signature()).isEqualTo(new byte[]{7});
    assertThat(restored.verifyData()).isEqualTo(new byte[]{8});
    assertThat(restored.signatureKeyVersion()).isEqualTo(2);
    assertThat(restored.expiresAt()).isEqualTo(Instant.parse("2026-01-01T01:00:00Z"));
  }
}
