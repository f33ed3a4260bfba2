package com.codeheadsystems.pqsession.crypto;

import static org.assertj.core.api.Assertions.assertThat;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.HexFormat;
import org.junit.jupiter.api.Test;

class HkdfSha256KeyDerivationTest {

  private static final HexFormat HEX = HexFormat.of();

  private final KeyDerivation kdf = new HkdfSha256KeyDerivation();

  @Test
  void extract_matchesRfc5869Case1() {
    byte[] ikm = new byte[22];
    Arrays.fill(ikm, (byte) 0x0b);
    byte[] salt = HEX.parseHex("000102030405060708090a0b0c");

    assertThat(HEX.formatHex(kdf.extract(salt, ikm)))
        .isEqualTo("077709362c2e32df0ddc3f0dc47bba6390b6c73bb50f9c3122ec844ad7c2b3e5");
  }

  @Test
  void extract_emptySaltEqualsZeroSalt() {
    byte[] ikm = {1, 2, 3};
    assertThat(kdf.extract(null, ikm)).isEqualTo(kdf.extract(new byte[32], ikm));
  }

  @Test
  void expandLabel_lengthAndLabelSeparation() {
    byte[] prk = kdf.extract(null, new byte[32]);
    byte[] ctx = kdf.hash("ctx".getBytes(StandardCharsets.UTF_8));

    byte[] a = kdf.expandLabel(prk, "c write key", ctx, 32);
    byte[] b = kdf.expandLabel(prk, "s write key", ctx, 32);
    byte[] iv = kdf.expandLabel(prk, "c write iv", ctx, 12);

    assertThat(a).hasSize(32).isNotEqualTo(b);
    assertThat(iv).hasSize(12);
    assertThat(kdf.expandLabel(prk, "c write key", ctx, 32)).isEqualTo(a);
  }

  @Test
  void expandLabel_contextChangesOutput() {
    byte[] prk = kdf.extract(null, new byte[32]);
    assertThat(kdf.expandLabel(prk, "x", new byte[]{1}, 16))
        .isNotEqualTo(kdf.expandLabel(prk, "x", new byte[]{2}, 16));
  }

  @Test
  void hash_isSha256() {
    assertThat(HEX.formatHex(kdf.hash("abc".getBytes(StandardCharsets.US_ASCII))))
        .isEqualTo("ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad");
  }
}
