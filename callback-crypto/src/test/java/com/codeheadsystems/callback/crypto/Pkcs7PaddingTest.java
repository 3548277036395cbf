package com.codeheadsystems.callback.crypto;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.codeheadsystems.callback.exceptions.PaddingException;
import java.util.Arrays;
import org.junit.jupiter.api.Test;

class Pkcs7PaddingTest {

  private final Pkcs7Padding padding = Pkcs7Padding.AES_BLOCK;

  @Test
  void pad_shortInput_fillsToBlock() {
    byte[] padded = padding.pad(new byte[]{1, 2, 3});

    assertThat(padded).hasSize(16);
    for (int i = 3; i < 16; i++) {
      assertThat(padded[i]).isEqualTo((byte) 13);
    }
  }

  @Test
  void pad_alignedInput_addsFullBlock() {
    byte[] padded = padding.pad(new byte[16]);

    assertThat(padded).hasSize(32);
    assertThat(padded[31]).isEqualTo((byte) 16);
    assertThat(padded[16]).isEqualTo((byte) 16);
  }

  @Test
  void pad_emptyInput_isOneFullBlock() {
    assertThat(padding.pad(new byte[0])).hasSize(16).containsOnly((byte) 16);
  }

  @Test
  void pad_thirtyTwoByteBlocks() {
    byte[] padded = new Pkcs7Padding(32).pad(new byte[43]);

    assertThat(padded).hasSize(64);
    assertThat(padded[63]).isEqualTo((byte) 21);
  }

  @Test
  void unpaddedLength_validPadding() {
    assertThat(padding.unpaddedLength(padding.pad(new byte[5]))).isEqualTo(5);
    assertThat(padding.unpaddedLength(padding.pad(new byte[16]))).isEqualTo(16);
  }

  @Test
  void unpaddedLength_zeroPadByte_throws() {
    byte[] data = new byte[16];

    assertThatThrownBy(() -> padding.unpaddedLength(data)).isInstanceOf(PaddingException.class);
  }

  @Test
  void unpaddedLength_padLargerThanBlock_throws() {
    byte[] data = new byte[32];
    Arrays.fill(data, (byte) 17);

    assertThatThrownBy(() -> padding.unpaddedLength(data)).isInstanceOf(PaddingException.class);
  }

  @Test
  void unpaddedLength_padAcceptedByWiderBlockSize() {
    byte[] data = new byte[32];
    Arrays.fill(data, (byte) 17);

    assertThat(new Pkcs7Padding(32).unpaddedLength(data)).isEqualTo(15);
  }

  @Test
  void unpaddedLength_inconsistentPadBytes_throws() {
    byte[] data = padding.pad(new byte[10]);
    data[11] = 0x05;

    assertThatThrownBy(() -> padding.unpaddedLength(data)).isInstanceOf(PaddingException.class);
  }

  @Test
  void unpaddedLength_empty_throws() {
    assertThatThrownBy(() -> padding.unpaddedLength(new byte[0])).isInstanceOf(PaddingException.class);
  }

  @Test
  void constructor_rejectsUnalignedBlockSize() {
    assertThatThrownBy(() -> new Pkcs7Padding(24)).isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> new Pkcs7Padding(256)).isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> new Pkcs7Padding(0)).isInstanceOf(IllegalArgumentException.class);
  }
}
