package com.codeheadsystems.callback.crypto;

import com.codeheadsystems.callback.exceptions.PaddingException;
import java.util.Arrays;

/**
 * PKCS#7 padding over a configurable block size.
 * <p>
 * The default is the AES block size of 16. The vendor's reference SDKs pad to 32 byte
 * multiples, which is still a whole number of AES blocks, so any multiple of 16 up to 240 is
 * accepted (the pad value has to fit in one byte).
 */
public final class Pkcs7Padding {

  /**
   * Padding to the AES block size.
   */
  public static final Pkcs7Padding AES_BLOCK = new Pkcs7Padding(MessageCodec.AES_BLOCK_SIZE);

  private final int blockSize;

  /**
   * Instantiates a new Pkcs 7 padding.
   *
   * @param blockSize the block size, a multiple of 16 between 16 and 240
   */
  public Pkcs7Padding(int blockSize) {
    if (blockSize < MessageCodec.AES_BLOCK_SIZE || blockSize > 240
        || blockSize % MessageCodec.AES_BLOCK_SIZE != 0) {
      throw new IllegalArgumentException("Padding block size must be a multiple of 16 between 16 and 240");
    }
    this.blockSize = blockSize;
  }

  /**
   * Block size.
   *
   * @return the int
   */
  public int blockSize() {
    return blockSize;
  }

  /**
   * Appends 1..blockSize bytes each holding the pad length. Already aligned input gains a full
   * block.
   *
   * @param data the data
   * @return a new padded array
   */
  public byte[] pad(byte[] data) {
    int padLength = blockSize - (data.length % blockSize);
    byte[] out = Arrays.copyOf(data, data.length + padLength);
    Arrays.fill(out, data.length, out.length, (byte) padLength);
    return out;
  }

  /**
   * Validates the trailing pad and returns the length of the unpadded data.
   *
   * @param data the decrypted data
   * @return the unpadded length
   * @throws PaddingException if the pad value is out of range or the pad bytes disagree
   */
  public int unpaddedLength(byte[] data) {
    if (data.length == 0) {
      throw new PaddingException("Invalid padding");
    }
    int padLength = data[data.length - 1] & 0xFF;
    if (padLength < 1 || padLength > blockSize || padLength > data.length) {
      throw new PaddingException("Invalid padding");
    }
    int diff = 0;
    for (int i = data.length - padLength; i < data.length; i++) {
      diff |= (data[i] & 0xFF) ^ padLength;
    }
    if (diff != 0) {
      throw new PaddingException("Invalid padding");
    }
    return data.length - padLength;
  }
}
