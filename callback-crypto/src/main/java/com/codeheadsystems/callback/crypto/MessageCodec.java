package com.codeheadsystems.callback.crypto;

import static com.codeheadsystems.callback.common.ByteUtils.concat;

import com.codeheadsystems.callback.common.ByteUtils;
import com.codeheadsystems.callback.common.RandomProvider;
import com.codeheadsystems.callback.exceptions.FrameException;
import com.codeheadsystems.callback.exceptions.PaddingException;
import com.codeheadsystems.callback.exceptions.ReceiverMismatchException;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.util.Arrays;
import java.util.Base64;
import javax.crypto.Cipher;

/**
 * Encrypts and decrypts the framed message envelope with AES-256-CBC.
 * <p>
 * Plaintext frame layout:
 * <pre>
 *   [0, 16)        random prefix, discarded on decrypt
 *   [16, 20)       big-endian unsigned 32 bit payload length L
 *   [20, 20 + L)   payload
 *   [20 + L, end)  receiver id
 * </pre>
 * followed by PKCS#7 padding. Instances hold no per-request state and are thread safe.
 */
public class MessageCodec {

  /**
   * AES block size in bytes.
   */
  public static final int AES_BLOCK_SIZE = 16;

  /**
   * Length of the random prefix.
   */
  public static final int PREFIX_LENGTH = 16;

  /**
   * Length of the prefix plus the length field.
   */
  public static final int HEADER_LENGTH = PREFIX_LENGTH + 4;

  private static final String TRANSFORMATION = "AES/CBC/NoPadding";
  private static final Base64.Encoder B64 = Base64.getEncoder();
  private static final Base64.Decoder B64D = Base64.getDecoder();

  private final RandomProvider randomProvider;
  private final Pkcs7Padding padding;

  /**
   * Creates a codec with a default {@link RandomProvider} and 16 byte padding.
   */
  public MessageCodec() {
    this(new RandomProvider(), Pkcs7Padding.AES_BLOCK);
  }

  /**
   * Instantiates a new Message codec.
   *
   * @param randomProvider source of the random prefix
   * @param padding        the padding scheme
   */
  public MessageCodec(RandomProvider randomProvider, Pkcs7Padding padding) {
    this.randomProvider = randomProvider;
    this.padding = padding;
  }

  /**
   * Decrypts without checking the receiver id.
   *
   * @param keyMaterial  the key material
   * @param cipherBase64 the base64 ciphertext
   * @return the decrypted message
   */
  public DecryptedMessage decrypt(KeyMaterial keyMaterial, String cipherBase64) {
    return decrypt(keyMaterial, cipherBase64, null);
  }

  /**
   * Decrypts and unframes a message.
   *
   * @param keyMaterial        the key material
   * @param cipherBase64       the base64 ciphertext
   * @param expectedReceiverId the receiver id the frame must carry, or null to skip the check
   * @return the decrypted message
   * @throws PaddingException          if the ciphertext is not base64, not a positive multiple
   *                                   of 16 bytes, or its padding is malformed
   * @throws FrameException            if the plaintext frame is truncated or inconsistent
   * @throws ReceiverMismatchException if the receiver id differs from the expected one
   */
  public DecryptedMessage decrypt(KeyMaterial keyMaterial, String cipherBase64, byte[] expectedReceiverId) {
    byte[] ciphertext = decodeCiphertext(cipherBase64);
    if (ciphertext.length == 0 || ciphertext.length % AES_BLOCK_SIZE != 0) {
      throw new PaddingException("Ciphertext is not block aligned");
    }
    byte[] plain = runCipher(Cipher.DECRYPT_MODE, keyMaterial, ciphertext);
    try {
      int frameLength = padding.unpaddedLength(plain);
      if (frameLength < HEADER_LENGTH) {
        throw new FrameException("Frame too short");
      }
      long payloadLength = ByteUtils.readUint32(plain, PREFIX_LENGTH);
      if (payloadLength > frameLength - HEADER_LENGTH) {
        throw new FrameException("Frame length field is inconsistent");
      }
      int payloadEnd = HEADER_LENGTH + (int) payloadLength;
      byte[] payload = Arrays.copyOfRange(plain, HEADER_LENGTH, payloadEnd);
      byte[] receiverId = Arrays.copyOfRange(plain, payloadEnd, frameLength);
      if (expectedReceiverId != null && !MessageDigest.isEqual(expectedReceiverId, receiverId)) {
        throw new ReceiverMismatchException();
      }
      return new DecryptedMessage(payload, receiverId);
    } finally {
      Arrays.fill(plain, (byte) 0);
    }
  }

  /**
   * Frames, pads and encrypts a message.
   *
   * @param keyMaterial the key material
   * @param payload     the payload
   * @param receiverId  the receiver id, may be empty
   * @return the base64 ciphertext
   */
  public String encrypt(KeyMaterial keyMaterial, byte[] payload, byte[] receiverId) {
    byte[] frame = concat(
        randomProvider.randomBytes(PREFIX_LENGTH),
        ByteUtils.uint32(payload.length),
        payload,
        receiverId);
    byte[] padded = padding.pad(frame);
    Arrays.fill(frame, (byte) 0);
    try {
      return B64.encodeToString(runCipher(Cipher.ENCRYPT_MODE, keyMaterial, padded));
    } finally {
      Arrays.fill(padded, (byte) 0);
    }
  }

  /**
   * Padding scheme in use.
   *
   * @return the pkcs 7 padding
   */
  public Pkcs7Padding padding() {
    return padding;
  }

  private static byte[] decodeCiphertext(String cipherBase64) {
    if (cipherBase64 == null) {
      throw new PaddingException("Missing ciphertext");
    }
    try {
      return B64D.decode(cipherBase64);
    } catch (IllegalArgumentException e) {
      throw new PaddingException("Ciphertext is not valid base64", e);
    }
  }

  private static byte[] runCipher(int mode, KeyMaterial keyMaterial, byte[] input) {
    try {
      Cipher cipher = Cipher.getInstance(TRANSFORMATION);
      cipher.init(mode, keyMaterial.secretKeySpec(), keyMaterial.ivParameterSpec());
      return cipher.doFinal(input);
    } catch (GeneralSecurityException e) {
      throw new IllegalStateException(TRANSFORMATION + " not available", e);
    }
  }
}
