package com.codeheadsystems.callback.handshake;

import com.codeheadsystems.callback.common.RandomProvider;
import com.codeheadsystems.callback.crypto.CredentialSet;
import com.codeheadsystems.callback.crypto.DecryptedMessage;
import com.codeheadsystems.callback.crypto.MessageCodec;
import com.codeheadsystems.callback.crypto.SignatureVerifier;
import com.codeheadsystems.callback.exceptions.SignatureMismatchException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the two request kinds of the callback protocol for one {@link CredentialSet}.
 * <p>
 * Each request is authenticated, then decoded, and is evaluated exactly once. No state is
 * carried between requests, so a single instance serves any number of concurrent callers.
 * <p>
 * <strong>Exception contract</strong>: every per-request failure is a
 * {@link com.codeheadsystems.callback.exceptions.RejectedRequestException}
 * ({@link SignatureMismatchException}, {@code PaddingException}, {@code FrameException} or
 * {@code ReceiverMismatchException}); callers map them to an HTTP 400 with a generic body.
 */
public class HandshakeService {

  private static final Logger log = LoggerFactory.getLogger(HandshakeService.class);
  private static final int NONCE_DIGITS = 10;

  private final CredentialSet credentials;
  private final MessageCodec codec;
  private final RandomProvider randomProvider;
  private final Clock clock;

  /**
   * Instantiates a new Handshake service with the default codec and the system clock.
   *
   * @param credentials the credentials
   */
  public HandshakeService(final CredentialSet credentials) {
    this(credentials, new MessageCodec(), new RandomProvider(), Clock.systemUTC());
  }

  /**
   * Instantiates a new Handshake service.
   *
   * @param credentials    the credentials
   * @param codec          the codec
   * @param randomProvider source of reply nonces
   * @param clock          source of reply timestamps
   */
  public HandshakeService(final CredentialSet credentials,
                          final MessageCodec codec,
                          final RandomProvider randomProvider,
                          final Clock clock) {
    this.credentials = credentials;
    this.codec = codec;
    this.randomProvider = randomProvider;
    this.clock = clock;
    log.info("HandshakeService({})", credentials);
  }

  /**
   * Answers a setup-time verification challenge. The decrypted echo payload is returned as the
   * literal response body, proving possession of the shared key.
   *
   * @param challenge the challenge, whose cipher body is the {@code echostr}
   * @return the decrypted echo payload
   */
  public byte[] answerChallenge(final Envelope challenge) {
    log.debug("answerChallenge({})", challenge);
    authenticate(challenge);
    return codec.decrypt(credentials.keyMaterial(), challenge.cipherBody()).payload();
  }

  /**
   * Authenticates and decrypts an event callback, enforcing the configured receiver id.
   *
   * @param event the event envelope
   * @return the decrypted message
   */
  public DecryptedMessage openEvent(final Envelope event) {
    log.debug("openEvent({})", event);
    authenticate(event);
    return codec.decrypt(credentials.keyMaterial(), event.cipherBody(),
        credentials.expectedReceiverIdBytes());
  }

  /**
   * Encrypts a reply and signs it with a fresh timestamp and nonce.
   *
   * @param payload the reply payload
   * @return the sealed reply
   */
  public SealedReply sealReply(final byte[] payload) {
    String timestamp = Long.toString(clock.instant().getEpochSecond());
    return sealReply(payload, timestamp, randomProvider.randomDigits(NONCE_DIGITS));
  }

  /**
   * Encrypts a reply and signs it with the given timestamp and nonce.
   *
   * @param payload   the reply payload
   * @param timestamp the timestamp
   * @param nonce     the nonce
   * @return the sealed reply
   */
  public SealedReply sealReply(final byte[] payload, final String timestamp, final String nonce) {
    byte[] receiverId = credentials.expectedReceiverId()
        .map(id -> id.getBytes(StandardCharsets.UTF_8))
        .orElse(new byte[0]);
    String cipherBody = codec.encrypt(credentials.keyMaterial(), payload, receiverId);
    String signature = SignatureVerifier.computeSignature(credentials.token(), timestamp, nonce, cipherBody);
    log.trace("sealReply(timestamp={}, nonce={})", timestamp, nonce);
    return new SealedReply(cipherBody, signature, timestamp, nonce);
  }

  private void authenticate(final Envelope envelope) {
    if (!SignatureVerifier.verify(envelope.signature(), credentials.token(),
        envelope.timestamp(), envelope.nonce(), envelope.cipherBody())) {
      throw new SignatureMismatchException();
    }
  }
}
