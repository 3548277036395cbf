package com.codeheadsystems.callback.server.manager;

import com.codeheadsystems.callback.crypto.DecryptedMessage;
import com.codeheadsystems.callback.handshake.Envelope;
import com.codeheadsystems.callback.handshake.HandshakeService;
import com.codeheadsystems.callback.model.EncryptedEventRequest;
import com.codeheadsystems.callback.model.EncryptedReplyResponse;
import com.codeheadsystems.callback.server.handler.CallbackEvent;
import com.codeheadsystems.callback.server.handler.EventHandler;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Framework-agnostic service handling the verification challenge and event callbacks.
 * <p>
 * Framework adapters ({@code CallbackResource} for JAX-RS / Dropwizard) stay thin wrappers that
 * translate exceptions into HTTP responses.
 * <p>
 * <strong>Exception contract</strong> (callers should map these to HTTP responses):
 * <ul>
 *   <li>{@link IllegalArgumentException}: missing request parameters maps to HTTP 400</li>
 *   <li>{@link com.codeheadsystems.callback.exceptions.RejectedRequestException}: signature,
 *       padding, frame or receiver failure maps to HTTP 400 with a generic message</li>
 * </ul>
 * Failures inside the {@link EventHandler} are logged and treated as an acknowledgement without
 * reply; the request itself was authentic, so the caller is not asked to resend it.
 */
public class CallbackManager {

  private static final Logger log = LoggerFactory.getLogger(CallbackManager.class);

  private final HandshakeService handshakeService;
  private final EventHandler eventHandler;

  /**
   * Instantiates a new Callback manager.
   *
   * @param handshakeService the handshake service
   * @param eventHandler     the event handler
   */
  public CallbackManager(final HandshakeService handshakeService, final EventHandler eventHandler) {
    this.handshakeService = handshakeService;
    this.eventHandler = eventHandler;
    log.info("CallbackManager({})", eventHandler);
  }

  /**
   * Answers the setup-time verification challenge.
   *
   * @param signature the signature
   * @param timestamp the timestamp
   * @param nonce     the nonce
   * @param echostr   the encrypted echo string
   * @return the decrypted echo payload, to be written verbatim as the response body
   * @throws IllegalArgumentException if a parameter is missing
   */
  public byte[] verify(String signature, String timestamp, String nonce, String echostr) {
    log.debug("verify(timestamp={}, nonce={})", timestamp, nonce);
    requirePresent(signature, timestamp, nonce, echostr);
    return handshakeService.answerChallenge(new Envelope(signature, timestamp, nonce, echostr));
  }

  /**
   * Authenticates, decrypts and dispatches an event callback.
   *
   * @param signature the signature
   * @param timestamp the timestamp
   * @param nonce     the nonce
   * @param request   the body carrying the ciphertext
   * @return the encrypted reply, or empty if the handler only acknowledged the event
   * @throws IllegalArgumentException if a parameter or the ciphertext is missing
   */
  public Optional<EncryptedReplyResponse> handleEvent(String signature, String timestamp, String nonce,
                                                      EncryptedEventRequest request) {
    log.debug("handleEvent(timestamp={}, nonce={})", timestamp, nonce);
    String cipherBody = request == null ? null : request.encrypt();
    requirePresent(signature, timestamp, nonce, cipherBody);

    DecryptedMessage message = handshakeService.openEvent(new Envelope(signature, timestamp, nonce, cipherBody));
    CallbackEvent event = new CallbackEvent(message.payload(), message.receiverIdAsString(), timestamp, nonce);

    Optional<byte[]> reply;
    try {
      reply = eventHandler.handle(event);
    } catch (RuntimeException e) {
      log.warn("Event handler failed for {}", event, e);
      return Optional.empty();
    }
    return reply.map(handshakeService::sealReply).map(EncryptedReplyResponse::new);
  }

  private static void requirePresent(String... values) {
    for (String value : values) {
      if (value == null || value.isBlank()) {
        throw new IllegalArgumentException("Missing callback parameters");
      }
    }
  }
}
