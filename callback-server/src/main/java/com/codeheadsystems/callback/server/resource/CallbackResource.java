package com.codeheadsystems.callback.server.resource;

import com.codeheadsystems.callback.exceptions.RejectedRequestException;
import com.codeheadsystems.callback.model.EncryptedEventRequest;
import com.codeheadsystems.callback.model.EncryptedReplyResponse;
import com.codeheadsystems.callback.server.manager.CallbackManager;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.WebApplicationException;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * JAX-RS resource receiving the vendor's callbacks.
 * <p>
 * Endpoints:
 * <ul>
 *   <li>{@code GET /callback}: URL verification; responds with the decrypted {@code echostr}</li>
 *   <li>{@code POST /callback}: encrypted event; responds with an encrypted JSON reply or
 *       {@code success}</li>
 * </ul>
 * The signature is read from {@code msg_signature}, falling back to {@code signature}.
 * Every rejection yields HTTP 400 with the same generic message; the reason is only logged.
 */
@Singleton
@Path("/callback")
public class CallbackResource {

  /**
   * Body returned for acknowledged events that carry no reply.
   */
  public static final String ACK = "success";

  static final String REJECTED = "invalid callback request";

  private static final Logger log = LoggerFactory.getLogger(CallbackResource.class);

  private final CallbackManager callbackManager;

  /**
   * Instantiates a new Callback resource.
   *
   * @param callbackManager the callback manager
   */
  @Inject
  public CallbackResource(final CallbackManager callbackManager) {
    this.callbackManager = callbackManager;
    log.info("CallbackResource({})", callbackManager);
  }

  /**
   * URL verification challenge.
   *
   * @param msgSignature the msg signature
   * @param signature    legacy name of the signature parameter
   * @param timestamp    the timestamp
   * @param nonce        the nonce
   * @param echostr      the encrypted echo string
   * @return the decrypted echo payload
   */
  @GET
  @Produces(MediaType.TEXT_PLAIN)
  public byte[] verify(@QueryParam("msg_signature") final String msgSignature,
                       @QueryParam("signature") final String signature,
                       @QueryParam("timestamp") final String timestamp,
                       @QueryParam("nonce") final String nonce,
                       @QueryParam("echostr") final String echostr) {
    try {
      return callbackManager.verify(pick(msgSignature, signature), timestamp, nonce, echostr);
    } catch (IllegalArgumentException e) {
      throw new WebApplicationException(e.getMessage(), Response.Status.BAD_REQUEST);
    } catch (RejectedRequestException e) {
      log.warn("Verification challenge rejected: {}", e.reason());
      throw new WebApplicationException(REJECTED, Response.Status.BAD_REQUEST);
    }
  }

  /**
   * Encrypted event callback.
   *
   * @param msgSignature the msg signature
   * @param signature    legacy name of the signature parameter
   * @param timestamp    the timestamp
   * @param nonce        the nonce
   * @param request      the body
   * @return the response
   */
  @POST
  @Consumes(MediaType.APPLICATION_JSON)
  @Produces({MediaType.APPLICATION_JSON, MediaType.TEXT_PLAIN})
  public Response event(@QueryParam("msg_signature") final String msgSignature,
                        @QueryParam("signature") final String signature,
                        @QueryParam("timestamp") final String timestamp,
                        @QueryParam("nonce") final String nonce,
                        final EncryptedEventRequest request) {
    Optional<EncryptedReplyResponse> reply;
    try {
      reply = callbackManager.handleEvent(pick(msgSignature, signature), timestamp, nonce, request);
    } catch (IllegalArgumentException e) {
      throw new WebApplicationException(e.getMessage(), Response.Status.BAD_REQUEST);
    } catch (RejectedRequestException e) {
      log.warn("Event callback rejected: {}", e.reason());
      throw new WebApplicationException(REJECTED, Response.Status.BAD_REQUEST);
    }
    return reply
        .map(r -> Response.ok(r, MediaType.APPLICATION_JSON_TYPE).build())
        .orElseGet(() -> Response.ok(ACK, MediaType.TEXT_PLAIN_TYPE).build());
  }

  private static String pick(String preferred, String fallback) {
    return (preferred == null || preferred.isBlank()) ? fallback : preferred;
  }
}
