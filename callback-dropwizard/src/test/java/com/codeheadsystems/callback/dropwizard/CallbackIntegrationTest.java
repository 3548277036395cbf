package com.codeheadsystems.callback.dropwizard;

import static org.assertj.core.api.Assertions.assertThat;

import com.codeheadsystems.callback.common.RandomProvider;
import com.codeheadsystems.callback.crypto.CredentialSet;
import com.codeheadsystems.callback.crypto.DecryptedMessage;
import com.codeheadsystems.callback.crypto.MessageCodec;
import com.codeheadsystems.callback.crypto.Pkcs7Padding;
import com.codeheadsystems.callback.crypto.SignatureVerifier;
import com.codeheadsystems.callback.model.EncryptedEventRequest;
import com.codeheadsystems.callback.model.EncryptedReplyResponse;
import io.dropwizard.testing.ResourceHelpers;
import io.dropwizard.testing.junit5.DropwizardAppExtension;
import io.dropwizard.testing.junit5.DropwizardExtensionsSupport;
import jakarta.ws.rs.client.Entity;
import jakarta.ws.rs.client.WebTarget;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

/**
 * Dropwizard integration tests for {@link CallbackBundle}.
 * <p>
 * Starts a real embedded Jetty server with the published vendor test credentials and drives
 * the verification challenge and event callbacks over HTTP.
 */
@ExtendWith(DropwizardExtensionsSupport.class)
class CallbackIntegrationTest {

  static final DropwizardAppExtension<CallbackConfiguration> APP =
      new DropwizardAppExtension<>(
          CallbackApplication.class,
          ResourceHelpers.resourceFilePath("test-config.yml"));

  private static final String TOKEN = "QDG6eK";
  private static final String ENCODED_KEY = "jWmYm7qr5nMoAUwZRjGtBxmz3KA1tkAj3ykkR6q2B2C";
  private static final String RECEIVER_ID = "wx5823bf96d3bd56c7";
  private static final String TIMESTAMP = "1409659589";
  private static final String NONCE = "263014780";
  private static final String ECHOSTR =
      "P9nAzCzyDtyTWESHep1vC5X9xho/qYX3Zpb4yKa9SKld1DsH3Iyt3tP3zNdtp+4RPcs8TgAE7OaBO+FZXvnaqQ==";
  private static final String SIGNATURE = "5c45ff5e21c57e6ad56bac8758b79b1d9ac89fd3";

  private final CredentialSet credentials = new CredentialSet(TOKEN, ENCODED_KEY, RECEIVER_ID);
  private final MessageCodec codec = new MessageCodec(new RandomProvider(), new Pkcs7Padding(32));

  private WebTarget callback() {
    return APP.client().target(String.format("http://localhost:%d/callback", APP.getLocalPort()));
  }

  // Pre-encoded so '+' survives as a literal plus rather than a space.
  private static String encode(String value) {
    return URLEncoder.encode(value, StandardCharsets.UTF_8);
  }

  private Response post(String cipher, String signature, String timestamp, String nonce) {
    return callback()
        .queryParam("msg_signature", signature)
        .queryParam("timestamp", timestamp)
        .queryParam("nonce", nonce)
        .request()
        .post(Entity.entity(new EncryptedEventRequest(cipher), MediaType.APPLICATION_JSON_TYPE));
  }

  private String seal(String payload, String receiverId) {
    return codec.encrypt(credentials.keyMaterial(),
        payload.getBytes(StandardCharsets.UTF_8), receiverId.getBytes(StandardCharsets.UTF_8));
  }

  @Test
  void healthCheckReportsHealthy() {
    Response response = APP.client()
        .target(String.format("http://localhost:%d/healthcheck", APP.getAdminPort()))
        .request()
        .get();

    assertThat(response.getStatus()).isEqualTo(200);
    assertThat(response.readEntity(String.class)).contains("callback-credentials");
  }

  @Test
  void verificationChallenge_publishedVector_returnsEcho() {
    Response response = callback()
        .queryParam("msg_signature", SIGNATURE)
        .queryParam("timestamp", TIMESTAMP)
        .queryParam("nonce", NONCE)
        .queryParam("echostr", encode(ECHOSTR))
        .request()
        .get();

    assertThat(response.getStatus()).isEqualTo(200);
    assertThat(response.readEntity(String.class)).isEqualTo("1616140317555161061");
  }

  @Test
  void verificationChallenge_legacySignatureName_returnsEcho() {
    Response response = callback()
        .queryParam("signature", SIGNATURE)
        .queryParam("timestamp", TIMESTAMP)
        .queryParam("nonce", NONCE)
        .queryParam("echostr", encode(ECHOSTR))
        .request()
        .get();

    assertThat(response.getStatus()).isEqualTo(200);
    assertThat(response.readEntity(String.class)).isEqualTo("1616140317555161061");
  }

  @Test
  void verificationChallenge_tamperedNonce_returns400() {
    Response response = callback()
        .queryParam("msg_signature", SIGNATURE)
        .queryParam("timestamp", TIMESTAMP)
        .queryParam("nonce", "263014781")
        .queryParam("echostr", encode(ECHOSTR))
        .request()
        .get();

    assertThat(response.getStatus()).isEqualTo(400);
    assertThat(response.readEntity(String.class)).doesNotContain("1616140317555161061");
  }

  @Test
  void verificationChallenge_missingEchostr_returns400() {
    Response response = callback()
        .queryParam("msg_signature", SIGNATURE)
        .queryParam("timestamp", TIMESTAMP)
        .queryParam("nonce", NONCE)
        .request()
        .get();

    assertThat(response.getStatus()).isEqualTo(400);
  }

  @Test
  void event_acknowledgedWithoutReply_returnsSuccess() {
    String cipher = seal("{\"msgtype\":\"text\"}", RECEIVER_ID);
    String signature = SignatureVerifier.computeSignature(TOKEN, TIMESTAMP, NONCE, cipher);

    Response response = post(cipher, signature, TIMESTAMP, NONCE);

    assertThat(response.getStatus()).isEqualTo(200);
    assertThat(response.readEntity(String.class)).isEqualTo("success");
  }

  @Test
  void event_handlerReplies_returnsSignedEncryptedReply() {
    String cipher = seal(CallbackApplication.PING, RECEIVER_ID);
    String signature = SignatureVerifier.computeSignature(TOKEN, TIMESTAMP, NONCE, cipher);

    Response response = post(cipher, signature, TIMESTAMP, NONCE);

    assertThat(response.getStatus()).isEqualTo(200);
    EncryptedReplyResponse reply = response.readEntity(EncryptedReplyResponse.class);
    assertThat(SignatureVerifier.verify(reply.msgSignature(), TOKEN, reply.timestamp(), reply.nonce(),
        reply.encrypt())).isTrue();

    DecryptedMessage opened = codec.decrypt(credentials.keyMaterial(), reply.encrypt(),
        RECEIVER_ID.getBytes(StandardCharsets.UTF_8));
    assertThat(opened.payloadAsString()).isEqualTo(CallbackApplication.PONG);
  }

  @Test
  void event_handlerFailure_isAcknowledged() {
    String cipher = seal(CallbackApplication.EXPLODE, RECEIVER_ID);
    String signature = SignatureVerifier.computeSignature(TOKEN, TIMESTAMP, NONCE, cipher);

    Response response = post(cipher, signature, TIMESTAMP, NONCE);

    assertThat(response.getStatus()).isEqualTo(200);
    assertThat(response.readEntity(String.class)).isEqualTo("success");
  }

  @Test
  void event_foreignReceiver_returns400() {
    String cipher = seal(CallbackApplication.PING, "wwsomeoneelse");
    String signature = SignatureVerifier.computeSignature(TOKEN, TIMESTAMP, NONCE, cipher);

    Response response = post(cipher, signature, TIMESTAMP, NONCE);

    assertThat(response.getStatus()).isEqualTo(400);
    assertThat(response.readEntity(String.class)).contains("invalid callback request");
  }

  @Test
  void event_badSignature_returns400() {
    String cipher = seal(CallbackApplication.PING, RECEIVER_ID);

    Response response = post(cipher, SIGNATURE, TIMESTAMP, NONCE);

    assertThat(response.getStatus()).isEqualTo(400);
  }

  @Test
  void event_misalignedCiphertext_returns400() {
    String cipher = "AAAAAAAAAAAAAAAAAAAA";
    String signature = SignatureVerifier.computeSignature(TOKEN, TIMESTAMP, NONCE, cipher);

    Response response = post(cipher, signature, TIMESTAMP, NONCE);

    assertThat(response.getStatus()).isEqualTo(400);
  }
}
