package com.codeheadsystems.callback.server.handler;

import static org.assertj.core.api.Assertions.assertThat;

import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.Test;

class AcknowledgingEventHandlerTest {

  @Test
  void handle_neverReplies() {
    CallbackEvent event = new CallbackEvent("{\"msgtype\":\"text\"}".getBytes(StandardCharsets.UTF_8),
        "wx5823bf96d3bd56c7", "1409659589", "263014780");

    assertThat(new AcknowledgingEventHandler().handle(event)).isEmpty();
  }

  @Test
  void callbackEvent_toStringOmitsPayload() {
    CallbackEvent event = new CallbackEvent("secret body".getBytes(StandardCharsets.UTF_8),
        "corp", "1409659589", "263014780");

    assertThat(event.toString()).doesNotContain("secret").contains("payloadLength=11");
    assertThat(event.payloadAsString()).isEqualTo("secret body");
  }
}
