package com.codeheadsystems.callback.server.handler;

import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Default handler: records that an event arrived and never replies.
 */
public class AcknowledgingEventHandler implements EventHandler {

  private static final Logger log = LoggerFactory.getLogger(AcknowledgingEventHandler.class);

  @Override
  public Optional<byte[]> handle(CallbackEvent event) {
    log.info("handle(payloadLength={}, timestamp={})", event.payload().length, event.timestamp());
    return Optional.empty();
  }
}
