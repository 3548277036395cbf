package com.codeheadsystems.callback.dropwizard;

import com.codeheadsystems.callback.common.RandomProvider;
import com.codeheadsystems.callback.crypto.CredentialSet;
import com.codeheadsystems.callback.crypto.MessageCodec;
import com.codeheadsystems.callback.crypto.Pkcs7Padding;
import com.codeheadsystems.callback.dropwizard.health.KeyMaterialHealthCheck;
import com.codeheadsystems.callback.exceptions.ConfigException;
import com.codeheadsystems.callback.handshake.HandshakeService;
import com.codeheadsystems.callback.server.handler.AcknowledgingEventHandler;
import com.codeheadsystems.callback.server.handler.EventHandler;
import com.codeheadsystems.callback.server.manager.CallbackManager;
import com.codeheadsystems.callback.server.resource.CallbackResource;
import io.dropwizard.core.ConfiguredBundle;
import io.dropwizard.core.setup.Bootstrap;
import io.dropwizard.core.setup.Environment;
import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Dropwizard bundle that wires the callback endpoint into an existing Dropwizard application.
 * <p>
 * Registers {@link CallbackResource} at {@code /callback} and a {@code callback-credentials}
 * health check. Requires a {@link CallbackConfiguration} block in the application's YAML config.
 * <p>
 * Events are only acknowledged unless an {@link EventHandler} is supplied:
 * <pre>{@code
 *   bootstrap.addBundle(new CallbackBundle<>(event -> myDispatcher.dispatch(event)));
 * }</pre>
 * A malformed token or key fails {@link #run} with a {@link ConfigException}, so the
 * application never starts with credentials it cannot use.
 */
public class CallbackBundle<C extends CallbackConfiguration> implements ConfiguredBundle<C> {

  private static final Logger log = LoggerFactory.getLogger(CallbackBundle.class);

  private final EventHandler eventHandler;

  /**
   * Creates a bundle that acknowledges every event without replying.
   */
  public CallbackBundle() {
    this(new AcknowledgingEventHandler());
    log.warn("No EventHandler supplied; callback events will be acknowledged and dropped.");
  }

  /**
   * Creates a bundle dispatching events to the given handler.
   *
   * @param eventHandler the event handler
   */
  public CallbackBundle(final EventHandler eventHandler) {
    this.eventHandler = eventHandler;
  }

  @Override
  public void initialize(Bootstrap<?> bootstrap) {
    // No additional bootstrapping needed
  }

  @Override
  public void run(C configuration, Environment environment) {
    CredentialSet credentials = new CredentialSet(
        configuration.getToken(), configuration.getEncodedKey(), configuration.getReceiverId());
    // Derive now rather than on the first request.
    credentials.keyMaterial();

    RandomProvider randomProvider = new RandomProvider();
    MessageCodec codec = new MessageCodec(randomProvider, buildPadding(configuration));
    HandshakeService handshakeService =
        new HandshakeService(credentials, codec, randomProvider, Clock.systemUTC());

    CallbackManager callbackManager = new CallbackManager(handshakeService, eventHandler);
    environment.jersey().register(new CallbackResource(callbackManager));
    environment.healthChecks().register("callback-credentials", new KeyMaterialHealthCheck(credentials));
    log.info("run(): callback endpoint registered, receiverCheck={}, paddingBlockSize={}",
        credentials.expectedReceiverId().isPresent(), codec.padding().blockSize());
  }

  private Pkcs7Padding buildPadding(C configuration) {
    try {
      return new Pkcs7Padding(configuration.getPaddingBlockSize());
    } catch (IllegalArgumentException e) {
      throw new ConfigException("paddingBlockSize must be a multiple of 16 between 16 and 240", e);
    }
  }
}
