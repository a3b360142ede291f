package io.github.themoah.breakout.config;

import io.vertx.core.DeploymentOptions;
import io.vertx.core.VertxOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Vert.x instance and deployment options.
 * The event-loop pool size can be overridden via VERTX_EVENT_LOOP_POOL_SIZE.
 */
public final class VertxConfig {

  private static final Logger log = LoggerFactory.getLogger(VertxConfig.class);
  private static final String ENV_EVENT_LOOP_POOL_SIZE = "VERTX_EVENT_LOOP_POOL_SIZE";

  private VertxConfig() {}

  public static VertxOptions createVertxOptions(Env env) {
    VertxOptions options = new VertxOptions();
    options.setPreferNativeTransport(true);

    int poolSize = env.getInt(ENV_EVENT_LOOP_POOL_SIZE, 0);
    if (poolSize > 0) {
      log.info("Using {} event-loop threads", poolSize);
      options.setEventLoopPoolSize(poolSize);
    }
    return options;
  }

  public static DeploymentOptions createDeploymentOptions() {
    return new DeploymentOptions().setInstances(1);
  }
}
