package io.github.themoah.breakout;

import io.github.themoah.breakout.config.Env;
import io.github.themoah.breakout.config.VertxConfig;
import io.vertx.core.DeploymentOptions;
import io.vertx.core.Vertx;
import io.vertx.core.VertxOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point: creates the Vert.x instance and deploys {@link MainVerticle}.
 */
public class BreakoutLauncher {

  private static final Logger log = LoggerFactory.getLogger(BreakoutLauncher.class);

  public static void main(String[] args) {
    Env env = Env.system();
    VertxOptions vertxOptions = VertxConfig.createVertxOptions(env);
    Vertx vertx = Vertx.vertx(vertxOptions);

    DeploymentOptions deploymentOptions = VertxConfig.createDeploymentOptions();

    vertx.deployVerticle(new MainVerticle(env), deploymentOptions)
      .onSuccess(id -> log.info("MainVerticle deployed with ID: {}", id))
      .onFailure(err -> {
        log.error("Failed to deploy MainVerticle", err);
        vertx.close();
        System.exit(1);
      });
  }
}
