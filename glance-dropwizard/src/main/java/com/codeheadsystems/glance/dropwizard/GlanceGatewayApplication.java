package com.codeheadsystems.glance.dropwizard;

import io.dropwizard.configuration.EnvironmentVariableSubstitutor;
import io.dropwizard.configuration.SubstitutingSourceProvider;
import io.dropwizard.core.Application;
import io.dropwizard.core.setup.Bootstrap;
import io.dropwizard.core.setup.Environment;

/**
 * Standalone Glance gateway. Run with {@code server config.yml}.
 */
public class GlanceGatewayApplication extends Application<GlanceGatewayConfiguration> {

  /**
   * The entry point of application.
   *
   * @param args the input arguments
   * @throws Exception the exception
   */
  public static void main(String[] args) throws Exception {
    new GlanceGatewayApplication().run(args);
  }

  @Override
  public String getName() {
    return "glance-gateway";
  }

  @Override
  public void initialize(Bootstrap<GlanceGatewayConfiguration> bootstrap) {
    bootstrap.setConfigurationSourceProvider(new SubstitutingSourceProvider(
        bootstrap.getConfigurationSourceProvider(), new EnvironmentVariableSubstitutor(false)));
    bootstrap.addBundle(new GlanceBundle<>());
  }

  @Override
  public void run(GlanceGatewayConfiguration configuration, Environment environment) {
    // Everything is registered by the bundle
  }
}
