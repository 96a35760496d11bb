package org.jwtauth.guice;

import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import org.jwtauth.auth.Authenticator;
import org.jwtauth.auth.JwtAuthenticator;
import org.jwtauth.config.ConfigProvider;
import org.jwtauth.config.PropertiesConfigProvider;
import org.jwtauth.registry.ExecutorConfig;
import org.jwtauth.registry.ExecutorRegistry;
import org.jwtauth.sign.JwtSigner;
import org.jwtauth.sign.Signer;

public class BaseModule extends AbstractModule {

  @Override
  protected void configure() {
    // Host configuration comes from environment variables and application.properties.
    bind(ConfigProvider.class).to(PropertiesConfigProvider.class).in(Singleton.class);
  }

  @Provides
  @Singleton
  public ExecutorRegistry provideExecutorRegistry(ConfigProvider configProvider) {
    return new ExecutorRegistry(configProvider);
  }

  @Provides
  @Singleton
  // Authenticator without executor config, all key material comes from the host configuration.
  public Authenticator provideAuthenticator(ExecutorRegistry registry) {
    return (Authenticator) registry.getExecutor(JwtAuthenticator.NAME, ExecutorConfig.empty())
        .orElseThrow();
  }

  @Provides
  @Singleton
  public Signer provideSigner(ExecutorRegistry registry) {
    return (Signer) registry.getExecutor(JwtSigner.NAME, ExecutorConfig.empty()).orElseThrow();
  }
}
