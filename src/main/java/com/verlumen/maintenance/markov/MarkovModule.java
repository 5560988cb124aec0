package com.verlumen.maintenance.markov;

import com.google.inject.AbstractModule;

public final class MarkovModule extends AbstractModule {
  public static MarkovModule create() {
    return new MarkovModule();
  }

  private MarkovModule() {}

  @Override
  protected void configure() {
    bind(ChainAnalyzer.class).to(ChainAnalyzerImpl.class);
  }
}
