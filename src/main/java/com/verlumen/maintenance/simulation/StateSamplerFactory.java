package com.verlumen.maintenance.simulation;

/**
 * Creates independent, reproducible sampling streams. The same {@code (seed, stream)} pair always
 * yields the same sequence of draws, whatever thread the sampler is used on.
 */
public interface StateSamplerFactory {
  StateSampler create(long seed, long stream);
}
