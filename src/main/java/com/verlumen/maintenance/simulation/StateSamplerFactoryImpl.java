package com.verlumen.maintenance.simulation;

import com.google.common.hash.HashFunction;
import com.google.common.hash.Hashing;
import com.google.inject.Inject;
import java.util.SplittableRandom;
import java.util.random.RandomGenerator;

final class StateSamplerFactoryImpl implements StateSamplerFactory {
  // Streams must not share SplittableRandom's own gamma, or neighbouring streams become shifts.
  private static final HashFunction STREAM_MIXER = Hashing.murmur3_128();

  @Inject
  StateSamplerFactoryImpl() {}

  @Override
  public StateSampler create(long seed, long stream) {
    return new InverseCdfSampler(new SplittableRandom(streamSeed(seed, stream)));
  }

  static long streamSeed(long seed, long stream) {
    return STREAM_MIXER.newHasher().putLong(seed).putLong(stream).hash().asLong();
  }

  /** Inverse-CDF sampling over a single uniform draw. Not thread-safe. */
  static final class InverseCdfSampler implements StateSampler {
    private final RandomGenerator random;

    InverseCdfSampler(RandomGenerator random) {
      this.random = random;
    }

    @Override
    public int nextState(double[] distribution) {
      double u = random.nextDouble();
      double cumulative = 0;
      int lastPositive = -1;
      for (int j = 0; j < distribution.length; j++) {
        if (distribution[j] <= 0) {
          continue;
        }
        cumulative += distribution[j];
        lastPositive = j;
        if (u < cumulative) {
          return j;
        }
      }
      // Rounding can leave the cumulative sum just below u.
      if (lastPositive < 0) {
        throw new IllegalArgumentException("Distribution has no positive entry");
      }
      return lastPositive;
    }
  }
}
