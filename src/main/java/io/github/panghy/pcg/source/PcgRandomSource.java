package io.github.panghy.pcg.source;

import io.github.panghy.pcg.PcgJavaRandom;
import io.github.panghy.pcg.PcgRandom;

import java.util.Random;

/**
 * A deterministic {@link RandomSource} with an explicit seed and stream.
 * The same {@code (seed, stream)} pair always yields the same sequence.
 *
 * <p>Children share the parent's seed and run on streams derived from the child name,
 * which makes them reproducible and keeps their sequences apart.</p>
 */
public class PcgRandomSource implements RandomSource {

  private final long seed;
  private final PcgJavaRandom random;

  /**
   * Creates a new source with the given seed on the default stream.
   *
   * @param seed The seed for the generator
   */
  public PcgRandomSource(long seed) {
    this(seed, PcgRandom.DEFAULT_STREAM);
  }

  /**
   * Creates a new source with the given seed and stream.
   *
   * @param seed   The seed for the generator
   * @param stream The stream selector
   */
  public PcgRandomSource(long seed, long stream) {
    this.seed = seed;
    this.random = new PcgJavaRandom(seed, stream);
  }

  @Override
  public Random getRandom() {
    return random;
  }

  @Override
  public long getSeed() {
    return seed;
  }

  @Override
  public long getStream() {
    return random.getEngine().getIncrement();
  }

  @Override
  public RandomSource createChild(String name) {
    return new PcgRandomSource(seed, RandomSource.deriveStream(getStream(), name));
  }

  @Override
  public String toString() {
    return "PcgRandomSource{seed=" + seed + ", stream=" + Long.toUnsignedString(getStream()) + "}";
  }
}
