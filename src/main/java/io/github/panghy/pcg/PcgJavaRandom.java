package io.github.panghy.pcg;

import java.util.Random;

/**
 * Adapts a {@link PcgRandom} to {@link java.util.Random}, so PCG output can be handed to any API
 * that takes a {@code Random} (or a {@link java.util.random.RandomGenerator}).
 *
 * <p>The adapter holds the engine and delegates to it; none of {@code Random}'s own
 * linear-congruential state is used. Methods that {@code Random} builds on {@link #next(int)}
 * ({@code nextLong}, {@code nextBoolean}, {@code nextFloat}, {@code nextGaussian}, the stream
 * methods) therefore draw from the PCG output too.</p>
 *
 * <p>Where {@code Random}'s contract and the engine's semantics differ, the engine wins:
 * {@code nextInt(0)} returns 0 rather than throwing, and {@code nextInt(origin, bound)} with equal
 * arguments returns {@code origin}.</p>
 *
 * <p>Not thread-safe, unlike {@code java.util.Random}.</p>
 */
public class PcgJavaRandom extends Random {

  private final PcgRandom engine;

  /**
   * Creates an adapter over a generator seeded from the clock on the default stream.
   *
   * @see PcgRandom#PcgRandom()
   */
  public PcgJavaRandom() {
    this(new PcgRandom());
  }

  /**
   * Creates an adapter over a generator with the given seed on the default stream.
   *
   * @param seed The seed
   */
  public PcgJavaRandom(long seed) {
    this(new PcgRandom(seed));
  }

  /**
   * Creates an adapter over a generator with the given seed and stream.
   *
   * @param seed   The seed
   * @param stream The stream selector
   */
  public PcgJavaRandom(long seed, long stream) {
    this(new PcgRandom(seed, stream));
  }

  /**
   * Creates an adapter over an existing generator. The generator is shared, not copied.
   *
   * @param engine The generator to draw from
   * @throws NullPointerException if engine is null
   */
  public PcgJavaRandom(PcgRandom engine) {
    super(0L);
    if (engine == null) {
      throw new NullPointerException("engine cannot be null");
    }
    this.engine = engine;
  }

  /**
   * Gets the underlying generator, e.g. for access to raw 32-bit draws.
   *
   * @return The engine
   */
  public PcgRandom getEngine() {
    return engine;
  }

  /**
   * Reseeding is not supported. {@code Random}'s constructor calls this before the engine is
   * attached; that call is ignored.
   *
   * @throws UnsupportedOperationException always, once constructed
   */
  @Override
  public void setSeed(long seed) {
    if (engine == null) {
      return;
    }
    throw new UnsupportedOperationException("PcgJavaRandom cannot be reseeded");
  }

  @Override
  protected int next(int bits) {
    return engine.nextUnsigned() >>> (32 - bits);
  }

  @Override
  public int nextInt() {
    return engine.nextUnsigned();
  }

  @Override
  public int nextInt(int bound) {
    return engine.nextBelow(bound);
  }

  @Override
  public int nextInt(int origin, int bound) {
    return engine.nextInRange(origin, bound);
  }

  @Override
  public void nextBytes(byte[] bytes) {
    engine.fillBytes(bytes);
  }

  @Override
  public double nextDouble() {
    return engine.sample();
  }

  @Override
  public String toString() {
    return "PcgJavaRandom{" + engine + "}";
  }
}
