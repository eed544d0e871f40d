package io.github.panghy.pcg.source;

import io.github.panghy.pcg.PcgRandom;

import java.util.Random;
import java.util.logging.Logger;

import static io.github.panghy.pcg.util.LoggingUtil.debug;

/**
 * Per-thread access point for PCG generators.
 *
 * <p>A single {@link PcgRandom} must not be shared between threads without locking. This class
 * keeps one {@link RandomSource} per thread instead. Tests and replays install a deterministic
 * source with {@link #initialize(RandomSource)}; threads that never do get a clock-seeded source
 * whose stream is derived from the thread id, so threads started together do not repeat each
 * other's sequence even if their clock seeds collide.</p>
 *
 * <p>Usage example:</p>
 * <pre>{@code
 * PcgRandoms.initialize(new PcgRandomSource(12345));
 *
 * int value = PcgRandoms.current().nextInt(100);
 * double probability = PcgRandoms.current().nextDouble();
 * }</pre>
 */
public final class PcgRandoms {

  private static final Logger LOGGER = Logger.getLogger(PcgRandoms.class.getName());

  private static final ThreadLocal<RandomSource> randomSource = new ThreadLocal<>();

  private PcgRandoms() { }

  /**
   * Installs the random source for the current thread, replacing any previous one.
   *
   * @param source The random source to use
   * @throws NullPointerException if source is null
   */
  public static void initialize(RandomSource source) {
    if (source == null) {
      throw new NullPointerException("RandomSource cannot be null");
    }
    randomSource.set(source);
  }

  /**
   * Gets the current thread's random source, creating a clock-seeded one if none is installed.
   *
   * @return The random source
   */
  public static RandomSource currentSource() {
    RandomSource source = randomSource.get();
    if (source == null) {
      Thread thread = Thread.currentThread();
      source = new ClockSeededRandomSource(
          RandomSource.deriveStream(PcgRandom.DEFAULT_STREAM, Long.toString(thread.getId())));
      debug(LOGGER, "No random source on thread " + thread.getName() + ", using " + source);
      randomSource.set(source);
    }
    return source;
  }

  /**
   * Gets the current thread's Random instance.
   *
   * @return The Random instance to use for random number generation
   */
  public static Random current() {
    return currentSource().getRandom();
  }

  /**
   * Gets the seed of the current thread's random source, for logging failures with a seed
   * that reproduces them.
   *
   * @return The seed value, or 0 if no source has been installed or created yet
   */
  public static long getCurrentSeed() {
    RandomSource source = randomSource.get();
    return source != null ? source.getSeed() : 0;
  }

  /**
   * Checks whether the current thread runs on an explicitly seeded source.
   *
   * @return true if the current source is a {@link PcgRandomSource}
   */
  public static boolean isDeterministic() {
    return randomSource.get() instanceof PcgRandomSource;
  }

  /**
   * Creates a named child of the current thread's source.
   *
   * @param name A unique name for the child source
   * @return A new RandomSource on its own stream
   * @throws NullPointerException if name is null
   */
  public static RandomSource createChild(String name) {
    if (name == null) {
      throw new NullPointerException("Child name cannot be null");
    }
    return currentSource().createChild(name);
  }

  /**
   * Removes the current thread's random source.
   * Tests should call this during cleanup to prevent thread-local leaks.
   */
  public static void clear() {
    randomSource.remove();
  }
}
