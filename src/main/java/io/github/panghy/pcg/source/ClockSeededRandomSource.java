package io.github.panghy.pcg.source;

import io.github.panghy.pcg.PcgConfiguration;
import io.github.panghy.pcg.PcgJavaRandom;
import io.github.panghy.pcg.PcgRandom;

import java.util.Random;
import java.util.function.LongSupplier;
import java.util.logging.Logger;

import static io.github.panghy.pcg.util.LoggingUtil.info;

/**
 * A {@link RandomSource} whose seed is read from a clock when it is created.
 *
 * <p>The seed is logged at INFO so that a run can be replayed with
 * {@code new PcgRandomSource(seed, stream)}. Clock ticks have finite resolution, so two sources
 * created at nearly the same moment may get the same seed; give them different streams (as
 * {@link PcgRandoms} does per thread) to keep their sequences apart.</p>
 */
public class ClockSeededRandomSource implements RandomSource {

  private static final Logger LOGGER = Logger.getLogger(ClockSeededRandomSource.class.getName());

  private final long seed;
  private final LongSupplier tickSource;
  private final PcgJavaRandom random;

  /**
   * Creates a source seeded from {@link System#nanoTime()} on the default stream.
   */
  public ClockSeededRandomSource() {
    this(PcgRandom.DEFAULT_STREAM);
  }

  /**
   * Creates a source seeded from {@link System#nanoTime()} on the given stream.
   *
   * @param stream The stream selector
   */
  public ClockSeededRandomSource(long stream) {
    this(PcgConfiguration.builder().stream(stream).build());
  }

  /**
   * Creates a source from a configuration. A seed set on the configuration is ignored; the
   * configuration's tick source always supplies it.
   *
   * @param configuration Supplies the stream and the tick source
   */
  public ClockSeededRandomSource(PcgConfiguration configuration) {
    this.tickSource = configuration.getTickSource();
    this.seed = tickSource.getAsLong();
    this.random = new PcgJavaRandom(seed, configuration.getStream());
    info(LOGGER, "Clock-seeded generator created with seed=" + seed +
        ", stream=" + Long.toUnsignedString(getStream()));
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

  /**
   * Creates a new clock-seeded source on a stream derived from this one and the name.
   * The child reads a fresh seed from the same tick source.
   */
  @Override
  public RandomSource createChild(String name) {
    return new ClockSeededRandomSource(PcgConfiguration.builder()
        .stream(RandomSource.deriveStream(getStream(), name))
        .tickSource(tickSource)
        .build());
  }

  @Override
  public String toString() {
    return "ClockSeededRandomSource{seed=" + seed + ", stream=" + Long.toUnsignedString(getStream()) + "}";
  }
}
