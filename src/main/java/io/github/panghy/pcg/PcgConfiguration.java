package io.github.panghy.pcg;

import java.util.OptionalLong;
import java.util.function.LongSupplier;
import java.util.logging.Logger;

import static io.github.panghy.pcg.util.LoggingUtil.debug;

/**
 * Configuration for creating {@link PcgRandom} generators.
 *
 * <p>A configuration names the stream and, optionally, the seed. When no seed is set, one is
 * taken from the tick source each time a generator is built. The default tick source is
 * {@link System#nanoTime()}, which has finite resolution: generators built in close succession
 * may share a seed, so unseeded generators that must be independent need distinct streams.</p>
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * PcgConfiguration config = PcgConfiguration.builder()
 *     .seed(42)
 *     .stream(54)
 *     .build();
 *
 * PcgRandom random = config.newGenerator();
 * }</pre>
 */
public class PcgConfiguration {

  private static final Logger LOGGER = Logger.getLogger(PcgConfiguration.class.getName());

  private final OptionalLong seed;
  private final long stream;
  private final LongSupplier tickSource;

  private PcgConfiguration(Builder builder) {
    this.seed = builder.seed;
    this.stream = builder.stream;
    this.tickSource = builder.tickSource;
  }

  /**
   * Creates a new builder for PcgConfiguration.
   *
   * @return A new builder instance
   */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * Creates a configuration with no seed on the default stream.
   *
   * @return A default configuration
   */
  public static PcgConfiguration defaultConfig() {
    return builder().build();
  }

  /**
   * Creates a configuration with a fixed seed on the default stream.
   *
   * @param seed The seed
   * @return A seeded configuration
   */
  public static PcgConfiguration seeded(long seed) {
    return builder().seed(seed).build();
  }

  /**
   * Creates a configuration with a fixed seed and stream.
   *
   * @param seed   The seed
   * @param stream The stream selector
   * @return A seeded configuration
   */
  public static PcgConfiguration seeded(long seed, long stream) {
    return builder().seed(seed).stream(stream).build();
  }

  /**
   * Gets the configured seed.
   *
   * @return The seed, or empty if seeds come from the tick source
   */
  public OptionalLong getSeed() {
    return seed;
  }

  /**
   * Gets the configured stream selector, as given (before the low bit is forced).
   *
   * @return The stream
   */
  public long getStream() {
    return stream;
  }

  /**
   * Gets the tick source consulted when no seed is configured.
   *
   * @return The tick source
   */
  public LongSupplier getTickSource() {
    return tickSource;
  }

  /**
   * Returns the configured seed, or reads one from the tick source.
   *
   * @return The seed for the next generator
   */
  long resolveSeed() {
    if (seed.isPresent()) {
      return seed.getAsLong();
    }
    long ticks = tickSource.getAsLong();
    debug(LOGGER, "Seeding generator from tick source: seed=" + ticks +
        ", stream=" + Long.toUnsignedString(stream));
    return ticks;
  }

  /**
   * Builds a new generator from this configuration.
   *
   * @return A new generator
   */
  public PcgRandom newGenerator() {
    return new PcgRandom(this);
  }

  @Override
  public String toString() {
    return "PcgConfiguration{" +
           "seed=" + (seed.isPresent() ? String.valueOf(seed.getAsLong()) : "<ticks>") +
           ", stream=" + Long.toUnsignedString(stream) +
           '}';
  }

  /**
   * Builder for PcgConfiguration.
   */
  public static class Builder {
    private OptionalLong seed = OptionalLong.empty();
    private long stream = PcgRandom.DEFAULT_STREAM;
    private LongSupplier tickSource = System::nanoTime;

    private Builder() {
    }

    /**
     * Sets a fixed seed.
     *
     * @param seed The seed
     * @return This builder for chaining
     */
    public Builder seed(long seed) {
      this.seed = OptionalLong.of(seed);
      return this;
    }

    /**
     * Sets the stream selector. Even values are made odd when the generator is built.
     *
     * @param stream The stream
     * @return This builder for chaining
     */
    public Builder stream(long stream) {
      this.stream = stream;
      return this;
    }

    /**
     * Sets the tick source used when no seed is configured.
     *
     * @param tickSource The tick source
     * @return This builder for chaining
     * @throws NullPointerException if tickSource is null
     */
    public Builder tickSource(LongSupplier tickSource) {
      if (tickSource == null) {
        throw new NullPointerException("Tick source cannot be null");
      }
      this.tickSource = tickSource;
      return this;
    }

    /**
     * Builds the configuration with the specified settings.
     *
     * @return A new PcgConfiguration instance
     */
    public PcgConfiguration build() {
      return new PcgConfiguration(this);
    }
  }
}
