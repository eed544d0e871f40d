package io.github.panghy.pcg;

/**
 * A PCG32 pseudo-random number generator (64-bit state, 32-bit output, XSH-RR permutation).
 * Details of the PCG family are available at <a href="http://www.pcg-random.org/">pcg-random.org</a>.
 *
 * <p>Every operation is derived from a single primitive, {@link #nextUnsigned()}, which advances
 * a 64-bit linear congruential state and permutes the old state into a 32-bit output. Java has no
 * unsigned integer types, so unsigned 32-bit values are carried in {@code int} and unsigned 64-bit
 * values in {@code long}; the wraparound of {@code long} multiplication is exactly the modular
 * arithmetic the generator needs.</p>
 *
 * <p>The increment selects a stream. Two generators with the same seed and different streams
 * produce independent, non-overlapping sequences. The increment is always odd, which the LCG
 * requires for its full period of 2<sup>64</sup>.</p>
 *
 * <p>Usage example:</p>
 * <pre>{@code
 * PcgRandom random = new PcgRandom(42, 54);
 * int die = random.nextInRange(1, 7);
 * double probability = random.sample();
 * byte[] key = new byte[16];
 * random.fillBytes(key);
 * }</pre>
 *
 * <p>PCG is not cryptographically secure: its state can be recovered from its output. Instances
 * are not thread-safe; give each thread its own generator (on its own stream) or guard a shared
 * one externally.</p>
 */
public final class PcgRandom {

  /**
   * The LCG multiplier shared by all generators.
   */
  public static final long MULTIPLIER = 6364136223846793005L;

  /**
   * The stream used when none is given.
   */
  public static final long DEFAULT_STREAM = 1442695040888963407L;

  /**
   * {@code 1 / 0xFFFFFFFF}, the scale applied by {@link #sample()}.
   */
  private static final double INVERSE_MAX = 1.0 / 0xFFFFFFFFL;

  private static final int BYTE_WIDTH = Integer.BYTES;

  private final long increment;

  private long state;

  /**
   * Creates a generator seeded from {@link System#nanoTime()} on the default stream.
   *
   * <p>The time source has finite resolution. Generators created in close succession by this
   * constructor may receive the same seed and therefore produce identical sequences of random
   * numbers. Callers that need independent unseeded generators must supply distinct streams
   * through {@link #PcgRandom(long, long)} or explicit seeds, or share a single generator.</p>
   */
  public PcgRandom() {
    this(System.nanoTime(), DEFAULT_STREAM);
  }

  /**
   * Creates a generator with the given seed on the default stream.
   *
   * @param seed The initial state
   */
  public PcgRandom(long seed) {
    this(seed, DEFAULT_STREAM);
  }

  /**
   * Creates a generator with the given seed and stream. Identical {@code (seed, stream)} pairs
   * always produce identical sequences.
   *
   * @param seed   The initial state
   * @param stream The stream selector; its low bit is forced to 1
   */
  public PcgRandom(long seed, long stream) {
    this.state = seed;
    // The increment must be odd.
    this.increment = stream | 1L;
  }

  /**
   * Creates a generator from a configuration. If the configuration has no seed, its tick source
   * supplies one, with the same caveat as {@link #PcgRandom()}.
   *
   * @param configuration The configuration to use
   */
  public PcgRandom(PcgConfiguration configuration) {
    this(configuration.resolveSeed(), configuration.getStream());
  }

  /**
   * Draws the next raw 32-bit value.
   *
   * @return A value whose 32 bits are all random, to be read as unsigned
   */
  public int nextUnsigned() {
    long old = state;
    state = old * MULTIPLIER + increment;
    int xorShifted = (int) (((old >>> 18) ^ old) >>> 27);
    int rot = (int) (old >>> 59);
    return (xorShifted >>> rot) | (xorShifted << ((-rot) & 31));
  }

  /**
   * Draws the next raw 32-bit value widened to a non-negative {@code long}.
   *
   * @return A value in {@code [0, 2^32)}
   */
  public long nextUnsignedAsLong() {
    return Integer.toUnsignedLong(nextUnsigned());
  }

  /**
   * Draws an unsigned value below {@code bound} without modulo bias. Draws below
   * {@code 2^32 mod bound} are rejected, so every residue is equally likely.
   *
   * @param bound The exclusive upper bound, read as unsigned
   * @return A value in {@code [0, bound)} read as unsigned, or 0 if {@code bound} is 0
   */
  public int nextUnsigned(int bound) {
    if (bound == 0) {
      return 0;
    }
    // (0xFFFFFFFF - bound) % bound, unsigned
    int threshold = Integer.remainderUnsigned(~bound, bound);
    for (;;) {
      int r = nextUnsigned();
      if (Integer.compareUnsigned(r, threshold) >= 0) {
        return Integer.remainderUnsigned(r, bound);
      }
    }
  }

  /**
   * Draws a non-negative integer.
   *
   * @return A value in {@code [0, Integer.MAX_VALUE]}
   */
  public int next() {
    return nextUnsigned() >>> 1;
  }

  /**
   * Draws an integer below {@code max}.
   *
   * @param max The exclusive upper bound
   * @return A value in {@code [0, max)}, or 0 if {@code max} is 0
   * @throws InvalidArgumentException if {@code max} is negative
   */
  public int nextBelow(int max) {
    if (max < 0) {
      throw new InvalidArgumentException("max", max, "is less than 0");
    }
    return nextUnsigned(max);
  }

  /**
   * Draws an integer in {@code [min, max)}. The span may exceed {@link Integer#MAX_VALUE}, e.g.
   * {@code nextInRange(Integer.MIN_VALUE, Integer.MAX_VALUE)}.
   *
   * @param min The inclusive lower bound
   * @param max The exclusive upper bound
   * @return A value in {@code [min, max)}, or {@code min} without drawing if {@code min == max}
   * @throws InvalidArgumentException if {@code min} is greater than {@code max}
   */
  public int nextInRange(int min, int max) {
    if (min > max) {
      throw new InvalidArgumentException("min", min, "is greater than max (" + max + ")");
    }
    if (min == max) {
      return min;
    }
    return nextUnsigned(max - min) + min;
  }

  /**
   * Fills {@code buffer} with random bytes. Each draw supplies four bytes, least significant
   * first. The trailing group always comes from one final draw whose unused high bytes are
   * dropped, so an empty buffer still consumes one draw.
   *
   * @param buffer The buffer to fill
   * @throws NullPointerException if {@code buffer} is null
   */
  public void fillBytes(byte[] buffer) {
    if (buffer == null) {
      throw new NullPointerException("buffer cannot be null");
    }
    int i;
    int pack;
    for (i = 0; i < buffer.length - BYTE_WIDTH; i += BYTE_WIDTH) {
      pack = nextUnsigned();
      buffer[i] = (byte) pack;
      buffer[i + 1] = (byte) (pack >>> 8);
      buffer[i + 2] = (byte) (pack >>> 16);
      buffer[i + 3] = (byte) (pack >>> 24);
    }
    for (pack = nextUnsigned(); i < buffer.length; i++, pack >>>= 8) {
      buffer[i] = (byte) pack;
    }
  }

  /**
   * Draws a double in {@code [0, 1)}. A draw of {@code 0xFFFFFFFF} would map to exactly 1.0 and
   * is redrawn, so the largest possible result is {@code 0xFFFFFFFE / 0xFFFFFFFF}.
   *
   * @return A value greater than or equal to 0.0 and less than 1.0
   */
  public double sample() {
    for (;;) {
      int r = nextUnsigned();
      if (r != 0xFFFFFFFF) {
        return INVERSE_MAX * Integer.toUnsignedLong(r);
      }
    }
  }

  /**
   * Moves the generator forward by {@code delta} draws in {@code O(log delta)} steps. The delta is
   * read as unsigned, and since the period is 2<sup>64</sup>, {@code advance(-n)} steps back by
   * {@code n} draws.
   *
   * @param delta The number of raw draws to skip
   */
  public void advance(long delta) {
    long accMult = 1L;
    long accPlus = 0L;
    long curMult = MULTIPLIER;
    long curPlus = increment;
    while (delta != 0) {
      if ((delta & 1L) != 0) {
        accMult *= curMult;
        accPlus = accPlus * curMult + curPlus;
      }
      curPlus = (curMult + 1) * curPlus;
      curMult *= curMult;
      delta >>>= 1;
    }
    state = accMult * state + accPlus;
  }

  /**
   * Gets the stream selector as stored, which is always odd.
   *
   * @return The increment
   */
  public long getIncrement() {
    return increment;
  }

  // Visible for testing.
  long state() {
    return state;
  }

  @Override
  public String toString() {
    return "PcgRandom{increment=" + Long.toUnsignedString(increment) + "}";
  }
}
