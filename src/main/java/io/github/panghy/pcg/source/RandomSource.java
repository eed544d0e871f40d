package io.github.panghy.pcg.source;

import java.util.Random;

/**
 * A provider of PCG-backed {@link Random} instances.
 *
 * <p>A source pins down the {@code (seed, stream)} pair its generator was built from, so the
 * sequence it produces can be reproduced later. {@link PcgRandomSource} takes both explicitly;
 * {@link ClockSeededRandomSource} reads the seed from a clock and records it.</p>
 */
public interface RandomSource {

  /**
   * Gets the Random instance associated with this source.
   * The same instance is returned on every call.
   *
   * @return The Random instance
   */
  Random getRandom();

  /**
   * Gets the seed used to initialize this source's generator.
   *
   * @return The seed value
   */
  long getSeed();

  /**
   * Gets the stream selector of this source's generator, as stored (always odd).
   *
   * @return The stream
   */
  long getStream();

  /**
   * Creates a child random source on its own stream.
   *
   * <p>Children are derived from the parent's stream and the given name, so the same name yields
   * the same stream and different names yield different streams.</p>
   *
   * @param name A unique name for the child source
   * @return A new RandomSource with independent randomness
   */
  RandomSource createChild(String name);

  /**
   * Derives a child stream from a parent stream and a name.
   *
   * @param parentStream The parent's stream
   * @param name         The child's name
   * @return The child's stream, already odd
   */
  static long deriveStream(long parentStream, String name) {
    long hash = parentStream;
    for (char c : name.toCharArray()) {
      hash = hash * 31 + c;
    }
    // Shift before forcing the low bit so hashes one apart stay distinct.
    return hash << 1 | 1L;
  }
}
