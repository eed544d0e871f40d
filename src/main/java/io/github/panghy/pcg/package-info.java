/**
 * PCG32 pseudo-random number generation.
 *
 * <p>{@link io.github.panghy.pcg.PcgRandom} is the generator itself. It owns the state and
 * exposes the raw 32-bit draw plus the bounded, ranged, byte and floating-point draws built on it.
 * {@link io.github.panghy.pcg.PcgJavaRandom} wraps a generator as a {@link java.util.Random} for
 * APIs that expect one. {@link io.github.panghy.pcg.PcgConfiguration} describes how generators are
 * seeded, and the {@code source} subpackage hands out generators per thread.</p>
 */
package io.github.panghy.pcg;
