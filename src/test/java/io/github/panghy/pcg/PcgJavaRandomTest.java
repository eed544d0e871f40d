package io.github.panghy.pcg;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import java.util.random.RandomGenerator;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for PcgJavaRandom, the java.util.Random view of a generator.
 */
class PcgJavaRandomTest {

  @Test
  void testDelegatesIntDrawsToEngine() {
    PcgJavaRandom random = new PcgJavaRandom(42, 54);
    PcgRandom twin = new PcgRandom(42, 54);

    assertThat(random.nextInt()).isEqualTo(twin.nextUnsigned());
    assertThat(random.nextInt(1000)).isEqualTo(twin.nextBelow(1000));
    assertThat(random.nextInt(-50, 50)).isEqualTo(twin.nextInRange(-50, 50));
    assertThat(random.nextDouble()).isEqualTo(twin.sample());
    assertThat(random.getEngine().getIncrement()).isEqualTo(55L);
  }

  @Test
  void testNextLongAndBooleanUseRawDraws() {
    PcgJavaRandom random = new PcgJavaRandom(7);
    PcgRandom twin = new PcgRandom(7);

    long expectedLong = ((long) twin.nextUnsigned() << 32) + twin.nextUnsigned();
    assertThat(random.nextLong()).isEqualTo(expectedLong);

    boolean expectedBoolean = (twin.nextUnsigned() >>> 31) != 0;
    assertThat(random.nextBoolean()).isEqualTo(expectedBoolean);

    float expectedFloat = (twin.nextUnsigned() >>> 8) / ((float) (1 << 24));
    assertThat(random.nextFloat()).isEqualTo(expectedFloat);
  }

  @Test
  void testNextBytesMatchesFillBytes() {
    PcgJavaRandom random = new PcgJavaRandom(99, 3);
    PcgRandom twin = new PcgRandom(99, 3);
    byte[] actual = new byte[13];
    byte[] expected = new byte[13];

    random.nextBytes(actual);
    twin.fillBytes(expected);

    assertThat(actual).containsExactly(expected);
  }

  @Test
  void testEngineSemanticsOverrideRandomContract() {
    PcgJavaRandom random = new PcgJavaRandom(1);

    assertThat(random.nextInt(0)).isZero();
    assertThat(random.nextInt(5, 5)).isEqualTo(5);
    assertThatThrownBy(() -> random.nextInt(-1))
        .isInstanceOf(InvalidArgumentException.class)
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> random.nextInt(10, 3))
        .isInstanceOf(InvalidArgumentException.class)
        .hasMessageContaining("min = 10");
    assertThatThrownBy(() -> random.nextBytes(null))
        .isInstanceOf(NullPointerException.class)
        .hasMessageContaining("buffer");
  }

  @Test
  void testSetSeedIsRejected() {
    PcgJavaRandom random = new PcgJavaRandom(1);

    assertThatThrownBy(() -> random.setSeed(2))
        .isInstanceOf(UnsupportedOperationException.class);
  }

  @Test
  void testNullEngineIsRejected() {
    assertThatThrownBy(() -> new PcgJavaRandom((PcgRandom) null))
        .isInstanceOf(NullPointerException.class)
        .hasMessageContaining("engine");
  }

  @Test
  void testSharesWrappedEngine() {
    PcgRandom engine = new PcgRandom(5, 5);
    PcgJavaRandom random = new PcgJavaRandom(engine);
    PcgRandom twin = new PcgRandom(5, 5);

    engine.nextUnsigned();
    twin.nextUnsigned();

    assertThat(random.getEngine()).isSameAs(engine);
    assertThat(random.nextInt()).isEqualTo(twin.nextUnsigned());
  }

  @Test
  void testWorksAsStandardRandom() {
    List<Integer> first = new ArrayList<>();
    List<Integer> second = new ArrayList<>();
    for (int i = 0; i < 52; i++) {
      first.add(i);
      second.add(i);
    }

    Random a = new PcgJavaRandom(2024, 11);
    RandomGenerator b = new PcgJavaRandom(2024, 11);
    Collections.shuffle(first, a);
    Collections.shuffle(second, (Random) b);

    assertThat(first).isEqualTo(second).containsExactlyInAnyOrderElementsOf(second);
    assertThat(a.ints(1000, 0, 6).allMatch(v -> v >= 0 && v < 6)).isTrue();
    assertThat(a.doubles(1000).allMatch(v -> v >= 0.0 && v < 1.0)).isTrue();
  }

  @Test
  void testToStringNamesEngine() {
    assertThat(new PcgJavaRandom(1, 54).toString())
        .contains("PcgJavaRandom")
        .contains("increment=55");
  }
}
