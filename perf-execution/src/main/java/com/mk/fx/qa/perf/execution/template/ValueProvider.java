package com.mk.fx.qa.perf.execution.template;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import java.util.random.RandomGenerator;

/**
 * A stateless generator of one value per invocation, selected once from a template tag or a
 * generator definition.
 *
 * <p>Providers never hold randomness themselves: the caller passes the random handle, so a seeded
 * handle reproduces a run. Apart from that handle (and the clock for timestamps) a provider is
 * pure with respect to configuration.
 */
public sealed interface ValueProvider {

  /**
   * Produces a fresh value.
   *
   * @param random random source owned by the calling worker
   * @return the generated value
   */
  Object provide(RandomGenerator random);

  /** Returns the configured value unchanged. */
  record Literal(Object value) implements ValueProvider {
    @Override
    public Object provide(RandomGenerator random) {
      return value;
    }
  }

  /** Uniform integer in {@code [min, max]} inclusive, restricted to {@code min + k * step}. */
  record IntegerRange(long min, long max, long step) implements ValueProvider {
    public IntegerRange {
      if (min > max) {
        long swap = min;
        min = max;
        max = swap;
      }
      if (step < 1) {
        throw new IllegalArgumentException("Range step must be positive, got " + step);
      }
    }

    public IntegerRange(long min, long max) {
      this(min, max, 1);
    }

    @Override
    public Object provide(RandomGenerator random) {
      // span and slot count are unsigned: max - min may exceed Long.MAX_VALUE
      long slots = Long.divideUnsigned(max - min, step) + 1;
      if (slots == 0) {
        return random.nextLong();
      }
      if (slots > 0) {
        return min + random.nextLong(slots) * step;
      }
      long k;
      do {
        k = random.nextLong();
      } while (Long.compareUnsigned(k, slots) >= 0);
      return min + k * step;
    }
  }

  /** Uniform decimal in {@code [min, max]} rounded to {@code scale} decimal places. */
  record DecimalRange(BigDecimal min, BigDecimal max, int scale) implements ValueProvider {
    public DecimalRange {
      Objects.requireNonNull(min, "min");
      Objects.requireNonNull(max, "max");
      if (min.compareTo(max) > 0) {
        BigDecimal swap = min;
        min = max;
        max = swap;
      }
    }

    @Override
    public Object provide(RandomGenerator random) {
      double low = min.doubleValue();
      double sample = low + random.nextDouble() * (max.doubleValue() - low);
      BigDecimal rounded = BigDecimal.valueOf(sample).setScale(scale, RoundingMode.HALF_UP);
      if (rounded.compareTo(min) < 0) {
        rounded = min.setScale(scale, RoundingMode.CEILING);
      } else if (rounded.compareTo(max) > 0) {
        rounded = max.setScale(scale, RoundingMode.FLOOR);
      }
      return rounded.doubleValue();
    }
  }

  /** Uniform pick from a fixed list. */
  record Choice(List<Object> options) implements ValueProvider {
    public Choice {
      if (options == null || options.isEmpty()) {
        throw new IllegalArgumentException("Choice needs at least one value");
      }
      options = Collections.unmodifiableList(new ArrayList<>(options));
    }

    @Override
    public Object provide(RandomGenerator random) {
      return options.get(random.nextInt(options.size()));
    }
  }

  /** Pick proportional to non-negative weights. */
  record WeightedChoice(List<Object> values, List<Double> weights) implements ValueProvider {
    public WeightedChoice {
      if (values == null || values.isEmpty() || weights == null || values.size() != weights.size()) {
        throw new IllegalArgumentException("Weighted choice needs one weight per value");
      }
      double total = 0;
      for (Double weight : weights) {
        if (weight == null || weight < 0) {
          throw new IllegalArgumentException("Weights must be non-negative, got " + weight);
        }
        total += weight;
      }
      if (total <= 0) {
        throw new IllegalArgumentException("At least one weight must be positive");
      }
      values = Collections.unmodifiableList(new ArrayList<>(values));
      weights = List.copyOf(weights);
    }

    @Override
    public Object provide(RandomGenerator random) {
      double total = weights.stream().mapToDouble(Double::doubleValue).sum();
      double target = random.nextDouble() * total;
      double cumulative = 0;
      for (int i = 0; i < values.size(); i++) {
        cumulative += weights.get(i);
        if (target < cumulative) {
          return values.get(i);
        }
      }
      // floating point residue lands on the last positive weight
      for (int i = values.size() - 1; i >= 0; i--) {
        if (weights.get(i) > 0) {
          return values.get(i);
        }
      }
      return values.get(values.size() - 1);
    }
  }

  /** Random string of {@code length} characters drawn from {@code alphabet}. */
  record RandomString(int length, String alphabet) implements ValueProvider {
    public RandomString {
      if (length < 0) {
        throw new IllegalArgumentException("String length must not be negative, got " + length);
      }
      if (alphabet == null || alphabet.isEmpty()) {
        throw new IllegalArgumentException("String alphabet must not be empty");
      }
    }

    @Override
    public Object provide(RandomGenerator random) {
      var sb = new StringBuilder(length);
      for (int i = 0; i < length; i++) {
        sb.append(alphabet.charAt(random.nextInt(alphabet.length())));
      }
      return sb.toString();
    }
  }

  /** Version 4 UUID built from the random handle. */
  record Uuid() implements ValueProvider {
    @Override
    public Object provide(RandomGenerator random) {
      long msb = (random.nextLong() & ~0xF000L) | 0x4000L;
      long lsb = (random.nextLong() & 0x3FFFFFFFFFFFFFFFL) | 0x8000000000000000L;
      return new UUID(msb, lsb).toString();
    }
  }

  /** Current instant as an ISO-8601 UTC string, read at invocation time. */
  record Timestamp(Clock clock) implements ValueProvider {
    public Timestamp {
      Objects.requireNonNull(clock, "clock");
    }

    @Override
    public Object provide(RandomGenerator random) {
      return Instant.now(clock).toString();
    }
  }

  /** {@code words} space-separated filler words. */
  record Lorem(int words) implements ValueProvider {
    private static final List<String> WORDS =
        List.of(
            "lorem", "ipsum", "dolor", "sit", "amet", "consectetur", "adipiscing", "elit", "sed",
            "do", "eiusmod", "tempor", "incididunt", "ut", "labore", "et", "dolore", "magna",
            "aliqua", "enim", "ad", "minim", "veniam", "quis", "nostrud", "exercitation",
            "ullamco", "laboris", "nisi", "aliquip", "ex", "ea", "commodo", "consequat");

    public Lorem {
      if (words < 0) {
        throw new IllegalArgumentException("Word count must not be negative, got " + words);
      }
    }

    @Override
    public Object provide(RandomGenerator random) {
      var sb = new StringBuilder();
      for (int i = 0; i < words; i++) {
        if (i > 0) sb.append(' ');
        sb.append(WORDS.get(random.nextInt(WORDS.size())));
      }
      return sb.toString();
    }
  }

  /** Random address on a reserved example domain. */
  record Email() implements ValueProvider {
    private static final List<String> DOMAINS = List.of("example.com", "example.org", "example.net");

    @Override
    public Object provide(RandomGenerator random) {
      return "user" + random.nextInt(1_000_000) + "@" + DOMAINS.get(random.nextInt(DOMAINS.size()));
    }
  }
}
