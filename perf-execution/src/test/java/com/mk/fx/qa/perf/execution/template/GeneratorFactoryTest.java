package com.mk.fx.qa.perf.execution.template;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.SplittableRandom;
import org.junit.jupiter.api.Test;

class GeneratorFactoryTest {

  private static final Clock FIXED = Clock.fixed(Instant.parse("2024-05-01T10:15:30Z"), ZoneOffset.UTC);

  private final SplittableRandom random = new SplittableRandom(3);

  private Object generate(Map<String, Object> definition) {
    return GeneratorFactory.fromDefinition("gen", definition, FIXED).provide(random);
  }

  @Test
  void isDefinition_requiresTypeKey() {
    assertTrue(GeneratorFactory.isDefinition(Map.of("type", "uuid")));
    assertFalse(GeneratorFactory.isDefinition(Map.of("min", 1)));
  }

  @Test
  void builtInTypes_produceExpectedShapes() {
    assertThat(generate(Map.of("type", "choice", "values", List.of("x", "y")))).isIn("x", "y");
    long number = (Long) generate(Map.of("type", "randint", "min", 1, "max", 3));
    assertTrue(number >= 1 && number <= 3);
    assertThat((String) generate(Map.of("type", "string", "length", 6, "chars", "ab"))).matches("[ab]{6}");
    assertThat((String) generate(Map.of("type", "string"))).matches("[a-z0-9]{10}");
    assertThat((String) generate(Map.of("type", "email"))).contains("@example.");
    assertThat(generate(Map.of("type", "boolean"))).isIn(true, false);
    assertEquals("2024-05-01T10:15:30Z", generate(Map.of("type", "timestamp")));
    assertEquals(3, ((String) generate(Map.of("type", "lorem", "words", 3))).split(" ").length);
    double decimal = (Double) generate(Map.of("type", "float", "min", 1.5, "max", 2.5));
    assertTrue(decimal >= 1.5 && decimal <= 2.5);
  }

  @Test
  void weightedChoice_neverPicksZeroWeight() {
    Map<String, Object> definition =
        Map.of(
            "type",
            "weighted_choice",
            "choices",
            List.of(Map.of("value", "high", "weight", 0), Map.of("value", "low", "weight", 5)));
    for (int i = 0; i < 200; i++) {
      assertEquals("low", generate(definition));
    }
  }

  @Test
  void unknownType_isRejected() {
    var ex = assertThrows(
        IllegalArgumentException.class, () -> generate(Map.of("type", "telepathy")));
    assertTrue(ex.getMessage().contains("telepathy"));
  }

  @Test
  void missingParameters_areRejected() {
    assertThrows(IllegalArgumentException.class, () -> generate(Map.of("type", "randint", "min", 1)));
    assertThrows(IllegalArgumentException.class, () -> generate(Map.of("type", "choice", "values", List.of())));
  }

  @Test
  void rangeFrom_acceptsMappingOrPair() {
    var fromMap = GeneratorFactory.rangeFrom("r", Map.of("min", 0, "max", 100, "step", 25));
    assertEquals(new ValueProvider.IntegerRange(0, 100, 25), fromMap);
    var fromList = GeneratorFactory.rangeFrom("r", List.of(1, 2));
    assertEquals(new ValueProvider.IntegerRange(1, 2, 1), fromList);
    assertInstanceOf(ValueProvider.DecimalRange.class, GeneratorFactory.rangeFrom("r", List.of(0.5, 2)));
  }

  @Test
  void rangeFrom_rejectsBadBounds() {
    Map<String, Object> noMax = new HashMap<>();
    noMax.put("min", 1);
    assertThrows(IllegalArgumentException.class, () -> GeneratorFactory.rangeFrom("r", noMax));
    assertThrows(IllegalArgumentException.class, () -> GeneratorFactory.rangeFrom("r", "1-5"));
    assertThrows(
        IllegalArgumentException.class,
        () -> GeneratorFactory.rangeFrom("r", Map.of("min", 1, "max", 5, "step", 0.5)));
    assertThrows(
        IllegalArgumentException.class, () -> GeneratorFactory.rangeFrom("r", Map.of("min", "a", "max", 5)));
  }

  @Test
  void boundsOutsideLongRange_areRejected() {
    var ex =
        assertThrows(
            IllegalArgumentException.class,
            () -> GeneratorFactory.rangeFrom("big", Map.of("min", 1, "max", "99999999999999999999")));
    assertTrue(ex.getMessage().contains("big.max"));
    assertThrows(
        IllegalArgumentException.class,
        () -> generate(Map.of("type", "randint", "min", "-99999999999999999999", "max", 1)));
  }
}
