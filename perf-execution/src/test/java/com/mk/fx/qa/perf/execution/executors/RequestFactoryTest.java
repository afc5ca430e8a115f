package com.mk.fx.qa.perf.execution.executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

import com.mk.fx.qa.perf.execution.cfg.ObjectMapperConfig;
import com.mk.fx.qa.perf.execution.config.EndpointSpec;
import com.mk.fx.qa.perf.execution.config.PayloadLoader;
import com.mk.fx.qa.perf.execution.config.TestConfig;
import com.mk.fx.qa.perf.execution.template.LookupTables;
import com.mk.fx.qa.perf.execution.template.TemplateResolver;
import com.mk.fx.qa.perf.execution.template.ValueProviderRegistry;
import com.mk.fx.qa.perf.rest.BodyEncoding;
import com.mk.fx.qa.perf.rest.HttpMethod;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.SplittableRandom;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class RequestFactoryTest {

  private static final ObjectMapperConfig MAPPERS = new ObjectMapperConfig();

  @TempDir Path dir;

  private TestConfig config(EndpointSpec endpoint) {
    return TestConfig.builder()
        .baseUrl("http://api.test/v1/")
        .endpoints(List.of(endpoint))
        .variables(Map.of("item_id", 12345, "token", "abc"))
        .datasets(Map.of("categories", List.of("Books", "Home")))
        .build();
  }

  private PreparedRequest prepare(EndpointSpec endpoint) {
    var config = config(endpoint);
    var tables = LookupTables.from(config);
    var resolver = new TemplateResolver(new ValueProviderRegistry(tables), tables, new SplittableRandom(5));
    var payloads = new PayloadLoader(dir, MAPPERS.objectMapper(), MAPPERS.yamlObjectMapper());
    return new RequestFactory(config, payloads).prepare(endpoint, resolver);
  }

  @Test
  void resolvesPathQueryAndHeaders() {
    var endpoint =
        EndpointSpec.builder()
            .name("get item")
            .path("/items/${item_id}")
            .params(Map.of("category", "$random{categories}", "limit", 10))
            .headers(Map.of("Authorization", "Bearer ${token}"))
            .timeoutSeconds(3)
            .build();

    var request = prepare(endpoint);

    assertEquals("get item", request.endpointName());
    assertEquals(HttpMethod.GET, request.method());
    assertEquals("http://api.test/v1/items/12345", request.url());
    assertThat(request.query().get("category")).isIn("Books", "Home");
    assertEquals("10", request.query().get("limit"));
    assertEquals("Bearer abc", request.headers().get("Authorization"));
    assertEquals(Duration.ofSeconds(3), request.toRequest().getTimeout());
  }

  @Test
  void body_isAttachedOnlyForMethodsThatCarryOne() {
    var data = Map.<String, Object>of("id", "$uuid");

    assertNull(prepare(EndpointSpec.builder().path("/a").data(data).build()).body());
    assertNull(prepare(EndpointSpec.builder().method("DELETE").path("/a").data(data).build()).body());

    var post = prepare(EndpointSpec.builder().method("POST").path("/a").data(data).build());
    assertTrue(post.hasBody());
    assertNotEquals("$uuid", ((Map<?, ?>) post.body()).get("id"));
    assertEquals(BodyEncoding.JSON, post.encoding());
  }

  @Test
  void emptyBody_isNotAttached() {
    assertFalse(prepare(EndpointSpec.builder().method("POST").path("/a").data(Map.of()).build()).hasBody());
    assertFalse(prepare(EndpointSpec.builder().method("PUT").path("/a").data("").build()).hasBody());
    assertFalse(prepare(EndpointSpec.builder().method("PATCH").path("/a").build()).hasBody());
  }

  @Test
  void formEncoding_followsJsonContentFlag() {
    var request =
        prepare(
            EndpointSpec.builder()
                .method("POST")
                .path("/form")
                .jsonContent(false)
                .data(Map.of("user", "u-${item_id}"))
                .build());

    assertEquals(BodyEncoding.FORM, request.encoding());
    assertEquals(Map.of("user", "u-12345"), request.body());
  }

  @Test
  void fileReference_isLoadedThenResolved() throws IOException {
    Files.writeString(dir.resolve("item.json"), "{\"id\": \"${item_id}\", \"name\": \"Product $random{1000,9999}\"}");

    var request = prepare(EndpointSpec.builder().method("POST").path("/items").data("@item.json").build());

    var body = (Map<?, ?>) request.body();
    assertEquals(12345, body.get("id"));
    assertThat((String) body.get("name")).matches("Product \\d{4}");
  }
}
