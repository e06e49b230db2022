package com.flamingo.ai.regulation.api;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.regulation.api.rest.RegulationController;
import java.util.Arrays;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;

/**
 * Contract tests for the published endpoints.
 *
 * <ul>
 *   <li>POST /api/regulations/parse - Structure extracted text
 *   <li>POST /api/regulations/upload - Structure an uploaded file
 *   <li>POST /api/regulations/chunks - Chunks of extracted text
 * </ul>
 */
class ApiContractTest {

  @Nested
  @DisplayName("RegulationController API contract")
  class RegulationControllerContract {

    @Test
    @DisplayName("should be mapped to /api/regulations")
    void shouldBeMappedToApiRegulations() {
      RequestMapping mapping = RegulationController.class.getAnnotation(RequestMapping.class);
      assertThat(mapping).isNotNull();
      assertThat(mapping.value()).containsExactly("/api/regulations");
    }

    @Test
    @DisplayName("should expose parse, upload and chunks as POST endpoints")
    void shouldExposePostEndpoints() {
      assertThat(
              Arrays.stream(RegulationController.class.getDeclaredMethods())
                  .map(method -> method.getAnnotation(PostMapping.class))
                  .filter(mapping -> mapping != null)
                  .flatMap(mapping -> Arrays.stream(mapping.value())))
          .containsExactlyInAnyOrder("/parse", "/upload", "/chunks");
    }
  }
}
