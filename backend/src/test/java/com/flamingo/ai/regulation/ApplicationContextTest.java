package com.flamingo.ai.regulation;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.regulation.service.chunking.RegulationChunk;
import com.flamingo.ai.regulation.service.chunking.RegulationChunker;
import com.flamingo.ai.regulation.service.conversion.RegulationConversionService;
import com.flamingo.ai.regulation.service.extraction.TextExtractorRouter;
import com.flamingo.ai.regulation.service.parsing.model.ParsedRegulation;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;

/** Verifies that the application context loads and the pipeline beans are wired together. */
@SpringBootTest
class ApplicationContextTest {

  @Autowired private ApplicationContext applicationContext;
  @Autowired private RegulationConversionService conversionService;
  @Autowired private RegulationChunker chunker;
  @Autowired private TextExtractorRouter extractorRouter;
  @Autowired private MeterRegistry meterRegistry;

  @Test
  @DisplayName("Application context should load successfully")
  void contextLoads() {
    assertThat(applicationContext).isNotNull();
  }

  @Test
  @DisplayName("Should route PDF and DOCX files to an extractor")
  void shouldRegisterExtractors() {
    assertThat(extractorRouter.supports("rule.pdf")).isTrue();
    assertThat(extractorRouter.supports("rule.docx")).isTrue();
    assertThat(extractorRouter.supports("rule.hwp")).isFalse();
  }

  @Test
  @DisplayName("Should structure and chunk text with the configured pipeline")
  void shouldStructureText() {
    ParsedRegulation result =
        conversionService.convert(
            "1", "rule(훈령)(제1호)(20240101).txt", "제6조(보안과제) ①비밀 준수 의무\n②교육 실시");

    assertThat(result.document().mainBody()).hasSize(1);
    assertThat(chunker.chunk(result.document()))
        .extracting(RegulationChunk::chunkId)
        .containsExactly("1.6", "1.6.1", "1.6.2");
  }

  @Test
  @DisplayName("Should time conversions through the timed aspect")
  void shouldTimeConversions() {
    conversionService.convert("2", "rule.txt", "제1조(목적) 내용");

    Timer timer = meterRegistry.find("regulation.convert").timer();
    assertThat(timer).isNotNull();
    assertThat(timer.count()).isPositive();
  }
}
