package com.flamingo.ai.regulation.api.dto.response;

import com.flamingo.ai.regulation.service.chunking.RegulationChunk;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for the chunks of one regulation. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChunkResponse {

  private List<RegulationChunk> chunks;
}
