package com.flamingo.ai.regulation.service.chunking;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A retrieval unit cut from a regulation tree: one per article and one per paragraph.
 *
 * @param chunkId {@code {document_id}.{article}} or {@code {document_id}.{article}.{paragraph}}
 * @param chunkType {@link ChunkType#ARTICLE} or {@link ChunkType#PARAGRAPH}
 * @param metadataText human-readable citation, e.g. {@code 「방위사업관리규정」 2조1항}
 * @param content text to embed
 */
public record RegulationChunk(
    @JsonProperty("chunk_id") String chunkId,
    @JsonProperty("chunk_type") ChunkType chunkType,
    @JsonProperty("metadata_text") String metadataText,
    @JsonProperty("content") String content) {}
