package com.flamingo.ai.regulation.service.parsing.model;

/**
 * Counters collected while structuring one document. Not part of the document tree.
 *
 * @param linesRead non-empty input lines before noise filtering
 * @param noiseLinesDropped lines removed as running headers, footers or page numbers
 * @param articles articles emitted, including an implicit leading article
 * @param paragraphs paragraphs emitted, including virtual ones
 * @param virtualParagraphs paragraphs synthesized with an empty symbol
 * @param items items emitted
 * @param subitems subitems emitted
 * @param subSubitems sub-subitems emitted
 * @param orphansDropped subitem/sub-subitem enumerators discarded for lack of a parent
 * @param orphansSynthesized virtual items/subitems created for orphan enumerators
 */
public record ParseStatistics(
    int linesRead,
    int noiseLinesDropped,
    int articles,
    int paragraphs,
    int virtualParagraphs,
    int items,
    int subitems,
    int subSubitems,
    int orphansDropped,
    int orphansSynthesized) {}
