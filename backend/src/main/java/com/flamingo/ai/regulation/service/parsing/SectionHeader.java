package com.flamingo.ai.regulation.service.parsing;

/**
 * An article header recognized at the start of a line.
 *
 * @param articleNumber e.g. {@code 6조}, {@code 6조의2}, {@code 6조의2의3}
 * @param articleTitle text inside the parentheses, trimmed; empty for {@code ()}
 * @param trailingContent text after the closing parenthesis, trimmed
 */
public record SectionHeader(String articleNumber, String articleTitle, String trailingContent) {}
