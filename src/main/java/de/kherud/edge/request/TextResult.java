package de.kherud.edge.request;

/**
 * Text produced by a completion.
 *
 * @param text       generated text without the prompt
 * @param tokenCount number of generated tokens
 */
public record TextResult(String text, int tokenCount) {
}
