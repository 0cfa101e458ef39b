package com.simsuggest.similarity.fusion;

/**
 * Weights applied to the normalized lexical and vector subscores. They usually sum to 1.0; nothing enforces it.
 */
public record FusionPolicy(double lexicalWeight, double vectorWeight) {
}
