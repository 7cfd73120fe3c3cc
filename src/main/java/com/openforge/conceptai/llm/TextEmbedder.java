package com.openforge.conceptai.llm;

/** Turns text into an embedding vector with whatever provider is active. */
@FunctionalInterface
public interface TextEmbedder {

    float[] embed(String text);
}
