package com.openforge.conceptai.llm;

/** Per-instance knobs carried into a newly constructed provider. */
public record ProviderSettings(String model, double temperature) {
}
