package com.enterpriseagent.core.model;

import java.io.Serializable;

/**
 * Coder output.
 *
 * @param output generated artifact text
 * @param model  model (or tool model) that produced it
 * @param source {@link #SOURCE_MODEL}, {@link #SOURCE_TOOL}, or {@link #SOURCE_TOOL_FALLBACK}
 *               when the tool was unavailable and a model answered instead
 */
public record Generation(
        String output,
        String model,
        String source
) implements Serializable {

    public static final String SOURCE_MODEL = "model";
    public static final String SOURCE_TOOL = "tool";
    public static final String SOURCE_TOOL_FALLBACK = "model_fallback";
}
