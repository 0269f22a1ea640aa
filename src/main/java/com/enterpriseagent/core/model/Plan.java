package com.enterpriseagent.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * Planner output: the raw plan text, its non-empty lines as ordered epics, and the model used.
 */
public record Plan(
        String text,
        List<String> epics,
        String model
) implements Serializable {

    public Plan {
        text = text == null ? "" : text;
        epics = epics == null ? List.of() : List.copyOf(epics);
        model = model == null ? "" : model;
    }
}
