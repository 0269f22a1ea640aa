package com.enterpriseagent.core.roles;

import com.enterpriseagent.core.llm.ParsedResponse;
import com.enterpriseagent.core.llm.ResponseParser;
import com.enterpriseagent.core.model.ReflectionOutcome;
import com.enterpriseagent.core.model.ReflectionProposal;
import com.enterpriseagent.core.model.ValidationResult;
import com.enterpriseagent.core.state.RunState;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Proposes a repair after a failed validation. Halts once confident or after
 * {@link RunState#MAX_ITERATIONS} attempts.
 */
@Component
public class Reflector {

    private static final Logger log = LoggerFactory.getLogger(Reflector.class);

    static final String ROLE = "Reflector";
    static final double HALT_CONFIDENCE = 0.8;

    private final RoleSupport support;
    private final ResponseParser parser;
    private final ObjectMapper objectMapper;

    public Reflector(RoleSupport support, ResponseParser parser, ObjectMapper objectMapper) {
        this.support = support;
        this.parser = parser;
        this.objectMapper = objectMapper;
    }

    public ReflectionOutcome reflect(RunContext context,
                                     Map<String, Object> validation,
                                     String currentOutput,
                                     String domain,
                                     int iterations,
                                     boolean vulnFlag) {
        if (iterations >= RunState.MAX_ITERATIONS) {
            log.warn("Reflection ceiling of {} reached; halting", RunState.MAX_ITERATIONS);
            return new ReflectionOutcome(currentOutput, true, iterations, 0.0, "", "");
        }

        String feedback = toJson(validation);
        String model = support.route(feedback, domain, vulnFlag);
        String prompt = "Analyze the validation feedback and propose targeted fixes.\n"
                + "Respond with JSON: {\"analysis\": str, \"fixes\": [{\"description\": str, \"risks\": str}], "
                + "\"selected_fix\": int, \"revised_output\": str, \"confidence\": float}.\n"
                + "Base only on provided data.\n"
                + "Validation feedback: " + feedback + "\nCurrent output:\n" + currentOutput + "\n";
        String response = support.callModel(context, model, prompt, ROLE, "reflect");

        ParsedResponse<ReflectionProposal> parsed = parser.parseOrRaw(response, ReflectionProposal.class);
        String revised;
        double confidence;
        String analysis;
        if (parsed.isStructured()) {
            ReflectionProposal proposal = parsed.value();
            revised = proposal.revisedOutput() == null || proposal.revisedOutput().isBlank()
                    ? currentOutput : proposal.revisedOutput();
            confidence = proposal.confidence() == null ? 0.0 : proposal.confidence();
            analysis = proposal.analysis() == null ? "" : proposal.analysis();
        } else {
            String raw = response == null ? "" : response.strip();
            revised = raw.isEmpty() ? currentOutput : raw;
            confidence = 0.0;
            analysis = raw;
        }
        boolean halt = confidence >= HALT_CONFIDENCE;
        log.info("Reflection {} → confidence {}, halt={}", iterations + 1, confidence, halt);
        return new ReflectionOutcome(revised, halt, iterations + 1, confidence, analysis, model);
    }

    private String toJson(Map<String, Object> validation) {
        try {
            return objectMapper.writeValueAsString(validation);
        } catch (JsonProcessingException e) {
            log.debug("Validation feedback not serializable: {}", e.getMessage());
            return String.valueOf(validation);
        }
    }

    public Map<String, Object> apply(RunContext context, RunState state) {
        Map<String, Object> validation = state.validation().map(ValidationResult::toMap).orElse(Map.of());
        ReflectionOutcome outcome = reflect(context, validation, state.output(), state.domain(),
                state.iterations(), state.vulnFlag());
        var update = new LinkedHashMap<String, Object>();
        update.put("output", outcome.output());
        update.put("halted", outcome.halt());
        update.put("iterations", outcome.iterations());
        update.put("confidence", outcome.confidence());
        update.put("reflectionAnalysis", outcome.analysis());
        return update;
    }
}
