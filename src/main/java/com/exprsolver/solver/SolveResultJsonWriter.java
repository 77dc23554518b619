package com.exprsolver.solver;

import com.exprsolver.exception.ConfigurationException;
import com.exprsolver.exception.EvaluationException;
import com.exprsolver.exception.ExprSolverException;
import com.exprsolver.exception.LexicalException;
import com.exprsolver.exception.SyntaxException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Renders solver output as the JSON payload returned by the HTTP layer.
 * <p>
 * Success:
 * <pre>
 * {"input_expression": "...", "expression_corrected": "...",
 *  "solution": {"steps": [...], "final_result": "14"},
 *  "export_formats": {"latex": "...", "mathml": "..."},
 *  "status": "success"}
 * </pre>
 * Errors carry only structured fields: {@code error_type} plus position/expected/found,
 * character, or kind/step_index/partial_steps.
 */
public class SolveResultJsonWriter {

    private static final ObjectMapper objectMapper = new ObjectMapper();

    public String write(SolveResult solved) {
        ObjectNode root = objectMapper.createObjectNode();
        root.put("input_expression", solved.inputExpression());
        root.put("expression_corrected", solved.normalizedExpression());

        ObjectNode solution = root.putObject("solution");
        ArrayNode steps = solution.putArray("steps");
        solved.formattedSteps().forEach(steps::add);
        solution.put("final_result", solved.result().finalValueText());

        ObjectNode exports = root.putObject("export_formats");
        exports.put("latex", solved.latex());
        exports.put("mathml", solved.mathml());

        root.put("status", "success");
        return serialize(root);
    }

    public String writeError(ExprSolverException error) {
        ObjectNode root = objectMapper.createObjectNode();
        root.put("status", "error");

        if (error instanceof LexicalException lexical) {
            root.put("error_type", "lexical");
            root.put("position", lexical.getPosition());
            if (lexical.getCharacter() != null) {
                root.put("character", String.valueOf(lexical.getCharacter()));
            }
        } else if (error instanceof SyntaxException syntax) {
            root.put("error_type", "syntax");
            root.put("position", syntax.getPosition());
            root.put("expected", syntax.getExpected());
            root.put("found", syntax.getFound());
        } else if (error instanceof EvaluationException evaluation) {
            root.put("error_type", "arithmetic");
            root.put("kind", evaluation.getKind().name());
            root.put("step_index", evaluation.getStepIndex());
            ArrayNode partial = root.putArray("partial_steps");
            evaluation.getPartialSteps().forEach(step -> partial.add(StepFormatter.format(step)));
        } else if (error instanceof ConfigurationException) {
            root.put("error_type", "configuration");
        } else {
            root.put("error_type", "internal");
        }
        return serialize(root);
    }

    private static String serialize(ObjectNode node) {
        try {
            return objectMapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize solver response", e);
        }
    }
}
