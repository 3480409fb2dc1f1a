package io.turnstile.core.tool.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.turnstile.core.tool.Tool;
import io.turnstile.core.tool.ToolContext;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Scores how ready a product is for positioning work from five yes/no checks, two points each.
 */
public final class PositioningReadinessTool implements Tool {
    private static final ObjectMapper JSON = new ObjectMapper();
    private static final Map<String, String> CHECKS = checks();

    @Override
    public String name() {
        return "calculate_positioning_readiness";
    }

    @Override
    public String description() {
        return "Calculate how ready a product is for positioning work. Use when the user wants to know "
            + "whether they can start positioning or which gaps to close first.";
    }

    @Override
    public Map<String, Object> schema() {
        Map<String, Object> properties = new LinkedHashMap<>();
        CHECKS.forEach((argument, label) -> properties.put(argument, Map.of(
            "type", "boolean",
            "description", label)));
        return Map.of(
            "type", "object",
            "properties", properties,
            "required", List.copyOf(CHECKS.keySet()));
    }

    @Override
    public String execute(Map<String, Object> input, ToolContext context) {
        List<String> strengths = new ArrayList<>();
        List<String> gaps = new ArrayList<>();
        String nextAction = null;
        for (Map.Entry<String, String> check : CHECKS.entrySet()) {
            if (flag(input, check.getKey())) {
                strengths.add(check.getValue());
            } else {
                gaps.add(check.getValue());
                if (nextAction == null) {
                    nextAction = nextAction(check.getKey());
                }
            }
        }

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("score", strengths.size() * 2);
        result.put("strengths", strengths);
        result.put("gaps", gaps);
        result.put("next_action", nextAction == null ? "You're ready to create positioning!" : nextAction);
        try {
            return JSON.writeValueAsString(result);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to render readiness score", e);
        }
    }

    private boolean flag(Map<String, Object> input, String key) {
        Object value = input.get(key);
        if (value instanceof Boolean bool) {
            return bool;
        }
        if (value instanceof String text && ("true".equalsIgnoreCase(text) || "false".equalsIgnoreCase(text))) {
            return Boolean.parseBoolean(text);
        }
        throw new IllegalArgumentException(key + " must be a boolean, got: " + value);
    }

    private String nextAction(String missingCheck) {
        return switch (missingCheck) {
            case "has_target_customer" -> "Define your target customer segment first";
            case "has_competitive_alternative" -> "Identify what customers use before finding you";
            case "has_key_differentiator" -> "Articulate what you have that alternatives don't";
            case "has_customer_proof" -> "Collect customer testimonials and use cases";
            default -> "Define your market category";
        };
    }

    private static Map<String, String> checks() {
        Map<String, String> checks = new LinkedHashMap<>();
        checks.put("has_target_customer", "Target Customer Definition");
        checks.put("has_competitive_alternative", "Competitive Alternative Identified");
        checks.put("has_key_differentiator", "Key Differentiator Articulated");
        checks.put("has_customer_proof", "Customer Proof Available");
        checks.put("has_clear_category", "Market Category Defined");
        return checks;
    }
}
