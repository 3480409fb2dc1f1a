package io.turnstile.core.tool.impl;

import io.turnstile.core.tool.Tool;
import io.turnstile.core.tool.ToolContext;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Breaks a free-text product description into what is already stated and what still needs to be
 * clarified before positioning.
 */
public final class ProductAnalysisTool implements Tool {
    static final String ARGUMENT = "product_description";
    private static final int MIN_DESCRIPTION_CHARS = 20;

    @Override
    public String name() {
        return "analyze_product";
    }

    @Override
    public String description() {
        return "Analyze a product description: summarize the target customer, alternatives and "
            + "differentiators it mentions and list what still needs clarification.";
    }

    @Override
    public Map<String, Object> schema() {
        return Map.of(
            "type", "object",
            "properties", Map.of(ARGUMENT, Map.of(
                "type", "string",
                "description", "Free-text description of the product")),
            "required", List.of(ARGUMENT));
    }

    @Override
    public Optional<String> fallbackArgument() {
        return Optional.of(ARGUMENT);
    }

    @Override
    public String execute(Map<String, Object> input, ToolContext context) {
        String description = String.valueOf(input.getOrDefault(ARGUMENT, "")).trim();
        if (description.length() < MIN_DESCRIPTION_CHARS) {
            throw new IllegalArgumentException(ARGUMENT + " is too short to analyze");
        }
        String normalized = description.toLowerCase(Locale.ROOT);

        List<String> understood = new ArrayList<>();
        List<String> questions = new ArrayList<>();
        signal(normalized, understood, questions,
            "Target customer is described",
            "Who is the primary customer, and what triggers them to look for a solution?",
            "for ", "helps ", "customers", "users", "teams", "seekers");
        signal(normalized, understood, questions,
            "Current alternative is named",
            "What do customers use today instead of this product?",
            "instead of", "replaces", "rely on", "currently", "spreadsheets", "manual");
        signal(normalized, understood, questions,
            "A differentiator is claimed",
            "What can this product do that the alternatives cannot?",
            "unlike", "only ", "first ", "faster", "structured", "automat");
        signal(normalized, understood, questions,
            "Evidence or outcomes are mentioned",
            "What proof do you have that customers get this value?",
            "customers say", "case study", "increase", "reduce", "saves", "%");

        StringBuilder output = new StringBuilder();
        output.append("## Product Analysis\n\n");
        output.append("**Description:** ").append(description).append("\n\n");
        output.append("**What I understand:**\n");
        if (understood.isEmpty()) {
            output.append("- Only the general product idea so far\n");
        }
        understood.forEach(item -> output.append("- ").append(item).append('\n'));
        output.append("\n**What I need to clarify:**\n");
        if (questions.isEmpty()) {
            output.append("- Nothing critical; ready for positioning work\n");
        }
        questions.forEach(item -> output.append("- ").append(item).append('\n'));
        return output.toString();
    }

    private void signal(
        String text,
        List<String> understood,
        List<String> questions,
        String finding,
        String question,
        String... markers
    ) {
        for (String marker : markers) {
            if (text.contains(marker)) {
                understood.add(finding);
                return;
            }
        }
        questions.add(question);
    }
}
