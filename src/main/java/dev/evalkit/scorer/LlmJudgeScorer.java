package dev.evalkit.scorer;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.github.mustachejava.DefaultMustacheFactory;
import com.github.mustachejava.Mustache;
import dev.evalkit.error.EvalException;
import dev.evalkit.json.EvalJsonMapper;
import dev.evalkit.provider.ModelConfig;
import dev.evalkit.provider.ModelProvider;
import dev.evalkit.provider.ModelRequest;
import java.io.StringReader;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;
import javax.annotation.Nullable;
import lombok.extern.slf4j.Slf4j;

/**
 * Grades a response with a judge model against a {@link Rubric}.
 *
 * <p>The judge is always called at temperature 0. Its answer must contain a JSON object with a
 * {@code criteria_scores} map of criterion name to a score in [0,1]. The aggregate is the
 * weight-normalized sum of the criterion scores.
 */
@Slf4j
public final class LlmJudgeScorer implements Scorer {
    public static final String NAME = "llm_judge";
    public static final double DEFAULT_THRESHOLD = 0.7;
    public static final String DEFAULT_JUDGE_MODEL = "gpt-4o-mini";

    static final String SYSTEM_PROMPT =
            "You are an impartial evaluator. Grade the response strictly against the rubric and"
                    + " answer with a single JSON object only.";

    static final String DEFAULT_TEMPLATE =
            """
            Evaluate the response below.

            Input:
            {{{input}}}

            Expected answer:
            {{{expected}}}

            Response:
            {{{actual}}}

            Criteria:
            {{#criteria}}
            - {{name}} (weight {{weight}}): {{{description}}}
            {{/criteria}}
            {{#instructions}}

            Additional instructions:
            {{{instructions}}}
            {{/instructions}}

            Score every criterion between 0.0 and 1.0 and reply with JSON of the form:
            {"criteria_scores": {"<criterion>": <score>}, "reasoning": "<why>",
             "suggestions": ["<improvement>"]}
            """;

    private final ModelProvider judge;
    private final ModelConfig judgeModel;
    private final Rubric rubric;
    private final double threshold;
    private final Mustache template;

    private LlmJudgeScorer(Builder builder) {
        this.judge = Objects.requireNonNull(builder.judge, "judge provider");
        this.judgeModel = builder.judgeModel.withTemperature(0.0);
        this.rubric = builder.rubric;
        this.threshold = builder.threshold;
        this.template =
                new DefaultMustacheFactory()
                        .compile(new StringReader(builder.template), "llm-judge");
    }

    public static Builder builder(ModelProvider judge) {
        return new Builder(judge);
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public boolean callsModel() {
        return true;
    }

    @Override
    public ScorerResult score(
            @Nullable Object actual, @Nullable Object expected, ScoringContext context) {
        var prompt = renderPrompt(actual, expected, context.input());
        final JsonNode verdict;
        try {
            var response = judge.complete(new ModelRequest(judgeModel, SYSTEM_PROMPT, prompt));
            verdict = parseVerdict(response.text());
        } catch (EvalException | JsonProcessingException e) {
            log.debug("judge {} failed to grade test case {}", judgeModel, context.testCaseId(), e);
            return ScorerResult.error(NAME, "Judge error", e);
        }

        var scores = verdict.path("criteria_scores");
        var breakdown = new LinkedHashMap<String, Double>();
        var missing = new ArrayList<String>();
        double weighted = 0;
        for (var criterion : rubric.criteria()) {
            var node = scores.get(criterion.name());
            double value;
            if (node == null || !node.isNumber()) {
                missing.add(criterion.name());
                value = 0.0;
            } else {
                value = ScorerResult.clamp(node.asDouble());
            }
            breakdown.put(criterion.name(), value);
            weighted += value * criterion.weight();
        }
        double aggregate = ScorerResult.clamp(weighted / rubric.totalWeight());
        boolean passed = aggregate >= threshold;

        var metadata = new LinkedHashMap<String, Object>();
        metadata.put("model", judgeModel.model());
        metadata.put("reasoning", verdict.path("reasoning").asText(""));
        var suggestions = new ArrayList<String>();
        verdict.path("suggestions").forEach(s -> suggestions.add(s.asText()));
        metadata.put("suggestions", suggestions);
        if (!missing.isEmpty()) {
            metadata.put("missingCriteria", missing);
        }
        var reason =
                "Judge score %.2f %s threshold %.2f"
                        .formatted(aggregate, passed ? "meets" : "is below", threshold);
        return new ScorerResult(NAME, aggregate, passed, reason, breakdown, metadata);
    }

    String renderPrompt(
            @Nullable Object actual, @Nullable Object expected, @Nullable Object input) {
        Map<String, Object> scope = new LinkedHashMap<>();
        scope.put("input", render(input));
        scope.put("expected", render(expected));
        scope.put("actual", render(actual));
        scope.put(
                "criteria",
                rubric.criteria().stream()
                        .map(
                                c ->
                                        Map.<String, Object>of(
                                                "name", c.name(),
                                                "description", c.description(),
                                                "weight", c.weight()))
                        .collect(Collectors.toList()));
        if (!rubric.instructions().isBlank()) {
            scope.put("instructions", rubric.instructions());
        }
        var writer = new StringWriter();
        template.execute(writer, scope);
        writer.flush();
        return writer.toString();
    }

    /** Pulls the outermost JSON object out of the judge's answer, ignoring code fences. */
    static JsonNode parseVerdict(String text) throws JsonProcessingException {
        int start = text.indexOf('{');
        int end = text.lastIndexOf('}');
        if (start < 0 || end <= start) {
            throw EvalException.scoring(NAME, "judge answer contained no JSON object: " + text);
        }
        return EvalJsonMapper.get().readTree(text.substring(start, end + 1));
    }

    private static String render(@Nullable Object value) {
        if (value == null) {
            return "(none)";
        } else if (value instanceof String text) {
            return text;
        }
        return EvalJsonMapper.toJson(value);
    }

    public static final class Builder {
        private final ModelProvider judge;
        private ModelConfig judgeModel = ModelConfig.of(DEFAULT_JUDGE_MODEL);
        private Rubric rubric = Rubric.defaultRubric();
        private double threshold = DEFAULT_THRESHOLD;
        private String template = DEFAULT_TEMPLATE;

        private Builder(ModelProvider judge) {
            this.judge = judge;
        }

        public Builder judgeModel(ModelConfig judgeModel) {
            this.judgeModel = Objects.requireNonNull(judgeModel);
            return this;
        }

        public Builder rubric(Rubric rubric) {
            this.rubric = Objects.requireNonNull(rubric);
            return this;
        }

        public Builder threshold(double threshold) {
            this.threshold = threshold;
            return this;
        }

        /** Mustache template rendered with input, expected, actual and criteria. */
        public Builder template(String template) {
            this.template = Objects.requireNonNull(template);
            return this;
        }

        public LlmJudgeScorer build() {
            return new LlmJudgeScorer(this);
        }
    }
}
