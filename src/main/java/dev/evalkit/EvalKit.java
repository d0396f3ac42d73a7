package dev.evalkit;

import dev.evalkit.alert.AlertDispatcher;
import dev.evalkit.alert.EmailChannel;
import dev.evalkit.alert.LoggingChannel;
import dev.evalkit.alert.WebhookChannel;
import dev.evalkit.baseline.BaselineComparator;
import dev.evalkit.baseline.BaselineStore;
import dev.evalkit.config.EvalKitConfig;
import dev.evalkit.config.EvalSettings;
import dev.evalkit.cost.CostTracker;
import dev.evalkit.dataset.DatasetStore;
import dev.evalkit.error.EvalException;
import dev.evalkit.eval.EvalRunner;
import dev.evalkit.orchestrator.Orchestrator;
import dev.evalkit.orchestrator.RunRepository;
import dev.evalkit.orchestrator.RunRequest;
import dev.evalkit.provider.EmbeddingProvider;
import dev.evalkit.provider.ModelConfig;
import dev.evalkit.provider.ModelProvider;
import dev.evalkit.provider.OpenAIProvider;
import dev.evalkit.scorer.ScorerRegistry;
import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.trace.Tracer;
import java.nio.file.Path;
import java.time.Clock;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.experimental.Accessors;
import lombok.extern.slf4j.Slf4j;

/**
 * Everything an evaluation needs, wired once and passed around explicitly.
 *
 * <p>Create one per process (or per test) with {@link #of(EvalKitConfig, EvalSettings)} or the
 * {@link #builder(EvalKitConfig, EvalSettings) builder}. Stores, trackers and the alert history
 * belong to the instance; two instances share nothing.
 */
@Slf4j
@Getter
@Accessors(fluent = true)
public final class EvalKit {
    public static final String OPENAI = "openai";

    private final @Nonnull EvalKitConfig config;
    private final @Nonnull EvalSettings settings;
    private final @Nonnull DatasetStore datasets;
    private final @Nonnull RunRepository runs;
    private final @Nonnull BaselineStore baselines;
    private final @Nonnull CostTracker costTracker;
    private final @Nonnull AlertDispatcher alerts;
    private final @Nonnull ScorerRegistry scorers;
    private final @Nonnull Orchestrator orchestrator;

    @Getter(AccessLevel.NONE)
    private final @Nullable ModelProvider modelProvider;

    @Getter(AccessLevel.NONE)
    private final @Nullable EmbeddingProvider embeddingProvider;

    @Getter(AccessLevel.NONE)
    private volatile OpenAIProvider openAi;

    public static EvalKit of(EvalKitConfig config, EvalSettings settings) {
        return builder(config, settings).build();
    }

    public static Builder builder(EvalKitConfig config, EvalSettings settings) {
        return new Builder(config, settings);
    }

    private EvalKit(Builder builder) {
        this.config = builder.config;
        this.settings = builder.settings;
        this.modelProvider = builder.modelProvider;
        this.embeddingProvider = builder.embeddingProvider;
        this.datasets =
                builder.datasets != null
                        ? builder.datasets
                        : DatasetStore.of(Path.of(config.datasetsDir()));
        var storage =
                builder.storageDir != null
                        ? builder.storageDir
                        : config.storageDir().map(Path::of).orElse(null);
        if (builder.runs != null) {
            this.runs = builder.runs;
        } else {
            this.runs =
                    storage != null
                            ? RunRepository.of(storage.resolve("runs"), builder.clock)
                            : RunRepository.inMemory();
        }
        if (builder.baselines != null) {
            this.baselines = builder.baselines;
        } else {
            this.baselines =
                    storage != null
                            ? BaselineStore.of(storage.resolve("baselines.json"), builder.clock)
                            : BaselineStore.inMemory(builder.clock);
        }
        if (storage != null) {
            log.debug("keeping runs and baselines under {}", storage);
        }
        this.costTracker = new CostTracker(builder.clock, settings.toBudgets());
        this.alerts = alertDispatcher(config, settings, builder);
        this.scorers = ScorerRegistry.withDefaults(this::embeddingProvider, this::judgeProvider);

        var runner = settings.runner();
        this.orchestrator =
                Orchestrator.builder()
                        .datasets(datasets)
                        .runs(runs)
                        .baselines(baselines)
                        .comparator(new BaselineComparator(settings.baseline().toThresholds()))
                        .costTracker(costTracker)
                        .alerts(alerts)
                        .scorers(scorers)
                        .providers(this::modelProvider)
                        .runner(
                                EvalRunner.builder()
                                        .tracer(builder.tracer)
                                        .concurrency(runner.concurrency())
                                        .retryPolicy(runner.retryPolicy())
                                        .testTimeout(runner.testTimeout())
                                        .judgeTimeout(runner.judgeTimeout())
                                        .clock(builder.clock)
                                        .build())
                        .clock(builder.clock)
                        .build();
    }

    private static AlertDispatcher alertDispatcher(
            EvalKitConfig config, EvalSettings settings, Builder builder) {
        var dispatcher =
                AlertDispatcher.builder()
                        .policy(settings.alerts().policy())
                        .historySize(settings.alerts().historySize())
                        .dashboardUrl(config.dashboardUrl().orElse(null))
                        .clock(builder.clock)
                        .channel(new LoggingChannel());
        config.alertWebhookUrl()
                .ifPresent(url -> dispatcher.channel(webhook(url, config)));
        if (config.emailAlertsEnabled()) {
            dispatcher.channel(
                    new EmailChannel(
                            config.emailApiUrl(),
                            config.emailApiKey().orElseThrow(),
                            config.emailFrom(),
                            config.emailTo(),
                            config.requestTimeout()));
        }
        return dispatcher.build();
    }

    private static WebhookChannel webhook(String url, EvalKitConfig config) {
        return new WebhookChannel(url, config.requestTimeout());
    }

    /** The provider that answers completions for {@code model}. */
    public ModelProvider modelProvider(ModelConfig model) {
        if (modelProvider != null) {
            return modelProvider;
        }
        if (!OPENAI.equals(model.provider())) {
            throw EvalException.configuration(
                    "unsupported model provider '%s' for model %s"
                            .formatted(model.provider(), model.model()));
        }
        return openAi();
    }

    /** A run request for {@code datasetId} using the configured scorers and pass policy. */
    public RunRequest request(
            String datasetId, @Nullable String datasetVersion, ModelConfig model) {
        return new RunRequest(
                datasetId,
                datasetVersion,
                model,
                settings.scorers(),
                settings.runner().passPolicy());
    }

    private EmbeddingProvider embeddingProvider() {
        return embeddingProvider != null ? embeddingProvider : openAi();
    }

    private ModelProvider judgeProvider() {
        return modelProvider != null ? modelProvider : openAi();
    }

    private OpenAIProvider openAi() {
        if (openAi == null) {
            synchronized (this) {
                if (openAi == null) {
                    openAi = OpenAIProvider.of(config);
                    log.debug("created OpenAI provider");
                }
            }
        }
        return openAi;
    }

    public static final class Builder {
        private final EvalKitConfig config;
        private final EvalSettings settings;
        private @Nullable ModelProvider modelProvider;
        private @Nullable EmbeddingProvider embeddingProvider;
        private @Nullable DatasetStore datasets;
        private @Nullable RunRepository runs;
        private @Nullable BaselineStore baselines;
        private @Nullable Path storageDir;
        private Clock clock = Clock.systemUTC();
        private Tracer tracer = GlobalOpenTelemetry.getTracer("evalkit");

        private Builder(EvalKitConfig config, EvalSettings settings) {
            this.config = config;
            this.settings = settings;
        }

        /** Answers every model's completions, and the LLM judge's, instead of OpenAI. */
        public Builder modelProvider(ModelProvider modelProvider) {
            this.modelProvider = modelProvider;
            return this;
        }

        public Builder embeddingProvider(EmbeddingProvider embeddingProvider) {
            this.embeddingProvider = embeddingProvider;
            return this;
        }

        public Builder datasets(DatasetStore datasets) {
            this.datasets = datasets;
            return this;
        }

        public Builder runs(RunRepository runs) {
            this.runs = runs;
            return this;
        }

        public Builder baselines(BaselineStore baselines) {
            this.baselines = baselines;
            return this;
        }

        /** Keeps runs and baselines as files under {@code storageDir}, unless set explicitly. */
        public Builder storageDir(Path storageDir) {
            this.storageDir = storageDir;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public Builder tracer(Tracer tracer) {
            this.tracer = tracer;
            return this;
        }

        public EvalKit build() {
            return new EvalKit(this);
        }
    }
}
