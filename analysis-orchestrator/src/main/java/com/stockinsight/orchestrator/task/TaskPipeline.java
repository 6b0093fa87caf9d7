package com.stockinsight.orchestrator.task;

import com.stockinsight.analysis.composite.CompositeScorer;
import com.stockinsight.analysis.fundamental.FundamentalScore;
import com.stockinsight.analysis.fundamental.FundamentalScorer;
import com.stockinsight.analysis.indicator.IndicatorEngine;
import com.stockinsight.analysis.indicator.TechnicalSnapshot;
import com.stockinsight.analysis.sentiment.SentimentAnalysis;
import com.stockinsight.analysis.sentiment.SentimentEngine;
import com.stockinsight.common.exception.NarrativeUnavailableException;
import com.stockinsight.common.exception.ScoringException;
import com.stockinsight.common.model.DataCategory;
import com.stockinsight.common.model.FinancialIndicator;
import com.stockinsight.common.model.FinancialIndicatorSet;
import com.stockinsight.common.model.NewsItem;
import com.stockinsight.common.model.PriceSeries;
import com.stockinsight.common.model.ScoreResult;
import com.stockinsight.common.model.TaskState;
import com.stockinsight.marketdata.service.MarketDataService;
import com.stockinsight.orchestrator.ai.Narrative;
import com.stockinsight.orchestrator.ai.NarrativeInput;
import com.stockinsight.orchestrator.ai.NarrativeService;
import com.stockinsight.orchestrator.ai.PromptBuilder;
import com.stockinsight.orchestrator.ai.RuleBasedNarrativeGenerator;
import com.stockinsight.orchestrator.logger.AnalysisFlowLogger;
import com.stockinsight.orchestrator.stream.StreamBroadcaster;
import com.stockinsight.orchestrator.stream.StreamEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Body of one task: fetch the three data categories concurrently, score what arrived,
 * then produce the narrative. Progress, score updates and AI tokens are published to the
 * task's client as they happen; the final report is left to the caller.
 *
 * <p>A category that fails to fetch or score is recorded and the task carries on with the
 * rest. Only a task with nothing left to combine fails.
 */
public class TaskPipeline {

    private static final Logger log = LoggerFactory.getLogger(TaskPipeline.class);

    private final MarketDataService marketData;
    private final IndicatorEngine indicatorEngine;
    private final FundamentalScorer fundamentalScorer;
    private final SentimentEngine sentimentEngine;
    private final CompositeScorer compositeScorer;
    private final NarrativeService narrativeService;
    private final PromptBuilder promptBuilder;
    private final RuleBasedNarrativeGenerator ruleBasedNarrative;
    private final StreamBroadcaster broadcaster;
    private final AnalysisFlowLogger flowLogger;
    private final Clock clock;

    public TaskPipeline(MarketDataService marketData,
                        IndicatorEngine indicatorEngine,
                        FundamentalScorer fundamentalScorer,
                        SentimentEngine sentimentEngine,
                        CompositeScorer compositeScorer,
                        NarrativeService narrativeService,
                        PromptBuilder promptBuilder,
                        RuleBasedNarrativeGenerator ruleBasedNarrative,
                        StreamBroadcaster broadcaster,
                        AnalysisFlowLogger flowLogger,
                        Clock clock) {
        this.marketData = marketData;
        this.indicatorEngine = indicatorEngine;
        this.fundamentalScorer = fundamentalScorer;
        this.sentimentEngine = sentimentEngine;
        this.compositeScorer = compositeScorer;
        this.narrativeService = narrativeService;
        this.promptBuilder = promptBuilder;
        this.ruleBasedNarrative = ruleBasedNarrative;
        this.broadcaster = broadcaster;
        this.flowLogger = flowLogger;
        this.clock = clock;
    }

    public Mono<AnalysisReport> run(AnalysisTask task) {
        return Mono.defer(() -> {
                transition(task, TaskState.FETCHING, 10, "Fetching price, financial and news data");
                return Mono.zip(
                    outcome(DataCategory.PRICE, marketData.getPriceSeries(task.symbol())),
                    outcome(DataCategory.FUNDAMENTAL, marketData.getFinancialIndicators(task.symbol())),
                    outcome(DataCategory.NEWS, marketData.getNews(task.symbol())),
                    marketData.getStockName(task.symbol()).map(Optional::of).defaultIfEmpty(Optional.empty()));
            })
            .doOnEach(flowLogger.stage(AnalysisFlowLogger.DATA_FETCHED))
            .flatMap(fetched -> Mono.fromCallable(() ->
                    score(task, fetched.getT4().orElse(null), fetched.getT1(), fetched.getT2(), fetched.getT3()))
                .subscribeOn(Schedulers.boundedElastic()))
            .doOnEach(flowLogger.stage(AnalysisFlowLogger.SCORES_COMPUTED))
            .flatMap(scored -> narrate(task, scored)
                .map(narrative -> report(task, scored, narrative)));
    }

    // ── fetching ──────────────────────────────────────────────────────────────

    record FetchOutcome<T>(DataCategory category, T value, String error) {
        boolean ok() { return value != null; }
    }

    private <T> Mono<FetchOutcome<T>> outcome(DataCategory category, Mono<T> fetch) {
        return fetch
            .map(value -> new FetchOutcome<T>(category, value, null))
            .onErrorResume(e -> {
                log.warn("[TaskPipeline] fetch failed category={} reason={}", category, e.getMessage());
                return Mono.just(new FetchOutcome<>(category, null, e.getMessage()));
            })
            .defaultIfEmpty(new FetchOutcome<>(category, null, "no data returned"));
    }

    // ── scoring ───────────────────────────────────────────────────────────────

    record Scored(String name,
                  TechnicalSnapshot technical,
                  FinancialIndicatorSet financials,
                  FundamentalScore fundamental,
                  SentimentAnalysis sentiment,
                  ScoreResult scores,
                  Map<DataCategory, String> problems) {}

    /** @param name display name of the security, {@code null} when unknown */
    Scored score(AnalysisTask task,
                 String name,
                 FetchOutcome<PriceSeries> price,
                 FetchOutcome<FinancialIndicatorSet> financial,
                 FetchOutcome<List<NewsItem>> news) {
        Map<DataCategory, String> problems = new EnumMap<>(DataCategory.class);
        for (FetchOutcome<?> o : List.of(price, financial, news)) {
            if (!o.ok()) {
                problems.put(o.category(), "fetch failed: " + o.error());
                publishLog(task, "WARN", categoryLabel(o.category()) + " data unavailable: " + o.error());
            }
        }
        if (problems.size() == DataCategory.values().length) {
            throw new TaskFailedException(FailureKind.DATA_UNAVAILABLE,
                "No data could be retrieved for " + task.symbol().symbol());
        }

        transition(task, TaskState.SCORING, 40, "Computing scores");
        Map<DataCategory, Double> subScores = new EnumMap<>(DataCategory.class);

        TechnicalSnapshot technical = null;
        if (price.ok()) {
            try {
                technical = indicatorEngine.analyze(price.value());
                publishScore(task, DataCategory.PRICE, technical.score(), subScores);
            } catch (ScoringException e) {
                problems.put(DataCategory.PRICE, e.getMessage());
            }
        }

        FundamentalScore fundamental = null;
        if (financial.ok()) {
            try {
                fundamental = fundamentalScorer.score(financial.value());
                publishScore(task, DataCategory.FUNDAMENTAL, fundamental.score(), subScores);
            } catch (ScoringException e) {
                problems.put(DataCategory.FUNDAMENTAL, e.getMessage());
            }
        }

        SentimentAnalysis sentiment = null;
        if (news.ok()) {
            sentiment = sentimentEngine.analyze(news.value());
            if (sentiment.noData()) {
                // neutral score with zero confidence
                problems.put(DataCategory.NEWS, "no analysable news among " + sentiment.itemsReceived() + " items");
                publishLog(task, "WARN", "No analysable news, sentiment defaults to neutral");
            }
            publishScore(task, DataCategory.NEWS, sentiment.score(), subScores);
        }

        if (!compositeScorer.canCombine(subScores)) {
            throw new TaskFailedException(FailureKind.SCORING_FAILED,
                "None of the retrieved data for " + task.symbol().symbol() + " could be scored");
        }
        ScoreResult scores = compositeScorer.combine(subScores);
        return new Scored(name, technical, financial.ok() ? financial.value() : null,
            fundamental, sentiment, scores, problems);
    }

    private void publishScore(AnalysisTask task, DataCategory category, double subScore,
                              Map<DataCategory, Double> subScores) {
        subScores.put(category, subScore);
        Double running = compositeScorer.canCombine(subScores)
            ? compositeScorer.combine(subScores).composite()
            : null;
        emit(task, StreamEvent.scoreUpdate(task.clientId(), task.taskId(), clock.instant(),
            new StreamEvent.ScoreUpdate(category, subScore, running, subScores.size())));
    }

    // ── narrative ─────────────────────────────────────────────────────────────

    private Mono<Narrative> narrate(AnalysisTask task, Scored scored) {
        return Mono.defer(() -> {
            transition(task, TaskState.NARRATING, 70, "Generating narrative");
            flowLogger.logWithTraceId(AnalysisFlowLogger.NARRATIVE_STARTED, task.taskId());
            NarrativeInput input = new NarrativeInput(task.symbol(), scored.name(), scored.technical(), scored.financials(),
                scored.fundamental(), scored.sentiment(), scored.scores());

            if (!narrativeService.hasProviders()) {
                publishLog(task, "INFO", "No AI provider configured, using rule-based narrative");
                return Mono.just(Narrative.ruleBased(ruleBasedNarrative.generate(input), false));
            }

            String prompt = promptBuilder.build(input);
            Mono<Narrative> generated = task.streaming()
                ? streamNarrative(task, prompt)
                : narrativeService.generate(prompt);
            return generated.onErrorResume(e -> fallback(task, input, e));
        });
    }

    private Mono<Narrative> streamNarrative(AnalysisTask task, String prompt) {
        return Mono.defer(() -> {
            StringBuilder text = new StringBuilder();
            AtomicReference<String> provider = new AtomicReference<>();
            return narrativeService.streamNarrative(prompt)
                .doOnNext(token -> {
                    text.append(token.text());
                    provider.set(token.provider());
                    emit(task, StreamEvent.aiToken(task.clientId(), task.taskId(), clock.instant(),
                        token.provider(), token.text()));
                })
                .then(Mono.fromCallable(() -> Narrative.fromProvider(provider.get(), text.toString())));
        });
    }

    private Mono<Narrative> fallback(AnalysisTask task, NarrativeInput input, Throwable error) {
        boolean interrupted = !(error instanceof NarrativeUnavailableException);
        String reason = interrupted
            ? "AI narrative interrupted, replaced by rule-based narrative"
            : "AI narrative unavailable, using rule-based narrative";
        log.warn("[TaskPipeline] {} taskId={} reason={}", reason, task.taskId(), error.getMessage());
        publishLog(task, "WARN", reason);
        return Mono.just(Narrative.ruleBased(ruleBasedNarrative.generate(input), interrupted));
    }

    // ── report ────────────────────────────────────────────────────────────────

    private AnalysisReport report(AnalysisTask task, Scored scored, Narrative narrative) {
        int indicatorsUsed = scored.fundamental() != null ? scored.fundamental().indicatorsUsed()
            : scored.financials() != null ? scored.financials().presentCount() : 0;
        int newsAnalyzed = scored.sentiment() != null ? scored.sentiment().itemsAnalyzed() : 0;
        Set<DataCategory> missing = scored.scores().missingCategories().isEmpty()
            ? EnumSet.noneOf(DataCategory.class)
            : EnumSet.copyOf(scored.scores().missingCategories());
        DataQuality quality = DataQuality.of(indicatorsUsed, FinancialIndicator.COUNT, newsAnalyzed,
            missing, scored.problems());

        return new AnalysisReport(task.taskId(), task.symbol().symbol(), scored.name(), task.symbol().market(),
            scored.scores(), scored.technical(), scored.fundamental(), scored.sentiment(),
            narrative, quality, clock.instant());
    }

    // ── events ────────────────────────────────────────────────────────────────

    private void transition(AnalysisTask task, TaskState next, int percent, String message) {
        task.advance(next, clock.instant());
        emit(task, StreamEvent.progress(task.clientId(), task.taskId(), clock.instant(),
            next, percent, message));
    }

    private void publishLog(AnalysisTask task, String level, String message) {
        emit(task, StreamEvent.log(task.clientId(), task.taskId(), clock.instant(), level, message));
    }

    /**
     * Scoring keeps running on its worker thread after a disconnect cancels the task, so its
     * output must not reopen the departed client's channel. A disconnect landing between the
     * check and the publish is cleaned up by the second check.
     */
    private void emit(AnalysisTask task, StreamEvent event) {
        if (task.state().isTerminal()) return;
        broadcaster.publish(event);
        if (task.failureKind() == FailureKind.CANCELLED) broadcaster.releaseIfDetached(task.clientId());
    }

    private static String categoryLabel(DataCategory category) {
        return switch (category) {
            case PRICE       -> "Price";
            case FUNDAMENTAL -> "Financial";
            case NEWS        -> "News";
        };
    }
}
