package com.stockinsight.orchestrator.task;

import com.stockinsight.analysis.composite.CompositeScorer;
import com.stockinsight.analysis.fundamental.FundamentalScorer;
import com.stockinsight.analysis.fundamental.FundamentalScoringProfile;
import com.stockinsight.analysis.indicator.IndicatorEngine;
import com.stockinsight.analysis.indicator.IndicatorSettings;
import com.stockinsight.analysis.sentiment.SentimentEngine;
import com.stockinsight.analysis.sentiment.SentimentLexicon;
import com.stockinsight.analysis.sentiment.SentimentSettings;
import com.stockinsight.common.config.RecommendationThresholds;
import com.stockinsight.common.config.ScoringWeights;
import com.stockinsight.common.exception.AIProviderException;
import com.stockinsight.common.exception.AIProviderException.ErrorKind;
import com.stockinsight.common.exception.TaskNotFoundException;
import com.stockinsight.common.exception.ValidationException;
import com.stockinsight.common.model.DataCategory;
import com.stockinsight.common.model.FinancialIndicator;
import com.stockinsight.common.model.FinancialIndicatorSet;
import com.stockinsight.common.model.Market;
import com.stockinsight.common.model.NewsCategory;
import com.stockinsight.common.model.NewsItem;
import com.stockinsight.common.model.PriceBar;
import com.stockinsight.common.model.PriceSeries;
import com.stockinsight.common.model.TaskState;
import com.stockinsight.marketdata.cache.CacheSettings;
import com.stockinsight.marketdata.cache.TtlCache;
import com.stockinsight.marketdata.provider.FinancialDataProvider;
import com.stockinsight.marketdata.provider.NewsProvider;
import com.stockinsight.marketdata.provider.PriceSeriesProvider;
import com.stockinsight.marketdata.provider.StockNameProvider;
import com.stockinsight.marketdata.service.MarketDataService;
import com.stockinsight.marketdata.symbol.ResolvedSymbol;
import com.stockinsight.orchestrator.MutableClock;
import com.stockinsight.orchestrator.ai.FakeNarrativeProvider;
import com.stockinsight.orchestrator.ai.Narrative;
import com.stockinsight.orchestrator.ai.NarrativeProvider;
import com.stockinsight.orchestrator.ai.NarrativeService;
import com.stockinsight.orchestrator.ai.PromptBuilder;
import com.stockinsight.orchestrator.ai.RuleBasedNarrativeGenerator;
import com.stockinsight.orchestrator.logger.AnalysisFlowLogger;
import com.stockinsight.orchestrator.stream.StreamBroadcaster;
import com.stockinsight.orchestrator.stream.StreamEvent;
import com.stockinsight.orchestrator.stream.StreamEventType;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;
import java.util.function.Predicate;

import static org.junit.jupiter.api.Assertions.*;

class AnalysisOrchestratorTest {

    private static final Instant START = Instant.parse("2024-06-03T09:30:00Z");
    private static final String CLIENT = "c1";

    private final MutableClock clock = new MutableClock(START);
    private final List<StreamEvent> events = new CopyOnWriteArrayList<>();
    private final List<AnalysisOrchestrator> started = new ArrayList<>();
    private final List<Disposable> subscriptions = new ArrayList<>();

    private PriceSeriesProvider prices = (symbol, market, days) -> Mono.just(risingSeries(symbol));
    private FinancialDataProvider financials = (symbol, market) -> Mono.just(allIndicators(symbol));
    private NewsProvider news = (symbol, market, max) -> Mono.just(List.of(
        NewsItem.of("n1", START.minusSeconds(60), "wire", "Strong growth in orders", "", NewsCategory.COMPANY_NEWS),
        NewsItem.of("n2", START.minusSeconds(120), "wire", "Record profit announced", "", NewsCategory.ANNOUNCEMENT)));
    private StockNameProvider names = (symbol, market) -> Mono.just(symbol + " Holdings");

    private StreamBroadcaster broadcaster;
    private TaskPipeline pipeline;

    @AfterEach
    void tearDown() {
        subscriptions.forEach(Disposable::dispose);
        started.forEach(AnalysisOrchestrator::shutdown);
    }

    // ── fixture ───────────────────────────────────────────────────────────────

    private AnalysisOrchestrator orchestrator(List<NarrativeProvider> providers, int poolSize) {
        broadcaster = new StreamBroadcaster(1024, clock);
        MarketDataService marketData = new MarketDataService(prices, financials, news, names,
            new TtlCache(CacheSettings.defaults(), clock), Duration.ofSeconds(2), 180, 100);
        SentimentEngine sentimentEngine = new SentimentEngine(
            SentimentLexicon.of(Map.of("growth", 1.0, "profit", 1.0, "strong", 0.8), Map.of("loss", 1.0)),
            SentimentSettings.defaults());
        AnalysisFlowLogger flowLogger = new AnalysisFlowLogger();
        NarrativeService narrativeService = new NarrativeService(providers);
        pipeline = new TaskPipeline(marketData,
            new IndicatorEngine(IndicatorSettings.defaults()),
            new FundamentalScorer(FundamentalScoringProfile.defaults()),
            sentimentEngine,
            new CompositeScorer(ScoringWeights.defaults(), RecommendationThresholds.defaults()),
            narrativeService,
            new PromptBuilder(),
            new RuleBasedNarrativeGenerator(),
            broadcaster, flowLogger, clock);
        OrchestratorSettings settings = new OrchestratorSettings(poolSize, 10, Duration.ofMinutes(10), 1024,
            Duration.ofSeconds(20));
        AnalysisOrchestrator orchestrator = new AnalysisOrchestrator(pipeline,
            new TaskRegistry(settings.taskRetention(), clock), broadcaster, marketData,
            narrativeService, flowLogger, settings, clock);
        started.add(orchestrator);
        subscriptions.add(broadcaster.subscribe(CLIENT).subscribe(events::add));
        return orchestrator;
    }

    private static PriceSeries risingSeries(String symbol) {
        List<PriceBar> bars = new ArrayList<>();
        for (int i = 0; i < 80; i++) {
            double close = 100 + i * 0.5 + (i % 3 == 0 ? -0.8 : 0.4);
            bars.add(PriceBar.of(START.minus(Duration.ofDays(80 - i)), close - 0.3, close + 1, close - 1,
                close, 1_000_000L + i * 5_000L));
        }
        return PriceSeries.of(symbol, bars);
    }

    private static FinancialIndicatorSet allIndicators(String symbol) {
        Map<FinancialIndicator, Double> values = new EnumMap<>(FinancialIndicator.class);
        for (FinancialIndicator indicator : FinancialIndicator.values()) values.put(indicator, 12.0);
        return FinancialIndicatorSet.of(symbol, values);
    }

    private List<StreamEvent> eventsOf(String taskId) {
        return events.stream().filter(e -> taskId.equals(e.taskId())).toList();
    }

    private static void await(BooleanSupplier condition, String description) {
        long deadline = System.nanoTime() + Duration.ofSeconds(10).toNanos();
        while (!condition.getAsBoolean()) {
            if (System.nanoTime() > deadline) fail("timed out waiting for " + description);
            try {
                Thread.sleep(10);
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                fail("interrupted while waiting for " + description);
            }
        }
    }

    private StreamEvent awaitEvent(Predicate<StreamEvent> condition) {
        await(() -> events.stream().anyMatch(condition), "a matching event among " + events.size());
        return events.stream().filter(condition).findFirst().orElseThrow();
    }

    private List<String> batchSummaries() {
        return events.stream()
            .filter(e -> e.type() == StreamEventType.LOG && e.taskId() == null)
            .map(e -> ((StreamEvent.Log) e.payload()).message())
            .toList();
    }

    private StreamEvent awaitTerminal(String taskId) {
        return awaitEvent(e -> taskId.equals(e.taskId()) && e.type().isTerminal());
    }

    private static AnalysisReport reportOf(StreamEvent event) {
        assertEquals(StreamEventType.FINAL_RESULT, event.type());
        return (AnalysisReport) event.payload();
    }

    // ── tests ─────────────────────────────────────────────────────────────────

    @Nested
    @DisplayName("single analysis")
    class Single {

        @Test
        @DisplayName("streams progress, score updates and tokens, then ends with the final result")
        void fullEventSequence() {
            AnalysisOrchestrator o = orchestrator(List.of(FakeNarrativeProvider.streaming("b", "Solid ", "setup.")), 3);

            String taskId = o.submitAnalysis("aapl", null, CLIENT, true);
            AnalysisReport report = reportOf(awaitTerminal(taskId));

            List<StreamEvent> taskEvents = eventsOf(taskId);
            assertEquals(StreamEventType.FINAL_RESULT, taskEvents.get(taskEvents.size() - 1).type());
            assertEquals(1, taskEvents.stream().filter(e -> e.type().isTerminal()).count());

            List<TaskState> progress = taskEvents.stream()
                .filter(e -> e.type() == StreamEventType.PROGRESS)
                .map(e -> ((StreamEvent.Progress) e.payload()).state())
                .toList();
            assertEquals(List.of(TaskState.QUEUED, TaskState.FETCHING, TaskState.SCORING,
                TaskState.NARRATING, TaskState.DONE), progress);

            List<StreamEvent.ScoreUpdate> updates = taskEvents.stream()
                .filter(e -> e.type() == StreamEventType.SCORE_UPDATE)
                .map(e -> (StreamEvent.ScoreUpdate) e.payload())
                .toList();
            assertEquals(3, updates.size());
            assertEquals(3, updates.get(2).scoredCategories());
            assertEquals(report.scores().composite(), updates.get(2).runningComposite(), 1e-9);

            String streamed = taskEvents.stream()
                .filter(e -> e.type() == StreamEventType.AI_TOKEN)
                .map(e -> ((StreamEvent.AiToken) e.payload()).text())
                .reduce("", String::concat);
            assertEquals("Solid setup.", streamed);

            assertEquals("AAPL", report.symbol());
            assertEquals(Market.US, report.market());
            assertEquals(Narrative.fromProvider("b", "Solid setup."), report.narrative());
            assertFalse(report.isPartial());
            assertEquals(DataQuality.Completeness.COMPLETE, report.dataQuality().completeness());
            assertEquals(TaskState.DONE, o.getTaskStatus(taskId).state());
        }

        @Test
        @DisplayName("with every AI provider failing the task still finishes with a rule-based narrative")
        void aiUnavailable() {
            AnalysisOrchestrator o = orchestrator(List.of(
                FakeNarrativeProvider.failing("a", new AIProviderException("a", ErrorKind.AUTH, "bad key")),
                FakeNarrativeProvider.failing("b", new AIProviderException("b", ErrorKind.NETWORK, "down"))), 3);

            String taskId = o.submitAnalysis("MSFT", Market.US, CLIENT, true);
            AnalysisReport report = reportOf(awaitTerminal(taskId));

            assertTrue(report.narrative().isRuleBased());
            assertFalse(report.narrative().interrupted());
            assertTrue(report.narrative().text().contains(report.scores().recommendation().label()));
            assertTrue(eventsOf(taskId).stream().anyMatch(e -> e.type() == StreamEventType.LOG));
            assertEquals(TaskState.DONE, o.getTaskStatus(taskId).state());
        }

        @Test
        @DisplayName("a provider breaking off mid-stream yields an interrupted rule-based narrative")
        void interruptedStream() {
            FakeNarrativeProvider flaky = new FakeNarrativeProvider("a", true,
                () -> Flux.concat(Flux.just("Partial"), Flux.error(new AIProviderException("a", ErrorKind.NETWORK, "reset"))),
                () -> Mono.just("unused"));
            AnalysisOrchestrator o = orchestrator(List.of(flaky), 3);

            String taskId = o.submitAnalysis("MSFT", Market.US, CLIENT, true);
            AnalysisReport report = reportOf(awaitTerminal(taskId));

            assertTrue(report.narrative().isRuleBased());
            assertTrue(report.narrative().interrupted());
        }

        @Test
        @DisplayName("without streaming no token events are sent and generate() supplies the narrative")
        void nonStreaming() {
            FakeNarrativeProvider provider = FakeNarrativeProvider.streaming("b", "Whole ", "text");
            AnalysisOrchestrator o = orchestrator(List.of(provider), 3);

            String taskId = o.submitAnalysis("MSFT", Market.US, CLIENT, false);
            AnalysisReport report = reportOf(awaitTerminal(taskId));

            assertEquals("Whole text", report.narrative().text());
            assertEquals(0, provider.streamCalls.get());
            assertTrue(eventsOf(taskId).stream().noneMatch(e -> e.type() == StreamEventType.AI_TOKEN));
        }
    }

    @Nested
    @DisplayName("degradation")
    class Degradation {

        @Test
        @DisplayName("a failed news fetch gives a partial result scored from the other categories")
        void partialResult() {
            news = (symbol, market, max) -> Mono.error(new IllegalStateException("news source down"));
            AnalysisOrchestrator o = orchestrator(List.of(), 3);

            String taskId = o.submitAnalysis("600519", null, CLIENT, true);
            AnalysisReport report = reportOf(awaitTerminal(taskId));

            assertTrue(report.isPartial());
            assertNull(report.scores().sentiment());
            assertEquals(Set.of(DataCategory.NEWS), report.scores().missingCategories());
            assertEquals(0.5, report.scores().effectiveWeights().get(DataCategory.PRICE), 1e-9);
            assertEquals(DataQuality.Completeness.PARTIAL, report.dataQuality().completeness());
            assertTrue(report.dataQuality().problems().containsKey(DataCategory.NEWS));
            assertEquals(Market.A_SHARE, report.market());
            assertEquals(2, eventsOf(taskId).stream().filter(e -> e.type() == StreamEventType.SCORE_UPDATE).count());
        }

        @Test
        @DisplayName("no news at all scores sentiment as neutral and surfaces it")
        void noNews() {
            news = (symbol, market, max) -> Mono.just(List.of());
            AnalysisOrchestrator o = orchestrator(List.of(), 3);

            String taskId = o.submitAnalysis("MSFT", Market.US, CLIENT, true);
            AnalysisReport report = reportOf(awaitTerminal(taskId));

            assertFalse(report.isPartial());
            assertEquals(50.0, report.scores().sentiment(), 1e-9);
            assertTrue(report.sentiment().noData());
            assertEquals(0.0, report.sentiment().confidence(), 1e-9);
            assertEquals(DataQuality.Completeness.PARTIAL, report.dataQuality().completeness());
            assertTrue(report.dataQuality().problems().containsKey(DataCategory.NEWS));
            assertTrue(eventsOf(taskId).stream().anyMatch(e -> e.type() == StreamEventType.LOG
                && ((StreamEvent.Log) e.payload()).message().contains("neutral")));
        }

        @Test
        @DisplayName("the report names the security when the gateway knows its name")
        void stockName() {
            AnalysisOrchestrator o = orchestrator(List.of(), 3);

            String taskId = o.submitAnalysis("600519", null, CLIENT, true);
            AnalysisReport report = reportOf(awaitTerminal(taskId));

            assertEquals("600519 Holdings", report.name());
            assertTrue(report.narrative().text().contains("600519 Holdings (600519)"));
        }

        @Test
        @DisplayName("a failed name lookup leaves the name out without degrading the result")
        void stockNameUnavailable() {
            names = (symbol, market) -> Mono.error(new IllegalStateException("profile missing"));
            AnalysisOrchestrator o = orchestrator(List.of(), 3);

            String taskId = o.submitAnalysis("AAPL", Market.US, CLIENT, true);
            AnalysisReport report = reportOf(awaitTerminal(taskId));

            assertNull(report.name());
            assertFalse(report.isPartial());
            assertEquals(DataQuality.Completeness.COMPLETE, report.dataQuality().completeness());
        }

        @Test
        @DisplayName("when every fetch fails the task fails with a classified error event")
        void allFetchesFail() {
            prices = (s, m, d) -> Mono.error(new IllegalStateException("down"));
            financials = (s, m) -> Mono.error(new IllegalStateException("down"));
            news = (s, m, n) -> Mono.error(new IllegalStateException("down"));
            AnalysisOrchestrator o = orchestrator(List.of(), 3);

            String taskId = o.submitAnalysis("TSLA", Market.US, CLIENT, true);
            StreamEvent terminal = awaitTerminal(taskId);

            assertEquals(StreamEventType.ERROR, terminal.type());
            StreamEvent.Failure failure = (StreamEvent.Failure) terminal.payload();
            assertEquals(FailureKind.DATA_UNAVAILABLE.name(), failure.kind());
            assertTrue(failure.message().contains("TSLA"));
            assertTrue(eventsOf(taskId).stream().noneMatch(e -> e.type() == StreamEventType.FINAL_RESULT));
            assertEquals(TaskState.FAILED, o.getTaskStatus(taskId).state());
        }
    }

    @Nested
    @DisplayName("batches")
    class Batches {

        @Test
        @DisplayName("three symbols on a pool of one run one at a time and all finish")
        void sequentialBatch() {
            AtomicInteger running = new AtomicInteger();
            AtomicInteger maxRunning = new AtomicInteger();
            prices = (symbol, market, days) -> Mono.delay(Duration.ofMillis(30))
                .doOnSubscribe(s -> maxRunning.accumulateAndGet(running.incrementAndGet(), Math::max))
                .map(tick -> risingSeries(symbol))
                .doFinally(signal -> running.decrementAndGet());
            AnalysisOrchestrator o = orchestrator(List.of(), 1);

            List<String> taskIds = o.submitBatchAnalysis(List.of("AAPL", "MSFT", "NVDA"), Market.US, CLIENT, true);
            assertEquals(3, taskIds.size());
            for (String taskId : taskIds) {
                awaitTerminal(taskId);
                assertTrue(o.getTaskStatus(taskId).state().isTerminal());
            }

            assertEquals(1, maxRunning.get());
            StreamEvent summary = awaitEvent(e -> e.type() == StreamEventType.LOG && e.taskId() == null);
            assertTrue(((StreamEvent.Log) summary.payload()).message().contains("3 tasks, 3 succeeded"));
        }

        @Test
        @DisplayName("a batch deduplicated onto a running task reports once that task finishes")
        void batchOntoRunningTask() {
            Sinks.Empty<Void> gate = Sinks.empty();
            prices = (symbol, market, days) -> gate.asMono().then(Mono.fromSupplier(() -> risingSeries(symbol)));
            AnalysisOrchestrator o = orchestrator(List.of(), 3);

            String single = o.submitAnalysis("AAPL", Market.US, CLIENT, true);
            List<String> batch = o.submitBatchAnalysis(List.of("AAPL", "MSFT"), Market.US, CLIENT, true);
            assertEquals(single, batch.get(0));
            assertTrue(batchSummaries().isEmpty());

            gate.tryEmitEmpty();
            StreamEvent summary = awaitEvent(e -> e.type() == StreamEventType.LOG && e.taskId() == null);
            assertTrue(((StreamEvent.Log) summary.payload()).message().contains("2 tasks, 2 succeeded"));
        }

        @Test
        @DisplayName("a batch made only of symbols already running reports when they finish")
        void batchEntirelyDeduplicated() {
            Sinks.Empty<Void> gate = Sinks.empty();
            prices = (symbol, market, days) -> gate.asMono().then(Mono.fromSupplier(() -> risingSeries(symbol)));
            AnalysisOrchestrator o = orchestrator(List.of(), 3);

            String single = o.submitAnalysis("AAPL", Market.US, CLIENT, true);
            assertEquals(List.of(single, single),
                o.submitBatchAnalysis(List.of("AAPL", "aapl"), Market.US, CLIENT, true));

            gate.tryEmitEmpty();
            awaitTerminal(single);
            StreamEvent summary = awaitEvent(e -> e.type() == StreamEventType.LOG && e.taskId() == null);
            assertTrue(((StreamEvent.Log) summary.payload()).message().contains("1 tasks, 1 succeeded"));
            assertEquals(1, batchSummaries().size());
        }

        @Test
        @DisplayName("batches whose tasks finish while the batch is still being scheduled all report")
        void fastBatches() {
            AnalysisOrchestrator o = orchestrator(List.of(), 3);
            int rounds = 20;
            for (int i = 0; i < rounds; i++) {
                subscriptions.add(broadcaster.subscribe("fast-" + i).subscribe(events::add));
            }
            for (int i = 0; i < rounds; i++) {
                o.submitBatchAnalysis(List.of("AAPL", "MSFT", "NVDA"), Market.US, "fast-" + i, true);
            }

            await(() -> batchSummaries().size() == rounds, rounds + " batch summaries");
            assertTrue(batchSummaries().stream().allMatch(m -> m.contains("3 tasks, 3 succeeded")));
        }

        @Test
        @DisplayName("empty and oversized batches are rejected before anything is scheduled")
        void validation() {
            AnalysisOrchestrator o = orchestrator(List.of(), 1);
            assertThrows(ValidationException.class, () -> o.submitBatchAnalysis(List.of(), null, CLIENT, true));
            List<String> eleven = new ArrayList<>();
            for (int i = 0; i < 11; i++) eleven.add("SYM" + (char) ('A' + i));
            assertThrows(ValidationException.class, () -> o.submitBatchAnalysis(eleven, Market.US, CLIENT, true));
            assertThrows(ValidationException.class, () -> o.submitBatchAnalysis(List.of("AAPL", " "), Market.US, CLIENT, true));
            assertEquals(0, o.getSystemStatus().retainedTasks());
        }
    }

    @Nested
    @DisplayName("lifecycle")
    class Lifecycle {

        @Test
        @DisplayName("a client cannot schedule overlapping analyses of one symbol")
        void dedupe() {
            prices = (symbol, market, days) -> Mono.never();
            AnalysisOrchestrator o = orchestrator(List.of(), 3);

            String first = o.submitAnalysis("AAPL", Market.US, CLIENT, true);
            String again = o.submitAnalysis("aapl", Market.US, CLIENT, true);
            String otherClient = o.submitAnalysis("AAPL", Market.US, "c2", true);

            assertEquals(first, again);
            assertNotEquals(first, otherClient);
        }

        @Test
        @DisplayName("a disconnect cancels the AI stream and destroys the client's tasks without a final result")
        void disconnectCancels() {
            FakeNarrativeProvider endless = new FakeNarrativeProvider("a", true,
                () -> Flux.concat(Flux.just("first"), Flux.never()), Mono::never);
            AnalysisOrchestrator o = orchestrator(List.of(endless), 3);

            String taskId = o.submitAnalysis("AAPL", Market.US, CLIENT, true);
            awaitEvent(e -> taskId.equals(e.taskId()) && e.type() == StreamEventType.AI_TOKEN);

            subscriptions.forEach(Disposable::dispose);

            await(endless.streamCancelled::get, "the AI stream to be cancelled");
            assertThrows(TaskNotFoundException.class, () -> o.getTaskStatus(taskId));
            assertTrue(eventsOf(taskId).stream().noneMatch(e -> e.type().isTerminal()));
        }

        @Test
        @DisplayName("scoring that finishes after a disconnect publishes nothing and leaves no channel behind")
        void lateScoringAfterDisconnect() {
            AnalysisOrchestrator o = orchestrator(List.of(), 3);
            Disposable gone = broadcaster.subscribe("gone").subscribe();
            AnalysisTask task = new AnalysisTask("late", "gone", new ResolvedSymbol("AAPL", Market.US),
                true, null, clock.instant());

            gone.dispose();
            assertTrue(task.fail(FailureKind.CANCELLED, "Client disconnected", clock.instant()));
            pipeline.score(task, "Apple Inc.",
                new TaskPipeline.FetchOutcome<>(DataCategory.PRICE, risingSeries("AAPL"), null),
                new TaskPipeline.FetchOutcome<>(DataCategory.FUNDAMENTAL, allIndicators("AAPL"), null),
                new TaskPipeline.FetchOutcome<>(DataCategory.NEWS, List.<NewsItem>of(), null));

            assertEquals(0, broadcaster.pendingEvents("gone"));
            assertEquals(1, o.getSystemStatus().connectedClients());
        }

        @Test
        @DisplayName("a disconnect releases a channel reopened by events of its still-running tasks")
        void disconnectReleasesReopenedChannel() {
            AnalysisOrchestrator o = orchestrator(List.of(), 3);
            broadcaster.publish(StreamEvent.log("gone", "t1", clock.instant(), "INFO", "late"));
            assertEquals(1, broadcaster.pendingEvents("gone"));

            o.cancelClient("gone");

            assertEquals(0, broadcaster.pendingEvents("gone"));
        }

        @Test
        @DisplayName("only finished tasks can be acknowledged, after which they are gone")
        void acknowledge() {
            AnalysisOrchestrator o = orchestrator(List.of(), 3);
            String taskId = o.submitAnalysis("AAPL", Market.US, CLIENT, true);
            awaitTerminal(taskId);

            o.acknowledge(taskId);
            assertThrows(TaskNotFoundException.class, () -> o.getTaskStatus(taskId));
            assertThrows(TaskNotFoundException.class, () -> o.acknowledge(taskId));
        }

        @Test
        @DisplayName("a running task cannot be acknowledged")
        void acknowledgeRunning() {
            prices = (symbol, market, days) -> Mono.never();
            AnalysisOrchestrator o = orchestrator(List.of(), 3);
            String taskId = o.submitAnalysis("AAPL", Market.US, CLIENT, true);
            assertThrows(ValidationException.class, () -> o.acknowledge(taskId));
        }

        @Test
        @DisplayName("finished tasks expire after the retention period")
        void retention() {
            AnalysisOrchestrator o = orchestrator(List.of(), 3);
            String taskId = o.submitAnalysis("AAPL", Market.US, CLIENT, true);
            awaitTerminal(taskId);

            clock.advance(Duration.ofMinutes(11));
            assertThrows(TaskNotFoundException.class, () -> o.getTaskStatus(taskId));
        }

        @Test
        @DisplayName("system status reports pool size, providers and connected clients")
        void systemStatus() {
            AnalysisOrchestrator o = orchestrator(List.of(FakeNarrativeProvider.streaming("b", "x")), 2);
            SystemStatus status = o.getSystemStatus();

            assertEquals(2, status.workerPoolSize());
            assertEquals(List.of("b"), status.aiProviders());
            assertEquals(1, status.connectedClients());
            assertEquals(0, status.activeTasks());
        }
    }
}
