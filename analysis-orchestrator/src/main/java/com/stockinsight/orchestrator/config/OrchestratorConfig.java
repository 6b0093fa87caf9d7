package com.stockinsight.orchestrator.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.stockinsight.analysis.composite.CompositeScorer;
import com.stockinsight.analysis.fundamental.FundamentalScorer;
import com.stockinsight.analysis.fundamental.FundamentalScoringProfile;
import com.stockinsight.analysis.indicator.IndicatorEngine;
import com.stockinsight.analysis.indicator.IndicatorSettings;
import com.stockinsight.analysis.indicator.TechnicalWeights;
import com.stockinsight.analysis.sentiment.SentimentEngine;
import com.stockinsight.analysis.sentiment.SentimentLexicon;
import com.stockinsight.analysis.sentiment.SentimentSettings;
import com.stockinsight.common.config.RecommendationThresholds;
import com.stockinsight.common.config.ScoringWeights;
import com.stockinsight.common.exception.ConfigurationException;
import com.stockinsight.marketdata.service.MarketDataService;
import com.stockinsight.orchestrator.ai.AiSettings;
import com.stockinsight.orchestrator.ai.AnthropicProvider;
import com.stockinsight.orchestrator.ai.NarrativeProvider;
import com.stockinsight.orchestrator.ai.NarrativeService;
import com.stockinsight.orchestrator.ai.OpenAiProvider;
import com.stockinsight.orchestrator.ai.PromptBuilder;
import com.stockinsight.orchestrator.ai.ProviderSettings;
import com.stockinsight.orchestrator.ai.RuleBasedNarrativeGenerator;
import com.stockinsight.orchestrator.ai.ZhipuProvider;
import com.stockinsight.orchestrator.logger.AnalysisFlowLogger;
import com.stockinsight.orchestrator.stream.StreamBroadcaster;
import com.stockinsight.orchestrator.task.AnalysisOrchestrator;
import com.stockinsight.orchestrator.task.OrchestratorSettings;
import com.stockinsight.orchestrator.task.TaskPipeline;
import com.stockinsight.orchestrator.task.TaskRegistry;
import io.netty.channel.ChannelOption;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.properties.bind.Bindable;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import java.io.IOException;
import java.io.InputStream;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * Reads the analysis configuration once at start-up and wires the engine. Every value
 * object validates itself, so a bad setting stops the application here rather than
 * failing a request later.
 */
@Configuration
public class OrchestratorConfig {

    private static final Logger log = LoggerFactory.getLogger(OrchestratorConfig.class);

    @Value("${analysis.weights.technical:0.4}")
    private double technicalWeight;

    @Value("${analysis.weights.fundamental:0.4}")
    private double fundamentalWeight;

    @Value("${analysis.weights.sentiment:0.2}")
    private double sentimentWeight;

    @Value("${analysis.recommendation.strong-buy:80}")
    private double strongBuyThreshold;

    @Value("${analysis.recommendation.buy:60}")
    private double buyThreshold;

    @Value("${analysis.recommendation.hold:40}")
    private double holdThreshold;

    @Value("${analysis.recommendation.sell:20}")
    private double sellThreshold;

    @Value("${analysis.technical.period-days:180}")
    private int periodDays;

    @Value("${analysis.technical.ma-windows:5,10,20,60}")
    private int[] maWindows;

    @Value("${analysis.technical.rsi-window:14}")
    private int rsiWindow;

    @Value("${analysis.technical.macd-fast:12}")
    private int macdFast;

    @Value("${analysis.technical.macd-slow:26}")
    private int macdSlow;

    @Value("${analysis.technical.macd-signal:9}")
    private int macdSignal;

    @Value("${analysis.technical.bollinger-window:20}")
    private int bollingerWindow;

    @Value("${analysis.technical.bollinger-k:2.0}")
    private double bollingerK;

    @Value("${analysis.technical.volume-window:20}")
    private int volumeWindow;

    @Value("${analysis.technical.weights.moving-average:0.25}")
    private double maIndicatorWeight;

    @Value("${analysis.technical.weights.rsi:0.20}")
    private double rsiIndicatorWeight;

    @Value("${analysis.technical.weights.macd:0.25}")
    private double macdIndicatorWeight;

    @Value("${analysis.technical.weights.bollinger:0.15}")
    private double bollingerIndicatorWeight;

    @Value("${analysis.technical.weights.volume:0.15}")
    private double volumeIndicatorWeight;

    @Value("${analysis.sentiment.max-items:100}")
    private int sentimentMaxItems;

    @Value("${analysis.sentiment.max-content-length:500}")
    private int sentimentMaxContentLength;

    @Value("${analysis.sentiment.lexicon-location:classpath:sentiment-lexicon.json}")
    private String lexiconLocation;

    @Value("${analysis.orchestrator.worker-pool-size:3}")
    private int workerPoolSize;

    @Value("${analysis.orchestrator.batch-max-symbols:10}")
    private int batchMaxSymbols;

    @Value("${analysis.orchestrator.task-retention:10m}")
    private Duration taskRetention;

    @Value("${analysis.orchestrator.queue-capacity:256}")
    private int queueCapacity;

    @Value("${analysis.orchestrator.heartbeat-interval:20s}")
    private Duration heartbeatInterval;

    @Value("${ai.provider-order:openai,anthropic,zhipu}")
    private String[] providerOrder;

    @Value("${ai.max-tokens:4000}")
    private int aiMaxTokens;

    @Value("${ai.temperature:0.7}")
    private double aiTemperature;

    @Value("${ai.timeout:60s}")
    private Duration aiTimeout;

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }

    // ── scoring ───────────────────────────────────────────────────────────────

    @Bean
    public CompositeScorer compositeScorer() {
        ScoringWeights weights = new ScoringWeights(technicalWeight, fundamentalWeight, sentimentWeight);
        RecommendationThresholds thresholds =
            new RecommendationThresholds(strongBuyThreshold, buyThreshold, holdThreshold, sellThreshold);
        log.info("[Config] scoring weights={} thresholds={}", weights, thresholds);
        return new CompositeScorer(weights, thresholds);
    }

    @Bean
    public IndicatorEngine indicatorEngine() {
        TechnicalWeights weights = new TechnicalWeights(maIndicatorWeight, rsiIndicatorWeight,
            macdIndicatorWeight, bollingerIndicatorWeight, volumeIndicatorWeight);
        List<Integer> windows = Arrays.stream(maWindows).boxed().toList();
        return new IndicatorEngine(new IndicatorSettings(periodDays, windows, rsiWindow,
            macdFast, macdSlow, macdSignal, bollingerWindow, bollingerK, volumeWindow, weights));
    }

    @Bean
    public FundamentalScorer fundamentalScorer(Environment environment) {
        Map<String, String> overrides = Binder.get(environment)
            .bind("analysis.fundamental.curves", Bindable.mapOf(String.class, String.class))
            .orElse(Map.of());
        if (!overrides.isEmpty()) log.info("[Config] fundamental curve overrides={}", overrides.keySet());
        return new FundamentalScorer(FundamentalScoringProfile.defaults().withOverrides(overrides));
    }

    @Bean
    public SentimentEngine sentimentEngine(ResourceLoader resourceLoader, ObjectMapper objectMapper) {
        Resource resource = resourceLoader.getResource(lexiconLocation);
        SentimentLexicon lexicon;
        try (InputStream in = resource.getInputStream()) {
            lexicon = SentimentLexicon.fromJson(in, objectMapper);
        } catch (IOException e) {
            throw new ConfigurationException("Cannot read sentiment lexicon at " + lexiconLocation, e);
        }
        log.info("[Config] sentiment lexicon location={} positive={} negative={}",
            lexiconLocation, lexicon.positive().size(), lexicon.negative().size());
        return new SentimentEngine(lexicon, new SentimentSettings(sentimentMaxItems, sentimentMaxContentLength));
    }

    // ── AI narrative ──────────────────────────────────────────────────────────

    @Bean
    public AiSettings aiSettings() {
        return new AiSettings(Arrays.asList(providerOrder), aiMaxTokens, aiTemperature, aiTimeout);
    }

    @Bean
    public NarrativeService narrativeService(AiSettings aiSettings, Environment environment,
                                             WebClient.Builder builder, ObjectMapper objectMapper) {
        List<NarrativeProvider> providers = new ArrayList<>();
        for (String name : aiSettings.providerOrder()) {
            ProviderSettings configured = providerSettings(environment, name);
            NarrativeProvider provider = switch (name) {
                case OpenAiProvider.NAME -> {
                    ProviderSettings s = configured.withDefaults(OpenAiProvider.DEFAULT_MODEL, OpenAiProvider.DEFAULT_BASE_URL);
                    yield new OpenAiProvider(s, aiSettings, aiWebClient(builder, s, aiSettings), objectMapper);
                }
                case AnthropicProvider.NAME -> {
                    ProviderSettings s = configured.withDefaults(AnthropicProvider.DEFAULT_MODEL, AnthropicProvider.DEFAULT_BASE_URL);
                    yield new AnthropicProvider(s, aiSettings, aiWebClient(builder, s, aiSettings), objectMapper);
                }
                case ZhipuProvider.NAME -> {
                    ProviderSettings s = configured.withDefaults(ZhipuProvider.DEFAULT_MODEL, ZhipuProvider.DEFAULT_BASE_URL);
                    yield new ZhipuProvider(s, aiSettings, aiWebClient(builder, s, aiSettings), objectMapper);
                }
                default -> throw new ConfigurationException("Unknown AI provider in ai.provider-order: " + name);
            };
            if (!provider.isConfigured()) {
                log.warn("[Config] AI provider {} has no API key and will be skipped", name);
            }
            providers.add(provider);
        }
        return new NarrativeService(providers);
    }

    @Bean
    public PromptBuilder promptBuilder() {
        return new PromptBuilder();
    }

    @Bean
    public RuleBasedNarrativeGenerator ruleBasedNarrativeGenerator() {
        return new RuleBasedNarrativeGenerator();
    }

    // ── tasks and streams ─────────────────────────────────────────────────────

    @Bean
    public OrchestratorSettings orchestratorSettings() {
        return new OrchestratorSettings(workerPoolSize, batchMaxSymbols, taskRetention, queueCapacity, heartbeatInterval);
    }

    @Bean
    public StreamBroadcaster streamBroadcaster(OrchestratorSettings settings, Clock clock) {
        return new StreamBroadcaster(settings.queueCapacity(), clock);
    }

    @Bean
    public TaskRegistry taskRegistry(OrchestratorSettings settings, Clock clock) {
        return new TaskRegistry(settings.taskRetention(), clock);
    }

    @Bean
    public TaskPipeline taskPipeline(MarketDataService marketDataService,
                                     IndicatorEngine indicatorEngine,
                                     FundamentalScorer fundamentalScorer,
                                     SentimentEngine sentimentEngine,
                                     CompositeScorer compositeScorer,
                                     NarrativeService narrativeService,
                                     PromptBuilder promptBuilder,
                                     RuleBasedNarrativeGenerator ruleBasedNarrativeGenerator,
                                     StreamBroadcaster streamBroadcaster,
                                     AnalysisFlowLogger analysisFlowLogger,
                                     Clock clock) {
        return new TaskPipeline(marketDataService, indicatorEngine, fundamentalScorer, sentimentEngine,
            compositeScorer, narrativeService, promptBuilder, ruleBasedNarrativeGenerator,
            streamBroadcaster, analysisFlowLogger, clock);
    }

    @Bean(destroyMethod = "shutdown")
    public AnalysisOrchestrator analysisOrchestrator(TaskPipeline taskPipeline,
                                                     TaskRegistry taskRegistry,
                                                     StreamBroadcaster streamBroadcaster,
                                                     MarketDataService marketDataService,
                                                     NarrativeService narrativeService,
                                                     AnalysisFlowLogger analysisFlowLogger,
                                                     OrchestratorSettings settings,
                                                     Clock clock) {
        return new AnalysisOrchestrator(taskPipeline, taskRegistry, streamBroadcaster, marketDataService,
            narrativeService, analysisFlowLogger, settings, clock);
    }

    private static ProviderSettings providerSettings(Environment environment, String name) {
        String prefix = "ai." + name + ".";
        return new ProviderSettings(
            environment.getProperty(prefix + "api-key", ""),
            environment.getProperty(prefix + "model", ""),
            environment.getProperty(prefix + "base-url", ""));
    }

    private static WebClient aiWebClient(WebClient.Builder builder, ProviderSettings settings, AiSettings aiSettings) {
        HttpClient httpClient = HttpClient.create()
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, 10_000)
            .responseTimeout(aiSettings.timeout());
        return builder.clone()
            .baseUrl(settings.baseUrl())
            .clientConnector(new ReactorClientHttpConnector(httpClient))
            .build();
    }
}
