package com.phillippitts.vibedj.config;

import com.phillippitts.vibedj.config.properties.CatalogProperties;
import com.phillippitts.vibedj.config.properties.CooldownProperties;
import com.phillippitts.vibedj.config.properties.CoordinatorProperties;
import com.phillippitts.vibedj.config.properties.OracleProperties;
import com.phillippitts.vibedj.config.properties.VibeProperties;
import com.phillippitts.vibedj.service.catalog.CatalogIndex;
import com.phillippitts.vibedj.service.catalog.CatalogRepository;
import com.phillippitts.vibedj.service.catalog.FullScanCatalogIndex;
import com.phillippitts.vibedj.service.catalog.IndexedCatalogIndex;
import com.phillippitts.vibedj.service.catalog.ShortlistSampler;
import com.phillippitts.vibedj.service.chat.CalendarSource;
import com.phillippitts.vibedj.service.chat.EmptyCalendarSource;
import com.phillippitts.vibedj.service.chat.InMemoryChatFeed;
import com.phillippitts.vibedj.service.coordinator.DjCoordinator;
import com.phillippitts.vibedj.service.coordinator.PickPipeline;
import com.phillippitts.vibedj.service.health.DjCoordinatorHealthIndicator;
import com.phillippitts.vibedj.service.history.CooldownScorer;
import com.phillippitts.vibedj.service.history.PlayHistoryRepository;
import com.phillippitts.vibedj.service.history.PlayHistoryService;
import com.phillippitts.vibedj.service.metrics.DjMetrics;
import com.phillippitts.vibedj.service.oracle.RecommenderOracle;
import com.phillippitts.vibedj.service.oracle.VibeOracle;
import com.phillippitts.vibedj.service.oracle.http.HttpRecommenderOracle;
import com.phillippitts.vibedj.service.oracle.http.HttpVibeOracle;
import com.phillippitts.vibedj.service.playback.PlayerWebSocketHandler;
import com.phillippitts.vibedj.service.scaler.FeatureScaler;
import com.phillippitts.vibedj.service.selector.CandidateSelector;
import com.phillippitts.vibedj.service.vibe.VibePlanner;
import com.phillippitts.vibedj.service.weights.WeightOverrideRepository;
import com.phillippitts.vibedj.service.weights.WeightOverrideService;
import io.micrometer.core.instrument.MeterRegistry;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.net.http.HttpClient;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;

/**
 * Composition root for the DJ pipeline. The coordinator is constructed here explicitly
 * and its loop is started and stopped through the bean lifecycle.
 */
@Configuration
public class DjConfig {

    private static final Logger LOG = LogManager.getLogger(DjConfig.class);

    private final CoordinatorProperties coordinatorProperties;
    private final VibeProperties vibeProperties;
    private final CatalogProperties catalogProperties;
    private final CooldownProperties cooldownProperties;
    private final OracleProperties oracleProperties;

    public DjConfig(CoordinatorProperties coordinatorProperties,
                    VibeProperties vibeProperties,
                    CatalogProperties catalogProperties,
                    CooldownProperties cooldownProperties,
                    OracleProperties oracleProperties) {
        this.coordinatorProperties = coordinatorProperties;
        this.vibeProperties = vibeProperties;
        this.catalogProperties = catalogProperties;
        this.cooldownProperties = cooldownProperties;
        this.oracleProperties = oracleProperties;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public FeatureScaler featureScaler() {
        return new FeatureScaler();
    }

    @Bean
    public DjMetrics djMetrics(MeterRegistry registry) {
        return new DjMetrics(registry);
    }

    // ---- persistence ----

    @Bean
    public PlayHistoryRepository playHistoryRepository(NamedParameterJdbcTemplate jdbc) {
        return new PlayHistoryRepository(jdbc);
    }

    @Bean
    public PlayHistoryService playHistoryService(PlayHistoryRepository repository,
                                                 PlatformTransactionManager txManager,
                                                 Clock clock) {
        return new PlayHistoryService(repository, new CooldownScorer(cooldownProperties),
                new TransactionTemplate(txManager), clock);
    }

    @Bean
    public WeightOverrideService weightOverrideService(NamedParameterJdbcTemplate jdbc) {
        return new WeightOverrideService(new WeightOverrideRepository(jdbc));
    }

    @Bean
    public CatalogRepository catalogRepository(NamedParameterJdbcTemplate jdbc) {
        return new CatalogRepository(jdbc);
    }

    /**
     * Nearest-neighbor backend chosen by {@code dj.catalog.backend}.
     */
    @Bean
    public CatalogIndex catalogIndex(CatalogRepository repository,
                                     WeightOverrideService weights,
                                     FeatureScaler scaler) {
        LOG.info("Catalog backend: {}", catalogProperties.getBackend());
        if (catalogProperties.getBackend() == CatalogProperties.Backend.FULL_SCAN) {
            return new FullScanCatalogIndex(repository, scaler);
        }
        return new IndexedCatalogIndex(repository, weights, scaler, catalogProperties);
    }

    @Bean
    public ShortlistSampler shortlistSampler(CatalogIndex index, PlayHistoryService history) {
        return new ShortlistSampler(index, history, catalogProperties);
    }

    // ---- oracles ----

    @Bean
    public HttpClient oracleHttpClient() {
        return HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .build();
    }

    @Bean
    public VibeOracle vibeOracle(HttpClient oracleHttpClient) {
        return new HttpVibeOracle(oracleHttpClient, oracleProperties.getVibeUrl(),
                Duration.ofMillis(oracleProperties.getRequestTimeoutMs()),
                vibeProperties.getDefaultPlanDurationMinutes());
    }

    @Bean
    public RecommenderOracle recommenderOracle(HttpClient oracleHttpClient) {
        return new HttpRecommenderOracle(oracleHttpClient, oracleProperties.getRecommenderUrl(),
                Duration.ofMillis(oracleProperties.getRequestTimeoutMs()));
    }

    // ---- player and context ----

    @Bean
    public InMemoryChatFeed chatFeed(Clock clock) {
        return new InMemoryChatFeed(clock);
    }

    @Bean
    public CalendarSource calendarSource() {
        return new EmptyCalendarSource();
    }

    @Bean
    public PlayerWebSocketHandler playerWebSocketHandler(InMemoryChatFeed chatFeed) {
        return new PlayerWebSocketHandler(chatFeed);
    }

    // ---- pipeline ----

    @Bean
    public VibePlanner vibePlanner(VibeOracle vibeOracle, Clock clock) {
        return new VibePlanner(vibeOracle, vibeProperties, clock);
    }

    @Bean
    public CandidateSelector candidateSelector(PlayHistoryService history) {
        return new CandidateSelector(history::score, new SecureRandom());
    }

    @Bean
    public PickPipeline pickPipeline(VibePlanner planner,
                                     ShortlistSampler sampler,
                                     RecommenderOracle recommender,
                                     CandidateSelector selector,
                                     PlayHistoryService history,
                                     InMemoryChatFeed chatFeed,
                                     CalendarSource calendar,
                                     DjMetrics metrics,
                                     Clock clock) {
        return new PickPipeline(planner, sampler, recommender, selector, history, chatFeed, calendar,
                coordinatorProperties, vibeProperties, metrics, clock);
    }

    @Bean(initMethod = "start", destroyMethod = "stop")
    public DjCoordinator djCoordinator(PickPipeline pipeline,
                                       VibePlanner planner,
                                       CandidateSelector selector,
                                       PlayHistoryService history,
                                       PlayerWebSocketHandler player,
                                       InMemoryChatFeed chatFeed,
                                       DjMetrics metrics,
                                       Clock clock) {
        DjCoordinator coordinator = new DjCoordinator(pipeline, planner, selector, history, player, chatFeed,
                coordinatorProperties, metrics, clock);
        player.setListener(coordinator);
        return coordinator;
    }

    @Bean
    public DjCoordinatorHealthIndicator djCoordinatorHealthIndicator(DjCoordinator coordinator,
                                                                     PlayerWebSocketHandler player) {
        return new DjCoordinatorHealthIndicator(coordinator, player);
    }
}
