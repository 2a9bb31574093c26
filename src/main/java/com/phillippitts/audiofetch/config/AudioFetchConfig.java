package com.phillippitts.audiofetch.config;

import com.phillippitts.audiofetch.config.properties.AcquisitionProperties;
import com.phillippitts.audiofetch.config.properties.RetryProperties;
import com.phillippitts.audiofetch.config.properties.SearchProperties;
import com.phillippitts.audiofetch.config.properties.ToolProperties;
import com.phillippitts.audiofetch.service.acquisition.AcquisitionPipeline;
import com.phillippitts.audiofetch.service.acquisition.ArtifactPostProcessor;
import com.phillippitts.audiofetch.service.acquisition.ArtifactValidator;
import com.phillippitts.audiofetch.service.acquisition.AudioProbe;
import com.phillippitts.audiofetch.service.acquisition.DefaultAcquisitionPipeline;
import com.phillippitts.audiofetch.service.acquisition.FetchProvider;
import com.phillippitts.audiofetch.service.acquisition.FfprobeAudioProbe;
import com.phillippitts.audiofetch.service.acquisition.NoopArtifactPostProcessor;
import com.phillippitts.audiofetch.service.acquisition.YtDlpFetchProvider;
import com.phillippitts.audiofetch.service.batch.BatchCoordinator;
import com.phillippitts.audiofetch.service.batch.CollectionDownloadService;
import com.phillippitts.audiofetch.service.batch.DefaultBatchCoordinator;
import com.phillippitts.audiofetch.service.catalog.CatalogClient;
import com.phillippitts.audiofetch.service.catalog.RetryPolicy;
import com.phillippitts.audiofetch.service.catalog.RetryingCatalogClient;
import com.phillippitts.audiofetch.service.catalog.UnconfiguredCatalogClient;
import com.phillippitts.audiofetch.service.job.DownloadJobService;
import com.phillippitts.audiofetch.service.job.JobStatusTracker;
import com.phillippitts.audiofetch.service.metrics.AcquisitionMetrics;
import com.phillippitts.audiofetch.service.process.DefaultProcessFactory;
import com.phillippitts.audiofetch.service.process.ProcessRunner;
import com.phillippitts.audiofetch.service.search.DefaultSearchOrchestrator;
import com.phillippitts.audiofetch.service.search.MatchScorer;
import com.phillippitts.audiofetch.service.search.QueryGenerator;
import com.phillippitts.audiofetch.service.search.SearchOrchestrator;
import com.phillippitts.audiofetch.service.search.SearchProvider;
import com.phillippitts.audiofetch.service.search.YtDlpSearchProvider;
import com.phillippitts.audiofetch.util.Sleeper;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.Executor;

/**
 * Wires the search, acquisition and job services explicitly.
 *
 * <p>Collaborators backed by external tools (search, fetch, probe) and the catalog are declared
 * {@link ConditionalOnMissingBean}, so an integration can replace any of them with its own bean.
 */
@Configuration
public class AudioFetchConfig {

    private final SearchProperties searchProperties;
    private final AcquisitionProperties acquisitionProperties;
    private final ToolProperties toolProperties;

    public AudioFetchConfig(SearchProperties searchProperties,
                            AcquisitionProperties acquisitionProperties,
                            ToolProperties toolProperties) {
        this.searchProperties = searchProperties;
        this.acquisitionProperties = acquisitionProperties;
        this.toolProperties = toolProperties;
    }

    @Bean
    public ProcessRunner processRunner() {
        return new ProcessRunner(new DefaultProcessFactory(), toolProperties.maxStdoutBytes());
    }

    @Bean
    @ConditionalOnMissingBean
    public SearchProvider searchProvider(ProcessRunner processRunner) {
        return new YtDlpSearchProvider(processRunner, toolProperties, searchProperties);
    }

    @Bean
    @ConditionalOnMissingBean
    public FetchProvider fetchProvider(ProcessRunner processRunner) {
        return new YtDlpFetchProvider(processRunner, toolProperties, acquisitionProperties);
    }

    @Bean
    @ConditionalOnMissingBean
    public AudioProbe audioProbe(ProcessRunner processRunner) {
        return new FfprobeAudioProbe(processRunner, toolProperties);
    }

    @Bean
    @ConditionalOnMissingBean
    public ArtifactPostProcessor artifactPostProcessor() {
        return new NoopArtifactPostProcessor();
    }

    /**
     * Catalog used when no integration provides one. Integrations supplying their own
     * {@link CatalogClient} wrap it in a {@link RetryingCatalogClient} themselves.
     */
    @Bean
    @ConditionalOnMissingBean
    public CatalogClient catalogClient(RetryProperties retryProperties) {
        return new RetryingCatalogClient(new UnconfiguredCatalogClient(), RetryPolicy.from(retryProperties),
                Sleeper.SYSTEM);
    }

    @Bean
    public SearchOrchestrator searchOrchestrator(SearchProvider searchProvider,
                                                 QueryGenerator queryGenerator,
                                                 MatchScorer matchScorer,
                                                 AcquisitionMetrics metrics) {
        return new DefaultSearchOrchestrator(searchProvider, queryGenerator, matchScorer, searchProperties,
                metrics, Sleeper.SYSTEM);
    }

    @Bean
    public ArtifactValidator artifactValidator(AudioProbe audioProbe) {
        return new ArtifactValidator(audioProbe, acquisitionProperties);
    }

    @Bean
    public AcquisitionPipeline acquisitionPipeline(FetchProvider fetchProvider,
                                                   ArtifactValidator validator,
                                                   AcquisitionMetrics metrics) {
        return new DefaultAcquisitionPipeline(fetchProvider, validator, acquisitionProperties, metrics);
    }

    @Bean
    public BatchCoordinator batchCoordinator(AcquisitionPipeline pipeline,
                                             @Qualifier("acquisitionExecutor") Executor acquisitionExecutor) {
        return new DefaultBatchCoordinator(pipeline, acquisitionExecutor, acquisitionProperties.getBatchConcurrency());
    }

    @Bean
    public CollectionDownloadService collectionDownloadService(CatalogClient catalogClient,
                                                               SearchOrchestrator searchOrchestrator,
                                                               BatchCoordinator batchCoordinator) {
        return new CollectionDownloadService(catalogClient, searchOrchestrator, batchCoordinator);
    }

    @Bean
    public DownloadJobService downloadJobService(JobStatusTracker tracker,
                                                 CatalogClient catalogClient,
                                                 SearchOrchestrator searchOrchestrator,
                                                 AcquisitionPipeline pipeline,
                                                 ArtifactPostProcessor postProcessor,
                                                 @Qualifier("jobExecutor") Executor jobExecutor) {
        return new DownloadJobService(tracker, catalogClient, searchOrchestrator, pipeline, postProcessor,
                jobExecutor);
    }
}
