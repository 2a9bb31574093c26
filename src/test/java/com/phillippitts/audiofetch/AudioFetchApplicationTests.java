package com.phillippitts.audiofetch;

import com.phillippitts.audiofetch.service.batch.BatchCoordinator;
import com.phillippitts.audiofetch.service.batch.CollectionDownloadService;
import com.phillippitts.audiofetch.service.catalog.CatalogClient;
import com.phillippitts.audiofetch.service.catalog.RetryingCatalogClient;
import com.phillippitts.audiofetch.service.job.DownloadJobService;
import com.phillippitts.audiofetch.service.search.SearchOrchestrator;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(
    properties = {
        "audiofetch.acquisition.output-dir=target/test-downloads",
        "audiofetch.search.backoff-ms=0"
    }
)
class AudioFetchApplicationTests {

    @Autowired
    private ApplicationContext context;

    @Test
    void contextLoads() {
        assertThat(context.getBean(SearchOrchestrator.class)).isNotNull();
        assertThat(context.getBean(BatchCoordinator.class)).isNotNull();
        assertThat(context.getBean(CollectionDownloadService.class)).isNotNull();
        assertThat(context.getBean(DownloadJobService.class)).isNotNull();
        assertThat(context.getBean(CatalogClient.class)).isInstanceOf(RetryingCatalogClient.class);
    }
}
