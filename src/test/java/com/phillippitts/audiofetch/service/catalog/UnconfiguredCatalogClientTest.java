package com.phillippitts.audiofetch.service.catalog;

import com.phillippitts.audiofetch.exception.UpstreamFailure;
import com.phillippitts.audiofetch.exception.UpstreamUnavailableException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

class UnconfiguredCatalogClientTest {

    @Test
    void everyCallIsUnavailable() {
        UnconfiguredCatalogClient client = new UnconfiguredCatalogClient();

        UpstreamUnavailableException e = catchThrowableOfType(
                () -> client.resolveTrack("https://open.spotify.com/track/x"), UpstreamUnavailableException.class);

        assertThat(e.getKind()).isEqualTo(UpstreamFailure.UNAVAILABLE);
        assertThat(e.getKind().isRetryable()).isFalse();
        assertThat(e).hasMessage("No catalog client configured");
    }
}
