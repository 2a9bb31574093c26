package com.phillippitts.audiofetch.service.search;

import com.phillippitts.audiofetch.domain.TrackDescriptor;
import com.phillippitts.audiofetch.testutil.Tracks;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class QueryGeneratorTest {

    private final QueryGenerator generator = new QueryGenerator();

    @Test
    void generatesQueriesMostSpecificFirst() {
        List<String> queries = generator.generate(Tracks.blindingLights());

        assertThat(queries).containsExactly(
                "The Weeknd Blinding Lights",
                "The Weeknd Blinding Lights official audio",
                "Blinding Lights The Weeknd",
                "The Weeknd Blinding Lights lyrics",
                "Blinding Lights audio",
                "Blinding Lights After Hours",
                "Blinding Lights full song",
                "The Weeknd Blinding Lights");
    }

    @Test
    void isrcGoesFourthWhenPresent() {
        List<String> queries = generator.generate(Tracks.withIsrc("GBARL9300135"));

        assertThat(queries).hasSize(QueryGenerator.MAX_QUERIES);
        assertThat(queries.get(3)).isEqualTo("GBARL9300135");
    }

    @Test
    void lastQueryUsesFirstOfSeveralArtists() {
        TrackDescriptor track = Tracks.named("Daft Punk, Pharrell Williams", "Get Lucky");

        List<String> queries = generator.generate(track);

        assertThat(queries.get(queries.size() - 1)).isEqualTo("Daft Punk Get Lucky");
        assertThat(queries.get(0)).isEqualTo("Daft Punk, Pharrell Williams Get Lucky");
    }

    @Test
    void outputIsDeterministicAndImmutable() {
        TrackDescriptor track = Tracks.blindingLights();

        List<String> first = generator.generate(track);

        assertThat(generator.generate(track)).isEqualTo(first);
        assertThatThrownBy(() -> first.add("x")).isInstanceOf(UnsupportedOperationException.class);
    }
}
