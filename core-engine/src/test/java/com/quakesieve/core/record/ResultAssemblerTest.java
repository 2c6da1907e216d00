package com.quakesieve.core.record;

import com.quakesieve.core.cluster.ClaimMode;
import com.quakesieve.core.cluster.WindowDeclusterer;
import com.quakesieve.core.model.DeclusteringResult;
import com.quakesieve.core.model.Event;
import com.quakesieve.core.window.FixedWindow;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link ResultAssembler}.
 */
class ResultAssemblerTest {

    private static final List<String> HEADER = List.of("event_id", "magnitude", "timestamp",
            "latitude", "longitude", "place");

    private DeclusteringResult result;

    @BeforeEach
    void setUp() {
        List<Event> catalog = List.of(
                event("after", 4.0, "2020-01-05T00:00:00Z", "North"),
                event("main", 6.0, "2020-01-01T00:00:00Z", "Centre"),
                event("far", 5.0, "2020-01-03T00:00:00Z", "Elsewhere", 10.0));
        result = new WindowDeclusterer(new FixedWindow(50, 30), ClaimMode.SINGLE).decluster(catalog);
    }

    @Test
    @DisplayName("Should write plain records with the input columns only")
    void shouldAssemblePlain() {
        AssembledCatalog catalog = ResultAssembler.assemble(result, HEADER, false);

        assertThat(catalog.getIndependentHeader()).containsExactlyElementsOf(HEADER);
        assertThat(catalog.getDependentHeader()).containsExactlyElementsOf(HEADER);
        assertThat(catalog.getIndependent()).extracting(r -> r.getField("event_id").orElseThrow())
                .containsExactly("main", "far");
        assertThat(catalog.getDependent()).singleElement()
                .satisfies(r -> {
                    assertThat(r.getFields().keySet()).containsExactlyElementsOf(HEADER);
                    assertThat(r.hasField(ResultAssembler.PARENT_ID)).isFalse();
                });
    }

    @Test
    @DisplayName("Should append attribution columns to dependent records only")
    void shouldAssembleAttributed() {
        AssembledCatalog catalog = ResultAssembler.assemble(result, HEADER, true);

        assertThat(catalog.getIndependentHeader()).containsExactlyElementsOf(HEADER);
        assertThat(catalog.getDependentHeader()).endsWith(
                "parent_id", "parent_magnitude", "delta_t_seconds", "delta_distance_km");
        assertThat(catalog.getIndependent()).allSatisfy(
                r -> assertThat(r.hasField(ResultAssembler.PARENT_ID)).isFalse());

        OutputRecord after = catalog.getDependent().get(0);
        assertThat(after.getFields().keySet()).containsExactlyElementsOf(catalog.getDependentHeader());
        assertThat(after.getField("place")).contains("North");
        assertThat(after.getField(ResultAssembler.PARENT_ID)).contains("main");
        assertThat(after.getField(ResultAssembler.PARENT_MAGNITUDE)).contains(6.0);
        assertThat(after.getField(ResultAssembler.DELTA_T_SECONDS)).contains(4 * 86_400.0);
        assertThat(after.getField(ResultAssembler.DELTA_DISTANCE_KM)).contains(0.0);
    }

    @Test
    @DisplayName("Should derive the header from event attributes")
    void shouldDeriveHeader() {
        AssembledCatalog catalog = ResultAssembler.assemble(result, false);

        assertThat(catalog.getIndependentHeader()).containsExactlyElementsOf(HEADER);
    }

    @Test
    @DisplayName("Should assemble an empty result with headers intact")
    void shouldAssembleEmpty() {
        AssembledCatalog catalog = ResultAssembler.assemble(DeclusteringResult.empty(), HEADER, true);

        assertThat(catalog.getIndependent()).isEmpty();
        assertThat(catalog.getDependent()).isEmpty();
        assertThat(catalog.getDependentHeader()).hasSize(HEADER.size() + 4);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static Event event(String id, double magnitude, String time, String place) {
        return event(id, magnitude, time, place, 0.0);
    }

    private static Event event(String id, double magnitude, String time, String place, double lat) {
        Map<String, String> attributes = new LinkedHashMap<>();
        attributes.put("event_id", id);
        attributes.put("magnitude", String.valueOf(magnitude));
        attributes.put("timestamp", time);
        attributes.put("latitude", String.valueOf(lat));
        attributes.put("longitude", "0.0");
        attributes.put("place", place);
        return Event.builder()
                .id(id)
                .magnitude(magnitude)
                .time(Instant.parse(time))
                .latitude(lat)
                .longitude(0.0)
                .attributes(attributes)
                .build();
    }
}
