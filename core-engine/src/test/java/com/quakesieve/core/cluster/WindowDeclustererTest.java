package com.quakesieve.core.cluster;

import com.quakesieve.core.model.Attribution;
import com.quakesieve.core.model.ClassifiedEvent;
import com.quakesieve.core.model.DeclusteringResult;
import com.quakesieve.core.model.Event;
import com.quakesieve.core.window.FixedWindow;
import com.quakesieve.core.window.GardnerKnopoffFormulaWindow;
import com.quakesieve.core.window.GardnerKnopoffTableWindow;
import com.quakesieve.core.window.ScaledWindowModel;
import com.quakesieve.core.window.WindowModel;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link WindowDeclusterer}.
 */
class WindowDeclustererTest {

    private static final Instant T0 = Instant.parse("2020-01-01T00:00:00Z");

    @Test
    @DisplayName("Should keep the mainshock, claim the near event and free the late one")
    void shouldClassifyFixedWindowScenario() {
        List<Event> catalog = List.of(
                event("A", 7.0, T0, 0.0, 0.0),
                event("B", 4.5, T0.plus(Duration.ofDays(10)), 0.1, 0.1),
                event("C", 4.0, T0.plus(Duration.ofDays(200)), 0.1, 0.1));

        DeclusteringResult result = new WindowDeclusterer(new FixedWindow(100, 100), ClaimMode.SINGLE)
                .decluster(catalog);

        assertThat(ids(result.getIndependent())).containsExactly("A", "C");
        assertThat(ids(result.getDependent())).containsExactly("B");

        Attribution b = result.find("B").orElseThrow().getAttribution().orElseThrow();
        assertThat(b.getParentId()).isEqualTo("A");
        assertThat(b.getParentMagnitude()).isEqualTo(7.0);
        assertThat(b.getDeltaSeconds()).isEqualTo(10 * 86_400.0);
        assertThat(b.getDistanceKm()).isCloseTo(15.7, within(0.1));
    }

    @Test
    @DisplayName("Should attribute to the trigger closest in time in nearest mode")
    void shouldAttributeToClosestInTime() {
        List<Event> catalog = overlapCatalog();

        DeclusteringResult result = new WindowDeclusterer(new GardnerKnopoffFormulaWindow(), ClaimMode.NEAREST)
                .decluster(catalog);

        assertThat(ids(result.getIndependent())).containsExactly("A", "B");
        Attribution c = result.find("C").orElseThrow().getAttribution().orElseThrow();
        assertThat(c.getParentId()).isEqualTo("B");
        assertThat(c.getParentMagnitude()).isEqualTo(6.8);
        // C precedes B by 400 days: a foreshock of its parent.
        assertThat(c.getDeltaSeconds()).isEqualTo(-400 * 86_400.0);
    }

    @Test
    @DisplayName("Should keep the first trigger in single-claim mode")
    void shouldKeepFirstTriggerInSingleMode() {
        DeclusteringResult result = new WindowDeclusterer(new GardnerKnopoffFormulaWindow(), ClaimMode.SINGLE)
                .decluster(overlapCatalog());

        Attribution c = result.find("C").orElseThrow().getAttribution().orElseThrow();
        assertThat(c.getParentId()).isEqualTo("A");
        assertThat(c.getDeltaSeconds()).isEqualTo(599 * 86_400.0);
    }

    @Test
    @DisplayName("Should record a negative elapsed time for foreshocks")
    void shouldRecordForeshock() {
        List<Event> catalog = List.of(
                event("fore", 4.0, T0, 10.0, 20.0),
                event("main", 6.0, T0.plus(Duration.ofHours(6)), 10.0, 20.05));

        DeclusteringResult result = new WindowDeclusterer(new GardnerKnopoffFormulaWindow(), ClaimMode.SINGLE)
                .decluster(catalog);

        Attribution fore = result.find("fore").orElseThrow().getAttribution().orElseThrow();
        assertThat(fore.getParentId()).isEqualTo("main");
        assertThat(fore.getDeltaSeconds()).isEqualTo(-6 * 3_600.0);
    }

    @Test
    @DisplayName("Should let the earlier of two equal magnitudes trigger")
    void shouldBreakMagnitudeTiesByTime() {
        List<Event> catalog = List.of(
                event("later", 5.0, T0.plus(Duration.ofDays(1)), 0.0, 0.0),
                event("earlier", 5.0, T0, 0.0, 0.0));

        DeclusteringResult result = new WindowDeclusterer(new GardnerKnopoffFormulaWindow(), ClaimMode.SINGLE)
                .decluster(catalog);

        assertThat(ids(result.getIndependent())).containsExactly("earlier");
        assertThat(result.find("later").orElseThrow().getAttribution().orElseThrow().getParentId())
                .isEqualTo("earlier");
    }

    @Test
    @DisplayName("Should fall back to input order for identical magnitude and time")
    void shouldBreakFullTiesByInputOrder() {
        List<Event> catalog = List.of(
                event("first", 5.0, T0, 0.0, 0.0),
                event("second", 5.0, T0, 0.0, 0.0));

        DeclusteringResult result = new WindowDeclusterer(new GardnerKnopoffFormulaWindow(), ClaimMode.NEAREST)
                .decluster(catalog);

        assertThat(ids(result.getIndependent())).containsExactly("first");
        assertThat(ids(result.getDependent())).containsExactly("second");
    }

    @Test
    @DisplayName("Should never let a dependent event trigger smaller events")
    void shouldNotTriggerFromDependent() {
        // B is inside A's window; C is inside B's window but outside A's.
        List<Event> catalog = List.of(
                event("A", 6.0, T0, 0.0, 0.0),
                event("B", 5.0, T0.plus(Duration.ofDays(10)), 0.0, 0.4),
                event("C", 4.0, T0.plus(Duration.ofDays(12)), 0.0, 0.7));

        for (ClaimMode mode : ClaimMode.values()) {
            DeclusteringResult result = new WindowDeclusterer(new GardnerKnopoffFormulaWindow(), mode)
                    .decluster(catalog);

            assertThat(ids(result.getDependent())).as(mode.name()).containsExactly("B");
            assertThat(ids(result.getIndependent())).as(mode.name()).containsExactly("A", "C");
        }
    }

    @Test
    @DisplayName("Should partition every event exactly once")
    void shouldPartitionCompletely() {
        List<Event> catalog = randomCatalog(250, 42L);

        for (ClaimMode mode : ClaimMode.values()) {
            DeclusteringResult result = new WindowDeclusterer(new GardnerKnopoffFormulaWindow(), mode)
                    .decluster(catalog);

            Set<String> independent = new HashSet<>(ids(result.getIndependent()));
            Set<String> dependent = new HashSet<>(ids(result.getDependent()));
            Set<String> all = catalog.stream().map(Event::getId).collect(Collectors.toSet());

            assertThat(result.size()).isEqualTo(catalog.size());
            assertThat(independent).doesNotContainAnyElementsOf(dependent);
            Set<String> union = new HashSet<>(independent);
            union.addAll(dependent);
            assertThat(union).isEqualTo(all);
        }
    }

    @Test
    @DisplayName("Should keep both sequences in input order")
    void shouldPreserveInputOrder() {
        List<Event> catalog = randomCatalog(80, 7L);
        List<String> inputOrder = catalog.stream().map(Event::getId).toList();

        DeclusteringResult result = new WindowDeclusterer(new GardnerKnopoffTableWindow(), ClaimMode.SINGLE)
                .decluster(catalog);

        assertThat(ids(result.getIndependent())).isSubsetOf(inputOrder);
        assertThat(ids(result.getIndependent())).isSortedAccordingTo(
                (a, b) -> Integer.compare(inputOrder.indexOf(a), inputOrder.indexOf(b)));
        assertThat(ids(result.getDependent())).isSortedAccordingTo(
                (a, b) -> Integer.compare(inputOrder.indexOf(a), inputOrder.indexOf(b)));
    }

    @Test
    @DisplayName("Should classify identically with scale 1.0")
    void shouldKeepScaleIdentity() {
        List<Event> catalog = randomCatalog(150, 11L);
        List<WindowModel> models = List.of(new GardnerKnopoffFormulaWindow(), new GardnerKnopoffTableWindow());

        for (WindowModel model : models) {
            DeclusteringResult plain = new WindowDeclusterer(model, ClaimMode.SINGLE).decluster(catalog);
            DeclusteringResult scaled = new WindowDeclusterer(new ScaledWindowModel(model, 1.0), ClaimMode.SINGLE)
                    .decluster(catalog);

            assertThat(scaled.getIndependent()).isEqualTo(plain.getIndependent());
            assertThat(scaled.getDependent()).isEqualTo(plain.getDependent());
        }
    }

    @Test
    @DisplayName("Should remove no fewer events as windows widen")
    void shouldGrowMonotonicallyWithScale() {
        // M6.0 windows are ~53.2 km / ~499 days.
        List<Event> catalog = List.of(
                event("main", 6.0, T0, 35.0, 139.0),
                // ~44.6 km and 399 days away: inside at 1.0, outside at 0.75
                event("edge-space", 3.0, Instant.parse("2021-02-03T00:00:00Z"), 35.0, 139.49),
                // 520 days away: inside at 1.25 only
                event("edge-time", 3.0, Instant.parse("2021-06-04T00:00:00Z"), 35.0, 139.1));
        WindowModel base = new GardnerKnopoffFormulaWindow();

        int tight = dependentCount(new ScaledWindowModel(base, 0.75), catalog);
        int normal = dependentCount(base, catalog);
        int wide = dependentCount(new ScaledWindowModel(base, 1.25), catalog);

        assertThat(tight).isZero();
        assertThat(normal).isEqualTo(1);
        assertThat(wide).isEqualTo(2);
    }

    @Test
    @DisplayName("Should fail before classifying when the table rejects a magnitude")
    void shouldFailOnRejectedMagnitude() {
        List<Event> catalog = List.of(
                event("ok", 5.0, T0, 0.0, 0.0),
                event("tiny", 2.0, T0.plus(Duration.ofDays(1)), 0.0, 0.0));
        WindowDeclusterer declusterer = new WindowDeclusterer(
                new GardnerKnopoffTableWindow(GardnerKnopoffTableWindow.Underflow.REJECT), ClaimMode.SINGLE);

        assertThatThrownBy(() -> declusterer.decluster(catalog))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("2.00");
    }

    @Test
    @DisplayName("Should handle empty and singleton catalogs")
    void shouldHandleDegenerateCatalogs() {
        WindowDeclusterer declusterer = new WindowDeclusterer(new GardnerKnopoffFormulaWindow(), ClaimMode.SINGLE);

        DeclusteringResult empty = declusterer.decluster(List.of());
        assertThat(empty.getIndependent()).isEmpty();
        assertThat(empty.getDependent()).isEmpty();

        DeclusteringResult single = declusterer.decluster(List.of(event("only", 3.0, T0, 0.0, 0.0)));
        assertThat(ids(single.getIndependent())).containsExactly("only");
        assertThat(single.getDependent()).isEmpty();
    }

    @Test
    @DisplayName("Should reject duplicate ids")
    void shouldRejectDuplicateIds() {
        List<Event> catalog = List.of(
                event("dup", 5.0, T0, 0.0, 0.0),
                event("dup", 4.0, T0.plus(Duration.ofDays(1)), 1.0, 1.0));
        WindowDeclusterer declusterer = new WindowDeclusterer(new GardnerKnopoffFormulaWindow(), ClaimMode.SINGLE);

        assertThatThrownBy(() -> declusterer.decluster(catalog))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("dup");
    }

    @Test
    @DisplayName("Should name itself after model and claim mode")
    void shouldExposeMethodName() {
        assertThat(new WindowDeclusterer(new GardnerKnopoffTableWindow(), ClaimMode.NEAREST).getMethodName())
                .isEqualTo("gk-table/nearest");
    }

    @Test
    @DisplayName("Should attribute events at the far end of the time range")
    void shouldHandleDistantInstants() {
        Instant late = Instant.MAX.minus(Duration.ofDays(30));
        List<Event> catalog = List.of(
                event("main", 6.0, late, 35.0, 139.0),
                event("after", 4.0, late.plus(Duration.ofDays(2)).plusMillis(500), 35.0, 139.1));

        DeclusteringResult result = new WindowDeclusterer(new GardnerKnopoffFormulaWindow(), ClaimMode.SINGLE)
                .decluster(catalog);

        Attribution a = result.find("after").orElseThrow().getAttribution().orElseThrow();
        assertThat(a.getParentId()).isEqualTo("main");
        assertThat(a.getDeltaSeconds()).isEqualTo(2 * 86_400.0 + 0.5);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    /**
     * A (M7.0) and B (M6.8) are 999 days apart, beyond A's window, and both
     * cover C: 599 days after A, 400 days before B.
     */
    private static List<Event> overlapCatalog() {
        return List.of(
                event("A", 7.0, T0, 35.0, 139.0),
                event("B", 6.8, Instant.parse("2022-09-26T00:00:00Z"), 35.0, 139.1),
                event("C", 5.5, Instant.parse("2021-08-22T00:00:00Z"), 35.05, 139.05));
    }

    private static int dependentCount(WindowModel model, List<Event> catalog) {
        return new WindowDeclusterer(model, ClaimMode.SINGLE).decluster(catalog).getDependent().size();
    }

    private static List<Event> randomCatalog(int n, long seed) {
        Random random = new Random(seed);
        List<Event> events = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            events.add(event("ev" + i,
                    2.5 + Math.round(random.nextDouble() * 45) / 10.0,
                    T0.plus(Duration.ofHours(random.nextInt(24 * 365 * 3))),
                    30.0 + random.nextDouble() * 4,
                    135.0 + random.nextDouble() * 4));
        }
        return events;
    }

    private static Event event(String id, double magnitude, Instant time, double lat, double lon) {
        return Event.builder()
                .id(id)
                .magnitude(magnitude)
                .time(time)
                .latitude(lat)
                .longitude(lon)
                .build();
    }

    private static List<String> ids(List<ClassifiedEvent> events) {
        return events.stream().map(e -> e.getEvent().getId()).toList();
    }
}
