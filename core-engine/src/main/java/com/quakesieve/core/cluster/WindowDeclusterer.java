package com.quakesieve.core.cluster;

import com.quakesieve.core.geo.GeodesicDistance;
import com.quakesieve.core.model.Attribution;
import com.quakesieve.core.model.ClassificationState;
import com.quakesieve.core.model.DeclusteringResult;
import com.quakesieve.core.model.Event;
import com.quakesieve.core.model.Window;
import com.quakesieve.core.window.WindowModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Magnitude-ordered window declustering (Gardner-Knopoff family).
 *
 * <p>
 * Events are visited by descending magnitude (ties: earlier first, then
 * input position). Each event that is still independent when visited acts as
 * a trigger: every not-yet-visited event of smaller or equal magnitude inside
 * its window (|Δt| within the temporal extent <em>and</em> distance within the
 * spatial extent, both inclusive) becomes dependent on it.
 * </p>
 *
 * <h3>Claim modes</h3>
 * <ul>
 * <li>{@link ClaimMode#SINGLE}: a dependent event keeps the first trigger
 * that claimed it.</li>
 * <li>{@link ClaimMode#NEAREST}: a dependent event is re-evaluated by every
 * later trigger and ends up attributed to the one closest in time.</li>
 * </ul>
 * <p>
 * In both modes a dependent event never becomes a trigger itself.
 * </p>
 *
 * <h3>Complexity</h3>
 * <p>
 * O(n²) pairwise tests; windows are computed once per event up front so a
 * model that rejects a magnitude fails before any event is classified.
 * </p>
 *
 * @since 1.0.0
 */
public class WindowDeclusterer implements Declusterer {

    private static final Logger LOG = LoggerFactory.getLogger(WindowDeclusterer.class);

    private final WindowModel windowModel;
    private final ClaimMode claimMode;

    /**
     * @param windowModel the window model; must not be {@code null}
     * @param claimMode   how overlapping claims are resolved; must not be
     *                    {@code null}
     */
    public WindowDeclusterer(WindowModel windowModel, ClaimMode claimMode) {
        this.windowModel = Objects.requireNonNull(windowModel, "Window model must not be null");
        this.claimMode = Objects.requireNonNull(claimMode, "Claim mode must not be null");
    }

    @Override
    public DeclusteringResult decluster(List<Event> events) {
        Objects.requireNonNull(events, "Events must not be null");
        if (events.isEmpty()) {
            return DeclusteringResult.empty();
        }
        Catalogs.requireUniqueIds(events);

        int n = events.size();
        Window[] windows = new Window[n];
        ClassificationState[] states = new ClassificationState[n];
        for (int i = 0; i < n; i++) {
            windows[i] = windowModel.windowFor(events.get(i).getMagnitude());
            states[i] = new ClassificationState();
        }

        boolean[] visited = new boolean[n];
        int triggers = 0;
        int reassignments = 0;

        for (int p : Catalogs.magnitudeDescending(events)) {
            if (states[p].isDependent()) {
                continue;
            }
            visited[p] = true;
            triggers++;

            Event parent = events.get(p);
            Window window = windows[p];
            double windowSeconds = window.getTemporalSeconds();

            for (int q = 0; q < n; q++) {
                if (q == p || visited[q]) {
                    continue;
                }
                Event candidate = events.get(q);
                if (candidate.getMagnitude() > parent.getMagnitude()) {
                    continue;
                }
                boolean alreadyDependent = states[q].isDependent();
                if (alreadyDependent && claimMode == ClaimMode.SINGLE) {
                    continue;
                }

                double deltaSeconds = Attribution.elapsedSeconds(parent, candidate);
                if (Math.abs(deltaSeconds) > windowSeconds) {
                    continue;
                }
                double distanceKm = GeodesicDistance.km(parent, candidate);
                if (distanceKm > window.getSpatialKm()) {
                    continue;
                }

                Attribution attribution = new Attribution(
                        parent.getId(), parent.getMagnitude(), deltaSeconds, distanceKm);
                if (claimMode == ClaimMode.SINGLE) {
                    states[q].claim(attribution);
                    LOG.trace("{} claimed {} (dt={}s, d={}km)",
                            parent.getId(), candidate.getId(), deltaSeconds, distanceKm);
                } else if (states[q].claimIfCloserInTime(attribution) && alreadyDependent) {
                    reassignments++;
                    LOG.trace("{} re-claimed {} (dt={}s, d={}km)",
                            parent.getId(), candidate.getId(), deltaSeconds, distanceKm);
                }
            }
        }

        DeclusteringResult result = DeclusteringResult.fromStates(events, states);
        LOG.debug("Window declustering [{} / {}]: {} events, {} triggers, {} dependent, {} reassigned",
                windowModel.getName(), claimMode, n, triggers, result.getDependent().size(), reassignments);
        return result;
    }

    public WindowModel getWindowModel() {
        return windowModel;
    }

    public ClaimMode getClaimMode() {
        return claimMode;
    }

    @Override
    public String getMethodName() {
        return windowModel.getName() + "/" + claimMode.name().toLowerCase(Locale.ROOT);
    }
}
