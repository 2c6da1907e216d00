package com.quakesieve.core.cluster;

import com.quakesieve.core.config.ReasenbergParameters;
import com.quakesieve.core.geo.GeodesicDistance;
import com.quakesieve.core.model.Attribution;
import com.quakesieve.core.model.ClassificationState;
import com.quakesieve.core.model.DeclusteringResult;
import com.quakesieve.core.model.Event;
import com.quakesieve.core.model.Window;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;

/**
 * Reasenberg (1985) interaction-based clustering.
 *
 * <p>
 * Events are processed chronologically (ties by input position). Before an
 * event is evaluated, every open cluster whose lookback has elapsed is
 * closed. The event then joins the qualifying open cluster with the largest
 * mainshock, or opens a new one. When the catalog is exhausted every cluster
 * is closed; its largest event is independent and the other members are
 * dependent on it.
 * </p>
 *
 * <h3>Interaction zone</h3>
 *
 * <pre>
 *   r_int = rfact · 10^(0.11·Mmax + 0.024)                     km
 *   τ     = clamp(−ln(1 − p) / 10^(b·(Mmax − xmeff)), τmin, τmax)   days
 * </pre>
 * <p>
 * Distances are measured to the cluster's current largest event; elapsed
 * time to its last counted member. Events below {@code xmeff} may join a
 * cluster but do not extend its lookback.
 * </p>
 *
 * <h3>Ambiguity</h3>
 * <p>
 * An event inside several open clusters joins the one whose largest
 * magnitude is greatest; then the one active most recently; then the oldest.
 * </p>
 *
 * <p>
 * Inherently sequential: each decision depends on the cluster state left by
 * the previous events.
 * </p>
 *
 * @since 1.0.0
 */
public class ReasenbergDeclusterer implements Declusterer {

    private static final Logger LOG = LoggerFactory.getLogger(ReasenbergDeclusterer.class);

    /** Above this exponent 10^x overflows any useful τ; τ is τmin. */
    static final double MAX_RATE_EXPONENT = 300.0;

    private final double rfact;
    private final double tauMin;
    private final double tauMax;
    private final double p;
    private final double xmeff;
    private final double bvalue;

    /**
     * @param parameters clustering parameters; must not be {@code null}
     * @throws IllegalArgumentException if any parameter is invalid
     */
    public ReasenbergDeclusterer(ReasenbergParameters parameters) {
        Objects.requireNonNull(parameters, "ReasenbergParameters must not be null");
        List<String> errors = parameters.collectErrors();
        if (!errors.isEmpty()) {
            throw new IllegalArgumentException(
                    "Invalid Reasenberg parameters: " + String.join("; ", errors));
        }
        this.rfact = parameters.getRfact();
        this.tauMin = parameters.getTauMin();
        this.tauMax = parameters.getTauMax();
        this.p = parameters.getP();
        this.xmeff = parameters.getXmeff();
        this.bvalue = parameters.getBvalue();
    }

    @Override
    public DeclusteringResult decluster(List<Event> events) {
        Objects.requireNonNull(events, "Events must not be null");
        if (events.isEmpty()) {
            return DeclusteringResult.empty();
        }

        List<ReasenbergCluster> clusters = buildClusters(events);

        ClassificationState[] states = new ClassificationState[events.size()];
        for (int i = 0; i < states.length; i++) {
            states[i] = new ClassificationState();
        }
        for (ReasenbergCluster cluster : clusters) {
            Event main = events.get(cluster.getLargestPosition());
            for (int member : cluster.getMembers()) {
                if (member == cluster.getLargestPosition()) {
                    continue;
                }
                Event dependent = events.get(member);
                states[member].claim(Attribution.between(main, dependent, GeodesicDistance.km(main, dependent)));
            }
        }

        DeclusteringResult result = DeclusteringResult.fromStates(events, states);
        LOG.debug("Reasenberg declustering: {} events, {} clusters, {} dependent",
                events.size(), clusters.size(), result.getDependent().size());
        return result;
    }

    /**
     * Run the clustering pass and return every cluster, closed, in creation
     * order.
     *
     * @param events the catalog; ids must be unique
     * @return closed clusters covering every event exactly once
     */
    public List<ReasenbergCluster> buildClusters(List<Event> events) {
        Objects.requireNonNull(events, "Events must not be null");
        Catalogs.requireUniqueIds(events);

        List<ReasenbergCluster> open = new ArrayList<>();
        List<ReasenbergCluster> closed = new ArrayList<>();
        int sequence = 0;

        for (int position : Catalogs.chronological(events)) {
            Event event = events.get(position);
            closeExpired(open, closed, event.getTime());

            ReasenbergCluster best = null;
            double bestElapsed = Double.POSITIVE_INFINITY;
            for (ReasenbergCluster cluster : open) {
                Event main = events.get(cluster.getLargestPosition());
                double distanceKm = GeodesicDistance.km(event, main);
                if (distanceKm > interactionRadiusKm(cluster.getLargestMagnitude())) {
                    continue;
                }
                double elapsed = elapsedDays(cluster.getLastActivity(), event.getTime());
                if (best == null
                        || cluster.getLargestMagnitude() > best.getLargestMagnitude()
                        || (cluster.getLargestMagnitude() == best.getLargestMagnitude() && elapsed < bestElapsed)) {
                    best = cluster;
                    bestElapsed = elapsed;
                }
            }

            if (best != null) {
                best.join(position, event, event.getMagnitude() >= xmeff);
                LOG.trace("{} joined cluster #{}", event.getId(), best.getSequence());
            } else {
                open.add(new ReasenbergCluster(sequence++, position, event));
            }
        }

        for (ReasenbergCluster cluster : open) {
            cluster.close(null);
            closed.add(cluster);
        }
        closed.sort(Comparator.comparingInt(ReasenbergCluster::getSequence));
        return closed;
    }

    private void closeExpired(List<ReasenbergCluster> open, List<ReasenbergCluster> closed, Instant now) {
        Iterator<ReasenbergCluster> it = open.iterator();
        while (it.hasNext()) {
            ReasenbergCluster cluster = it.next();
            double elapsed = elapsedDays(cluster.getLastActivity(), now);
            if (elapsed > lookbackDays(cluster.getLargestMagnitude())) {
                cluster.close(now);
                closed.add(cluster);
                it.remove();
                LOG.trace("Closed cluster #{} ({} members) at {}", cluster.getSequence(), cluster.size(), now);
            }
        }
    }

    /**
     * Interaction radius for a cluster whose largest magnitude is {@code mmax}.
     *
     * @return radius in km
     */
    public double interactionRadiusKm(double mmax) {
        return rfact * Math.pow(10, 0.11 * mmax + 0.024);
    }

    /**
     * Adaptive lookback for a cluster whose largest magnitude is {@code mmax},
     * clamped to {@code [tauMin, tauMax]}.
     *
     * @return lookback in days
     */
    public double lookbackDays(double mmax) {
        double exponent = bvalue * (mmax - xmeff);
        if (exponent > MAX_RATE_EXPONENT) {
            return tauMin;
        }
        double rate = Math.pow(10, exponent);
        double tau = -Math.log(1.0 - p) / rate;
        return Math.max(tauMin, Math.min(tauMax, tau));
    }

    private static double elapsedDays(Instant from, Instant to) {
        return Attribution.elapsedSeconds(from, to) / Window.SECONDS_PER_DAY;
    }

    @Override
    public String getMethodName() {
        return "reasenberg";
    }
}
