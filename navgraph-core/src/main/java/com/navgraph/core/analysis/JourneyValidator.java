package com.navgraph.core.analysis;

import com.navgraph.core.exception.NavigationAnalysisException;
import com.navgraph.core.graph.NavigationGraph;
import com.navgraph.core.model.Journey;
import com.navgraph.core.model.JourneyResult;
import com.navgraph.core.model.JourneyStatus;
import com.navgraph.core.model.MissingLink;
import com.navgraph.core.model.MissingLinkReason;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Checks that every consecutive step pair of a journey is backed by a link.
 *
 * <p>Only direct links count, in the journey's direction. A step naming a route that is not
 * in the graph is reported as a {@link MissingLink} with an unknown-step reason instead of
 * failing the run.
 *
 * <p>Journeys are independent of each other. With a parallelism above one they are
 * validated on a fixed worker pool; results are always returned in declaration order.
 */
public class JourneyValidator {

    private static final Logger log = LoggerFactory.getLogger(JourneyValidator.class);

    private static final String PHASE = "journey validation";

    private final AnalysisDeadline deadline;
    private final int parallelism;

    public JourneyValidator() {
        this(AnalysisDeadline.none(), 1);
    }

    /**
     * @param deadline time budget checked at every journey step
     * @param parallelism number of worker threads, 1 for sequential validation
     */
    public JourneyValidator(AnalysisDeadline deadline, int parallelism) {
        this.deadline = Objects.requireNonNull(deadline, "deadline must not be null");
        if (parallelism < 1) {
            throw new IllegalArgumentException("parallelism must be >= 1, got " + parallelism);
        }
        this.parallelism = parallelism;
    }

    /**
     * Validates journeys without orphan cross-referencing.
     *
     * @param graph the navigation graph
     * @param journeys journeys to validate
     * @return one result per journey, in the same order
     */
    public List<JourneyResult> validate(NavigationGraph graph, List<Journey> journeys) {
        return validate(graph, journeys, Set.of());
    }

    /**
     * Validates journeys and records which of their known steps are orphans.
     *
     * <p>Orphan steps are informational: they do not change coverage or status.
     *
     * @param graph the navigation graph
     * @param journeys journeys to validate
     * @param orphans routes unreachable from every entry point
     * @return one result per journey, in the same order
     */
    public List<JourneyResult> validate(NavigationGraph graph, List<Journey> journeys, Set<String> orphans) {
        Objects.requireNonNull(graph, "graph must not be null");
        Objects.requireNonNull(journeys, "journeys must not be null");
        Objects.requireNonNull(orphans, "orphans must not be null");

        if (parallelism == 1 || journeys.size() < 2) {
            List<JourneyResult> results = new ArrayList<>(journeys.size());
            for (Journey journey : journeys) {
                results.add(validateJourney(graph, journey, orphans));
            }
            return List.copyOf(results);
        }
        return validateConcurrently(graph, journeys, orphans);
    }

    private List<JourneyResult> validateConcurrently(NavigationGraph graph, List<Journey> journeys, Set<String> orphans) {
        int threads = Math.min(parallelism, journeys.size());
        log.debug("Validating {} journeys on {} threads", journeys.size(), threads);

        ExecutorService executor = Executors.newFixedThreadPool(threads);
        try {
            List<Callable<JourneyResult>> tasks = new ArrayList<>(journeys.size());
            for (Journey journey : journeys) {
                tasks.add(() -> validateJourney(graph, journey, orphans));
            }

            List<JourneyResult> results = new ArrayList<>(journeys.size());
            for (Future<JourneyResult> future : executor.invokeAll(tasks)) {
                results.add(future.get());
            }
            return List.copyOf(results);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new NavigationAnalysisException("Journey validation was interrupted", e);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new NavigationAnalysisException("Journey validation failed", e.getCause());
        } finally {
            executor.shutdownNow();
        }
    }

    /**
     * Validates a single journey.
     *
     * @param graph the navigation graph
     * @param journey the journey
     * @param orphans routes unreachable from every entry point
     * @return the journey result
     */
    JourneyResult validateJourney(NavigationGraph graph, Journey journey, Set<String> orphans) {
        List<String> steps = journey.steps();
        List<MissingLink> missingLinks = new ArrayList<>();
        int satisfied = 0;

        for (int i = 0; i < steps.size() - 1; i++) {
            deadline.check(PHASE);
            String from = steps.get(i);
            String to = steps.get(i + 1);

            MissingLinkReason reason = classify(graph, from, to);
            if (reason == null) {
                satisfied++;
            } else {
                missingLinks.add(new MissingLink(from, to, reason));
                if (reason.isUnknownStep()) {
                    log.warn("Journey '{}' references unknown route(s): {} -> {}", journey.name(), from, to);
                }
            }
        }

        List<String> unreachableSteps = new ArrayList<>();
        if (!orphans.isEmpty()) {
            for (String step : steps) {
                if (orphans.contains(step) && !unreachableSteps.contains(step)) {
                    unreachableSteps.add(step);
                }
            }
        }

        int total = journey.pairCount();
        double coverage = (double) satisfied / total;
        JourneyStatus status = satisfied == total ? JourneyStatus.COMPLETE : JourneyStatus.PARTIAL;

        log.debug("Journey '{}': {} ({}/{} links)", journey.name(), status, satisfied, total);
        return new JourneyResult(journey.name(), status, coverage, satisfied, total, missingLinks, unreachableSteps);
    }

    private static MissingLinkReason classify(NavigationGraph graph, String from, String to) {
        boolean fromKnown = graph.containsNode(from);
        boolean toKnown = graph.containsNode(to);
        if (!fromKnown && !toKnown) {
            return MissingLinkReason.UNKNOWN_BOTH;
        }
        if (!fromKnown) {
            return MissingLinkReason.UNKNOWN_FROM;
        }
        if (!toKnown) {
            return MissingLinkReason.UNKNOWN_TO;
        }
        return graph.hasEdge(from, to) ? null : MissingLinkReason.MISSING_EDGE;
    }

    /**
     * Mean coverage over all journey results.
     *
     * @param results journey results, may be null
     * @return the mean coverage, or null when there are no results
     */
    public static Double averageCoverage(List<JourneyResult> results) {
        if (results == null || results.isEmpty()) {
            return null;
        }
        double sum = 0.0;
        for (JourneyResult result : results) {
            sum += result.coverage();
        }
        return sum / results.size();
    }
}
