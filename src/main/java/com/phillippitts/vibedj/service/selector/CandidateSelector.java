package com.phillippitts.vibedj.service.selector;

import com.phillippitts.vibedj.domain.ScoredCandidate;
import com.phillippitts.vibedj.service.oracle.OracleCandidate;
import com.phillippitts.vibedj.util.SearchQuery;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Random;

/**
 * Picks one oracle candidate by cooldown-weighted random choice and keeps the rest as
 * backups, best score first.
 *
 * <p>Thread-safe: all state is guarded by the instance monitor.
 */
public class CandidateSelector {

    private static final Logger LOG = LogManager.getLogger(CandidateSelector.class);

    private final CandidateScorer scorer;
    private final Random random;
    private final Deque<ScoredCandidate> backups = new ArrayDeque<>();

    public CandidateSelector(CandidateScorer scorer, Random random) {
        this.scorer = Objects.requireNonNull(scorer, "scorer must not be null");
        this.random = Objects.requireNonNull(random, "random must not be null");
    }

    /**
     * Scores the candidates and draws a winner with probability proportional to score.
     * When every score is zero the draw is uniform. Replaces the backup list.
     *
     * @return the winner, or empty when no candidate has a usable title
     */
    public synchronized Optional<ScoredCandidate> choose(List<OracleCandidate> candidates) {
        List<ScoredCandidate> scored = score(candidates);
        backups.clear();
        if (scored.isEmpty()) {
            return Optional.empty();
        }

        double total = 0.0;
        for (ScoredCandidate c : scored) {
            total += c.score();
        }
        List<ScoredCandidate> withProbability = new ArrayList<>(scored.size());
        for (ScoredCandidate c : scored) {
            double p = total > 0.0 ? c.score() / total * 100.0 : 100.0 / scored.size();
            withProbability.add(c.withProbability(p));
        }

        int winnerIndex = draw(withProbability, total);
        ScoredCandidate winner = withProbability.get(winnerIndex);

        List<ScoredCandidate> rest = new ArrayList<>(withProbability);
        rest.remove(winnerIndex);
        rest.sort(Comparator.comparingDouble(ScoredCandidate::score).reversed());
        backups.addAll(rest);

        if (LOG.isDebugEnabled()) {
            for (ScoredCandidate c : withProbability) {
                LOG.debug("candidate '{}' by '{}' score={} p={}%", c.title(), c.artist(),
                        String.format("%.3f", c.score()), String.format("%.1f", c.probability()));
            }
        }
        LOG.info("Selected '{}' by '{}' (p={}%), {} backups", winner.title(), winner.artist(),
                String.format("%.1f", winner.probability()), backups.size());
        return Optional.of(winner);
    }

    /** Removes and returns the best remaining backup. */
    public synchronized Optional<ScoredCandidate> popBackup() {
        return Optional.ofNullable(backups.pollFirst());
    }

    public synchronized void clearBackups() {
        backups.clear();
    }

    public synchronized int backupCount() {
        return backups.size();
    }

    private List<ScoredCandidate> score(List<OracleCandidate> candidates) {
        List<ScoredCandidate> out = new ArrayList<>();
        if (candidates == null) {
            return out;
        }
        for (OracleCandidate c : candidates) {
            SearchQuery q = SearchQuery.resolve(c.title(), c.artist(), c.searchQuery());
            if (!q.hasTitle()) {
                LOG.debug("Dropping candidate without title: '{}'", c.searchQuery());
                continue;
            }
            q = q.withDefaultArtist();
            double s;
            try {
                s = scorer.score(q.title(), q.artist());
            } catch (RuntimeException e) {
                LOG.warn("Scoring failed for '{}' by '{}', using 1.0: {}", q.title(), q.artist(), e.getMessage());
                s = 1.0;
            }
            if (Double.isNaN(s) || s < 0.0) {
                s = 0.0;
            }
            out.add(new ScoredCandidate(q.title(), q.artist(), q.asQuery(), c.rationale(), s, 0.0));
        }
        return out;
    }

    private int draw(List<ScoredCandidate> scored, double total) {
        if (total <= 0.0) {
            return random.nextInt(scored.size());
        }
        double r = random.nextDouble() * total;
        double acc = 0.0;
        for (int i = 0; i < scored.size(); i++) {
            acc += scored.get(i).score();
            if (r < acc) {
                return i;
            }
        }
        return scored.size() - 1;
    }
}
