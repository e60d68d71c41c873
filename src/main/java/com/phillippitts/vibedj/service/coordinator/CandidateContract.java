package com.phillippitts.vibedj.service.coordinator;

import com.phillippitts.vibedj.domain.CatalogTrack;
import com.phillippitts.vibedj.service.oracle.OracleCandidate;
import com.phillippitts.vibedj.util.SearchQuery;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Enforces the recommender's output mix: up to {@code providedCount} candidates drawn from
 * the provided shortlist, the rest the oracle's own suggestions, {@code totalCount} overall.
 *
 * <p>When the oracle returns too few shortlist tracks, unused shortlist tracks are appended
 * in shortlist order. Own suggestions are truncated so the total never exceeds
 * {@code totalCount}. Each candidate is first resolved to a (title, artist) pair, using its
 * combined search string when a side is blank; candidates without a title are dropped.
 * Matching is by exact stripped (title, artist).
 */
final class CandidateContract {

    private static final Logger LOG = LogManager.getLogger(CandidateContract.class);

    static final String BACKFILL_RATIONALE = "Selected from provided list (server fill)";

    private CandidateContract() {}

    /**
     * @return the enforced list, shortlist-sourced first; the oracle's list unchanged when
     *         the shortlist is empty
     */
    static List<OracleCandidate> enforce(List<OracleCandidate> candidates, List<CatalogTrack> provided,
                                         int providedCount, int totalCount) {
        if (provided == null || provided.isEmpty()) {
            return candidates;
        }
        Set<Pair> providedSet = new HashSet<>();
        for (CatalogTrack t : provided) {
            Pair p = new Pair(t.title(), t.artist());
            if (p.isComplete()) {
                providedSet.add(p);
            }
        }

        List<OracleCandidate> fromProvided = new ArrayList<>();
        List<OracleCandidate> novel = new ArrayList<>();
        int dropped = 0;
        for (OracleCandidate raw : candidates) {
            OracleCandidate c = resolved(raw);
            if (c == null) {
                dropped++;
                continue;
            }
            if (providedSet.contains(new Pair(c.title(), c.artist()))) {
                fromProvided.add(c);
            } else {
                novel.add(c);
            }
        }
        if (dropped > 0) {
            LOG.debug("Dropped {} recommender candidate(s) without a title", dropped);
        }

        int desired = Math.min(providedCount, providedSet.size());
        if (desired <= 0) {
            return candidates;
        }

        if (fromProvided.size() < desired) {
            Set<Pair> used = new HashSet<>();
            for (OracleCandidate c : fromProvided) {
                used.add(new Pair(c.title(), c.artist()));
            }
            for (OracleCandidate c : novel) {
                used.add(new Pair(c.title(), c.artist()));
            }
            int before = fromProvided.size();
            for (CatalogTrack t : provided) {
                if (fromProvided.size() >= desired) {
                    break;
                }
                Pair p = new Pair(t.title(), t.artist());
                if (!p.isComplete() || !used.add(p)) {
                    continue;
                }
                fromProvided.add(new OracleCandidate(t.title(), t.artist(), t.searchQuery(), BACKFILL_RATIONALE));
            }
            LOG.warn("Recommender returned {} shortlist tracks, wanted {}; backfilled {}",
                    before, desired, fromProvided.size() - before);
        }

        if (fromProvided.size() > desired) {
            fromProvided = new ArrayList<>(fromProvided.subList(0, desired));
        }
        int novelBudget = Math.max(0, totalCount - fromProvided.size());
        if (novel.size() > novelBudget) {
            LOG.warn("Recommender returned {} own suggestions, keeping {}", novel.size(), novelBudget);
            novel = new ArrayList<>(novel.subList(0, novelBudget));
        }

        List<OracleCandidate> out = new ArrayList<>(fromProvided.size() + novel.size());
        out.addAll(fromProvided);
        out.addAll(novel);
        return out;
    }

    private static OracleCandidate resolved(OracleCandidate c) {
        SearchQuery q = SearchQuery.resolve(c.title(), c.artist(), c.searchQuery());
        if (!q.hasTitle()) {
            return null;
        }
        q = q.withDefaultArtist();
        String query = c.searchQuery().isEmpty() ? q.asQuery() : c.searchQuery();
        return new OracleCandidate(q.title(), q.artist(), query, c.rationale());
    }

    private record Pair(String title, String artist) {
        Pair {
            title = title == null ? "" : title.strip();
            artist = artist == null ? "" : artist.strip();
        }

        boolean isComplete() {
            return !title.isEmpty() && !artist.isEmpty();
        }
    }
}
