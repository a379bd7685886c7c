package com.partnerlink.matching;

import com.partnerlink.model.MatchCandidate;
import com.partnerlink.model.MatchKind;
import com.partnerlink.model.PartnerRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Produces a bounded list of candidate partners for a query name, best first.
 *
 * <p>A corporate number hit always comes first with score 1.0. All other partners are
 * scored on their best name field; those reaching the minimum score are sorted by score,
 * ties keeping snapshot order, and the list is cut at the candidate limit.
 */
public class CandidateRanker {

    private static final Logger logger = LoggerFactory.getLogger(CandidateRanker.class);

    private final PartnerIndex index;
    private final PartnerNameSimilarity similarity;
    private final MatchConfig config;

    public CandidateRanker(PartnerIndex index) {
        this(index, new PartnerNameSimilarity(), MatchConfig.defaults());
    }

    public CandidateRanker(PartnerIndex index, MatchConfig config) {
        this(index, new PartnerNameSimilarity(), config);
    }

    public CandidateRanker(PartnerIndex index, PartnerNameSimilarity similarity, MatchConfig config) {
        this.index = Objects.requireNonNull(index, "index");
        this.similarity = Objects.requireNonNull(similarity, "similarity");
        this.config = Objects.requireNonNull(config, "config");
    }

    public MatchConfig getConfig() {
        return config;
    }

    /**
     * Ranks with the configuration this ranker was created with.
     */
    public List<MatchCandidate> rank(String queryName, Optional<String> identifier) {
        return rank(queryName, identifier, config);
    }

    /**
     * Ranks the indexed partners against a query.
     *
     * @param queryName  free-text name to match, may be blank
     * @param identifier optional corporate number; a hit is returned first with score 1.0
     * @param config     configuration for this call
     * @return candidates with non-increasing scores, at most one per partner id,
     *         never more than {@code config.getMaxCandidates()}; empty when nothing qualifies
     */
    public List<MatchCandidate> rank(String queryName, Optional<String> identifier, MatchConfig config) {
        Objects.requireNonNull(config, "config");

        List<MatchCandidate> candidates = new ArrayList<>();
        Set<String> seenIds = new HashSet<>();

        // 1. corporate number lookup takes precedence
        MatchCandidate identifierHit = identifier == null ? null : identifier
                .flatMap(index::findByIdentifier)
                .map(MatchCandidate::identifierHit)
                .orElse(null);
        if (identifierHit != null) {
            seenIds.add(identifierHit.partner().getId());
        }

        // 2. name similarity over every remaining partner
        String normalizedQuery = NameNormalizer.normalize(queryName);
        if (!normalizedQuery.isEmpty()) {
            for (PartnerRecord partner : index.partners()) {
                if (seenIds.contains(partner.getId())) {
                    continue;
                }

                MatchCandidate best = scorePartner(normalizedQuery, partner, config.getExactMatchBoost());
                if (best != null && best.score() >= config.getMinScore()) {
                    candidates.add(best);
                    seenIds.add(partner.getId());
                }
            }
        }

        // List.sort is stable: equal scores keep snapshot order
        candidates.sort(Comparator.comparingDouble(MatchCandidate::score).reversed());

        List<MatchCandidate> ranked = new ArrayList<>(Math.min(config.getMaxCandidates(), candidates.size() + 1));
        if (identifierHit != null) {
            ranked.add(identifierHit);
        }
        for (MatchCandidate candidate : candidates) {
            if (ranked.size() >= config.getMaxCandidates()) {
                break;
            }
            ranked.add(candidate);
        }

        if (logger.isDebugEnabled()) {
            logger.debug("Ranked '{}' (identifier: {}): {} candidates, best {}",
                    queryName, identifier == null ? Optional.empty() : identifier, ranked.size(),
                    ranked.isEmpty() ? "none" : ranked.get(0).partner().getId() + "@" + ranked.get(0).score());
        }
        return List.copyOf(ranked);
    }

    /**
     * The top candidate, if any.
     */
    public Optional<MatchCandidate> findBestMatch(String queryName, Optional<String> identifier) {
        List<MatchCandidate> candidates = rank(queryName, identifier);
        return candidates.isEmpty() ? Optional.empty() : Optional.of(candidates.get(0));
    }

    public Optional<PartnerRecord> matchByIdentifier(String identifier) {
        return index.findByIdentifier(identifier);
    }

    /**
     * Scores every name field of a partner in priority order; only a strictly better
     * score replaces the current best, so earlier fields win ties.
     */
    private MatchCandidate scorePartner(String normalizedQuery, PartnerRecord partner, double exactMatchBoost) {
        double bestScore = -1.0;
        String bestField = null;

        for (PartnerIndex.NormalizedField field : index.normalizedFields(partner)) {
            if (field.normalized().isEmpty()) {
                continue;
            }
            double score = similarity.normalizedFieldScore(normalizedQuery, field.normalized(), exactMatchBoost);
            if (score > bestScore) {
                bestScore = score;
                bestField = field.field();
            }
        }

        if (bestField == null) {
            return null;
        }
        return new MatchCandidate(partner, bestScore, MatchKind.fromNameScore(bestScore), bestField);
    }
}
