package com.partnerlink.linking;

import com.partnerlink.model.ConfidenceBand;
import com.partnerlink.model.MatchCandidate;
import com.partnerlink.model.PartnerRecord;
import com.partnerlink.utils.Utils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Maps ranked candidates plus the resolved canonical name into one {@link LinkProposal}.
 *
 * <p>Works only on the candidates it is given and never queries the index itself.
 * Each call is independent.
 */
public class LinkDecisionEngine {

    private static final Logger logger = LoggerFactory.getLogger(LinkDecisionEngine.class);

    static final String NO_RESOLVED_NAME = "no resolved name";

    private final LinkConfig config;

    public LinkDecisionEngine() {
        this(LinkConfig.defaults());
    }

    public LinkDecisionEngine(LinkConfig config) {
        this.config = Objects.requireNonNull(config, "config");
    }

    public LinkConfig getConfig() {
        return config;
    }

    /**
     * Decides with the configuration this engine was created with.
     */
    public LinkProposal decide(String queryName,
                               Optional<String> resolvedName,
                               Optional<String> externalIdentifier,
                               List<MatchCandidate> candidates) {
        return decide(queryName, resolvedName, externalIdentifier, candidates, config);
    }

    /**
     * Decides what to do with one query.
     *
     * @param queryName          the name on the transaction
     * @param resolvedName       canonical name from name resolution; absent or blank means unresolved
     * @param externalIdentifier corporate number, if known
     * @param candidates         ranked candidates, best first (may be empty)
     * @param config             thresholds and policy for this call
     * @return a new proposal, never null
     */
    public LinkProposal decide(String queryName,
                               Optional<String> resolvedName,
                               Optional<String> externalIdentifier,
                               List<MatchCandidate> candidates,
                               LinkConfig config) {
        Objects.requireNonNull(config, "config");
        Optional<String> resolved = resolvedName == null
                ? Optional.empty()
                : resolvedName.filter(name -> !Utils.isBlank(name));
        Optional<String> identifier = externalIdentifier == null
                ? Optional.empty()
                : externalIdentifier.filter(id -> !Utils.isBlank(id));

        LinkProposal proposal;
        if (resolved.isEmpty()) {
            proposal = new LinkProposal(queryName, Optional.empty(), identifier, LinkAction.SKIP,
                    Optional.empty(), 0.0, ConfidenceBand.UNKNOWN, NO_RESOLVED_NAME);
        } else if (candidates == null || candidates.isEmpty()) {
            proposal = noMatch(queryName, resolved.get(), identifier, config);
        } else {
            proposal = fromBestCandidate(queryName, resolved.get(), identifier, candidates.get(0), config);
        }

        logger.debug("Decision for '{}': {} ({}) - {}",
                queryName, proposal.action(), proposal.confidenceBand().label(), proposal.rationale());
        return proposal;
    }

    private static LinkProposal noMatch(String queryName, String resolved, Optional<String> identifier,
                                        LinkConfig config) {
        if (config.isCreateNewIfNoMatch()) {
            ConfidenceBand band = identifier.isPresent() ? ConfidenceBand.MEDIUM : ConfidenceBand.LOW;
            return new LinkProposal(queryName, Optional.of(resolved), identifier, LinkAction.CREATE,
                    Optional.empty(), 0.0, band,
                    "no existing partner matched; create new partner: " + resolved);
        }
        return new LinkProposal(queryName, Optional.of(resolved), identifier, LinkAction.SKIP,
                Optional.empty(), 0.0, ConfidenceBand.LOW, "no existing partner matched");
    }

    private static LinkProposal fromBestCandidate(String queryName, String resolved, Optional<String> identifier,
                                                  MatchCandidate best, LinkConfig config) {
        double score = best.score();
        PartnerRecord partner = best.partner();

        if (score >= config.getAutoLinkThreshold()) {
            return new LinkProposal(queryName, Optional.of(resolved), identifier, LinkAction.LINK,
                    Optional.of(partner), score, ConfidenceBand.HIGH,
                    "matched with high similarity: " + partner.displayName() + " (score: " + formatScore(score) + ")");
        }
        if (score >= config.getSuggestThreshold()) {
            return new LinkProposal(queryName, Optional.of(resolved), identifier, LinkAction.LINK,
                    Optional.of(partner), score, ConfidenceBand.MEDIUM,
                    "candidate requires confirmation: " + partner.displayName() + " (score: " + formatScore(score) + ")");
        }

        String lowScore = "best candidate score too low (" + formatScore(score) + ")";
        if (config.isCreateNewIfNoMatch()) {
            return new LinkProposal(queryName, Optional.of(resolved), identifier, LinkAction.CREATE,
                    Optional.empty(), score, ConfidenceBand.LOW, lowScore + "; create new partner: " + resolved);
        }
        return new LinkProposal(queryName, Optional.of(resolved), identifier, LinkAction.SKIP,
                Optional.empty(), score, ConfidenceBand.LOW, lowScore);
    }

    static String formatScore(double score) {
        return String.format(Locale.ROOT, "%.2f", score);
    }
}
