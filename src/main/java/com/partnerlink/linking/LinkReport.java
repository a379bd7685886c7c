package com.partnerlink.linking;

import com.partnerlink.model.ConfidenceBand;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Append-only collection of proposals with summary counts.
 */
public class LinkReport {

    private static final Logger logger = LoggerFactory.getLogger(LinkReport.class);

    private final List<LinkProposal> proposals = new ArrayList<>();

    public synchronized void add(LinkProposal proposal) {
        proposals.add(Objects.requireNonNull(proposal, "proposal"));
    }

    public synchronized List<LinkProposal> proposals() {
        return List.copyOf(proposals);
    }

    public synchronized int size() {
        return proposals.size();
    }

    public synchronized Map<LinkAction, Integer> countsByAction() {
        Map<LinkAction, Integer> counts = new EnumMap<>(LinkAction.class);
        for (LinkProposal proposal : proposals) {
            counts.merge(proposal.action(), 1, Integer::sum);
        }
        return counts;
    }

    public synchronized Map<ConfidenceBand, Integer> countsByConfidence() {
        Map<ConfidenceBand, Integer> counts = new EnumMap<>(ConfidenceBand.class);
        for (LinkProposal proposal : proposals) {
            counts.merge(proposal.confidenceBand(), 1, Integer::sum);
        }
        return counts;
    }

    /**
     * Proposals that are links but still need a person to confirm them.
     */
    public synchronized List<LinkProposal> pendingConfirmation() {
        return proposals.stream().filter(LinkProposal::requiresConfirmation).toList();
    }

    public void logSummary() {
        if (size() == 0) {
            logger.info("No link proposals");
            return;
        }
        logger.info("Link proposals: {} total, by action {}, by confidence {}, {} awaiting confirmation",
                size(), countsByAction(), countsByConfidence(), pendingConfirmation().size());
    }
}
