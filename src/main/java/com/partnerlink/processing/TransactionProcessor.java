package com.partnerlink.processing;

import com.partnerlink.linking.LinkDecisionEngine;
import com.partnerlink.linking.LinkProposal;
import com.partnerlink.linking.LinkReport;
import com.partnerlink.matching.CandidateRanker;
import com.partnerlink.model.MatchCandidate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Runs statement lines through resolution, ranking and decision, collecting proposals in a {@link LinkReport}.
 *
 * <p>The resolver is called once per transaction. A resolver failure is logged and the
 * transaction is treated as unresolved, so the rest of the batch still runs.
 */
public class TransactionProcessor {

    private static final Logger logger = LoggerFactory.getLogger(TransactionProcessor.class);

    private final ParentCompanyResolver resolver;
    private final CandidateRanker ranker;
    private final LinkDecisionEngine decisionEngine;
    private final LinkReport report;
    private final int maxTransactions;

    public TransactionProcessor(ParentCompanyResolver resolver, CandidateRanker ranker, LinkDecisionEngine decisionEngine) {
        this(resolver, ranker, decisionEngine, new LinkReport(), 0);
    }

    /**
     * @param maxTransactions upper bound on transactions handled per batch, 0 for no limit
     */
    public TransactionProcessor(ParentCompanyResolver resolver, CandidateRanker ranker, LinkDecisionEngine decisionEngine,
                                LinkReport report, int maxTransactions) {
        this.resolver = Objects.requireNonNull(resolver, "resolver");
        this.ranker = Objects.requireNonNull(ranker, "ranker");
        this.decisionEngine = Objects.requireNonNull(decisionEngine, "decisionEngine");
        this.report = Objects.requireNonNull(report, "report");
        if (maxTransactions < 0) {
            throw new IllegalArgumentException("maxTransactions must not be negative: " + maxTransactions);
        }
        this.maxTransactions = maxTransactions;
    }

    public ProcessResult processTransaction(TransactionInput transaction) {
        String name = transaction.name();
        ParentCompanyResult resolution = resolveSafely(name);

        List<MatchCandidate> candidates = resolution.isResolved()
                ? ranker.rank(resolution.parentCompany().get(), Optional.empty())
                : List.of();

        LinkProposal proposal = decisionEngine.decide(name, resolution.parentCompany(), Optional.empty(), candidates);
        report.add(proposal);
        return new ProcessResult(transaction, resolution, proposal);
    }

    public List<ProcessResult> processBatch(List<TransactionInput> transactions) {
        List<TransactionInput> selected = transactions;
        if (maxTransactions > 0 && transactions.size() > maxTransactions) {
            logger.info("Limiting batch to {} of {} transactions", maxTransactions, transactions.size());
            selected = transactions.subList(0, maxTransactions);
        }

        List<ProcessResult> results = new ArrayList<>(selected.size());
        int position = 0;
        for (TransactionInput transaction : selected) {
            position++;
            ProcessResult result = processTransaction(transaction);
            logger.debug("[{}/{}] {} -> {} ({})", position, selected.size(), transaction.name(),
                    result.action(), result.proposal().rationale());
            results.add(result);
        }

        report.logSummary();
        return results;
    }

    public LinkReport getReport() {
        return report;
    }

    private ParentCompanyResult resolveSafely(String name) {
        try {
            ParentCompanyResult result = resolver.resolve(name);
            if (result == null) {
                return ParentCompanyResult.unresolved(name, "resolver returned no result");
            }
            return result;
        } catch (RuntimeException e) {
            logger.warn("Parent company resolution failed for '{}'", name, e);
            return ParentCompanyResult.unresolved(name, "resolution error: " + e.getMessage());
        }
    }
}
