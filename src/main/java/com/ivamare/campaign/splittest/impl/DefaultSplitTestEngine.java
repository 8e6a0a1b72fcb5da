package com.ivamare.campaign.splittest.impl;

import com.ivamare.campaign.dispatch.BatchDispatcher;
import com.ivamare.campaign.dispatch.DispatchJob;
import com.ivamare.campaign.dispatch.DispatchPayload;
import com.ivamare.campaign.dispatch.DispatchStatus;
import com.ivamare.campaign.exception.AlreadyDecidedException;
import com.ivamare.campaign.exception.InvalidOperationException;
import com.ivamare.campaign.exception.NotReadyException;
import com.ivamare.campaign.exception.SplitTestNotFoundException;
import com.ivamare.campaign.exception.StoreGuard;
import com.ivamare.campaign.recipient.RecipientRepository;
import com.ivamare.campaign.splittest.EngagementMetric;
import com.ivamare.campaign.splittest.EngagementReporter;
import com.ivamare.campaign.splittest.SplitTest;
import com.ivamare.campaign.splittest.SplitTestEngine;
import com.ivamare.campaign.splittest.SplitTestOutcome;
import com.ivamare.campaign.splittest.SplitTestRepository;
import com.ivamare.campaign.splittest.Variant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.transaction.support.TransactionOperations;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import java.util.UUID;

/**
 * Default implementation of SplitTestEngine.
 *
 * <p>Test creation and the decision each run in one transaction, so the test row and the jobs
 * it references are written together or not at all.
 */
public class DefaultSplitTestEngine implements SplitTestEngine {

    private static final Logger log = LoggerFactory.getLogger(DefaultSplitTestEngine.class);

    private final SplitTestRepository testRepository;
    private final RecipientRepository recipientRepository;
    private final BatchDispatcher dispatcher;
    private final EngagementReporter engagementReporter;
    private final TransactionOperations transactions;
    private final Clock clock;
    private final int chunkSize;

    public DefaultSplitTestEngine(
            SplitTestRepository testRepository,
            RecipientRepository recipientRepository,
            BatchDispatcher dispatcher,
            EngagementReporter engagementReporter,
            TransactionOperations transactions,
            Clock clock,
            int chunkSize) {
        this.testRepository = testRepository;
        this.recipientRepository = recipientRepository;
        this.dispatcher = dispatcher;
        this.engagementReporter = engagementReporter;
        this.transactions = transactions;
        this.clock = clock;
        this.chunkSize = chunkSize;
    }

    @Override
    public SplitTest createTest(String name, DispatchPayload variantA, DispatchPayload variantB,
                                double sampleFraction, EngagementMetric metric) {
        return createTest(name, variantA, variantB, sampleFraction, metric, null);
    }

    @Override
    public SplitTest createTest(String name, DispatchPayload variantA, DispatchPayload variantB,
                                double sampleFraction, EngagementMetric metric, String segment) {
        if (name == null || name.isBlank()) {
            throw new InvalidOperationException("Split test name is required");
        }
        if (variantA == null || variantB == null) {
            throw new InvalidOperationException("Both variants are required");
        }
        if (metric == null) {
            throw new InvalidOperationException("Engagement metric is required");
        }
        if (!(sampleFraction > 0.0 && sampleFraction <= 1.0)) {
            throw new InvalidOperationException("Sample fraction must be in (0, 1]: " + sampleFraction);
        }

        UUID testId = UUID.randomUUID();
        List<String> eligible = new ArrayList<>(StoreGuard.call("read eligible recipients",
            () -> recipientRepository.findEligibleAddresses(segment)));
        int sampleSize = sampleSize(eligible.size(), sampleFraction);
        if (sampleSize == 0) {
            throw new InvalidOperationException("Sample fraction " + sampleFraction + " of "
                + eligible.size() + " eligible recipients leaves the samples empty");
        }

        Collections.shuffle(eligible, new Random(seedOf(testId)));
        List<String> sampleA = List.copyOf(eligible.subList(0, sampleSize));
        List<String> sampleB = List.copyOf(eligible.subList(sampleSize, 2 * sampleSize));
        List<String> remainder = List.copyOf(eligible.subList(2 * sampleSize, eligible.size()));

        SplitTest test = transactions.execute(status -> {
            UUID jobA = dispatcher.submit(label(testId, "A"), variantA, sampleA, chunkSize);
            UUID jobB = dispatcher.submit(label(testId, "B"), variantB, sampleB, chunkSize);
            SplitTest created = new SplitTest(
                testId, name, variantA, variantB, sampleFraction, metric, segment, chunkSize,
                jobA, jobB, remainder,
                SplitTestOutcome.SAMPLING, null, null, null, null,
                clock.instant(), null, null
            );
            StoreGuard.run("create split test " + testId, () -> testRepository.save(created));
            return created;
        });

        log.info("Created split test {} '{}' (samples={}x2, remainder={}, metric={})",
            testId, name, sampleSize, remainder.size(), metric);
        return test;
    }

    @Override
    public SplitTest decide(UUID testId) {
        SplitTest test = getTest(testId);
        if (test.outcome().isDecided()) {
            throw new AlreadyDecidedException(testId);
        }
        if (test.outcome() != SplitTestOutcome.SAMPLING) {
            throw new NotReadyException("Split test " + testId + " is " + test.outcome());
        }
        DispatchJob sampleA = requireFinished(testId, Variant.A, test.sampleAJobId());
        DispatchJob sampleB = requireFinished(testId, Variant.B, test.sampleBJobId());

        double scoreA = engagementReporter.metricValue(testId, Variant.A, test.metric());
        double scoreB = engagementReporter.metricValue(testId, Variant.B, test.metric());
        Variant winner = chooseWinner(sampleA, sampleB, scoreA, scoreB);
        if (sampleA.status() != DispatchStatus.COMPLETED || sampleB.status() != DispatchStatus.COMPLETED) {
            log.warn("Deciding split test {} with incomplete samples (A={}, B={})",
                testId, sampleA.status(), sampleB.status());
        }

        SplitTest decided = transactions.execute(status -> {
            UUID remainderJobId = dispatcher.submit(label(testId, "remainder"), test.payloadOf(winner),
                test.remainderRecipients(), test.chunkSize());
            Instant now = clock.instant();
            boolean marked = StoreGuard.call("record split test decision " + testId,
                () -> testRepository.markDecided(testId, winner, scoreA, scoreB, remainderJobId, now));
            if (!marked) {
                // rolls back the remainder job
                throw new AlreadyDecidedException(testId);
            }
            return getTest(testId);
        });

        log.info("Decided split test {}: winner={} ({}={} vs {}), remainder job {} for {} recipients",
            testId, winner, test.metric(), scoreA, scoreB, decided.remainderJobId(),
            test.remainderRecipients().size());
        return decided;
    }

    @Override
    public boolean reconcile(UUID testId) {
        SplitTest test = getTest(testId);
        if (test.outcome() != SplitTestOutcome.DECIDED) {
            return false;
        }
        DispatchJob remainder = dispatcher.getJob(test.remainderJobId());
        if (!remainder.isTerminal()) {
            return false;
        }
        boolean completed = StoreGuard.call("complete split test " + testId,
            () -> testRepository.markCompleted(testId, clock.instant()));
        if (completed) {
            log.info("Completed split test {} (remainder job {} ended {})",
                testId, remainder.jobId(), remainder.status());
        }
        return completed;
    }

    @Override
    public int reconcileDecided(int limit) {
        List<SplitTest> decided = StoreGuard.call("find decided split tests",
            () -> testRepository.findByOutcome(SplitTestOutcome.DECIDED, limit));
        int completed = 0;
        for (SplitTest test : decided) {
            if (reconcile(test.testId())) {
                completed++;
            }
        }
        return completed;
    }

    @Override
    public SplitTest getTest(UUID testId) {
        return StoreGuard.call("load split test " + testId, () -> testRepository.findById(testId))
            .orElseThrow(() -> new SplitTestNotFoundException(testId));
    }

    @Override
    public List<SplitTest> listTests(SplitTestOutcome outcome, int limit) {
        if (outcome == null) {
            throw new InvalidOperationException("Outcome is required");
        }
        return StoreGuard.call("list split tests", () -> testRepository.findByOutcome(outcome, limit));
    }

    private DispatchJob requireFinished(UUID testId, Variant variant, UUID jobId) {
        DispatchJob job = dispatcher.getJob(jobId);
        if (!job.isTerminal()) {
            throw new NotReadyException("Sample " + variant + " of split test " + testId
                + " is " + job.status() + " (" + job.cursor() + "/" + job.totalCount() + ")");
        }
        return job;
    }

    /**
     * A sample that ended FAILED or CANCELLED forfeits to one that COMPLETED. Otherwise the
     * strictly higher score wins and ties go to A.
     */
    static Variant chooseWinner(DispatchJob sampleA, DispatchJob sampleB, double scoreA, double scoreB) {
        boolean completedA = sampleA.status() == DispatchStatus.COMPLETED;
        boolean completedB = sampleB.status() == DispatchStatus.COMPLETED;
        if (completedA != completedB) {
            return completedA ? Variant.A : Variant.B;
        }
        return scoreB > scoreA ? Variant.B : Variant.A;
    }

    /**
     * floor(total * fraction / 2), computed on the decimal value of the fraction.
     */
    static int sampleSize(int total, double sampleFraction) {
        return BigDecimal.valueOf(total)
            .multiply(BigDecimal.valueOf(sampleFraction))
            .divide(BigDecimal.valueOf(2), 0, RoundingMode.FLOOR)
            .intValueExact();
    }

    static long seedOf(UUID testId) {
        return testId.getMostSignificantBits() ^ testId.getLeastSignificantBits();
    }

    private static String label(UUID testId, String part) {
        return "split-test:" + testId + ":" + part;
    }
}
