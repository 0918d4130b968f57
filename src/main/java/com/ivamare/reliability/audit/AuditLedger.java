package com.ivamare.reliability.audit;

import com.ivamare.reliability.audit.compliance.AmlCheck;
import com.ivamare.reliability.audit.compliance.ComplianceCheck;
import com.ivamare.reliability.audit.compliance.ComplianceCheckResult;
import com.ivamare.reliability.audit.compliance.ComplianceReport;
import com.ivamare.reliability.audit.compliance.ComplianceReportGenerator;
import com.ivamare.reliability.audit.compliance.ComplianceRule;
import com.ivamare.reliability.audit.compliance.ComplianceRuleCatalog;
import com.ivamare.reliability.audit.compliance.KycCheck;
import com.ivamare.reliability.audit.compliance.SuspiciousActivityCheck;
import com.ivamare.reliability.audit.compliance.TransactionLimitCheck;
import com.ivamare.reliability.exception.AuditWriteException;
import com.ivamare.reliability.exception.StoreFailureClassifier;
import com.ivamare.reliability.metrics.MetricCategory;
import com.ivamare.reliability.metrics.MetricSink;
import com.ivamare.reliability.model.AuditOutcome;
import com.ivamare.reliability.model.Severity;
import com.ivamare.reliability.repository.AuditEntryRepository;
import com.ivamare.reliability.support.BoundedHistory;
import com.ivamare.reliability.support.CanonicalJson;
import com.ivamare.reliability.support.Hashing;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Append-only, hash-chained audit ledger.
 *
 * <p>Entries belong to logical chains. Appends to one chain are serialised by
 * that chain's lock; the durable write happens before the chain head moves, so a
 * failed write leaves the chain as it was and surfaces as
 * {@link AuditWriteException}. Each chain keeps its newest entries in a bounded
 * ring; older entries stay queryable through {@link #verifyStoredChain}.
 *
 * <p>Verification never throws for integrity problems. They are reported in the
 * returned {@link ChainVerification}.
 */
public class AuditLedger {

    private static final Logger log = LoggerFactory.getLogger(AuditLedger.class);

    public static final String FINANCIAL_EVENT = "FINANCIAL_EVENT";
    public static final String COMPLIANCE_VIOLATION = "COMPLIANCE_VIOLATION";

    private final AuditEntryRepository repository;
    private final MetricSink metricSink;
    private final Clock clock;
    private final EntrySigner signer;
    private final AuditEntryHasher hasher;
    private final AuditLedgerSettings settings;
    private final ComplianceRuleCatalog ruleCatalog;
    private final ComplianceReportGenerator reportGenerator;
    private final List<ComplianceCheck> complianceChecks;

    private final Map<String, Chain> chains = new ConcurrentHashMap<>();
    private volatile ChainVerification lastVerification;

    public AuditLedger(AuditEntryRepository repository, MetricSink metricSink, Clock clock) {
        this(repository, metricSink, clock, new DigestEntrySigner(), AuditLedgerSettings.defaults());
    }

    public AuditLedger(
            AuditEntryRepository repository,
            MetricSink metricSink,
            Clock clock,
            EntrySigner signer,
            AuditLedgerSettings settings) {
        this.repository = repository;
        this.metricSink = metricSink;
        this.clock = clock;
        this.signer = signer;
        this.settings = settings;
        CanonicalJson json = new CanonicalJson();
        this.hasher = new AuditEntryHasher(json);
        this.ruleCatalog = ComplianceRuleCatalog.defaults(settings.highValueThreshold());
        this.reportGenerator = new ComplianceReportGenerator(
            ruleCatalog, signer, json, settings.highValueThreshold(), clock);
        this.complianceChecks = List.of(
            new AmlCheck(settings.highValueThreshold()),
            new KycCheck(),
            new TransactionLimitCheck(settings.defaultDailyLimit(), settings.defaultMonthlyLimit()),
            new SuspiciousActivityCheck());
    }

    // --- Append ---

    /**
     * Append an entry to its chain.
     *
     * @param record caller-supplied content
     * @return the new entry's id
     * @throws AuditWriteException if the entry could not be made durable
     */
    public String append(AuditRecord record) {
        return appendEntry(record).id();
    }

    /**
     * Append an entry to its chain and return it.
     *
     * @throws AuditWriteException if the entry could not be made durable
     */
    public AuditEntry appendEntry(AuditRecord record) {
        String chainId = record.chainId();
        Chain chain = chains.computeIfAbsent(chainId, id -> new Chain(settings.ringCapacity()));

        chain.lock.lock();
        try {
            loadHead(chainId, chain);

            AuditEntry unsigned = new AuditEntry(
                "audit_" + UUID.randomUUID(),
                chainId,
                clock.instant().truncatedTo(ChronoUnit.MILLIS),
                record.eventType(),
                record.entityId(),
                record.entityType(),
                record.actor(),
                record.action(),
                record.resource(),
                record.outcome(),
                hasher.normalizeDetails(record.details()),
                null,
                chain.headHash,
                null);
            String chainHash = hasher.chainHash(unsigned);
            AuditEntry entry = new AuditEntry(
                unsigned.id(), chainId, unsigned.timestamp(), unsigned.eventType(),
                unsigned.entityId(), unsigned.entityType(), unsigned.actor(), unsigned.action(),
                unsigned.resource(), unsigned.outcome(), unsigned.details(),
                signer.sign(chainHash), chain.headHash, chainHash);

            try {
                repository.save(entry);
            } catch (DataAccessException e) {
                boolean transientFailure = StoreFailureClassifier.isTransient(e);
                log.error("Failed to persist audit entry {} on chain {} (transient={})",
                    entry.id(), chainId, transientFailure, e);
                throw new AuditWriteException(chainId, transientFailure, e);
            }

            chain.history.add(entry);
            chain.headHash = chainHash;
            log.debug("Appended audit entry {} ({}) to chain {}", entry.id(), entry.eventType(), chainId);
            return entry;
        } finally {
            chain.lock.unlock();
        }
    }

    private void loadHead(String chainId, Chain chain) {
        if (chain.headLoaded) {
            return;
        }
        try {
            repository.findLatest(chainId).ifPresent(latest -> {
                chain.headHash = latest.chainHash();
                log.info("Resumed audit chain {} from stored entry {}", chainId, latest.id());
            });
        } catch (DataAccessException e) {
            boolean transientFailure = StoreFailureClassifier.isTransient(e);
            log.error("Failed to load head of audit chain {}", chainId, e);
            throw new AuditWriteException(chainId, transientFailure, e);
        }
        chain.headLoaded = true;
    }

    // --- Financial events ---

    /**
     * Record a financial event and run the real-time compliance checks on it.
     *
     * <p>Each failed check appends its own COMPLIANCE_VIOLATION entry. A check that
     * throws is logged and skipped; it never blocks the event entry.
     *
     * @return id of the FINANCIAL_EVENT entry
     * @throws AuditWriteException if any entry could not be made durable
     */
    public String recordFinancialEvent(FinancialEvent event) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("eventType", event.eventType().name());
        details.put("amount", event.amount());
        details.put("currency", event.currency());
        details.put("metadata", event.metadata());
        details.put("riskScore", event.riskScore());
        details.put("complianceFlags", event.complianceFlags());
        details.put("eventTimestamp", event.timestamp().toString());

        String auditId = append(AuditRecord.builder(FINANCIAL_EVENT, event.entityId())
            .entityType("TRANSACTION")
            .actor(event.userId() != null ? event.userId() : "SYSTEM")
            .action(event.eventType().name())
            .resource("financial_event:" + event.eventId())
            .outcome(AuditOutcome.SUCCESS)
            .details(details)
            .build());

        for (ComplianceCheck check : complianceChecks) {
            ComplianceCheckResult result;
            try {
                result = check.evaluate(event);
            } catch (RuntimeException e) {
                log.warn("Compliance check {} failed for event {}: {}", check.name(), event.eventId(), e.getMessage());
                continue;
            }
            if (!result.compliant()) {
                recordViolation(event, result, auditId);
            }
        }

        if (event.hasAmount()) {
            metricSink.recordBusinessMetric(MetricCategory.FINANCIAL, "transaction_amount",
                event.amount().doubleValue(), event.currency(),
                Map.of("eventId", event.eventId(), "eventType", event.eventType().name(),
                    "complianceFlags", event.complianceFlags()));
        }
        if (event.riskScore() != null && event.riskScore() > settings.highRiskScore()) {
            metricSink.recordBusinessMetric(MetricCategory.ERROR_RATE, "high_risk_transaction", 1, "alert",
                Map.of("eventId", event.eventId(), "riskScore", event.riskScore(),
                    "complianceFlags", event.complianceFlags()));
        }
        return auditId;
    }

    /**
     * Run the compliance checks without recording anything. Checks that throw are skipped.
     */
    public List<ComplianceCheckResult> evaluateCompliance(FinancialEvent event) {
        List<ComplianceCheckResult> results = new ArrayList<>();
        for (ComplianceCheck check : complianceChecks) {
            try {
                results.add(check.evaluate(event));
            } catch (RuntimeException e) {
                log.warn("Compliance check {} failed for event {}: {}", check.name(), event.eventId(), e.getMessage());
            }
        }
        return results;
    }

    private void recordViolation(FinancialEvent event, ComplianceCheckResult result, String auditId) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("alertId", "alert_" + UUID.randomUUID());
        details.put("eventId", event.eventId());
        details.put("check", result.check());
        details.put("violations", result.violations());
        details.put("amount", event.amount());
        details.put("currency", event.currency());
        details.put("timestamp", event.timestamp().toString());

        append(AuditRecord.builder(COMPLIANCE_VIOLATION, event.entityId())
            .entityType("TRANSACTION")
            .actor("compliance-engine")
            .action(COMPLIANCE_VIOLATION)
            .resource(auditId)
            .outcome(AuditOutcome.WARNING)
            .details(details)
            .build());

        Map<String, Object> tags = new HashMap<>();
        tags.put("eventId", event.eventId());
        tags.put("check", result.check());
        tags.put("violations", result.violations());
        if (event.amount() != null) {
            tags.put("amount", event.amount());
        }
        metricSink.recordBusinessMetric(MetricCategory.ERROR_RATE, "compliance_violation", 1, "violation", tags);
        log.warn("Compliance check {} flagged event {}: {}", result.check(), event.eventId(), result.violations());
    }

    // --- Verification ---

    /**
     * Verify the in-memory ring of one chain.
     */
    public ChainVerification verifyChain(String chainId) {
        return verifyChain(chainId, null, null);
    }

    /**
     * Verify the in-memory entries of one chain within an optional period.
     */
    public ChainVerification verifyChain(String chainId, Instant from, Instant to) {
        Chain chain = chains.get(chainId);
        if (chain == null) {
            return remember(ChainVerification.empty());
        }
        return remember(verifyEntries(chain.history.filter(e -> inRange(e, from, to))));
    }

    /**
     * Verify every chain held in memory, each chain on its own.
     */
    public ChainVerification verifyAll(Instant from, Instant to) {
        int total = 0;
        int valid = 0;
        List<String> corrupted = new ArrayList<>();
        List<ChainViolation> violations = new ArrayList<>();
        for (String chainId : new TreeSet<>(chains.keySet())) {
            List<AuditEntry> entries = chains.get(chainId).history.filter(e -> inRange(e, from, to));
            ChainVerification result = verifyEntries(entries);
            total += result.chainLength();
            valid += result.chainLength() - result.corruptedEntryIds().size();
            corrupted.addAll(result.corruptedEntryIds());
            violations.addAll(result.violations());
        }
        double score = total > 0 ? ChainVerification.round((double) valid / total) : 1.0;
        return remember(new ChainVerification(violations.isEmpty(), score, total, corrupted, violations));
    }

    /**
     * Verify a chain as held by the durable store, including entries evicted from memory.
     *
     * @throws DataAccessException if the store cannot be read
     */
    public ChainVerification verifyStoredChain(String chainId, Instant from, Instant to) {
        return remember(verifyEntries(repository.findByChain(chainId, from, to)));
    }

    /**
     * Verify a caller-supplied sequence of entries from one chain, oldest first.
     *
     * <p>For every entry the signature and chain hash are recomputed; for every
     * entry after the first, its previous hash must equal the prior entry's chain hash.
     */
    public ChainVerification verifyEntries(List<AuditEntry> entries) {
        List<String> corrupted = new ArrayList<>();
        List<ChainViolation> violations = new ArrayList<>();

        for (int i = 0; i < entries.size(); i++) {
            AuditEntry entry = entries.get(i);
            List<String> problems = new ArrayList<>();
            if (i > 0 && !Objects.equals(entries.get(i - 1).chainHash(), entry.previousHash())) {
                problems.add("previous hash does not match chain hash of " + entries.get(i - 1).id());
            }
            if (entry.chainHash() == null || !signer.verify(entry.chainHash(), entry.signature())) {
                problems.add("signature mismatch");
            }
            if (!Hashing.matches(hasher.chainHash(entry), entry.chainHash())) {
                problems.add("chain hash mismatch");
            }
            if (!problems.isEmpty()) {
                corrupted.add(entry.id());
                violations.add(new ChainViolation(entry.id(),
                    "Hash verification failed: " + String.join(", ", problems), Severity.CRITICAL));
            }
        }

        int valid = entries.size() - corrupted.size();
        if (valid != entries.size()) {
            violations.add(new ChainViolation(ChainViolation.CHAIN,
                "Audit trail length mismatch: expected " + entries.size() + ", found " + valid,
                Severity.HIGH));
            log.warn("Audit chain verification found {} corrupted entries out of {}", corrupted.size(), entries.size());
        }

        double score = entries.isEmpty() ? 1.0 : ChainVerification.round((double) valid / entries.size());
        return new ChainVerification(violations.isEmpty(), score, entries.size(), corrupted, violations);
    }

    // --- Reporting ---

    /**
     * Generate a regulatory report over the in-memory entries of a period.
     *
     * @param framework Framework name, e.g. {@code AML} or {@code PCI-DSS}
     * @throws com.ivamare.reliability.exception.UnsupportedFrameworkException if the framework is unknown
     */
    public ComplianceReport generateComplianceReport(String framework, Instant start, Instant end) {
        ComplianceRule rule = reportGenerator.resolveRule(framework);
        List<AuditEntry> entries = entriesBetween(start, end);
        ComplianceReport report = reportGenerator.generate(rule, start, end, entries);

        metricSink.recordBusinessMetric(MetricCategory.ERROR_RATE, "compliance_report_generated", 1, "report",
            Map.of("framework", rule.framework().getValue(),
                "totalEntries", entries.size(),
                "complianceScore", report.summary().complianceScore()));
        log.info("Generated {} compliance report {} over {} entries with {} findings",
            rule.framework().getValue(), report.reportId(), entries.size(), report.findings().size());
        return report;
    }

    /**
     * Summary of the in-memory trail within an optional period.
     */
    public AuditTrailSummary getAuditTrailSummary(Instant from, Instant to) {
        List<AuditEntry> entries = entriesBetween(from, to);
        ChainVerification verification = verifyAll(from, to);
        int financialEvents = (int) entries.stream()
            .filter(e -> FINANCIAL_EVENT.equals(e.eventType()))
            .count();
        int violations = (int) entries.stream()
            .filter(e -> COMPLIANCE_VIOLATION.equals(e.action()))
            .count();
        return new AuditTrailSummary(
            entries.size(),
            financialEvents,
            violations,
            verification.integrityScore() * 100.0,
            ruleCatalog.frameworks(),
            from,
            to);
    }

    // --- Queries ---

    /**
     * In-memory entries of one chain, oldest first.
     */
    public List<AuditEntry> getEntries(String chainId) {
        Chain chain = chains.get(chainId);
        return chain != null ? chain.history.snapshot() : List.of();
    }

    /**
     * In-memory entries of all chains within an optional period, oldest first.
     */
    public List<AuditEntry> entriesBetween(Instant from, Instant to) {
        List<AuditEntry> result = new ArrayList<>();
        for (Chain chain : chains.values()) {
            result.addAll(chain.history.filter(e -> inRange(e, from, to)));
        }
        result.sort(Comparator.comparing(AuditEntry::timestamp));
        return result;
    }

    public Set<String> chainIds() {
        return Set.copyOf(chains.keySet());
    }

    public ComplianceRuleCatalog getRuleCatalog() {
        return ruleCatalog;
    }

    /**
     * Result of the most recent verification, or null if none ran yet.
     */
    public ChainVerification getLastVerification() {
        return lastVerification;
    }

    private ChainVerification remember(ChainVerification verification) {
        lastVerification = verification;
        return verification;
    }

    private static boolean inRange(AuditEntry entry, Instant from, Instant to) {
        return (from == null || !entry.timestamp().isBefore(from))
            && (to == null || !entry.timestamp().isAfter(to));
    }

    private static final class Chain {
        private final ReentrantLock lock = new ReentrantLock();
        private final BoundedHistory<AuditEntry> history;
        private String headHash = "";
        private boolean headLoaded;

        private Chain(int capacity) {
            this.history = new BoundedHistory<>(capacity);
        }
    }
}
