package org.netpreserve.crawlguard.selector;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import org.jetbrains.annotations.Nullable;
import org.netpreserve.crawlguard.store.KeyValueStore;
import org.netpreserve.crawlguard.util.Json;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Registry of the selectors that locate elements on each site, keyed by domain and purpose (such as
 * "checkout"), with cross-site patterns to fall back on for sites never seen before.
 * <p>
 * Entries are handed out and accepted as copies, so a caller can't change the library's state except through its
 * methods. With a store attached every change is written through: each domain's selectors under
 * {@code site.<domain>}, the global patterns under {@code global-patterns} and the archive under {@code archive}.
 * Unreadable documents are skipped with a warning and failed writes are logged, leaving the in-memory state
 * authoritative.
 */
public class SelectorLibrary implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(SelectorLibrary.class);
    static final String SITE_PREFIX = "site.";
    static final String GLOBAL_PATTERNS_KEY = "global-patterns";
    static final String ARCHIVE_KEY = "archive";
    static final double ALTERNATIVE_CONFIDENCE_FACTOR = 0.8;
    static final double GLOBAL_PATTERN_CONFIDENCE = 0.3;

    private static final TypeReference<Map<String, SelectorEntry>> SITE_TYPE = new TypeReference<>() {
    };
    private static final TypeReference<Map<String, List<String>>> PATTERNS_TYPE = new TypeReference<>() {
    };
    private static final TypeReference<Map<String, Map<String, ArchivedSelector>>> ARCHIVE_TYPE =
            new TypeReference<>() {
            };

    private final Map<String, Map<String, SelectorEntry>> selectors = new TreeMap<>();
    private final Map<String, List<String>> globalPatterns = new TreeMap<>();
    private final Map<String, Map<String, ArchivedSelector>> archive = new TreeMap<>();
    private final CandidateGenerator candidateGenerator = new CandidateGenerator();
    private final Clock clock;
    private @Nullable KeyValueStore store;

    /**
     * Creates a library that lives in memory only.
     */
    public SelectorLibrary() {
        this(null, Clock.systemUTC());
    }

    public SelectorLibrary(@Nullable KeyValueStore store) {
        this(store, Clock.systemUTC());
    }

    public SelectorLibrary(@Nullable KeyValueStore store, Clock clock) {
        this.store = store;
        this.clock = clock;
        load();
    }

    private void load() {
        if (store == null) return;
        List<String> keys;
        try {
            keys = store.list();
        } catch (IOException e) {
            log.error("Unable to read selector store, continuing in memory only", e);
            store = null;
            return;
        }
        Instant now = clock.instant();
        for (String key : keys) {
            try {
                String document = store.get(key);
                if (document == null) continue;
                if (key.startsWith(SITE_PREFIX)) {
                    Map<String, SelectorEntry> stored = Json.mapper().readValue(document, SITE_TYPE);
                    if (stored == null) {
                        log.warn("Ignoring empty selector document {}", key);
                        continue;
                    }
                    Map<String, SelectorEntry> site = new TreeMap<>();
                    stored.forEach((purpose, entry) -> {
                        if (entry != null && entry.selector() != null) site.put(purpose, entry.normalize(now));
                    });
                    if (!site.isEmpty()) selectors.put(key.substring(SITE_PREFIX.length()), site);
                } else if (key.equals(GLOBAL_PATTERNS_KEY)) {
                    Map<String, List<String>> stored = Json.mapper().readValue(document, PATTERNS_TYPE);
                    if (stored == null) {
                        log.warn("Ignoring empty selector document {}", key);
                        continue;
                    }
                    stored.forEach((purpose, patterns) -> {
                        if (patterns == null) return;
                        List<String> kept = new ArrayList<>();
                        patterns.forEach(pattern -> {
                            if (pattern != null && !kept.contains(pattern)) kept.add(pattern);
                        });
                        if (!kept.isEmpty()) globalPatterns.put(purpose, kept);
                    });
                } else if (key.equals(ARCHIVE_KEY)) {
                    Map<String, Map<String, ArchivedSelector>> stored = Json.mapper().readValue(document, ARCHIVE_TYPE);
                    if (stored == null) {
                        log.warn("Ignoring empty selector document {}", key);
                        continue;
                    }
                    stored.forEach((domain, purposes) -> {
                        if (purposes == null) return;
                        Map<String, ArchivedSelector> site = new TreeMap<>();
                        purposes.forEach((purpose, archived) -> {
                            if (archived != null && archived.entry().selector() != null) site.put(purpose, archived);
                        });
                        if (!site.isEmpty()) archive.put(domain, site);
                    });
                } else {
                    log.warn("Ignoring unknown document {} in selector store", key);
                }
            } catch (IOException | RuntimeException e) {
                log.warn("Skipping unreadable selector document {}", key, e);
            }
        }
        log.atDebug().addKeyValue("sites", selectors.size())
                .addKeyValue("globalPatterns", globalPatterns.size())
                .addKeyValue("archivedSites", archive.size())
                .log("Loaded selector library");
    }

    /**
     * @return a copy of the stored entry, or null if nothing is stored for the pair
     */
    public synchronized @Nullable SelectorEntry getSelector(String domain, String purpose) {
        SelectorEntry entry = lookup(domain, purpose);
        return entry == null ? null : entry.copy();
    }

    /**
     * Returns the selectors to try for a purpose, best first.
     * <p>
     * If the domain has a stored entry the list starts with it, followed by its alternatives at a reduced
     * confidence. Otherwise the purpose's global patterns are returned at a low fixed confidence, so that a site
     * seen for the first time still gets something to try. The list is empty if neither exists.
     */
    public synchronized List<SelectorEntry> getSelectorWithFallbacks(String domain, String purpose) {
        Instant now = clock.instant();
        List<SelectorEntry> result = new ArrayList<>();
        SelectorEntry primary = lookup(domain, purpose);
        if (primary != null) {
            result.add(primary.copy());
            double alternativeConfidence = primary.confidence() * ALTERNATIVE_CONFIDENCE_FACTOR;
            for (String alternative : primary.alternatives()) {
                result.add(new SelectorEntry(alternative, SelectorType.of(alternative), alternativeConfidence,
                        List.of(), now));
            }
        } else {
            Set<String> seen = new HashSet<>();
            for (String pattern : globalPatterns.getOrDefault(purpose, List.of())) {
                if (!seen.add(pattern)) continue;
                result.add(new SelectorEntry(pattern, SelectorType.of(pattern), GLOBAL_PATTERN_CONFIDENCE,
                        List.of(), now));
            }
        }
        // stable, so the primary stays ahead of alternatives with equal confidence
        result.sort(Comparator.comparingDouble(SelectorEntry::confidence).reversed());
        return result;
    }

    /**
     * Stores a copy of the entry, replacing any previous one for the pair.
     */
    public synchronized void storeSelector(String domain, String purpose, SelectorEntry entry) {
        selectors.computeIfAbsent(domain, k -> new TreeMap<>()).put(purpose, entry.copy());
        saveSite(domain);
    }

    /**
     * @return true if an entry was stored for the pair
     */
    public synchronized boolean removeSelector(String domain, String purpose) {
        Map<String, SelectorEntry> site = selectors.get(domain);
        if (site == null || site.remove(purpose) == null) return false;
        if (site.isEmpty()) selectors.remove(domain);
        saveSite(domain);
        return true;
    }

    /**
     * Reports that the stored selector worked. Does nothing for an unknown pair.
     */
    public synchronized void recordSuccess(String domain, String purpose) {
        SelectorEntry entry = lookup(domain, purpose);
        if (entry == null) return;
        entry.recordSuccess(clock.instant());
        saveSite(domain);
    }

    /**
     * Reports that the stored selector failed to locate its element. Does nothing for an unknown pair.
     */
    public synchronized void recordFailure(String domain, String purpose) {
        SelectorEntry entry = lookup(domain, purpose);
        if (entry == null) return;
        entry.recordFailure(clock.instant());
        log.atDebug().addKeyValue("domain", domain)
                .addKeyValue("purpose", purpose)
                .addKeyValue("confidence", entry.confidence())
                .log("Selector failed");
        saveSite(domain);
    }

    /**
     * Reports the result of a fallback selector tried for the stored entry. Does nothing for an unknown pair.
     */
    public synchronized void recordAlternativeResult(String domain, String purpose, String alternative,
                                                     boolean success) {
        SelectorEntry entry = lookup(domain, purpose);
        if (entry == null) return;
        entry.recordAlternativeResult(alternative, success, clock.instant());
        saveSite(domain);
    }

    /**
     * Appends a cross-site pattern for the purpose unless it is already known.
     *
     * @return true if added
     */
    public synchronized boolean addGlobalPattern(String purpose, String pattern) {
        List<String> patterns = globalPatterns.computeIfAbsent(purpose, k -> new ArrayList<>());
        if (patterns.contains(pattern)) return false;
        patterns.add(pattern);
        save(GLOBAL_PATTERNS_KEY, globalPatterns);
        return true;
    }

    public synchronized List<String> globalPatterns(String purpose) {
        return List.copyOf(globalPatterns.getOrDefault(purpose, List.of()));
    }

    /**
     * Proposes selectors for the first element of an HTML fragment, most stable first.
     */
    public List<SelectorCandidate> generateCandidates(String html, String purpose) {
        return candidateGenerator.generate(html, purpose);
    }

    public synchronized LibraryStats stats() {
        int total = 0;
        double confidenceSum = 0;
        for (Map<String, SelectorEntry> site : selectors.values()) {
            for (SelectorEntry entry : site.values()) {
                total++;
                confidenceSum += entry.confidence();
            }
        }
        int patternCount = globalPatterns.values().stream().mapToInt(List::size).sum();
        int archivedCount = archive.values().stream().mapToInt(Map::size).sum();
        return new LibraryStats(selectors.size(), total, total == 0 ? 0.0 : confidenceSum / total, patternCount,
                archivedCount, archive.size());
    }

    /**
     * Takes expired selectors out of the library.
     *
     * @param archive keep them in the archive for {@link #restoreFromArchive(String, String)} instead of deleting
     */
    public synchronized CleanupResult cleanupExpired(boolean archive) {
        Instant now = clock.instant();
        int expired = 0;
        int stale = 0;
        List<CleanupResult.Removed> archived = new ArrayList<>();
        Set<String> affected = new HashSet<>();
        for (var siteIterator = selectors.entrySet().iterator(); siteIterator.hasNext(); ) {
            var site = siteIterator.next();
            String domain = site.getKey();
            for (var iterator = site.getValue().entrySet().iterator(); iterator.hasNext(); ) {
                var purposeEntry = iterator.next();
                SelectorEntry entry = purposeEntry.getValue();
                if (entry.isExpired(now)) {
                    if (archive) {
                        this.archive.computeIfAbsent(domain, k -> new TreeMap<>()).put(purposeEntry.getKey(),
                                new ArchivedSelector(entry, now, ArchivedSelector.REASON_EXPIRED));
                        archived.add(new CleanupResult.Removed(domain, purposeEntry.getKey(), entry.selector()));
                    }
                    iterator.remove();
                    expired++;
                    affected.add(domain);
                } else if (entry.isStale(now)) {
                    stale++;
                }
            }
            if (site.getValue().isEmpty()) siteIterator.remove();
        }
        if (expired > 0) {
            affected.forEach(this::saveSite);
            if (archive) save(ARCHIVE_KEY, this.archive);
            log.atInfo().addKeyValue("expired", expired)
                    .addKeyValue("archived", archived.size())
                    .addKeyValue("sites", affected.size())
                    .log("Removed expired selectors");
        }
        return new CleanupResult(expired, archived.size(), stale, affected.size(), archived);
    }

    /**
     * Puts an archived selector back into use, replacing any entry stored for the pair since.
     *
     * @return false if the pair is not in the archive
     */
    public synchronized boolean restoreFromArchive(String domain, String purpose) {
        Map<String, ArchivedSelector> site = archive.get(domain);
        if (site == null) return false;
        ArchivedSelector archived = site.remove(purpose);
        if (archived == null) return false;
        if (site.isEmpty()) archive.remove(domain);
        selectors.computeIfAbsent(domain, k -> new TreeMap<>()).put(purpose, archived.entry());
        saveSite(domain);
        save(ARCHIVE_KEY, archive);
        return true;
    }

    /**
     * @return archived selectors by purpose for one domain
     */
    public synchronized Map<String, ArchivedSelector> archived(String domain) {
        return Map.copyOf(archive.getOrDefault(domain, Map.of()));
    }

    /**
     * @return all archived selectors by domain and purpose
     */
    public synchronized Map<String, Map<String, ArchivedSelector>> archived() {
        Map<String, Map<String, ArchivedSelector>> copy = new LinkedHashMap<>();
        archive.forEach((domain, purposes) -> copy.put(domain, Map.copyOf(purposes)));
        return copy;
    }

    /**
     * Permanently drops the archived selectors of one domain, or of all domains if {@code domain} is null.
     *
     * @return the number dropped
     */
    public synchronized int clearArchive(@Nullable String domain) {
        int count;
        if (domain != null) {
            Map<String, ArchivedSelector> removed = archive.remove(domain);
            count = removed == null ? 0 : removed.size();
        } else {
            count = archive.values().stream().mapToInt(Map::size).sum();
            archive.clear();
        }
        if (count > 0) save(ARCHIVE_KEY, archive);
        return count;
    }

    /**
     * Promotes every alternative that has clearly outperformed its primary.
     *
     * @see SelectorEntry#promotionCandidate()
     */
    public synchronized List<Promotion> autoPromoteAlternatives() {
        Instant now = clock.instant();
        List<Promotion> promotions = new ArrayList<>();
        Set<String> changed = new HashSet<>();
        selectors.forEach((domain, purposes) -> purposes.forEach((purpose, entry) -> {
            String candidate = entry.promotionCandidate();
            if (candidate == null) return;
            SelectorComparison comparison = entry.compareWithAlternative(candidate);
            String oldSelector = entry.selector();
            if (comparison == null || !entry.promoteAlternative(candidate, false, now)) return;
            promotions.add(new Promotion(domain, purpose, oldSelector, candidate, entry.confidence(), comparison));
            changed.add(domain);
            log.atInfo().addKeyValue("domain", domain)
                    .addKeyValue("purpose", purpose)
                    .addKeyValue("from", oldSelector)
                    .addKeyValue("to", candidate)
                    .log("Promoted alternative selector");
        }));
        changed.forEach(this::saveSite);
        return promotions;
    }

    /**
     * Counts stale, expired and low-confidence selectors and lists pending promotions, without changing anything.
     */
    public synchronized LifecycleReport lifecycleReport() {
        Instant now = clock.instant();
        int total = 0;
        int stale = 0;
        int expired = 0;
        int lowConfidence = 0;
        List<LifecycleReport.Candidate> candidates = new ArrayList<>();
        for (var site : selectors.entrySet()) {
            for (var purposeEntry : site.getValue().entrySet()) {
                SelectorEntry entry = purposeEntry.getValue();
                total++;
                if (entry.isExpired(now)) {
                    expired++;
                } else if (entry.isStale(now)) {
                    stale++;
                }
                if (entry.confidence() < LifecycleReport.LOW_CONFIDENCE) lowConfidence++;
                String candidate = entry.promotionCandidate();
                if (candidate != null) {
                    Double rate = entry.alternativeSuccessRate(candidate);
                    candidates.add(new LifecycleReport.Candidate(site.getKey(), purposeEntry.getKey(),
                            entry.selector(), candidate, rate == null ? 0.0 : rate));
                }
            }
        }
        return new LifecycleReport(total, stale, expired, lowConfidence, candidates,
                LifecycleReport.recommend(total, stale, expired, lowConfidence, candidates.size()));
    }

    private @Nullable SelectorEntry lookup(String domain, String purpose) {
        Map<String, SelectorEntry> site = selectors.get(domain);
        return site == null ? null : site.get(purpose);
    }

    private void saveSite(String domain) {
        if (store == null) return;
        Map<String, SelectorEntry> site = selectors.get(domain);
        if (site == null || site.isEmpty()) {
            try {
                store.delete(SITE_PREFIX + domain);
            } catch (IOException e) {
                log.warn("Failed to delete selectors of {} from store", domain, e);
            }
        } else {
            save(SITE_PREFIX + domain, site);
        }
    }

    private void save(String key, Object value) {
        if (store == null) return;
        String document;
        try {
            document = Json.mapper().writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
        try {
            store.put(key, document);
        } catch (IOException e) {
            log.warn("Failed to write {} to selector store", key, e);
        }
    }

    @Override
    public synchronized void close() {
        if (store == null) return;
        try {
            store.close();
        } catch (IOException e) {
            log.warn("Failed to close selector store", e);
        }
        store = null;
    }
}
