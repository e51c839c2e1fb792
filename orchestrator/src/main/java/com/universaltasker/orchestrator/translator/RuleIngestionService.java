package com.universaltasker.orchestrator.translator;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.universaltasker.orchestrator.model.StepOutcome;
import com.universaltasker.orchestrator.repository.StepRecordRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Grows the translator's rule file from the audit trail.
 *
 * Every distinct thought that led to a real instruction becomes a rule whose
 * single pattern is the start of that thought. Later sessions that phrase a
 * step the same way are then translated without an engine round trip.
 */
@Service
public class RuleIngestionService {

    private static final Logger log = LoggerFactory.getLogger(RuleIngestionService.class);

    static final int PATTERN_LENGTH = 80;

    public record IngestionReport(int candidates, int added, int total) {}

    private final StepRecordRepository stepRepo;
    private final RuleLoader           ruleLoader;

    public RuleIngestionService(StepRecordRepository stepRepo, RuleLoader ruleLoader) {
        this.stepRepo   = stepRepo;
        this.ruleLoader = ruleLoader;
    }

    /** Executed-instruction groups, most frequent first. */
    @Transactional(readOnly = true)
    public List<RuleCandidate> candidates() {
        return stepRepo.groupExecutedInstructions().stream()
                .map(row -> new RuleCandidate(
                        (String) row[0],
                        (String) row[1],
                        (StepOutcome) row[2],
                        ((Number) row[3]).longValue()))
                .toList();
    }

    /**
     * Append rules for thoughts not yet covered, de-duplicating by exact
     * pattern set against the entries already in the file. Existing entries
     * are written back as they were read, drafts and extra keys included.
     *
     * @throws RuleFileException when the file cannot be parsed or written;
     *         nothing is written in that case
     */
    @Transactional(readOnly = true)
    public IngestionReport ingest() {
        JsonNode  root  = ruleLoader.readRaw();
        ArrayNode rules = (ArrayNode) RuleLoader.ruleArray(root);

        Set<List<String>> existingKeys = new HashSet<>();
        rules.forEach(entry -> existingKeys.add(sorted(RuleLoader.patternsOf(entry))));

        List<RuleCandidate> candidates = candidates();
        Set<String> seenThoughts = new HashSet<>();
        int added = 0;
        for (RuleCandidate c : candidates) {
            if (c.thought() == null || c.instruction() == null || !seenThoughts.add(c.thought())) continue;
            String pattern = patternFor(c.thought());
            if (pattern.isEmpty() || !existingKeys.add(List.of(pattern))) continue;
            ObjectNode entry = rules.addObject();
            entry.putArray("patterns").add(pattern);
            entry.put("instruction", c.instruction().strip());
            added++;
        }
        if (added > 0) {
            ruleLoader.save(root);
        }
        log.info("Rule ingestion: {} candidate groups, {} new rules, {} entries in {}",
                candidates.size(), added, rules.size(), ruleLoader.rulesFile());
        return new IngestionReport(candidates.size(), added, rules.size());
    }

    static String patternFor(String thought) {
        String stripped = thought.strip();
        return stripped.substring(0, Math.min(PATTERN_LENGTH, stripped.length())).toLowerCase();
    }

    private static List<String> sorted(List<String> patterns) {
        return patterns.stream().sorted().toList();
    }
}
