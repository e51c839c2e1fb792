package com.universaltasker.orchestrator.api;

import com.universaltasker.orchestrator.translator.RuleCandidate;
import com.universaltasker.orchestrator.translator.RuleFileException;
import com.universaltasker.orchestrator.translator.RuleIngestionService;
import com.universaltasker.orchestrator.translator.RuleIngestionService.IngestionReport;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;

/**
 * Grows the translator's rule file from the audit trail.
 *
 * GET  /rules/candidates  grouped (thought, instruction, outcome) rows
 * POST /rules/ingest      append the new ones as rules
 */
@RestController
@RequestMapping("/rules")
public class RuleController {

    private final RuleIngestionService ingestion;

    public RuleController(RuleIngestionService ingestion) {
        this.ingestion = ingestion;
    }

    @GetMapping("/candidates")
    public List<RuleCandidate> candidates() {
        return ingestion.candidates();
    }

    @PostMapping("/ingest")
    public IngestionReport ingest() {
        try {
            return ingestion.ingest();
        } catch (RuleFileException e) {
            throw new ResponseStatusException(HttpStatus.INTERNAL_SERVER_ERROR, e.getMessage());
        }
    }
}
