package com.sc360.reportrefresh.config;

import com.sc360.reportrefresh.model.RefreshRun;
import com.sc360.reportrefresh.service.RefreshTriggerService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@RestController
@Slf4j
@RequiredArgsConstructor
public class RefreshController {

    private final RefreshTriggerService triggerService;
    private final ReportRefreshProperties properties;
    private final Clock clock;

    // ── Refresh triggers ──────────────────────────────────────────────────────

    @PostMapping("/refresh/trigger/{pipeline}")
    public ResponseEntity<Map<String, String>> trigger(
            @PathVariable String pipeline,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate batchDate) {
        if (properties.findPipeline(pipeline).isEmpty()) {
            return ResponseEntity.badRequest().body(Map.of("error", "Unknown pipeline: " + pipeline));
        }
        LocalDate date = batchDate != null ? batchDate : LocalDate.now(clock);
        new Thread(() -> runQuietly(pipeline, date), "manual-refresh-" + pipeline).start();
        return ResponseEntity.accepted().body(Map.of(
                "status", "accepted",
                "pipeline", pipeline,
                "batchDate", date.toString()));
    }

    // ── Audit views ───────────────────────────────────────────────────────────

    /**
     * Audit row for a pipeline and date.
     *
     * GET /refresh/status/spdst-emea?batchDate=2026-10-17
     */
    @GetMapping("/refresh/status/{pipeline}")
    public ResponseEntity<?> status(
            @PathVariable String pipeline,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate batchDate) {
        try {
            Optional<RefreshRun> run = triggerService.status(pipeline, batchDate != null ? batchDate : LocalDate.now(clock));
            return run.<ResponseEntity<?>>map(ResponseEntity::ok)
                    .orElseGet(() -> ResponseEntity.notFound().build());
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        } catch (Exception e) {
            log.error("Status query failed for {}: {}", pipeline, e.getMessage(), e);
            return ResponseEntity.internalServerError().body(Map.of("error", String.valueOf(e.getMessage())));
        }
    }

    @GetMapping("/refresh/pipelines")
    public ResponseEntity<List<ReportRefreshProperties.Pipeline>> pipelines() {
        return ResponseEntity.ok(properties.getPipelines());
    }

    private void runQuietly(String pipeline, LocalDate batchDate) {
        try {
            triggerService.trigger(pipeline, batchDate);
        } catch (Exception e) {
            log.error("Manual refresh of {} for {} failed: {}", pipeline, batchDate, e.getMessage(), e);
        }
    }
}
