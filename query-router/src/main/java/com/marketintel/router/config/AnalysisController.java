package com.marketintel.router.config;

import com.marketintel.router.data.CacheStatus;
import com.marketintel.router.data.DatasetCache;
import com.marketintel.router.exception.AnalysisPipelineException;
import com.marketintel.router.model.AnalysisRequest;
import com.marketintel.router.model.AnalysisResult;
import com.marketintel.router.model.RouteDecision;
import com.marketintel.router.routing.EndpointRouter;
import com.marketintel.router.routing.FieldKeywordIndex;
import com.marketintel.router.routing.FieldMatch;
import com.marketintel.router.service.AnalysisPipelineService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@Slf4j
@RequiredArgsConstructor
public class AnalysisController {

    private final AnalysisPipelineService pipelineService;
    private final EndpointRouter router;
    private final FieldKeywordIndex fieldIndex;
    private final DatasetCache datasetCache;

    // ── Analysis ──────────────────────────────────────────────────────────────

    /**
     * Run a question through routing, loading and standardisation.
     *
     * POST /analysis  {"query": "top areas for nike", "endpoint": null, "areaIds": ["10001"]}
     */
    @PostMapping("/analysis")
    public ResponseEntity<?> analyze(@RequestBody AnalysisRequest request) {
        try {
            AnalysisResult result = pipelineService.analyze(request);
            return ResponseEntity.ok(result);
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        } catch (AnalysisPipelineException e) {
            log.warn("Analysis failed ({}) for {}: {}", e.getKind(), e.getEndpoint(), e.getMessage());
            return ResponseEntity.status(statusFor(e.getKind())).body(errorBody(e));
        } catch (Exception e) {
            log.error("Analysis failed for query '{}': {}", request.query(), e.getMessage(), e);
            return ResponseEntity.internalServerError().body(Map.of("error", String.valueOf(e.getMessage())));
        }
    }

    /**
     * Routing decision only, without loading data.
     *
     * GET /analysis/route?query=compare+brooklyn+and+philadelphia
     */
    @GetMapping("/analysis/route")
    public ResponseEntity<?> route(@RequestParam String query,
                                   @RequestParam(required = false) String endpoint) {
        if (query.isBlank()) {
            return ResponseEntity.badRequest().body(Map.of("error", "query must not be blank"));
        }
        RouteDecision decision = router.route(query, endpoint);
        return ResponseEntity.ok(decision);
    }

    /**
     * Dataset fields the query refers to.
     *
     * GET /analysis/fields?query=median+income+and+nike+share
     */
    @GetMapping("/analysis/fields")
    public ResponseEntity<List<FieldMatch>> fields(@RequestParam String query) {
        return ResponseEntity.ok(fieldIndex.lookup(query));
    }

    // ── Cache ─────────────────────────────────────────────────────────────────

    @GetMapping("/analysis/cache/status")
    public ResponseEntity<CacheStatus> cacheStatus() {
        return ResponseEntity.ok(datasetCache.status());
    }

    @PostMapping("/analysis/cache/clear")
    public ResponseEntity<Map<String, String>> clearCache() {
        datasetCache.clear();
        return ResponseEntity.ok(Map.of("status", "cleared"));
    }

    // ── Internal ──────────────────────────────────────────────────────────────

    static HttpStatus statusFor(AnalysisPipelineException.ErrorKind kind) {
        switch (kind) {
            case DATASET_UNAVAILABLE:
                return HttpStatus.NOT_FOUND;
            case SCHEMA_VALIDATION_FAILED:
                return HttpStatus.UNPROCESSABLE_ENTITY;
            default:
                return HttpStatus.INTERNAL_SERVER_ERROR;
        }
    }

    private static Map<String, Object> errorBody(AnalysisPipelineException e) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", e.getMessage());
        body.put("kind", e.getKind().name());
        body.put("endpoint", e.getEndpoint());
        return body;
    }
}
