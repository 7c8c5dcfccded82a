package com.rkflow.caseengine.api;

import com.rkflow.caseengine.api.dto.*;
import com.rkflow.caseengine.service.CaseService;
import com.rkflow.caseengine.status.StatusCatalog;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * REST API for case status changes.
 *
 * POST /cases/status-check                         dry-run a status change
 * POST /cases/{id}/status                          apply a status change
 * POST /cases/invalidate                           close a batch of cases of one supply/demand
 * PUT  /cases/{id}/history/{historyId}/remark      edit the remark of one history entry
 * GET  /cases/{id}/history                         status history of a case
 * GET  /cases/statuses                             the status catalog in pipeline order
 *
 * Business failures surface as CaseServiceException and are mapped to HTTP
 * statuses by {@link CaseExceptionHandler}.
 */
@RestController
@RequestMapping("/cases")
public class CaseController {

    private final CaseService caseService;

    public CaseController(CaseService caseService) {
        this.caseService = caseService;
    }

    /**
     * Dry-run a status change. Always 200; read "allowed" in the body.
     *
     * Example:
     *   curl -X POST http://localhost:8080/cases/status-check \
     *     -H "Content-Type: application/json" \
     *     -d '{"caseId":42,"beforeStatus":"Negotiation","afterStatus":"Awarded"}'
     */
    @PostMapping("/status-check")
    public TransitionCheckResponse check(@RequestBody StatusCheckRequest req) {
        return TransitionCheckResponse.from(
                caseService.preflightCheck(req.caseId(), req.beforeStatus(), req.afterStatus()));
    }

    @PostMapping("/{id}/status")
    public TransitionResponse changeStatus(@PathVariable Long id, @RequestBody StatusChangeRequest req) {
        return TransitionResponse.from(
                caseService.applyTransition(id, req.beforeStatus(), req.afterStatus()));
    }

    @PostMapping("/invalidate")
    public ResponseEntity<Void> invalidate(@RequestBody InvalidateCasesRequest req) {
        caseService.invalidateBatch(req.caseIds(), req.ownerId(), req.ownerTable());
        return ResponseEntity.noContent().build();
    }

    @PutMapping("/{id}/history/{historyId}/remark")
    public ResponseEntity<Void> updateRemark(@PathVariable Long id,
                                             @PathVariable Long historyId,
                                             @RequestBody RemarkUpdateRequest req) {
        caseService.updateHistoryRemark(id, historyId, req.remarkText());
        return ResponseEntity.noContent().build();
    }

    /** Full history by default; activeOnly=true hides rolled-back entries. */
    @GetMapping("/{id}/history")
    public List<HistoryEntryResponse> history(@PathVariable Long id,
                                              @RequestParam(defaultValue = "false") boolean activeOnly) {
        return caseService.listHistory(id, activeOnly).stream()
                .map(HistoryEntryResponse::from)
                .toList();
    }

    @GetMapping("/statuses")
    public List<StatusResponse> statuses() {
        return StatusCatalog.names().stream()
                .map(StatusResponse::of)
                .toList();
    }
}
