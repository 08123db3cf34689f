package it.aw.documentsearch.controller;

import it.aw.documentsearch.model.BuildStartResponse;
import it.aw.documentsearch.model.IndexBuildReport;
import it.aw.documentsearch.model.IndexStatus;
import it.aw.documentsearch.service.IndexJobService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Gestione della build dell'indice.
 *
 * Endpoint disponibili:
 *   POST /api/v1/index/build       : avvia la build in background
 *   POST /api/v1/index/build/sync  : esegue la build e restituisce il report
 *   GET  /api/v1/index/status      : stato della build e ultimo report
 *
 * Una build fallita non è un errore HTTP: il report ha success=false e il campo error.
 * Se una build è già in corso la risposta è 409.
 */
@RestController
@RequestMapping("/api/v1/index")
public class IndexController {

    static final String ALREADY_RUNNING = "Index build already in progress";

    private final IndexJobService indexJobService;

    public IndexController(IndexJobService indexJobService) {
        this.indexJobService = indexJobService;
    }

    /**
     * Esempio:
     *   curl -X POST http://localhost:8000/api/v1/index/build
     */
    @PostMapping("/build")
    public ResponseEntity<BuildStartResponse> build() {
        if (!indexJobService.startAsync()) {
            return ResponseEntity.status(HttpStatus.CONFLICT)
                    .body(new BuildStartResponse(false, ALREADY_RUNNING));
        }
        return ResponseEntity.status(HttpStatus.ACCEPTED)
                .body(new BuildStartResponse(true, "Index build started"));
    }

    /**
     * Esempio:
     *   curl -X POST http://localhost:8000/api/v1/index/build/sync
     */
    @PostMapping("/build/sync")
    public ResponseEntity<IndexBuildReport> buildSync() {
        return indexJobService.buildSync()
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.status(HttpStatus.CONFLICT)
                        .body(IndexBuildReport.failed(ALREADY_RUNNING, "Wait for the running build to finish.")));
    }

    @GetMapping("/status")
    public ResponseEntity<IndexStatus> status() {
        return ResponseEntity.ok(indexJobService.status());
    }
}
