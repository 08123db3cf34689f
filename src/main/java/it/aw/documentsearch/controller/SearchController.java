package it.aw.documentsearch.controller;

import it.aw.documentsearch.exception.ServiceFailureException;
import it.aw.documentsearch.model.CollectionStats;
import it.aw.documentsearch.model.SearchRequest;
import it.aw.documentsearch.model.SearchResponse;
import it.aw.documentsearch.model.SearchResult;
import it.aw.documentsearch.service.QueryEngine;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import javax.validation.Valid;
import java.util.List;

/**
 * Espone la ricerca semantica e le statistiche della collection.
 *
 * Endpoint disponibili:
 *   POST /api/v1/search            : ricerca semantica
 *   GET  /api/v1/collection/stats  : statistiche della collection
 *
 * In caso di errore interno la risposta è un 500 il cui campo detail
 * contiene il messaggio dell'errore originale.
 */
@RestController
@RequestMapping("/api/v1")
public class SearchController {

    private final QueryEngine queryEngine;

    public SearchController(QueryEngine queryEngine) {
        this.queryEngine = queryEngine;
    }

    // -------------------------------------------------------------------------
    // POST /api/v1/search
    // -------------------------------------------------------------------------

    /**
     * Esempio:
     *   curl -X POST http://localhost:8000/api/v1/search \
     *        -H "Content-Type: application/json" \
     *        -d '{"query": "GPIO configuration", "k": 3}'
     */
    @PostMapping("/search")
    public ResponseEntity<SearchResponse> search(@Valid @RequestBody SearchRequest request) {
        List<SearchResult> results;
        try {
            results = queryEngine.search(request.query(), request.effectiveK());
        } catch (RuntimeException e) {
            throw new ServiceFailureException("Search error: " + e.getMessage(), e);
        }
        return ResponseEntity.ok(new SearchResponse(request.query(), results, results.size()));
    }

    // -------------------------------------------------------------------------
    // GET /api/v1/collection/stats
    // -------------------------------------------------------------------------

    /**
     * L'elenco sources è calcolato su un campione delle prime righe
     * della collection e può non essere completo.
     *
     * Esempio:
     *   curl http://localhost:8000/api/v1/collection/stats
     */
    @GetMapping("/collection/stats")
    public ResponseEntity<CollectionStats> stats() {
        try {
            return ResponseEntity.ok(queryEngine.getCollectionStats());
        } catch (RuntimeException e) {
            throw new ServiceFailureException("Error retrieving stats: " + e.getMessage(), e);
        }
    }
}
