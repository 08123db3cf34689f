package it.aw.documentsearch.controller;

import it.aw.documentsearch.exception.StoreException;
import it.aw.documentsearch.model.CollectionStats;
import it.aw.documentsearch.model.SearchResult;
import it.aw.documentsearch.service.QueryEngine;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(SearchController.class)
@DisplayName("SearchController")
class SearchControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private QueryEngine queryEngine;

    @Test
    void searchReturnsResultsWithTotal() throws Exception {
        when(queryEngine.search("GPIO configuration", 3)).thenReturn(List.of(
                new SearchResult("chunk_4", "GPIO pins", 3, "ref.pdf", 0.12),
                new SearchResult("chunk_0", "GPIO modes", 1, "ds.pdf", 0.4)));

        mockMvc.perform(post("/api/v1/search")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"query\": \"GPIO configuration\", \"k\": 3}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.query").value("GPIO configuration"))
                .andExpect(jsonPath("$.total_results").value(2))
                .andExpect(jsonPath("$.results[0].id").value("chunk_4"))
                .andExpect(jsonPath("$.results[0].page").value(3))
                .andExpect(jsonPath("$.results[0].source").value("ref.pdf"))
                .andExpect(jsonPath("$.results[0].score").value(0.12))
                .andExpect(jsonPath("$.results[1].id").value("chunk_0"));
    }

    @Test
    @DisplayName("k assente: vengono usati 5 risultati")
    void kDefaultsToFive() throws Exception {
        when(queryEngine.search("uart", 5)).thenReturn(List.of());

        mockMvc.perform(post("/api/v1/search")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"query\": \"uart\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.total_results").value(0))
                .andExpect(jsonPath("$.results").isEmpty());

        verify(queryEngine).search("uart", 5);
    }

    @Test
    void whitespaceQueryIsAccepted() throws Exception {
        when(queryEngine.search("   ", 5)).thenReturn(List.of(
                new SearchResult("chunk_0", "GPIO pins", 1, "ref.pdf", 1.3)));

        mockMvc.perform(post("/api/v1/search")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"query\": \"   \"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.total_results").value(1));
    }

    @Test
    void kOutOfRangeIsRejected() throws Exception {
        mockMvc.perform(post("/api/v1/search")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"query\": \"uart\", \"k\": 21}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("VALIDATION_001"))
                .andExpect(jsonPath("$.path").value("/api/v1/search"));

        mockMvc.perform(post("/api/v1/search")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"query\": \"uart\", \"k\": 0}"))
                .andExpect(status().isBadRequest());

        verify(queryEngine, never()).search(anyString(), anyInt());
    }

    @Test
    void emptyOrMissingQueryIsRejected() throws Exception {
        mockMvc.perform(post("/api/v1/search")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"query\": \"\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("VALIDATION_001"));

        mockMvc.perform(post("/api/v1/search")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"k\": 3}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void malformedBodyIsRejected() throws Exception {
        mockMvc.perform(post("/api/v1/search")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{not json"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.detail").value("Malformed request body"));
    }

    @Test
    void searchFailureBecomesServerError() throws Exception {
        when(queryEngine.search("uart", 5)).thenThrow(new StoreException("database is closed"));

        mockMvc.perform(post("/api/v1/search")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"query\": \"uart\"}"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.code").value("SERVICE_001"))
                .andExpect(jsonPath("$.detail").value("Search error: database is closed"))
                .andExpect(jsonPath("$.error_id").isNotEmpty());
    }

    @Test
    void statsAreReturned() throws Exception {
        when(queryEngine.getCollectionStats()).thenReturn(new CollectionStats(
                42, "pdf_manual_embedding", "sentence-transformers/all-MiniLM-L6-v2", List.of("a.pdf", "b.pdf")));

        mockMvc.perform(get("/api/v1/collection/stats"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.total_chunks").value(42))
                .andExpect(jsonPath("$.collection_name").value("pdf_manual_embedding"))
                .andExpect(jsonPath("$.embedding_model").value("sentence-transformers/all-MiniLM-L6-v2"))
                .andExpect(jsonPath("$.sources[1]").value("b.pdf"));
    }

    @Test
    void statsFailureBecomesServerError() throws Exception {
        when(queryEngine.getCollectionStats()).thenThrow(new StoreException("io error"));

        mockMvc.perform(get("/api/v1/collection/stats"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.detail").value("Error retrieving stats: io error"));
    }
}
