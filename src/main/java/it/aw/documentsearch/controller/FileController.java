package it.aw.documentsearch.controller;

import it.aw.documentsearch.model.DeleteResponse;
import it.aw.documentsearch.model.FileListResponse;
import it.aw.documentsearch.model.UploadResponse;
import it.aw.documentsearch.service.SourceFileService;
import org.springframework.core.io.Resource;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.MediaTypeFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.nio.charset.StandardCharsets;

/**
 * Gestione dei file nella directory sorgente dei documenti.
 *
 * Endpoint disponibili:
 *   GET    /api/v1/files                       : elenco dei file
 *   POST   /api/v1/files/upload                : carica un file (PDF, TXT, DOCX, DOC)
 *   DELETE /api/v1/files/{filename}            : elimina un file
 *   GET    /api/v1/files/download/{filename}   : scarica un file
 *
 * Le modifiche ai file diventano visibili nella ricerca solo dopo una nuova build dell'indice.
 * File inesistente: 404; nome o tipo non valido: 400.
 */
@RestController
@RequestMapping("/api/v1/files")
public class FileController {

    private final SourceFileService sourceFileService;

    public FileController(SourceFileService sourceFileService) {
        this.sourceFileService = sourceFileService;
    }

    // -------------------------------------------------------------------------
    // GET /api/v1/files
    // -------------------------------------------------------------------------

    /**
     * Esempio:
     *   curl http://localhost:8000/api/v1/files
     */
    @GetMapping
    public ResponseEntity<FileListResponse> listFiles() {
        return ResponseEntity.ok(sourceFileService.listFiles());
    }

    // -------------------------------------------------------------------------
    // POST /api/v1/files/upload
    // -------------------------------------------------------------------------

    /**
     * Esempio:
     *   curl -X POST http://localhost:8000/api/v1/files/upload \
     *        -F "file=@reference_manual.pdf"
     */
    @PostMapping("/upload")
    public ResponseEntity<UploadResponse> upload(@RequestParam("file") MultipartFile file) {
        return ResponseEntity.ok(sourceFileService.store(file));
    }

    // -------------------------------------------------------------------------
    // DELETE /api/v1/files/{filename}
    // -------------------------------------------------------------------------

    /**
     * Esempio:
     *   curl -X DELETE http://localhost:8000/api/v1/files/reference_manual.pdf
     */
    @DeleteMapping("/{filename}")
    public ResponseEntity<DeleteResponse> delete(@PathVariable String filename) {
        return ResponseEntity.ok(sourceFileService.delete(filename));
    }

    // -------------------------------------------------------------------------
    // GET /api/v1/files/download/{filename}
    // -------------------------------------------------------------------------

    /**
     * Esempio:
     *   curl -OJ http://localhost:8000/api/v1/files/download/reference_manual.pdf
     */
    @GetMapping("/download/{filename}")
    public ResponseEntity<Resource> download(@PathVariable String filename) {
        Resource resource = sourceFileService.load(filename);
        MediaType contentType = MediaTypeFactory.getMediaType(filename)
                .orElse(MediaType.APPLICATION_OCTET_STREAM);
        ContentDisposition disposition = ContentDisposition.attachment()
                .filename(filename, StandardCharsets.UTF_8)
                .build();
        return ResponseEntity.ok()
                .contentType(contentType)
                .header(HttpHeaders.CONTENT_DISPOSITION, disposition.toString())
                .body(resource);
    }
}
