package it.aw.documentsearch.controller;

import it.aw.documentsearch.exception.InvalidFileException;
import it.aw.documentsearch.exception.SourceFileNotFoundException;
import it.aw.documentsearch.model.DeleteResponse;
import it.aw.documentsearch.model.FileInfo;
import it.aw.documentsearch.model.FileListResponse;
import it.aw.documentsearch.model.UploadResponse;
import it.aw.documentsearch.service.SourceFileService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.web.servlet.MockMvc;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.hamcrest.Matchers.containsString;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(FileController.class)
@DisplayName("FileController")
class FileControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private SourceFileService sourceFileService;

    @Test
    void listsFiles() throws Exception {
        when(sourceFileService.listFiles()).thenReturn(new FileListResponse(List.of(
                new FileInfo("manual.pdf", "./document_source/manual.pdf", 2048, ".pdf")), 1));

        mockMvc.perform(get("/api/v1/files"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.total_files").value(1))
                .andExpect(jsonPath("$.files[0].filename").value("manual.pdf"))
                .andExpect(jsonPath("$.files[0].filepath").value("./document_source/manual.pdf"))
                .andExpect(jsonPath("$.files[0].size").value(2048))
                .andExpect(jsonPath("$.files[0].extension").value(".pdf"));
    }

    @Test
    void uploadsMultipartFile() throws Exception {
        MockMultipartFile file = new MockMultipartFile("file", "manual.pdf", "application/pdf",
                "%PDF-1.4".getBytes(StandardCharsets.UTF_8));
        when(sourceFileService.store(any())).thenReturn(
                new UploadResponse("File uploaded successfully", "manual.pdf", "./document_source/manual.pdf", 8));

        mockMvc.perform(multipart("/api/v1/files/upload").file(file))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("File uploaded successfully"))
                .andExpect(jsonPath("$.filename").value("manual.pdf"))
                .andExpect(jsonPath("$.size").value(8));
    }

    @Test
    void uploadWithoutFilePartIsBadRequest() throws Exception {
        mockMvc.perform(multipart("/api/v1/files/upload"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("VALIDATION_001"));

        verifyNoInteractions(sourceFileService);
    }

    @Test
    void rejectedUploadIsBadRequest() throws Exception {
        MockMultipartFile file = new MockMultipartFile("file", "run.sh", "text/plain",
                "echo".getBytes(StandardCharsets.UTF_8));
        when(sourceFileService.store(any())).thenThrow(new InvalidFileException("Unsupported file type '.sh'"));

        mockMvc.perform(multipart("/api/v1/files/upload").file(file))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("FILE_002"))
                .andExpect(jsonPath("$.detail").value("Unsupported file type '.sh'"));
    }

    @Test
    void deletesFile() throws Exception {
        when(sourceFileService.delete("manual.pdf"))
                .thenReturn(new DeleteResponse("File deleted successfully", "manual.pdf"));

        mockMvc.perform(delete("/api/v1/files/manual.pdf"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("File deleted successfully"))
                .andExpect(jsonPath("$.filename").value("manual.pdf"));
    }

    @Test
    void deleteOfMissingFileIsNotFound() throws Exception {
        when(sourceFileService.delete("ghost.pdf")).thenThrow(new SourceFileNotFoundException("ghost.pdf"));

        mockMvc.perform(delete("/api/v1/files/ghost.pdf"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("FILE_001"))
                .andExpect(jsonPath("$.detail").value("File 'ghost.pdf' not found"));
    }

    @Test
    @DisplayName("download come allegato con il content type del file")
    void downloadsFileAsAttachment() throws Exception {
        when(sourceFileService.load("manual.pdf"))
                .thenReturn(new ByteArrayResource("%PDF-1.4".getBytes(StandardCharsets.UTF_8)));

        mockMvc.perform(get("/api/v1/files/download/manual.pdf"))
                .andExpect(status().isOk())
                .andExpect(header().string("Content-Type", "application/pdf"))
                .andExpect(header().string("Content-Disposition", containsString("attachment")))
                .andExpect(header().string("Content-Disposition", containsString("manual.pdf")))
                .andExpect(content().bytes("%PDF-1.4".getBytes(StandardCharsets.UTF_8)));
    }

    @Test
    void downloadOfMissingFileIsNotFound() throws Exception {
        when(sourceFileService.load("ghost.pdf")).thenThrow(new SourceFileNotFoundException("ghost.pdf"));

        mockMvc.perform(get("/api/v1/files/download/ghost.pdf"))
                .andExpect(status().isNotFound());
    }
}
