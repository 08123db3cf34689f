package it.aw.documentsearch.service;

import it.aw.documentsearch.exception.FileStorageException;
import it.aw.documentsearch.exception.InvalidFileException;
import it.aw.documentsearch.exception.SourceFileNotFoundException;
import it.aw.documentsearch.model.DeleteResponse;
import it.aw.documentsearch.model.FileInfo;
import it.aw.documentsearch.model.FileListResponse;
import it.aw.documentsearch.model.UploadResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Gestione dei file nella directory sorgente: elenco, upload, cancellazione e download.
 * <p>
 * Opera solo sui file di primo livello della directory. I file caricati vengono
 * indicizzati alla build successiva (che considera solo i PDF); upload e
 * cancellazione non toccano il vector store.
 */
@Service
public class SourceFileService {

    private static final Logger log = LoggerFactory.getLogger(SourceFileService.class);

    static final Set<String> ALLOWED_EXTENSIONS = Set.of(".pdf", ".txt", ".docx", ".doc");

    private final Path sourceDir;

    @Autowired
    public SourceFileService(@Value("${documents.source-dir}") String sourceDir) {
        this(Paths.get(sourceDir));
    }

    public SourceFileService(Path sourceDir) {
        this.sourceDir = sourceDir;
    }

    /** File della directory sorgente ordinati per nome; lista vuota se la directory non esiste. */
    public FileListResponse listFiles() {
        if (!Files.isDirectory(sourceDir)) {
            return new FileListResponse(List.of(), 0);
        }
        List<FileInfo> files;
        try (Stream<Path> entries = Files.list(sourceDir)) {
            files = entries
                    .filter(Files::isRegularFile)
                    .sorted(Comparator.comparing(p -> p.getFileName().toString()))
                    .map(this::describe)
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new FileStorageException("Cannot list '" + sourceDir + "': " + e.getMessage(), e);
        }
        return new FileListResponse(files, files.size());
    }

    /**
     * Salva il file nella directory sorgente, creandola se serve.
     * Un file con lo stesso nome viene sovrascritto.
     *
     * @throws InvalidFileException se il file è vuoto, il nome non è valido o l'estensione non è ammessa
     */
    public UploadResponse store(MultipartFile file) {
        String filename = file.getOriginalFilename() != null ? file.getOriginalFilename() : "";
        if (file.isEmpty()) {
            throw new InvalidFileException("Uploaded file is empty");
        }
        Path target = resolve(filename);
        String extension = extensionOf(filename);
        if (!ALLOWED_EXTENSIONS.contains(extension)) {
            throw new InvalidFileException("Unsupported file type '" + extension + "'. Allowed: "
                    + ALLOWED_EXTENSIONS.stream().sorted().collect(Collectors.joining(", ")));
        }

        try {
            Files.createDirectories(sourceDir);
            try (InputStream is = file.getInputStream()) {
                Files.copy(is, target, StandardCopyOption.REPLACE_EXISTING);
            }
            long size = Files.size(target);
            log.info("File caricato: {} ({} byte)", filename, size);
            return new UploadResponse("File uploaded successfully", filename, target.toString(), size);
        } catch (IOException e) {
            throw new FileStorageException("Error saving file " + filename + ": " + e.getMessage(), e);
        }
    }

    /**
     * @throws SourceFileNotFoundException se il file non esiste
     */
    public DeleteResponse delete(String filename) {
        Path target = existing(filename);
        try {
            Files.delete(target);
        } catch (IOException e) {
            throw new FileStorageException("Error deleting file " + filename + ": " + e.getMessage(), e);
        }
        log.info("File eliminato: {}", filename);
        return new DeleteResponse("File deleted successfully", filename);
    }

    /**
     * @throws SourceFileNotFoundException se il file non esiste
     */
    public Resource load(String filename) {
        return new FileSystemResource(existing(filename));
    }

    private Path existing(String filename) {
        Path target = resolve(filename);
        if (!Files.isRegularFile(target)) {
            throw new SourceFileNotFoundException(filename);
        }
        return target;
    }

    /** Percorso del file nella directory sorgente; rifiuta nomi che ne uscirebbero. */
    private Path resolve(String filename) {
        if (filename.isBlank() || filename.contains("/") || filename.contains("\\")
                || filename.equals(".") || filename.equals("..")) {
            throw new InvalidFileException("Invalid filename '" + filename + "'");
        }
        return sourceDir.resolve(filename);
    }

    private FileInfo describe(Path file) {
        String filename = file.getFileName().toString();
        try {
            return new FileInfo(filename, file.toString(), Files.size(file), extensionOf(filename));
        } catch (IOException e) {
            throw new FileStorageException("Cannot read size of " + filename + ": " + e.getMessage(), e);
        }
    }

    static String extensionOf(String filename) {
        int dot = filename.lastIndexOf('.');
        return dot > 0 ? filename.substring(dot).toLowerCase(Locale.ROOT) : "";
    }
}
