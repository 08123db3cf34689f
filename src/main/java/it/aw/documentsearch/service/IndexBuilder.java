package it.aw.documentsearch.service;

import it.aw.documentsearch.exception.ConfigurationException;
import it.aw.documentsearch.exception.EncodingException;
import it.aw.documentsearch.exception.ExtractionException;
import it.aw.documentsearch.exception.ModelLoadException;
import it.aw.documentsearch.exception.StoreException;
import it.aw.documentsearch.model.Chunk;
import it.aw.documentsearch.model.ChunkingParams;
import it.aw.documentsearch.model.FileReport;
import it.aw.documentsearch.model.IndexBuildReport;
import it.aw.documentsearch.model.PageText;
import it.aw.documentsearch.model.StageResult;
import it.aw.documentsearch.store.VectorStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.function.Consumer;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Ricostruisce da zero l'indice a partire dai PDF della directory sorgente.
 * <p>
 * Pipeline:
 * <ol>
 *   <li>Scan: elenco dei *.pdf ordinati per nome (l'ordine determina gli id dei chunk)</li>
 *   <li>Extract + chunk: testo pagina per pagina, ChunkSplitter su ogni pagina</li>
 *   <li>Load model: caricamento lazy del modello di embedding</li>
 *   <li>Encode: un'unica chiamata batch per tutti i chunk</li>
 *   <li>Replace: cancellazione dei chunk esistenti, poi inserimento dei nuovi</li>
 * </ol>
 * Ogni fase restituisce uno {@link StageResult}; al primo errore la build si ferma
 * e l'errore finisce nel report. {@link #buildIndex()} non lancia eccezioni:
 * anche un errore imprevisto viene riportato nel campo error.
 * <p>
 * La sostituzione non è atomica: cancellazione e inserimento sono due chiamate
 * distinte allo store, quindi un crash tra le due lascia la collection vuota e
 * una ricerca concorrente può vedere la collection vuota durante la build.
 */
@Service
public class IndexBuilder {

    private static final Logger log = LoggerFactory.getLogger(IndexBuilder.class);

    static final String PDF_EXTENSION = ".pdf";

    private final Path documentDir;
    private final String collectionName;
    private final ChunkingParams chunkingParams;
    private final TextExtractor textExtractor;
    private final EmbeddingService embeddingService;
    private final VectorStore vectorStore;

    @Autowired
    public IndexBuilder(@Value("${documents.source-dir}") String sourceDir,
                        @Value("${store.collection-name}") String collectionName,
                        ChunkingParams chunkingParams,
                        TextExtractor textExtractor,
                        EmbeddingService embeddingService,
                        VectorStore vectorStore) {
        this(Paths.get(sourceDir), collectionName, chunkingParams, textExtractor, embeddingService, vectorStore);
    }

    public IndexBuilder(Path documentDir,
                        String collectionName,
                        ChunkingParams chunkingParams,
                        TextExtractor textExtractor,
                        EmbeddingService embeddingService,
                        VectorStore vectorStore) {
        this.documentDir = documentDir;
        this.collectionName = collectionName;
        this.chunkingParams = chunkingParams;
        this.textExtractor = textExtractor;
        this.embeddingService = embeddingService;
        this.vectorStore = vectorStore;
    }

    public IndexBuildReport buildIndex() {
        return buildIndex(progress -> {});
    }

    /**
     * @param progress riceve una descrizione testuale della fase in corso
     */
    public IndexBuildReport buildIndex(Consumer<String> progress) {
        try {
            return doBuild(progress);
        } catch (RuntimeException e) {
            log.error("Errore inatteso durante la build dell'indice", e);
            return IndexBuildReport.failed("Unexpected error during index build: " + e.getMessage(), null);
        }
    }

    private IndexBuildReport doBuild(Consumer<String> progress) {
        log.info("Inizio build indice: dir={}, collection={}, chunkSize={}, overlap={}",
                documentDir, collectionName, chunkingParams.chunkSize(), chunkingParams.overlap());

        // [1] Scan
        progress.accept("Scanning " + documentDir);
        StageResult<List<Path>> scan = scanDocuments();
        if (!scan.isSuccess()) {
            return fail(IndexBuildReport.failed(scan.error(), scan.message()));
        }
        List<Path> files = scan.value();

        // [2] Extract + chunk
        List<FileReport> fileStats = new ArrayList<>();
        StageResult<List<Chunk>> collected = collectChunks(files, fileStats, progress);
        if (!collected.isSuccess()) {
            return fail(IndexBuildReport.failed(collected.error(), collected.message(), fileStats));
        }
        List<Chunk> chunks = collected.value();

        // [3] Load model
        progress.accept("Loading embedding model " + embeddingService.getModelName());
        StageResult<Void> model = loadModel();
        if (!model.isSuccess()) {
            return fail(IndexBuildReport.failed(model.error(), model.message(), fileStats));
        }

        // [4] Encode
        progress.accept("Encoding " + chunks.size() + " chunks");
        StageResult<List<float[]>> encoded = encode(chunks);
        if (!encoded.isSuccess()) {
            return fail(IndexBuildReport.failed(encoded.error(), encoded.message(), fileStats));
        }

        // [5] Replace
        progress.accept("Writing collection " + collectionName);
        StageResult<int[]> replaced = replaceCollection(chunks, encoded.value());
        if (!replaced.isSuccess()) {
            return fail(IndexBuildReport.failed(replaced.error(), replaced.message(), fileStats));
        }
        int previousChunks = replaced.value()[0];
        int totalChunks = replaced.value()[1];

        log.info("Build indice completata: {} file, {} chunk (prima: {})",
                fileStats.size(), totalChunks, previousChunks);
        return IndexBuildReport.succeeded(totalChunks, previousChunks, fileStats,
                embeddingService.getModelName(), collectionName);
    }

    StageResult<List<Path>> scanDocuments() {
        try {
            return StageResult.ok(listDocuments());
        } catch (ConfigurationException e) {
            String hint = Files.isDirectory(documentDir)
                    ? "Please add PDF files to the " + documentDir.getFileName() + " directory."
                    : "Please create the directory and add PDF files.";
            return StageResult.failed(e.getMessage(), hint);
        }
    }

    /**
     * PDF della directory sorgente, ordinati lessicograficamente per nome file.
     * L'estensione è confrontata rispettando maiuscole e minuscole: {@code A.PDF} è ignorato.
     *
     * @throws ConfigurationException se la directory non esiste o non contiene PDF
     */
    List<Path> listDocuments() {
        if (!Files.isDirectory(documentDir)) {
            throw new ConfigurationException("Document directory '" + documentDir + "' not found.");
        }
        List<Path> files;
        try (Stream<Path> entries = Files.list(documentDir)) {
            files = entries
                    .filter(Files::isRegularFile)
                    .filter(p -> p.getFileName().toString().endsWith(PDF_EXTENSION))
                    .sorted(Comparator.comparing(p -> p.getFileName().toString()))
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new ConfigurationException("Cannot list document directory '" + documentDir + "': " + e.getMessage());
        }
        if (files.isEmpty()) {
            throw new ConfigurationException("No PDF files found in '" + documentDir + "'.");
        }
        return files;
    }

    /**
     * Estrae e divide in chunk tutti i file, in ordine. Le statistiche per file
     * vengono aggiunte a {@code fileStats} solo dopo che il file è stato elaborato,
     * così in caso di errore il chiamante ha l'elenco parziale.
     */
    StageResult<List<Chunk>> collectChunks(List<Path> files, List<FileReport> fileStats, Consumer<String> progress) {
        List<Chunk> chunks = new ArrayList<>();
        int chunkIdx = 0;
        for (Path file : files) {
            String filename = file.getFileName().toString();
            progress.accept("Processing " + filename);
            List<PageText> pages;
            try {
                pages = textExtractor.extractPages(file);
            } catch (ExtractionException e) {
                log.warn("Estrazione fallita per {}: {}", filename, e.getMessage());
                return StageResult.failed("Error processing " + filename + ": " + e.getMessage());
            }

            int fileChunks = 0;
            for (PageText page : pages) {
                for (String text : ChunkSplitter.split(page.text(), chunkingParams)) {
                    chunks.add(new Chunk("chunk_" + chunkIdx, text, page.page(), filename, file.toString()));
                    chunkIdx++;
                    fileChunks++;
                }
            }
            fileStats.add(new FileReport(filename, pages.size(), fileChunks));
            log.debug("{}: {} pagine, {} chunk", filename, pages.size(), fileChunks);
        }

        if (chunks.isEmpty()) {
            return StageResult.failed("No text chunks collected from PDFs.", "PDFs may be empty or unreadable.");
        }
        return StageResult.ok(chunks);
    }

    StageResult<Void> loadModel() {
        try {
            embeddingService.ensureModelLoaded();
            return StageResult.ok(null);
        } catch (ModelLoadException e) {
            return StageResult.failed("Failed to load embedding model: " + e.getMessage());
        }
    }

    StageResult<List<float[]>> encode(List<Chunk> chunks) {
        List<String> texts = chunks.stream().map(Chunk::text).collect(Collectors.toList());
        try {
            return StageResult.ok(embeddingService.embedAll(texts));
        } catch (EncodingException | ModelLoadException e) {
            return StageResult.failed("Failed to encode documents: " + e.getMessage());
        }
    }

    /**
     * Cancella la collection (se non vuota) e inserisce i nuovi chunk.
     *
     * @return {@code [previousChunks, totalChunks]}
     */
    StageResult<int[]> replaceCollection(List<Chunk> chunks, List<float[]> vectors) {
        try {
            int previous = vectorStore.count(collectionName);
            if (previous > 0) {
                vectorStore.deleteAll(collectionName);
            }
            vectorStore.add(collectionName, chunks, vectors);
            return StageResult.ok(new int[]{previous, vectorStore.count(collectionName)});
        } catch (StoreException e) {
            return StageResult.failed("Failed to update vector collection: " + e.getMessage());
        }
    }

    private IndexBuildReport fail(IndexBuildReport report) {
        log.warn("Build indice fallita: {}", report.error());
        return report;
    }
}
