package it.aw.documentsearch.service;

import it.aw.documentsearch.model.IndexBuildReport;
import it.aw.documentsearch.model.IndexStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Esegue la build dell'indice in background e ne tiene lo stato per il polling.
 * <p>
 * Al massimo una build alla volta: sia l'avvio asincrono sia la build sincrona
 * vengono rifiutati finché un'altra build è in corso.
 */
@Service
public class IndexJobService {

    private static final Logger log = LoggerFactory.getLogger(IndexJobService.class);

    private final IndexBuilder indexBuilder;
    private final Executor executor;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private volatile IndexBuildReport lastResult;
    private volatile String progress;

    public IndexJobService(IndexBuilder indexBuilder,
                           @Qualifier("indexBuildExecutor") Executor executor) {
        this.indexBuilder = indexBuilder;
        this.executor = executor;
    }

    /**
     * Avvia la build in background.
     *
     * @return false se un'altra build è già in corso
     */
    public boolean startAsync() {
        if (!running.compareAndSet(false, true)) {
            return false;
        }
        progress = "Queued";
        try {
            executor.execute(this::runBuild);
        } catch (RejectedExecutionException e) {
            progress = null;
            running.set(false);
            throw e;
        }
        log.info("Build indice avviata in background");
        return true;
    }

    /**
     * Esegue la build nel thread chiamante.
     *
     * @return il report, oppure vuoto se un'altra build è già in corso
     */
    public Optional<IndexBuildReport> buildSync() {
        if (!running.compareAndSet(false, true)) {
            return Optional.empty();
        }
        progress = "Starting";
        return Optional.of(runBuild());
    }

    public IndexStatus status() {
        return new IndexStatus(running.get(), lastResult, running.get() ? progress : null);
    }

    private IndexBuildReport runBuild() {
        try {
            IndexBuildReport report = indexBuilder.buildIndex(step -> progress = step);
            lastResult = report;
            return report;
        } finally {
            progress = null;
            running.set(false);
        }
    }
}
