package it.aw.documentsearch.config;

import it.aw.documentsearch.model.ChunkingParams;
import it.aw.documentsearch.store.DistanceMetric;
import it.aw.documentsearch.store.DuckDbVectorStore;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.nio.file.Paths;
import java.util.concurrent.Executor;

/**
 * Bean di infrastruttura per indicizzazione e ricerca.
 *
 * VectorStore:    DuckDB su {@code store.persist-dir}/vectors.duckdb, una sola connessione
 *                 per processo, chiusa allo shutdown (AutoCloseable).
 * ChunkingParams: {@code chunking.chunk-size} / {@code chunking.overlap}, validati all'avvio.
 * Executor:       un solo thread per le build asincrone.
 */
@Configuration
public class SearchConfig {

    @Value("${store.persist-dir}")
    private String persistDir;

    @Value("${store.distance-metric:l2}")
    private String distanceMetric;

    @Value("${chunking.chunk-size:" + ChunkingParams.DEFAULT_CHUNK_SIZE + "}")
    private int chunkSize;

    @Value("${chunking.overlap:" + ChunkingParams.DEFAULT_OVERLAP + "}")
    private int overlap;

    @Bean
    public DuckDbVectorStore vectorStore() {
        return new DuckDbVectorStore(Paths.get(persistDir), DistanceMetric.fromName(distanceMetric));
    }

    @Bean
    public ChunkingParams chunkingParams() {
        return new ChunkingParams(chunkSize, overlap);
    }

    @Bean(name = "indexBuildExecutor")
    public Executor indexBuildExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(1);
        executor.setMaxPoolSize(1);
        executor.setQueueCapacity(1);
        executor.setThreadNamePrefix("index-build-");
        executor.initialize();
        return executor;
    }
}
