package it.aw.documentsearch.config;

import dev.langchain4j.model.embedding.AllMiniLmL6V2EmbeddingModel;
import dev.langchain4j.model.embedding.AllMiniLmL6V2QuantizedEmbeddingModel;
import dev.langchain4j.model.embedding.EmbeddingModel;
import it.aw.documentsearch.exception.ModelLoadException;
import it.aw.documentsearch.service.EmbeddingModelHolder;
import it.aw.documentsearch.service.EmbeddingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Locale;

/**
 * Configura il modello di embedding LangChain4j.
 *
 * EmbeddingModel: AllMiniLM-L6-v2 (384 dimensioni), intero o quantizzato;
 *                 gira in locale via ONNX, senza API key.
 *                 Viene istanziato al primo utilizzo tramite EmbeddingModelHolder
 *                 e poi condiviso da build e ricerca.
 */
@Configuration
public class LangChain4jConfig {

    private static final Logger log = LoggerFactory.getLogger(LangChain4jConfig.class);

    @Value("${embedding.model}")
    private String embeddingModelName;

    @Bean
    public EmbeddingModelHolder embeddingModelHolder() {
        return new EmbeddingModelHolder(embeddingModelName, LangChain4jConfig::createModel);
    }

    @Bean
    public EmbeddingService embeddingService(EmbeddingModelHolder embeddingModelHolder) {
        return new EmbeddingService(embeddingModelHolder);
    }

    /**
     * Risolve l'identificativo configurato in un modello locale.
     * Accetta sia il nome HuggingFace ("sentence-transformers/all-MiniLM-L6-v2")
     * sia il nome breve, con suffisso "-q" o "-quantized" per la variante quantizzata.
     */
    static EmbeddingModel createModel(String name) {
        String key = name.trim().toLowerCase(Locale.ROOT);
        if (key.endsWith("all-minilm-l6-v2-q") || key.endsWith("all-minilm-l6-v2-quantized")) {
            log.info("EmbeddingModel: AllMiniLmL6V2Quantized (locale)");
            return new AllMiniLmL6V2QuantizedEmbeddingModel();
        }
        if (key.endsWith("all-minilm-l6-v2")) {
            log.info("EmbeddingModel: AllMiniLmL6V2 (locale)");
            return new AllMiniLmL6V2EmbeddingModel();
        }
        throw new ModelLoadException("Unsupported embedding model '" + name + "'");
    }
}
