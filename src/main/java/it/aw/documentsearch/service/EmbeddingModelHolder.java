package it.aw.documentsearch.service;

import dev.langchain4j.model.embedding.EmbeddingModel;
import it.aw.documentsearch.exception.ModelLoadException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.Function;

/**
 * Crea il modello di embedding al primo utilizzo e lo riusa per tutta la vita
 * del processo.
 * <p>
 * Un caricamento fallito non viene memorizzato: la chiamata successiva ritenta.
 */
public class EmbeddingModelHolder {

    private static final Logger log = LoggerFactory.getLogger(EmbeddingModelHolder.class);

    private final String modelName;
    private final Function<String, EmbeddingModel> factory;
    private volatile EmbeddingModel model;

    public EmbeddingModelHolder(String modelName, Function<String, EmbeddingModel> factory) {
        this.modelName = modelName;
        this.factory = factory;
    }

    public String getModelName() {
        return modelName;
    }

    /**
     * @throws ModelLoadException se il modello non è supportato o non si carica
     */
    public EmbeddingModel get() {
        EmbeddingModel loaded = model;
        if (loaded != null) {
            return loaded;
        }
        synchronized (this) {
            if (model == null) {
                log.info("Caricamento EmbeddingModel: {}", modelName);
                try {
                    model = factory.apply(modelName);
                } catch (ModelLoadException e) {
                    throw e;
                } catch (RuntimeException | LinkageError e) {
                    throw new ModelLoadException(e.getMessage() != null ? e.getMessage() : e.toString(), e);
                }
                if (model == null) {
                    throw new ModelLoadException("factory returned no model for '" + modelName + "'");
                }
            }
            return model;
        }
    }

    public boolean isLoaded() {
        return model != null;
    }
}
