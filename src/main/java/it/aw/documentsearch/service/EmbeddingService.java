package it.aw.documentsearch.service;

import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import it.aw.documentsearch.exception.EncodingException;
import it.aw.documentsearch.exception.ModelLoadException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Converte testi in vettori float32 usando il modello condiviso.
 * <p>
 * Tutti i vettori prodotti hanno la stessa dimensione; una risposta del modello
 * con un numero di vettori o una dimensione inattesi è trattata come errore
 * di encoding.
 */
public class EmbeddingService {

    private static final Logger log = LoggerFactory.getLogger(EmbeddingService.class);

    /**
     * Testo codificato al posto di una query di soli spazi. Il tokenizer BERT scarta
     * sia gli spazi sia i caratteri di formato (categoria Cf), quindi U+200B produce la
     * stessa sequenza [CLS][SEP] della query vuota, ma supera il controllo di
     * {@link TextSegment} sui testi blank.
     */
    static final String BLANK_QUERY_TEXT = "\u200B";

    private final EmbeddingModelHolder modelHolder;

    public EmbeddingService(EmbeddingModelHolder modelHolder) {
        this.modelHolder = modelHolder;
    }

    public String getModelName() {
        return modelHolder.getModelName();
    }

    /**
     * Forza il caricamento del modello.
     *
     * @throws ModelLoadException se il modello non si carica
     */
    public void ensureModelLoaded() {
        modelHolder.get();
    }

    /**
     * Codifica tutti i testi in un'unica chiamata batch.
     *
     * @throws ModelLoadException se il modello non si carica
     * @throws EncodingException  se la codifica fallisce
     */
    public List<float[]> embedAll(List<String> texts) {
        EmbeddingModel model = modelHolder.get();
        List<TextSegment> segments = new ArrayList<>(texts.size());
        for (String text : texts) {
            segments.add(TextSegment.from(text));
        }

        List<Embedding> embeddings;
        try {
            embeddings = model.embedAll(segments).content();
        } catch (RuntimeException e) {
            throw new EncodingException(describe(e), e);
        }
        if (embeddings == null || embeddings.size() != texts.size()) {
            throw new EncodingException("expected " + texts.size() + " embeddings, got "
                    + (embeddings == null ? 0 : embeddings.size()));
        }

        List<float[]> vectors = new ArrayList<>(embeddings.size());
        int dimension = -1;
        for (Embedding embedding : embeddings) {
            float[] vector = embedding.vector();
            if (dimension == -1) {
                dimension = vector.length;
            } else if (vector.length != dimension) {
                throw new EncodingException("inconsistent embedding dimension: "
                        + vector.length + " != " + dimension);
            }
            vectors.add(vector);
        }
        log.debug("Codificati {} testi, dimensione {}", vectors.size(), dimension);
        return vectors;
    }

    /**
     * Codifica una query. Una query di soli spazi è valida e viene codificata
     * come la sequenza vuota di token.
     *
     * @throws ModelLoadException se il modello non si carica
     * @throws EncodingException  se la codifica fallisce
     */
    public float[] embedQuery(String query) {
        EmbeddingModel model = modelHolder.get();
        String text = query == null || query.isBlank() ? BLANK_QUERY_TEXT : query;
        try {
            return model.embed(text).content().vector();
        } catch (RuntimeException e) {
            throw new EncodingException(describe(e), e);
        }
    }

    private static String describe(RuntimeException e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}
