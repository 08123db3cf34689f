package it.aw.documentsearch.store;

import java.util.Locale;

/**
 * Metriche di distanza supportate dallo store. Per tutte, un valore più basso
 * indica una maggiore somiglianza.
 */
public enum DistanceMetric {

    /** Distanza euclidea al quadrato. */
    L2("pow(list_distance(embedding, %s), 2)"),

    /** 1 - similarità coseno. */
    COSINE("1 - list_cosine_similarity(embedding, %s)"),

    /** 1 - prodotto scalare. */
    IP("1 - list_inner_product(embedding, %s)");

    private final String sqlTemplate;

    DistanceMetric(String sqlTemplate) {
        this.sqlTemplate = sqlTemplate;
    }

    /** Espressione SQL DuckDB che calcola la distanza tra la colonna embedding e {@code vectorExpr}. */
    String sqlExpression(String vectorExpr) {
        return String.format(sqlTemplate, vectorExpr);
    }

    public static DistanceMetric fromName(String name) {
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Metrica di distanza non supportata: '" + name
                    + "' (ammesse: l2, cosine, ip)", e);
        }
    }
}
