package com.aramcoach.core.retrieval;

import com.aramcoach.core.model.EvidenceSnippet;
import com.aramcoach.core.model.EvidenceSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * BM25 ranking over a small in-memory corpus.
 * <p>
 * Each source is indexed as {@code topic + " " + text}. IDF uses the
 * {@code ln(1 + (N - n + 0.5) / (n + 0.5))} form so that terms present in most
 * documents still score non-negative. Ties keep corpus order; a query with no
 * matching terms therefore returns the corpus prefix with score 0.
 */
@Component
public class Bm25Ranker implements Ranker {

    private static final Logger log = LoggerFactory.getLogger(Bm25Ranker.class);

    private final double k1;
    private final double b;

    @Autowired
    public Bm25Ranker(RankerProperties properties) {
        this(properties.getK1(), properties.getB());
    }

    Bm25Ranker(double k1, double b) {
        this.k1 = k1;
        this.b = b;
    }

    @Override
    public List<EvidenceSnippet> rank(String query, List<EvidenceSource> corpus, int k) {
        if (corpus == null || corpus.isEmpty() || k <= 0) {
            return List.of();
        }
        List<EvidenceSource> docs = distinctById(corpus);
        List<List<String>> tokenized = docs.stream()
                .map(d -> tokenize((d.topic() != null ? d.topic() : "") + " " + d.text()))
                .toList();

        int n = docs.size();
        double avgdl = tokenized.stream().mapToInt(List::size).average().orElse(0.0);
        Map<String, Integer> df = new HashMap<>();
        for (List<String> tokens : tokenized) {
            for (String t : new HashSet<>(tokens)) {
                df.merge(t, 1, Integer::sum);
            }
        }

        // Repeated query terms are scored once
        Set<String> queryTerms = new LinkedHashSet<>(tokenize(query));

        List<EvidenceSnippet> scored = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            List<String> tokens = tokenized.get(i);
            Map<String, Integer> tf = new HashMap<>();
            for (String t : tokens) {
                tf.merge(t, 1, Integer::sum);
            }
            double score = 0.0;
            for (String term : queryTerms) {
                int f = tf.getOrDefault(term, 0);
                if (f == 0) {
                    continue;
                }
                int nq = df.get(term);
                double idf = Math.log(1.0 + (n - nq + 0.5) / (nq + 0.5));
                double norm = avgdl > 0 ? tokens.size() / avgdl : 0.0;
                score += idf * (f * (k1 + 1)) / (f + k1 * (1 - b + b * norm));
            }
            var doc = docs.get(i);
            scored.add(new EvidenceSnippet(doc.id(), doc.topic(), doc.text(), score));
        }

        // List.sort is stable: equal scores keep corpus order
        scored.sort(Comparator.comparingDouble(EvidenceSnippet::score).reversed());
        List<EvidenceSnippet> top = scored.subList(0, Math.min(k, scored.size()));
        if (top.stream().allMatch(s -> s.score() == 0.0)) {
            log.debug("Query '{}' matched no terms in {} sources, keeping corpus order", query, n);
        }
        return List.copyOf(top);
    }

    private static List<EvidenceSource> distinctById(List<EvidenceSource> corpus) {
        var byId = new LinkedHashMap<String, EvidenceSource>();
        for (EvidenceSource source : corpus) {
            if (source != null && source.id() != null) {
                byId.putIfAbsent(source.id(), source);
            }
        }
        return new ArrayList<>(byId.values());
    }

    static List<String> tokenize(String text) {
        if (text == null || text.isBlank()) {
            return Collections.emptyList();
        }
        String normalized = text.toLowerCase(Locale.ROOT).replaceAll("[^\\p{L}\\p{Nd}\\s]", " ");
        List<String> out = new ArrayList<>();
        for (String part : normalized.split("\\s+")) {
            if (!part.isEmpty()) {
                out.add(part);
            }
        }
        return out;
    }
}
