package com.dashforge.orchestrator.context;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.Resource;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Keyword matching over a small, fixed corpus of query snippets, log formats
 * and example dashboards. Stands in for a vector store: deterministic, no I/O
 * after startup.
 *
 * Sections are added in a fixed order; when nothing matches, all example
 * dashboards are returned as general guidance.
 */
@Component
public class KeywordContextRetriever implements ContextRetriever {

    private static final Logger log = LoggerFactory.getLogger(KeywordContextRetriever.class);

    private static final List<String> DATABASE_TERMS    = List.of("mysql", "sql", "database", "query", "postgres");
    private static final List<String> METRICS_TERMS     = List.of("prometheus", "metrics", "monitoring", "cpu", "memory");
    private static final List<String> LOG_TERMS         = List.of("logs", "logging", "nginx", "error log");
    private static final List<String> PERFORMANCE_TERMS = List.of("api", "latency", "performance", "error rate");

    private static final TypeReference<LinkedHashMap<String, Object>> CORPUS_TYPE = new TypeReference<>() {};

    private final Map<String, Object> corpus;

    public KeywordContextRetriever(ObjectMapper objectMapper,
                                   @Value("${dashforge.context.corpus:classpath:context/sample-contexts.json}")
                                   Resource corpusResource) {
        try (InputStream in = corpusResource.getInputStream()) {
            this.corpus = objectMapper.readValue(in, CORPUS_TYPE);
        } catch (IOException e) {
            throw new UncheckedIOException("Could not load context corpus from " + corpusResource, e);
        }
        log.info("Loaded context corpus with sections {}", corpus.keySet());
    }

    @Override
    public Map<String, Object> retrieve(String requestText) {
        String text = requestText == null ? "" : requestText.toLowerCase(Locale.ROOT);
        Map<String, Object> context = new LinkedHashMap<>();

        if (containsAny(text, DATABASE_TERMS)) {
            String dialect = !text.contains("mysql") && text.contains("postgres") ? "postgres" : "mysql";
            context.put("sql_examples", section("sql_queries", dialect));
        }

        if (containsAny(text, METRICS_TERMS)) {
            context.put("metrics_examples", section("sql_queries", "prometheus"));
            context.put("system_dashboard_example", section("dashboard_examples", "system_monitoring"));
        }

        if (containsAny(text, LOG_TERMS)) {
            boolean application = !text.contains("nginx")
                    && (text.contains("application") || text.contains("json"));
            context.put("log_formats", section("log_formats", application ? "application" : "nginx"));
        }

        if (containsAny(text, PERFORMANCE_TERMS)) {
            context.put("application_dashboard_example",
                    section("dashboard_examples", "application_performance"));
        }

        if (context.isEmpty()) {
            context.put("general_dashboard_examples", corpus.get("dashboard_examples"));
        }

        log.debug("Retrieved context sections {} for request", context.keySet());
        return context;
    }

    @SuppressWarnings("unchecked")
    private Object section(String group, String name) {
        Object groupValue = corpus.get(group);
        if (groupValue instanceof Map<?, ?> map) {
            return ((Map<String, Object>) map).get(name);
        }
        return null;
    }

    private static boolean containsAny(String text, List<String> terms) {
        return terms.stream().anyMatch(text::contains);
    }
}
