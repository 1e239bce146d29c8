package com.dashforge.orchestrator.validation;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.Resource;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;

/**
 * The dashboard grammar, loaded once at startup from a JSON-Schema subset.
 *
 * Supported keywords: type (name or list of names), required, properties,
 * items, enum, oneOf. Unknown keywords are ignored. The catalogue is
 * read-only after construction.
 */
@Component
public class SchemaCatalogue {

    private static final Logger log = LoggerFactory.getLogger(SchemaCatalogue.class);

    private final JsonNode root;

    public SchemaCatalogue(ObjectMapper objectMapper,
                           @Value("${dashforge.validation.schema:classpath:schema/dashboard-schema.json}")
                           Resource schema) {
        try (InputStream in = schema.getInputStream()) {
            this.root = objectMapper.readTree(in);
        } catch (IOException e) {
            throw new UncheckedIOException("Could not load dashboard schema from " + schema, e);
        }
        log.info("Loaded dashboard schema version {} ({} panel types)", version(), panelTypes().size());
    }

    public JsonNode root() {
        return root;
    }

    public String version() {
        return root.path("version").asText("unversioned");
    }

    /** Permitted values of {@code panels[].type}. */
    public List<String> panelTypes() {
        List<String> types = new ArrayList<>();
        root.path("properties").path("panels").path("items")
                .path("properties").path("type").path("enum")
                .forEach(n -> types.add(n.asText()));
        return types;
    }
}
