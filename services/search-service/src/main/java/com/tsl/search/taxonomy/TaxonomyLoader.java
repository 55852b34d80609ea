package com.tsl.search.taxonomy;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

public class TaxonomyLoader {
    private static final Logger log = LoggerFactory.getLogger(TaxonomyLoader.class);
    private static final String CLASSPATH_PREFIX = "classpath:";

    public Taxonomy load(String location) {
        TaxonomyDefinition definition = read(location);
        TaxonomyValidator.validate(definition);
        Taxonomy taxonomy = Taxonomy.from(definition);
        log.info(
            "taxonomy loaded location={} version={} activities={} categories={} keys={}",
            location,
            taxonomy.getVersion(),
            taxonomy.getActivityIds().size(),
            taxonomy.getCategoryMap().size(),
            taxonomy.getSynonymMap().size()
        );
        return taxonomy;
    }

    TaxonomyDefinition read(String location) {
        if (location == null || location.isBlank()) {
            throw new TaxonomyConfigurationException("taxonomy path required");
        }
        try (InputStream input = open(location)) {
            Object parsed = new Yaml().load(input);
            return toDefinition(parsed);
        } catch (IOException | YAMLException ex) {
            throw new TaxonomyConfigurationException("taxonomy unreadable: " + location, ex);
        }
    }

    @SuppressWarnings("unchecked")
    private TaxonomyDefinition toDefinition(Object parsed) {
        if (!(parsed instanceof Map<?, ?> root)) {
            throw new TaxonomyConfigurationException("taxonomy root must be a map");
        }
        Object version = root.get("version");
        Object synonyms = root.get("synonyms");
        Object categories = root.get("categories");
        if (!(synonyms instanceof Map<?, ?>)) {
            throw new TaxonomyConfigurationException("taxonomy synonyms table missing or not a map");
        }
        if (!(categories instanceof Map<?, ?>)) {
            throw new TaxonomyConfigurationException("taxonomy categories table missing or not a map");
        }
        return new TaxonomyDefinition(
            version == null ? "v1" : version.toString().trim(),
            (Map<Object, Object>) synonyms,
            (Map<Object, Object>) categories
        );
    }

    private InputStream open(String location) throws IOException {
        if (location.startsWith(CLASSPATH_PREFIX)) {
            String resource = location.substring(CLASSPATH_PREFIX.length());
            if (resource.startsWith("/")) {
                resource = resource.substring(1);
            }
            InputStream input = TaxonomyLoader.class.getClassLoader().getResourceAsStream(resource);
            if (input == null) {
                throw new TaxonomyConfigurationException("taxonomy not found on classpath: " + resource);
            }
            return input;
        }
        Path path = resolvePath(location);
        if (!Files.exists(path)) {
            throw new TaxonomyConfigurationException("taxonomy not found at " + location);
        }
        return Files.newInputStream(path);
    }

    private Path resolvePath(String location) {
        Path direct = Path.of(location);
        if (Files.exists(direct) || direct.isAbsolute()) {
            return direct;
        }
        Path candidate = direct;
        for (int i = 0; i < 4; i++) {
            if (Files.exists(candidate)) {
                return candidate;
            }
            candidate = Path.of("..").resolve(candidate).normalize();
        }
        return direct;
    }
}
