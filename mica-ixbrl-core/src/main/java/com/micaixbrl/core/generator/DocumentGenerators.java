package com.micaixbrl.core.generator;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.ServiceLoader;

/**
 * Discovers {@link DocumentGenerator} implementations registered through {@link ServiceLoader}.
 */
public final class DocumentGenerators {

    private DocumentGenerators() {
        // Utility class
    }

    /**
     * Loads all registered generators, sorted by id.
     *
     * @return generators
     */
    public static List<DocumentGenerator> all() {
        List<DocumentGenerator> generators = new ArrayList<>();
        ServiceLoader.load(DocumentGenerator.class).forEach(generators::add);
        generators.sort(Comparator.comparing(DocumentGenerator::getId));
        return generators;
    }

    public static Optional<DocumentGenerator> byId(String id) {
        return all().stream()
            .filter(generator -> generator.getId().equalsIgnoreCase(id))
            .findFirst();
    }
}
