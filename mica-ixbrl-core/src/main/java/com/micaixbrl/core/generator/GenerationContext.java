package com.micaixbrl.core.generator;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Mutable state of one generation call: the fact-id counter and the hidden facts
 * registered while rendering.
 *
 * <p>Create one per call and never share it between calls. Ids are
 * {@code prefix_N} with a single counter across all prefixes, starting at 1.</p>
 */
public final class GenerationContext {

    private final GeneratorConfig config;
    private final List<HiddenFact> hiddenFacts = new ArrayList<>();
    private final Map<String, Integer> issuedPerPrefix = new HashMap<>();
    private int counter;

    public GenerationContext(GeneratorConfig config) {
        this.config = config != null ? config : GeneratorConfig.defaults();
    }

    public GeneratorConfig config() {
        return config;
    }

    /**
     * Issues the next fact id.
     *
     * @param prefix id prefix such as {@code fact}, {@code mica_enum} or {@code dim}
     * @return id unique within this context
     */
    public String nextId(String prefix) {
        counter++;
        issuedPerPrefix.merge(prefix, 1, Integer::sum);
        return prefix + "_" + counter;
    }

    /**
     * Registers an enumeration fact for the hidden block.
     *
     * @param hiddenFact hidden fact entry
     */
    public void registerHiddenFact(HiddenFact hiddenFact) {
        hiddenFacts.add(hiddenFact);
    }

    public List<HiddenFact> hiddenFacts() {
        return Collections.unmodifiableList(hiddenFacts);
    }

    /**
     * Number of ids issued with a prefix.
     *
     * @param prefix id prefix
     * @return issued count
     */
    public int issuedCount(String prefix) {
        return issuedPerPrefix.getOrDefault(prefix, 0);
    }
}
