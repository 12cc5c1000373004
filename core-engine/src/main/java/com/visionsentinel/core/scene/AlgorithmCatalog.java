package com.visionsentinel.core.scene;

import com.visionsentinel.core.config.AlgorithmDefinition;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Lookup of algorithm codes used by deployment requests.
 *
 * @since 1.0.0
 */
public final class AlgorithmCatalog {

    private final Map<String, AlgorithmDefinition> byCode;

    public AlgorithmCatalog(List<AlgorithmDefinition> definitions) {
        Map<String, AlgorithmDefinition> map = new LinkedHashMap<>();
        for (AlgorithmDefinition d : definitions) {
            d.validate();
            if (map.putIfAbsent(d.getCode(), d) != null) {
                throw new IllegalStateException("Duplicate algorithm code: " + d.getCode());
            }
        }
        this.byCode = Collections.unmodifiableMap(map);
    }

    public Optional<AlgorithmDefinition> find(String code) {
        return Optional.ofNullable(byCode.get(code));
    }

    public Collection<AlgorithmDefinition> all() {
        return byCode.values();
    }

    public int size() {
        return byCode.size();
    }
}
