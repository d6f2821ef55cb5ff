package org.benchlab.aggregate;

import java.util.List;
import java.util.Map;
import org.benchlab.model.Instance;
import org.benchlab.model.TypeTag;

/**
 * Stateless two-level reduction over all instances of a stage.
 */
public interface Aggregator {
    String name();

    TypeTag typeTag();

    default Map<String, Object> parameters() {
        return Map.of();
    }

    Report aggregate(List<? extends Instance> instances);
}
