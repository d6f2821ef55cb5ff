package org.benchlab.model;

/**
 * Indexable collection of instances a benchmark selects from.
 */
public interface InstanceSource {
    Instance get(int index);

    /**
     * @throws IllegalArgumentException when no instance has the id
     */
    Instance get(String id);

    int size();
}
