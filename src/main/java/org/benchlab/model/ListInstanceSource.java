package org.benchlab.model;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * In-memory instance source indexed by position and by id.
 */
public final class ListInstanceSource implements InstanceSource {
    private final List<Instance> instances;
    private final Map<String, Instance> byId;

    public ListInstanceSource(List<? extends Instance> instances) {
        Objects.requireNonNull(instances, "instances");
        List<Instance> copy = new ArrayList<>(instances.size());
        Map<String, Instance> index = new LinkedHashMap<>();
        for (Instance instance : instances) {
            Objects.requireNonNull(instance, "instance");
            if (index.putIfAbsent(instance.id(), instance) != null) {
                throw new IllegalArgumentException("duplicate instance id: " + instance.id());
            }
            copy.add(instance);
        }
        this.instances = List.copyOf(copy);
        this.byId = index;
    }

    public static ListInstanceSource of(Instance... instances) {
        return new ListInstanceSource(List.of(instances));
    }

    @Override
    public Instance get(int index) {
        if (index < 0 || index >= instances.size()) {
            throw new IndexOutOfBoundsException("instance index " + index + " out of range [0, " + instances.size() + ")");
        }
        return instances.get(index);
    }

    @Override
    public Instance get(String id) {
        Instance instance = byId.get(id);
        if (instance == null) {
            throw new IllegalArgumentException("unknown instance id: " + id);
        }
        return instance;
    }

    @Override
    public int size() {
        return instances.size();
    }
}
