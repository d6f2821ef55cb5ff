package org.benchlab.registry;

/**
 * Service-provider hook that adds instance, metric and aggregator types to the default
 * registry. Implementations are discovered through {@link java.util.ServiceLoader}.
 */
public interface TypeRegistryContributor {
    void contribute(TypeRegistry.Builder builder);
}
