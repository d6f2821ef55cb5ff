package org.benchlab.fixtures;

import org.benchlab.registry.TypeRegistry;
import org.benchlab.registry.TypeRegistryContributor;

public final class MathQaRegistryContributor implements TypeRegistryContributor {
    @Override
    public void contribute(TypeRegistry.Builder builder) {
        builder.registerInstance(MathQaInstance.TYPE_TAG, MathQaInstance::fromRecord);
    }
}
