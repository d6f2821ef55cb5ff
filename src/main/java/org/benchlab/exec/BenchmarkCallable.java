package org.benchlab.exec;

import java.util.Map;
import org.benchlab.model.Instance;

/**
 * The model or function under test.
 *
 * <p>{@link ProcessTimedExecutor} instantiates the callable inside a fresh JVM, so callables run
 * that way must be public top-level (or public static nested) classes with a public no-arg
 * constructor, configured only through {@code args}.
 */
@FunctionalInterface
public interface BenchmarkCallable {
    BenchmarkOutput call(Instance instance, Map<String, String> args) throws Exception;
}
