package org.benchlab.fixtures;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.benchlab.exec.BenchmarkCallable;
import org.benchlab.exec.BenchmarkOutput;
import org.benchlab.model.Instance;

/**
 * Replays a fixed sequence of answers per instance id. The answer {@link #FAIL} throws.
 */
public final class ScriptedCallable implements BenchmarkCallable {
    public static final String FAIL = "!fail";

    private final Map<String, Deque<String>> scripts = new HashMap<>();

    public ScriptedCallable script(String instanceId, List<String> answers) {
        scripts.put(instanceId, new ArrayDeque<>(answers));
        return this;
    }

    @Override
    public synchronized BenchmarkOutput call(Instance instance, Map<String, String> args) {
        Deque<String> answers = scripts.get(instance.id());
        if (answers == null || answers.isEmpty()) {
            throw new IllegalStateException("no scripted answer left for " + instance.id());
        }
        String answer = answers.removeFirst();
        if (FAIL.equals(answer)) {
            throw new IllegalStateException("scripted failure for " + instance.id());
        }
        return BenchmarkOutput.of(answer, Map.of("tokens", (long) answer.length()));
    }
}
