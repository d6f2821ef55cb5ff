package org.benchlab.exec;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import org.benchlab.fixtures.Callables;
import org.benchlab.model.LabeledInstance;
import org.benchlab.registry.InstanceRecord;
import org.benchlab.registry.TypeRegistry;
import org.junit.jupiter.api.Test;

class IsolatedWorkerTest {
    private static List<String> runWorker(String request, int expectedExit) {
        ByteArrayOutputStream channel = new ByteArrayOutputStream();
        int exitCode = IsolatedWorker.run(
            new ByteArrayInputStream(request.getBytes(StandardCharsets.UTF_8)),
            new PrintStream(channel, true, StandardCharsets.UTF_8),
            TypeRegistry.defaults()
        );
        assertEquals(expectedExit, exitCode);
        return List.of(channel.toString(StandardCharsets.UTF_8).trim().split("\\R"));
    }

    private static TimedExecution resultAfterReady(List<String> lines) {
        assertEquals(2, lines.size(), lines.toString());
        assertTrue(WorkerMessages.isReady(lines.get(0)));
        assertFalse(WorkerMessages.isReady(lines.get(1)));
        return WorkerMessages.decodeResult(lines.get(1), 99.0d);
    }

    private static String request(String callableClass, Map<String, String> args) {
        return WorkerMessages.encodeRequest(new WorkerMessages.Request(
            callableClass,
            InstanceRecord.of(new LabeledInstance("q-1", "What is 6 * 7?", "42")),
            args
        ));
    }

    @Test
    void writesReadyLineThenSuccessLine() {
        TimedExecution execution = resultAfterReady(runWorker(request(Callables.Constant.class.getName(), Map.of()), 0));

        assertEquals(ExecutionOutcome.SUCCESS, execution.outcome());
        assertEquals("42", execution.result().orElseThrow().answer());
        assertTrue(execution.runtimeSeconds() < 99.0d);
    }

    @Test
    void reportsCallableFailureAsErrorLine() {
        TimedExecution execution = resultAfterReady(
            runWorker(request(Callables.Dividing.class.getName(), Map.of("divisor", "0")), 0)
        );

        assertEquals(ExecutionOutcome.ERROR, execution.outcome());
        assertEquals("java.lang.ArithmeticException", execution.errorType().orElseThrow());
    }

    @Test
    void reportsSetupFailureWithoutReadyLine() {
        List<String> lines = runWorker(request("org.benchlab.missing.NoSuchCallable", Map.of()), 2);

        assertEquals(1, lines.size());
        assertFalse(WorkerMessages.isReady(lines.get(0)));
        TimedExecution execution = WorkerMessages.decodeResult(lines.get(0), 99.0d);

        assertEquals(ExecutionOutcome.ERROR, execution.outcome());
        assertEquals("java.lang.ClassNotFoundException", execution.errorType().orElseThrow());
    }

    @Test
    void unreadableResultBecomesProtocolError() {
        TimedExecution execution = WorkerMessages.decodeResult("not json", 1.5d);

        assertEquals(ExecutionOutcome.ERROR, execution.outcome());
        assertEquals("WorkerProtocolException", execution.errorType().orElseThrow());
        assertEquals(1.5d, execution.runtimeSeconds());
    }
}
