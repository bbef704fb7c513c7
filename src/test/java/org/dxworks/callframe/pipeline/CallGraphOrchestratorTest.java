package org.dxworks.callframe.pipeline;

import org.dxworks.callframe.analyzer.MethodAttribution;
import org.dxworks.callframe.analyzer.StructuralException;
import org.dxworks.callframe.render.DotGraphRenderer;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CallGraphOrchestratorTest {

    @TempDir
    Path tempDir;

    private final CallGraphOrchestrator orchestrator = new CallGraphOrchestrator(
            new CallGraphPipeline(new DotGraphRenderer(), MethodAttribution.GLOBAL));

    @Test
    void malformedFilesDoNotStopTheBatch() throws IOException {
        List<Path> files = new ArrayList<>();
        for (int i = 0; i < 8; i++) {
            String name = "Worker" + i;
            String source = i % 4 == 3
                    ? "class " + name + "<T> { T item; }"
                    : "class " + name + " { void work() { step" + i + "(); } }";
            files.add(Files.writeString(tempDir.resolve(name + ".java"), source));
        }

        List<FileOutcome> outcomes = orchestrator.run(files);

        assertEquals(8, outcomes.size());
        for (int i = 0; i < 8; i++) {
            FileOutcome outcome = outcomes.get(i);
            Path expectedOutput = tempDir.resolve("Worker" + i + ".dot");
            assertEquals(files.get(i), outcome.getSource());
            assertEquals((i + 1) + "/8", outcome.getProgress());
            if (i % 4 == 3) {
                assertFalse(outcome.isSuccess());
                assertNull(outcome.getOutput());
                assertInstanceOf(StructuralException.class, outcome.getError());
                assertFalse(Files.exists(expectedOutput));
            } else {
                assertTrue(outcome.isSuccess());
                assertEquals(expectedOutput, outcome.getOutput());
                assertTrue(Files.readString(expectedOutput).contains("\"work\" -> \"step" + i + "\";"));
            }
        }
    }

    @Test
    void deeplyNestedSourceFailsOnlyItself() throws IOException {
        Path good = Files.writeString(tempDir.resolve("Good.java"), "class Good { void run() { step(); } }");
        String nested = "(".repeat(20000) + "1" + ")".repeat(20000);
        Path deep = Files.writeString(tempDir.resolve("Deep.java"), "class Deep { int x = " + nested + "; }");

        List<FileOutcome> outcomes = orchestrator.run(List.of(good, deep));

        assertEquals(2, outcomes.size());
        assertTrue(outcomes.get(0).isSuccess());
        assertTrue(Files.exists(tempDir.resolve("Good.dot")));
        assertFalse(outcomes.get(1).isSuccess());
        assertInstanceOf(StackOverflowError.class, outcomes.get(1).getError());
        assertFalse(Files.exists(tempDir.resolve("Deep.dot")));
    }

    @Test
    void sourceOverLineLimitIsReportedAsFailure() throws IOException {
        Path small = Files.writeString(tempDir.resolve("Small.java"), "class Small { void run() { step(); } }");
        Path large = Files.writeString(tempDir.resolve("Large.java"), "class Large {\n    void run() {}\n}\n");
        CallGraphOrchestrator limited = new CallGraphOrchestrator(
                new CallGraphPipeline(new DotGraphRenderer(), MethodAttribution.GLOBAL, 1));

        List<FileOutcome> outcomes = limited.run(List.of(large, small));

        assertEquals(2, outcomes.size());
        assertEquals(large, outcomes.get(0).getSource());
        assertEquals("1/2", outcomes.get(0).getProgress());
        assertInstanceOf(SourceTooLargeException.class, outcomes.get(0).getError());
        assertTrue(outcomes.get(1).isSuccess());
        assertFalse(Files.exists(tempDir.resolve("Large.dot")));
    }

    @Test
    void emptyBatchCompletes() {
        assertTrue(orchestrator.run(List.of()).isEmpty());
    }
}
