package org.dxworks.callframe.pipeline;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.stream.Collectors;

/**
 * Runs one {@link CallGraphPipeline} per file, all of them concurrently, and waits for every
 * one to finish. A failing file is logged and reported in its {@link FileOutcome}; it never
 * stops the rest of the batch.
 */
public class CallGraphOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(CallGraphOrchestrator.class);

    private final CallGraphPipeline pipeline;

    public CallGraphOrchestrator(CallGraphPipeline pipeline) {
        this.pipeline = pipeline;
    }

    /**
     * @return one outcome per input file, in input order
     */
    public List<FileOutcome> run(List<Path> files) {
        ExecutorService executor = Executors.newCachedThreadPool();
        try {
            int total = files.size();
            List<CompletableFuture<FileOutcome>> futures = new ArrayList<>(total);
            for (int i = 0; i < total; i++) {
                Path file = files.get(i);
                String progress = (i + 1) + "/" + total;
                futures.add(CompletableFuture.supplyAsync(() -> processFile(file, progress), executor));
            }
            return futures.stream()
                    .map(CompletableFuture::join)
                    .collect(Collectors.toList());
        } finally {
            executor.shutdown();
        }
    }

    private FileOutcome processFile(Path file, String progress) {
        try {
            Path output = pipeline.process(file);
            log.info("[{}] create java callgraph success for {}", progress, file);
            return FileOutcome.success(file, output, progress);
        } catch (Exception e) {
            log.error("[{}] create java callgraph failed for {}: {}", progress, file, e.getMessage());
            log.debug("Failure details for {}", file, e);
            return FileOutcome.failure(file, progress, e);
        } catch (StackOverflowError e) {
            // Deeply nested expressions exhaust the recursive parser and tree walker
            log.error("[{}] create java callgraph failed for {}: source nesting too deep", progress, file);
            return FileOutcome.failure(file, progress, e);
        }
    }
}
