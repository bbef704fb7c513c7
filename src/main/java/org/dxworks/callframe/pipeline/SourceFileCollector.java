package org.dxworks.callframe.pipeline;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.stream.Stream;

/**
 * Finds the Java sources to process: the input itself when it is a file, every
 * {@code .java} file below it when it is a directory.
 */
public final class SourceFileCollector {

    private SourceFileCollector() {
        // utility class
    }

    public static boolean isJavaSource(Path path) {
        return path.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".java");
    }

    /**
     * @return matching files sorted by path, so batch positions are stable between runs
     */
    public static List<Path> collect(Path input) throws IOException {
        List<Path> files = new ArrayList<>();

        if (Files.isDirectory(input)) {
            try (Stream<Path> stream = Files.walk(input)) {
                stream.filter(Files::isRegularFile)
                      .filter(SourceFileCollector::isJavaSource)
                      .forEach(files::add);
            }
        } else if (Files.isRegularFile(input)) {
            files.add(input);
        }

        Collections.sort(files);
        return files;
    }
}
