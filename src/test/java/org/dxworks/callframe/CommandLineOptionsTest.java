package org.dxworks.callframe;

import org.dxworks.callframe.render.OutputFormat;
import org.junit.jupiter.api.Test;

import java.nio.file.Paths;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CommandLineOptionsTest {

    @Test
    void shortOptions() {
        CommandLineOptions options = CommandLineOptions.parse(new String[]{"-i", "src", "-v", "-f", "json"});

        assertEquals(Paths.get("src"), options.getInput());
        assertTrue(options.isVerbose());
        assertEquals(OutputFormat.JSON, options.getFormat().orElseThrow());
    }

    @Test
    void longOptionsWithDefaults() {
        CommandLineOptions options = CommandLineOptions.parse(new String[]{"--input", "Foo.java"});

        assertEquals(Paths.get("Foo.java"), options.getInput());
        assertFalse(options.isVerbose());
        assertTrue(options.getFormat().isEmpty());
    }

    @Test
    void inputIsRequired() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> CommandLineOptions.parse(new String[]{"-v"}));
        assertTrue(e.getMessage().contains("--input"));
    }

    @Test
    void optionWithoutValueIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> CommandLineOptions.parse(new String[]{"-i"}));
    }

    @Test
    void unknownOptionIsRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> CommandLineOptions.parse(new String[]{"-i", "src", "--recursive"}));
    }

    @Test
    void unknownFormatIsRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> CommandLineOptions.parse(new String[]{"-i", "src", "-f", "svg"}));
    }
}
