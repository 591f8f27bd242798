package io.github.eutro.funcextract.api;

import io.github.eutro.funcextract.core.analysis.Diagnostic;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;

import static org.junit.jupiter.api.Assertions.*;

public class BlockListReaderTest {
    static Set<String> names(String... names) {
        return new LinkedHashSet<>(Arrays.asList(names));
    }

    @Test
    void testParse() throws IOException {
        BlockList list = BlockListReader.read(new StringReader(
                "!countdown\n" +
                        "  while.cond  \n" +
                        "\n" +
                        "while.body\n" +
                        "! helper \n" +
                        "entry\n"));
        assertEquals(names("countdown", "helper"), list.getFunctions());
        assertEquals(names("while.cond", "while.body"), list.getBlocks("countdown"));
        assertEquals(names("entry"), list.getBlocks("helper"));
        assertTrue(list.getDiagnostics().isEmpty());
    }

    @Test
    void testEmptyEntry() {
        BlockList list = BlockListReader.parse(Arrays.asList("!foo", "!bar", "exit"));
        assertTrue(list.hasFunction("foo"));
        assertTrue(list.getBlocks("foo").isEmpty());
        assertEquals(names("exit"), list.getBlocks("bar"));
        assertTrue(list.getBlocks("baz").isEmpty());
        assertFalse(list.hasFunction("baz"));
    }

    @Test
    void testOrphanBlocks() {
        BlockList list = BlockListReader.parse(Arrays.asList("entry", "", "loop", "!main", "body"));
        assertEquals(names("main"), list.getFunctions());
        assertEquals(names("body"), list.getBlocks("main"));
        assertEquals(2, list.getDiagnostics().size());
        Diagnostic first = list.getDiagnostics().get(0);
        assertEquals(Diagnostic.Kind.MALFORMED_INPUT, first.getKind());
        assertTrue(first.getMessage().contains("line 1"));
        assertTrue(list.getDiagnostics().get(1).getMessage().contains("line 3"));
    }

    @Test
    void testRepeatedHeadersMerge() {
        BlockList list = BlockListReader.parse(Arrays.asList("!main", "a", "!other", "x", "!main", "b", "a"));
        assertEquals(names("a", "b"), list.getBlocks("main"));
        assertEquals(names("main", "other"), list.getFunctions());
    }

    @Test
    void testReadFile(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("blocks.txt");
        Files.write(file, Arrays.asList("!countdown", "while.cond", "while.body"), StandardCharsets.UTF_8);
        BlockList list = BlockListReader.read(file);
        assertEquals(names("while.cond", "while.body"), list.getBlocks("countdown"));
    }

    @Test
    void testMissingFile(@TempDir Path dir) {
        assertThrows(ConfigurationException.class, () -> BlockListReader.read(dir.resolve("missing.txt")));
        assertThrows(ConfigurationException.class, () -> BlockListReader.read(dir));
    }
}
