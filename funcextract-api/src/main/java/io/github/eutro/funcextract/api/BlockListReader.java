package io.github.eutro.funcextract.api;

import io.github.eutro.funcextract.core.analysis.Diagnostic;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads block lists.
 * <p>
 * A block list is line oriented. A line starting with {@code !} names a function, and the lines
 * after it, up to the next such line, name the blocks of that function's region:
 * <pre>
 * !main
 * entry
 * for.body
 * !helper
 * </pre>
 * Lines are trimmed, and blank lines are skipped. A function listed twice gets the blocks of both entries.
 * Block lines before the first function are reported as {@link Diagnostic.Kind#MALFORMED_INPUT malformed}
 * and skipped.
 */
public final class BlockListReader {
    private static final Logger log = LoggerFactory.getLogger(BlockListReader.class);

    private BlockListReader() {
    }

    /**
     * Read a block list from a file.
     *
     * @param path The file.
     * @return The block list.
     * @throws ConfigurationException If the file can't be read.
     */
    public static BlockList read(Path path) throws ConfigurationException {
        if (!Files.isRegularFile(path)) {
            throw new ConfigurationException("Block list " + path + " does not exist");
        }
        try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            BlockList list = read(reader);
            log.info("Read {} function(s) from {}", list.getFunctions().size(), path);
            return list;
        } catch (IOException e) {
            throw new ConfigurationException("Failed to read block list " + path, e);
        }
    }

    /**
     * Read a block list from a reader. The reader is not closed.
     *
     * @param reader The reader.
     * @return The block list.
     * @throws IOException If reading fails.
     */
    public static BlockList read(Reader reader) throws IOException {
        BufferedReader br = reader instanceof BufferedReader
                ? (BufferedReader) reader
                : new BufferedReader(reader);
        List<String> lines = new ArrayList<>();
        String line;
        while ((line = br.readLine()) != null) {
            lines.add(line);
        }
        return parse(lines);
    }

    /**
     * Parse a block list from its lines.
     *
     * @param lines The lines.
     * @return The block list.
     */
    public static BlockList parse(Iterable<String> lines) {
        BlockList list = new BlockList();
        String function = null;
        int lineNo = 0;
        for (String raw : lines) {
            lineNo++;
            String line = raw.trim();
            if (line.isEmpty()) continue;
            if (line.startsWith("!")) {
                function = line.substring(1).trim();
                if (list.hasFunction(function)) {
                    log.debug("Function {} listed again on line {}, merging", function, lineNo);
                }
                list.addFunction(function);
            } else if (function == null) {
                String message = "Block " + line + " on line " + lineNo + " has no function";
                log.warn("{}, skipping", message);
                list.addDiagnostic(new Diagnostic(Diagnostic.Kind.MALFORMED_INPUT, message));
            } else {
                list.addBlock(function, line);
            }
        }
        return list;
    }
}
