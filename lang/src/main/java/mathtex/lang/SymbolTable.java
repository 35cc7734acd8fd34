package mathtex.lang;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import lombok.AccessLevel;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;

/**
 * Read-only mapping from source names ({@code alpha}, {@code sqrt}) to LaTeX
 * fragments ({@code \alpha}, {@code \sqrt}).
 *
 * <p>Definitions are {@code key = value} lines. Surrounding whitespace is
 * trimmed, and a line that does not split into exactly two parts on {@code =}
 * is skipped.
 */
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
public final class SymbolTable {

    private static final Logger logger = LoggerFactory.getLogger(SymbolTable.class);

    /** Classpath location of the bundled definitions. */
    public static final String DEFAULT_RESOURCE = "/symbols.txt";

    private final Map<String, String> symbols;

    public static SymbolTable of(@NonNull Map<String, String> symbols) {
        return new SymbolTable(Map.copyOf(symbols));
    }

    /**
     * Loads the definitions bundled with the library.
     *
     * @throws IllegalStateException if the resource is missing from the classpath
     */
    public static SymbolTable load() {
        var in = SymbolTable.class.getResourceAsStream(DEFAULT_RESOURCE);
        if (in == null) {
            throw new IllegalStateException("Missing symbol definitions: " + DEFAULT_RESOURCE);
        }
        try (var reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
            var table = read(reader);
            logger.debug("Loaded {} symbols from {}", table.size(), DEFAULT_RESOURCE);
            return table;
        } catch (IOException ex) {
            throw new UncheckedIOException("Cannot read " + DEFAULT_RESOURCE, ex);
        }
    }

    public static SymbolTable load(@NonNull Path path) throws IOException {
        try (var reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            var table = read(reader);
            logger.debug("Loaded {} symbols from {}", table.size(), path);
            return table;
        }
    }

    public static SymbolTable read(@NonNull Reader reader) throws IOException {
        var symbols = new LinkedHashMap<String, String>();
        var buffered = reader instanceof BufferedReader br ? br : new BufferedReader(reader);
        String line;
        while ((line = buffered.readLine()) != null) {
            var parts = line.split("=", -1);
            if (parts.length != 2) {
                continue;
            }
            symbols.put(parts[0].trim(), parts[1].trim());
        }
        return new SymbolTable(Map.copyOf(symbols));
    }

    public Optional<String> lookup(String name) {
        return Optional.ofNullable(symbols.get(name));
    }

    /** The mapped fragment, or {@code name} itself when there is none. */
    public String resolve(String name) {
        return symbols.getOrDefault(name, name);
    }

    public boolean contains(String name) {
        return symbols.containsKey(name);
    }

    public int size() {
        return symbols.size();
    }
}
