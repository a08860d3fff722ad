package com.questrail.spacelang.macro.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.questrail.spacelang.api.Symbol;
import com.questrail.spacelang.api.Word;
import com.questrail.spacelang.macro.AdmissionRecord;
import com.questrail.spacelang.macro.Macro;
import com.questrail.spacelang.macro.MacroDictionary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * MacroDictionaryStore
 * -----------------------------------------------------------------------------
 * JSON persistence for {@link MacroDictionary}.
 *
 * <h2>Layout</h2>
 * <pre>
 * {
 *   "version": 2,
 *   "macros":  [ { "symbol": "A", "definition": "00", "expansion": "00", "verified": true, "metadata": {...} } ],
 *   "history": [ { "version": 2, "action": "add", "macro": "A := 00 ✓", "symbol": "A" } ]
 * }
 * </pre>
 *
 * <h2>Atomicity</h2>
 * The dictionary is captured with one {@link MacroDictionary#snapshot()},
 * written to a temporary file next to the target and moved over it. A failed
 * save leaves the previous file untouched. Loading validates the whole
 * document before the dictionary is touched.
 */
public final class MacroDictionaryStore
{
    private static final Logger log = LoggerFactory.getLogger(MacroDictionaryStore.class);

    private final ObjectMapper mapper;

    public MacroDictionaryStore() {
        this(JsonMapper.builder()
                .enable(SerializationFeature.INDENT_OUTPUT)
                .build());
    }

    public MacroDictionaryStore(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    public void save(MacroDictionary dictionary, Path path) {
        Objects.requireNonNull(dictionary, "dictionary");
        Objects.requireNonNull(path, "path");

        MacroDictionaryDocument document = toDocument(dictionary.snapshot());
        Path target = path.toAbsolutePath();
        Path tmp = null;
        try {
            Path dir = target.getParent();
            Files.createDirectories(dir);
            tmp = Files.createTempFile(dir, target.getFileName().toString(), ".tmp");
            mapper.writeValue(tmp.toFile(), document);
            move(tmp, target);
            log.info("Saved macro dictionary version {} ({} macros) to {}",
                    document.version(), document.macros().size(), target);
        } catch (IOException e) {
            deleteQuietly(tmp, e);
            throw new MacroDictionaryStoreException("Failed to save macro dictionary to " + target, e);
        }
    }

    /**
     * Reads a dictionary from {@code path} into a new {@link MacroDictionary}.
     */
    public MacroDictionary load(Path path) {
        return load(path, new MacroDictionary());
    }

    /**
     * Replaces the state of {@code into} with the dictionary stored at {@code path}.
     */
    public MacroDictionary load(Path path, MacroDictionary into) {
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(into, "into");

        if (!Files.isReadable(path)) {
            throw new MacroDictionaryStoreException("Macro dictionary not readable: " + path);
        }
        MacroDictionaryDocument document;
        try {
            document = mapper.readValue(path.toFile(), MacroDictionaryDocument.class);
        } catch (IOException e) {
            throw new MacroDictionaryStoreException("Failed to read macro dictionary from " + path, e);
        }

        MacroDictionary.Snapshot snapshot;
        try {
            snapshot = fromDocument(document);
            into.restore(snapshot);
        } catch (IllegalArgumentException | NullPointerException e) {
            throw new MacroDictionaryStoreException("Malformed macro dictionary in " + path, e);
        }
        log.info("Loaded macro dictionary version {} ({} macros) from {}",
                snapshot.version(), snapshot.macros().size(), path);
        return into;
    }

    static MacroDictionaryDocument toDocument(MacroDictionary.Snapshot snapshot) {
        MacroDictionary expander = new MacroDictionary();
        expander.restore(snapshot);

        List<MacroDictionaryDocument.MacroEntry> macros = new ArrayList<>();
        for (Macro m : snapshot.macros()) {
            macros.add(new MacroDictionaryDocument.MacroEntry(
                    m.symbol().value(),
                    m.definition().toString(),
                    expander.expand(m.definition()).toString(),
                    m.verified(),
                    m.metadata()));
        }
        List<MacroDictionaryDocument.HistoryEntry> history = new ArrayList<>();
        for (AdmissionRecord r : snapshot.history()) {
            history.add(new MacroDictionaryDocument.HistoryEntry(
                    r.version(), r.action(), r.macro(), r.symbol().value()));
        }
        return new MacroDictionaryDocument(snapshot.version(), macros, history);
    }

    static MacroDictionary.Snapshot fromDocument(MacroDictionaryDocument document) {
        Objects.requireNonNull(document, "document");
        List<Macro> macros = new ArrayList<>();
        for (MacroDictionaryDocument.MacroEntry e : nullToEmpty(document.macros())) {
            Map<String, Object> metadata = e.metadata() == null ? Map.of() : e.metadata();
            Macro m = Macro.propose(Symbol.of(e.symbol()), Word.of(e.definition()), metadata);
            macros.add(e.verified() ? m.asVerified() : m);
        }
        List<AdmissionRecord> history = new ArrayList<>();
        for (MacroDictionaryDocument.HistoryEntry h : nullToEmpty(document.history())) {
            history.add(new AdmissionRecord(h.version(), h.action(), h.macro(), Symbol.of(h.symbol())));
        }
        return new MacroDictionary.Snapshot(document.version(), macros, history);
    }

    private static <T> List<T> nullToEmpty(List<T> list) {
        return list == null ? List.of() : list;
    }

    private static void move(Path from, Path to) throws IOException {
        try {
            Files.move(from, to, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            log.debug("Atomic move not supported for {}, falling back to replace", to);
            Files.move(from, to, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void deleteQuietly(Path tmp, IOException failure) {
        if (tmp == null) {
            return;
        }
        try {
            Files.deleteIfExists(tmp);
        } catch (IOException suppressed) {
            failure.addSuppressed(suppressed);
        }
    }
}
