package com.questrail.spacelang.macro.store;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;
import java.util.Map;

/**
 * On-disk layout of a macro dictionary.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record MacroDictionaryDocument(
        int version,
        List<MacroEntry> macros,
        List<HistoryEntry> history
) {
    /**
     * One macro. {@code definition} is the flat text of the definition word
     * and may mention symbols of earlier macros; {@code expansion} is the same
     * definition spelled over {@code {0, |}} only. Loading reads
     * {@code definition} and ignores {@code expansion}.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record MacroEntry(
            String symbol,
            String definition,
            String expansion,
            boolean verified,
            Map<String, Object> metadata
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record HistoryEntry(int version, String action, String macro, String symbol) {}
}
