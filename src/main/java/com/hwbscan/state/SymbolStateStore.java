package com.hwbscan.state;

import com.hwbscan.model.SymbolState;

import java.io.IOException;
import java.util.Optional;

/**
 * Key-value persistence of per-symbol pattern state. Each save replaces the whole document.
 */
public interface SymbolStateStore {
    Optional<SymbolState> load(String symbol) throws IOException;

    void save(String symbol, SymbolState state) throws IOException;
}
