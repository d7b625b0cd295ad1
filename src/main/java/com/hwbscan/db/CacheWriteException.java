package com.hwbscan.db;

import java.sql.SQLException;

/**
 * The transactional replace of a symbol's cached series failed and was rolled back.
 */
public class CacheWriteException extends SQLException {
    private final String symbol;

    public CacheWriteException(String symbol, SQLException cause) {
        super("cache replace failed for " + symbol + ": " + cause.getMessage(), cause.getSQLState(), cause.getErrorCode(), cause);
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }
}
