package com.hwbscan.analysis;

import java.io.IOException;
import java.sql.SQLException;

public interface SymbolAnalyzer {
    SymbolAnalysisResult analyze(String symbol) throws IOException, SQLException;
}
