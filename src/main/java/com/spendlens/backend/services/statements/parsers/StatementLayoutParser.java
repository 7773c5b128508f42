package com.spendlens.backend.services.statements.parsers;

import java.util.List;

public interface StatementLayoutParser {

    String name();

    /**
     * @param lines trimmed, non-blank lines of the statement text
     */
    boolean isApplicable(List<String> lines);

    List<StatementRow> parse(List<String> lines);
}
