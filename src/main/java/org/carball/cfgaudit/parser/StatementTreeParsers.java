package org.carball.cfgaudit.parser;

import java.nio.file.Path;
import java.util.Locale;

public final class StatementTreeParsers {

    private StatementTreeParsers() {
    }

    /**
     * JSON statement trees for {@code .json} files, Java source for everything else.
     */
    public static StatementTreeParser forFile(Path file) {
        String name = file.getFileName().toString().toLowerCase(Locale.ROOT);
        if (name.endsWith(".json")) {
            return new JsonStatementTreeParser();
        }
        return new JavaSourceParser();
    }
}
