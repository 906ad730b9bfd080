package org.carball.cfgaudit.config;

public enum OutputFormat {
    JSON,
    MARKDOWN,
    BOTH
}
