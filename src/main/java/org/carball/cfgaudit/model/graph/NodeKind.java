package org.carball.cfgaudit.model.graph;

import lombok.Getter;

@Getter
public enum NodeKind {
    START("start"),
    END("end"),
    PROCESS("process"),
    DECISION("decision"),
    INPUT("input"),
    OUTPUT("output"),
    CALL("call");

    private final String token;

    NodeKind(String token) {
        this.token = token;
    }
}
