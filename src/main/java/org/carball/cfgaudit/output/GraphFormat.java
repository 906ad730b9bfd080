package org.carball.cfgaudit.output;

public enum GraphFormat {
    DOT("dot"),
    MERMAID("mmd");

    private final String fileExtension;

    GraphFormat(String fileExtension) {
        this.fileExtension = fileExtension;
    }

    public String getFileExtension() {
        return fileExtension;
    }

    public GraphExporter createExporter(LabelWrapper labelWrapper) {
        GraphDescriber describer = new GraphDescriber(labelWrapper);
        return switch (this) {
            case DOT -> new DotGraphExporter(describer);
            case MERMAID -> new MermaidGraphExporter(describer);
        };
    }
}
