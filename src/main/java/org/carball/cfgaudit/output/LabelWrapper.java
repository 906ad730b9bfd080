package org.carball.cfgaudit.output;

import java.util.ArrayList;
import java.util.List;

/**
 * Greedy word wrap. Labels no longer than the width are left alone; longer ones are broken at
 * whitespace only, so a single word wider than the column stays on its own line.
 */
public class LabelWrapper {

    public static final int DEFAULT_WIDTH = 30;

    private final int width;

    public LabelWrapper() {
        this(DEFAULT_WIDTH);
    }

    public LabelWrapper(int width) {
        if (width < 1) {
            throw new IllegalArgumentException("Wrap width must be positive: " + width);
        }
        this.width = width;
    }

    public int getWidth() {
        return width;
    }

    public List<String> wrap(String label) {
        if (label.length() <= width) {
            return List.of(label);
        }
        if (label.isBlank()) {
            return List.of(label.strip());
        }

        List<String> lines = new ArrayList<>();
        StringBuilder line = new StringBuilder();
        int lineLength = 0;
        for (String word : label.trim().split("\\s+")) {
            if (lineLength + word.length() + 1 <= width) {
                if (line.length() > 0) {
                    line.append(' ');
                }
                line.append(word);
                lineLength += word.length() + 1;
            } else {
                if (line.length() > 0) {
                    lines.add(line.toString());
                }
                line = new StringBuilder(word);
                lineLength = word.length();
            }
        }
        if (line.length() > 0) {
            lines.add(line.toString());
        }
        return lines;
    }
}
