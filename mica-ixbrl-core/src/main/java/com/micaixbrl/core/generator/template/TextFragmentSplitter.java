package com.micaixbrl.core.generator.template;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits oversized text into fragments for continuation chains.
 *
 * <p>Each chunk ends at the last paragraph break, else line break, else space within the
 * threshold, provided that boundary lies past 30% of the chunk; otherwise the chunk is cut
 * at the threshold. Separators stay with the preceding fragment, so joining the fragments
 * reproduces the input exactly.</p>
 */
public final class TextFragmentSplitter {

    private TextFragmentSplitter() {
        // Utility class
    }

    private static final double MIN_BOUNDARY_RATIO = 0.3;

    /**
     * Splits text into fragments of at most {@code threshold} characters.
     *
     * @param text text to split
     * @param threshold maximum fragment length, positive
     * @return fragments in order; a single fragment when the text fits
     */
    public static List<String> split(String text, int threshold) {
        if (threshold <= 0) {
            throw new IllegalArgumentException("threshold must be positive: " + threshold);
        }
        if (text == null) {
            return List.of("");
        }
        if (text.length() <= threshold) {
            return List.of(text);
        }

        List<String> fragments = new ArrayList<>();
        double minimumBoundary = threshold * MIN_BOUNDARY_RATIO;
        String remaining = text;
        while (!remaining.isEmpty()) {
            if (remaining.length() <= threshold) {
                fragments.add(remaining);
                break;
            }
            String chunk = remaining.substring(0, threshold);
            int splitIndex = boundary(chunk, "\n\n", minimumBoundary);
            if (splitIndex < 0) {
                splitIndex = boundary(chunk, "\n", minimumBoundary);
            }
            if (splitIndex < 0) {
                splitIndex = boundary(chunk, " ", minimumBoundary);
            }
            if (splitIndex < 0) {
                splitIndex = threshold;
            }
            fragments.add(remaining.substring(0, splitIndex));
            remaining = remaining.substring(splitIndex);
        }
        return List.copyOf(fragments);
    }

    private static int boundary(String chunk, String separator, double minimumBoundary) {
        int index = chunk.lastIndexOf(separator);
        return index > minimumBoundary ? index + separator.length() : -1;
    }
}
