package com.compara.stream;

/**
 * Separates connection filler from real output for one model's stream.
 * <p>
 * Some providers hold a slow connection open by emitting a lone space. A
 * whitespace-only fragment is treated as filler when nothing has been produced
 * yet, when the output already ends in whitespace, or when the previous fragment
 * was filler too. Fragments containing a line break are always content.
 * <p>
 * Not thread-safe; one instance per worker.
 */
public class FragmentClassifier {

    private final StringBuilder content = new StringBuilder();
    private boolean lastWasKeepalive;
    private int chunkCount;

    /**
     * @return true if the fragment is content (and was appended), false if it is filler
     */
    public boolean accept(String fragment) {
        if (isKeepalive(fragment)) {
            lastWasKeepalive = true;
            return false;
        }
        lastWasKeepalive = false;
        content.append(fragment);
        chunkCount++;
        return true;
    }

    boolean isKeepalive(String fragment) {
        if (!isFiller(fragment)) {
            return false;
        }
        return content.length() == 0
                || Character.isWhitespace(content.charAt(content.length() - 1))
                || lastWasKeepalive;
    }

    private static boolean isFiller(String fragment) {
        if (fragment.isEmpty() || !fragment.isBlank()) {
            return false;
        }
        return fragment.indexOf('\n') < 0 && fragment.indexOf('\r') < 0;
    }

    public String getContent() {
        return content.toString();
    }

    public int getChunkCount() {
        return chunkCount;
    }
}
