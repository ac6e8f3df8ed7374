package com.filetree.core.content;

/**
 * Classifies the leading bytes of a file as binary or text.
 * <p>
 * A sample is binary if it contains a NUL byte, or if more than 30% of its
 * bytes fall outside the text allow-list: BEL, BS, TAB, LF, FF, CR, ESC and
 * the range {@code 0x20..0xFF}.
 */
public final class BinaryContentInspector {

    /** Number of leading bytes inspected per file. */
    public static final int SAMPLE_SIZE = 8192;

    private static final double MAX_NON_TEXT_RATIO = 0.30;

    private static final boolean[] TEXT_BYTES = new boolean[256];

    static {
        for (int b : new int[]{7, 8, 9, 10, 12, 13, 27}) {
            TEXT_BYTES[b] = true;
        }
        for (int b = 0x20; b <= 0xFF; b++) {
            TEXT_BYTES[b] = true;
        }
    }

    private BinaryContentInspector() {}

    public static boolean sniff(byte[] sample) {
        return sniff(sample, sample.length);
    }

    /**
     * Inspects the first {@code min(length, SAMPLE_SIZE)} bytes of {@code buffer}.
     *
     * @return {@code true} if the sample looks binary
     */
    public static boolean sniff(byte[] buffer, int length) {
        int size = Math.min(Math.min(length, buffer.length), SAMPLE_SIZE);
        int nonText = 0;
        for (int i = 0; i < size; i++) {
            int b = buffer[i] & 0xFF;
            if (b == 0) {
                return true;
            }
            if (!TEXT_BYTES[b]) {
                nonText++;
            }
        }
        return nonText > size * MAX_NON_TEXT_RATIO;
    }
}
