package me.tavon.omnidock.stream.chat;

import me.tavon.omnidock.channel.CanonicalKey;

/**
 * Colors for chat sources that have none configured. Derived only from the key, so a source keeps its
 * color across runs without anything being stored.
 */
public final class SourceColors {

    public static final String PRIMARY_COLOR = "#94b3c3";

    private SourceColors() {
    }

    public static String forKey(CanonicalKey key) {
        if (CanonicalKey.PRIMARY_CHAT.equals(key)) {
            return PRIMARY_COLOR;
        }

        return colorFromString(key.toString());
    }

    /**
     * Picks U and V from the hashes of the string and of its reverse at a fixed luma, which keeps
     * every result readable on a dark background.
     */
    static String colorFromString(String s) {
        double hashU;
        double hashV;

        hashU = s.hashCode() + ((double) Integer.MIN_VALUE * -1D);

        char[] chars = s.toCharArray();

        for (int c = 0; c < chars.length / 2; c++) {
            char x = chars[c];
            chars[c] = chars[chars.length - 1 - c];
            chars[chars.length - 1 - c] = x;
        }

        hashV = new String(chars).hashCode() + ((double) Integer.MIN_VALUE * -1D);

        double randoU = hashU / (Integer.MAX_VALUE + ((double) Integer.MIN_VALUE * -1D));
        double randoV = hashV / (Integer.MAX_VALUE + ((double) Integer.MIN_VALUE * -1D));
        double y = 0.75D;
        double u = randoU - 0.5D;
        double v = randoV - 0.5D;

        double rTmp = y + (1.403 * v);
        double gTmp = y - (0.344 * u) - (0.714 * v);
        double bTmp = y + (1.770 * u);

        int r = (int) Math.round(Math.min(255, Math.max(0, rTmp * 255)));
        int g = (int) Math.round(Math.min(255, Math.max(0, gTmp * 255)));
        int b = (int) Math.round(Math.min(255, Math.max(0, bTmp * 255)));

        return String.format("#%02x%02x%02x", r, g, b);
    }
}
