package dev.py2flow.model;

import java.util.Locale;

public enum JoinType {
    INNER,
    LEFT,
    RIGHT,
    OUTER,
    CROSS;

    /** Maps a pandas {@code how=} value; unknown values fall back to INNER. */
    public static JoinType fromPandas(String how) {
        if (how == null) {
            return INNER;
        }
        return switch (how.toLowerCase(Locale.ROOT)) {
            case "left" -> LEFT;
            case "right" -> RIGHT;
            case "outer", "full" -> OUTER;
            case "cross" -> CROSS;
            default -> INNER;
        };
    }
}
