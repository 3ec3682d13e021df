package com.icodici.names.tools;

public class VerboseLevel
{
    static public final int NOTHING =           0;
    static public final int BASE =              1;
    static public final int DETAILED =          2;

    public static String intToString(int level) {
        if(level == NOTHING)
            return "nothing";
        if(level == BASE)
            return "base";
        if(level == DETAILED)
            return "detailed";
        return "unknown";
    }

    public static int stringToInt(String level) {
        switch (level.trim().toLowerCase()) {
            case "nothing":
                return NOTHING;
            case "base":
                return BASE;
            case "detailed":
                return DETAILED;
            default:
                throw new IllegalArgumentException("unknown verbose level: " + level);
        }
    }
}
