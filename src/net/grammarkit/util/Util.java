package net.grammarkit.util;

public final class Util {

    private Util() {}

    public static boolean isTrue(String s) {
        if (s == null) return false;
        return (Boolean.parseBoolean(s) || s.equalsIgnoreCase("1") ||
            s.equalsIgnoreCase("y") || s.equalsIgnoreCase("yes") ||
            s.equalsIgnoreCase("on"));
    }

    public static int hashLong(long v) {
        return (int) (v ^ (v >>> 32));
    }

}
