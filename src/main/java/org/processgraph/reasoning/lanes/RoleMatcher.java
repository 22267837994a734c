package org.processgraph.reasoning.lanes;

import java.util.List;
import java.util.Locale;

/**
 * Case- and separator-insensitive matching of declared roles against lane names.
 */
public class RoleMatcher {

    /**
     * Lower-cases and turns '-', '_', '.' and '/' into spaces, then collapses whitespace.
     * "Support_Agent" and "support-agent" both become "support agent".
     */
    public static String normalize(String value) {
        if (value == null) {
            return "";
        }
        return value.toLowerCase(Locale.ROOT)
                .replaceAll("[-_./]", " ")
                .replaceAll("\\s+", " ")
                .trim();
    }

    /**
     * A role matches a lane when the normalized names are equal, one contains the other,
     * or they differ only by a plural suffix ("manager" / "managers").
     */
    public static boolean roleMatchesLane(String role, String laneName) {
        String r = normalize(role);
        String l = normalize(laneName);
        if (r.isEmpty() || l.isEmpty()) {
            return false;
        }
        return r.equals(l)
                || l.contains(r)
                || r.contains(l)
                || (r + "s").equals(l)
                || r.equals(l + "s")
                || (r + "es").equals(l)
                || r.equals(l + "es");
    }

    /**
     * True when the lane name contains any of the hint fragments.
     */
    public static boolean nameMatchesAnyHint(String laneName, List<String> hints) {
        String l = normalize(laneName);
        for (String hint : hints) {
            String h = normalize(hint);
            if (!h.isEmpty() && l.contains(h)) {
                return true;
            }
        }
        return false;
    }
}
