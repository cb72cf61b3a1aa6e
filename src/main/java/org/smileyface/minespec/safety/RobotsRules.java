package org.smileyface.minespec.safety;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Allow/Disallow rules from a robots.txt body that apply to one user agent.
 *
 * <p>The group naming the agent's product token wins over the {@code *} group. Within the chosen
 * group the longest matching path pattern decides; on equal length Allow wins. Patterns support
 * {@code *} (any run of characters) and a trailing {@code $} (end of path). An empty or unreadable
 * robots.txt allows everything.</p>
 */
public final class RobotsRules {

    private static final RobotsRules ALLOW_ALL = new RobotsRules(List.of());

    private final List<Rule> rules;

    private RobotsRules(List<Rule> rules) {
        this.rules = rules;
    }

    public static RobotsRules allowAll() {
        return ALLOW_ALL;
    }

    /**
     * Parses a robots.txt body for the given user agent string.
     */
    public static RobotsRules parse(String robotsTxt, String userAgent) {
        if (robotsTxt == null || robotsTxt.isBlank()) {
            return ALLOW_ALL;
        }
        String token = productToken(userAgent);

        List<Rule> specific = new ArrayList<>();
        List<Rule> wildcard = new ArrayList<>();
        boolean specificSeen = false;

        List<String> groupAgents = new ArrayList<>();
        List<Rule> groupRules = new ArrayList<>();
        boolean inRules = false;

        for (String rawLine : robotsTxt.split("\\r?\\n|\\r")) {
            String line = rawLine;
            int hash = line.indexOf('#');
            if (hash >= 0) line = line.substring(0, hash);
            int colon = line.indexOf(':');
            if (colon < 0) continue;
            String field = line.substring(0, colon).trim().toLowerCase(Locale.ROOT);
            String value = line.substring(colon + 1).trim();

            switch (field) {
                case "user-agent" -> {
                    if (inRules) {
                        specificSeen |= assign(groupAgents, groupRules, token, specific, wildcard);
                        groupAgents = new ArrayList<>();
                        groupRules = new ArrayList<>();
                        inRules = false;
                    }
                    groupAgents.add(value.toLowerCase(Locale.ROOT));
                }
                case "allow", "disallow" -> {
                    inRules = true;
                    if (groupAgents.isEmpty()) continue;
                    if (value.isEmpty()) {
                        // "Disallow:" with no path allows everything; nothing to record
                        continue;
                    }
                    groupRules.add(new Rule(value, field.equals("allow")));
                }
                default -> {
                    // sitemap, crawl-delay and unknown fields are ignored
                }
            }
        }
        specificSeen |= assign(groupAgents, groupRules, token, specific, wildcard);

        List<Rule> chosen = specificSeen ? specific : wildcard;
        return chosen.isEmpty() ? ALLOW_ALL : new RobotsRules(List.copyOf(chosen));
    }

    /**
     * Whether the given path (including any query string) may be fetched.
     */
    public boolean isAllowed(String path) {
        String p = (path == null || path.isEmpty()) ? "/" : path;
        Rule best = null;
        for (Rule r : rules) {
            if (!r.matches(p)) continue;
            if (best == null
                    || r.pattern.length() > best.pattern.length()
                    || (r.pattern.length() == best.pattern.length() && r.allow && !best.allow)) {
                best = r;
            }
        }
        return best == null || best.allow;
    }

    public boolean isAllowAll() {
        return rules.isEmpty();
    }

    private static boolean assign(List<String> agents, List<Rule> rules, String token,
                                  List<Rule> specific, List<Rule> wildcard) {
        boolean matchedSpecific = false;
        for (String agent : agents) {
            if (agent.equals("*")) {
                wildcard.addAll(rules);
            } else if (!token.isEmpty() && token.contains(agent)) {
                specific.addAll(rules);
                matchedSpecific = true;
            }
        }
        return matchedSpecific;
    }

    private static String productToken(String userAgent) {
        if (userAgent == null) return "";
        String ua = userAgent.trim().toLowerCase(Locale.ROOT);
        int slash = ua.indexOf('/');
        int space = ua.indexOf(' ');
        int end = ua.length();
        if (slash >= 0) end = Math.min(end, slash);
        if (space >= 0) end = Math.min(end, space);
        return ua.substring(0, end);
    }

    private static final class Rule {
        private final String pattern;
        private final boolean allow;

        private Rule(String pattern, boolean allow) {
            this.pattern = pattern;
            this.allow = allow;
        }

        boolean matches(String path) {
            boolean anchored = pattern.endsWith("$");
            String pat = anchored ? pattern.substring(0, pattern.length() - 1) : pattern;
            return matchFrom(pat, 0, path, 0, anchored);
        }

        // Iterative wildcard match with single-star backtracking; linear in practice.
        private static boolean matchFrom(String pat, int pi, String s, int si, boolean anchored) {
            int starPi = -1;
            int starSi = -1;
            while (si < s.length()) {
                if (pi < pat.length() && pat.charAt(pi) == '*') {
                    starPi = pi++;
                    starSi = si;
                } else if (pi < pat.length() && pat.charAt(pi) == s.charAt(si)) {
                    pi++;
                    si++;
                } else if (pi == pat.length() && !anchored) {
                    return true;
                } else if (starPi >= 0) {
                    pi = starPi + 1;
                    si = ++starSi;
                } else {
                    return false;
                }
            }
            while (pi < pat.length() && pat.charAt(pi) == '*') pi++;
            return pi == pat.length();
        }
    }
}
