package com.hts.telemetry.codec.json;

import com.hts.telemetry.codec.exception.ConfigurationException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Named path filter: one anchored regex per depth of the JSON tree.
 *
 * "Interfaces~(?&lt;InterfaceName&gt;.*)~Latest" matches key "Interfaces" at depth 0,
 * captures the interface name at depth 1 and completes at depth 2.
 */
public final class FilterEntry {
    private static final Pattern NAMED_GROUP = Pattern.compile("\\(\\?<([a-zA-Z][a-zA-Z0-9]*)>");

    private final String name;
    private final List<String> atoms;
    private final List<Pattern> patterns;
    private final List<List<String>> groupNames;

    private FilterEntry(String name, List<String> atoms, List<Pattern> patterns, List<List<String>> groupNames) {
        this.name = name;
        this.atoms = atoms;
        this.patterns = patterns;
        this.groupNames = groupNames;
    }

    public static FilterEntry compile(String name, String filter, String delimiter) {
        if (name == null || filter == null) {
            throw new ConfigurationException("Filter name and expression are required",
                    ConfigurationException.INVALID_FILTER);
        }
        List<String> atoms = new ArrayList<>();
        if (!filter.isEmpty()) {
            Collections.addAll(atoms, filter.split(Pattern.quote(delimiter)));
        }

        List<Pattern> patterns = new ArrayList<>(atoms.size());
        List<List<String>> groupNames = new ArrayList<>(atoms.size());
        for (String atom : atoms) {
            try {
                patterns.add(Pattern.compile("^" + atom + "$"));
            } catch (PatternSyntaxException e) {
                throw new ConfigurationException("Filter '" + name + "' has invalid regex '" + atom + "'",
                        ConfigurationException.INVALID_FILTER, e);
            }
            groupNames.add(namedGroups(atom));
        }
        return new FilterEntry(name, List.copyOf(atoms), List.copyOf(patterns), List.copyOf(groupNames));
    }

    // Pattern.namedGroups() only exists from JDK 20
    private static List<String> namedGroups(String atom) {
        List<String> names = new ArrayList<>();
        Matcher m = NAMED_GROUP.matcher(atom);
        while (m.find()) {
            names.add(m.group(1));
        }
        return List.copyOf(names);
    }

    public String name() { return name; }

    /** Number of tree levels this filter spans. */
    public int depth() { return patterns.size(); }

    public boolean hasDepth(int depth) {
        return depth >= 0 && depth < patterns.size();
    }

    /**
     * @return matcher positioned on a whole-key match, or null when the key does not
     *         match or the filter has no regex at this depth
     */
    public Matcher match(int depth, String key) {
        if (!hasDepth(depth)) {
            return null;
        }
        Matcher m = patterns.get(depth).matcher(key);
        return m.matches() ? m : null;
    }

    /**
     * Returns {@code captured} extended with the named groups this depth captured.
     */
    public Map<String, String> capture(int depth, Matcher m, Map<String, String> captured) {
        List<String> names = groupNames.get(depth);
        if (names.isEmpty()) {
            return captured;
        }
        Map<String, String> next = new LinkedHashMap<>(captured);
        for (String group : names) {
            next.put(group, m.group(group));
        }
        return Collections.unmodifiableMap(next);
    }

    /**
     * Positional match of raw source path segments, used for leaf values nothing else
     * claimed. Needs one regex per segment; an atom holding ".*" or the digit class "\d"
     * counts as a match without being evaluated.
     *
     * Only the two-character sequence {@code \d} marks a wildcard. Atoms that merely contain
     * the letter 'd' ("Node", "Data") are evaluated like any other atom.
     */
    public boolean matchesSegments(String[] segments) {
        if (segments.length == 0 || segments.length != patterns.size()) {
            return false;
        }
        for (int i = 0; i < segments.length; i++) {
            if (isWildcard(i)) {
                continue;
            }
            if (!patterns.get(i).matcher(segments[i]).matches()) {
                return false;
            }
        }
        return true;
    }

    private boolean isWildcard(int depth) {
        String atom = atoms.get(depth);
        return atom.contains(".*") || atom.contains("\\d");
    }

    @Override
    public String toString() {
        return "FilterEntry[" + name + " " + atoms + "]";
    }
}
