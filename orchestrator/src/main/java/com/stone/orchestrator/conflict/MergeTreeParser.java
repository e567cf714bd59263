package com.stone.orchestrator.conflict;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Reads the output of the three-argument {@code git merge-tree base ours theirs}.
 *
 * That output is a sequence of sections. Each starts with an unindented
 * header ("changed in both", "added in remote", ...), followed by indented
 * {@code base/our/their/result} entry lines carrying mode, object id and
 * path, and then a unified diff of the merge result. A section is conflicted
 * only when its diff carries a complete marker block: a start marker, then a
 * separator, then an end marker. A lone {@code =======} line (a setext
 * heading underline, say) is content.
 */
final class MergeTreeParser {

    static final String START     = "<<<<<<<";
    static final String SEPARATOR = "=======";
    static final String END       = ">>>>>>>";

    private enum Block { NONE, OURS, THEIRS }

    private static final Set<String> ENTRY_ROLES = Set.of("base", "our", "their", "result");

    record Parsed(boolean hasConflicts, List<String> conflictingPaths) {}

    private MergeTreeParser() {}

    static Parsed parse(String output) {
        Set<String> paths = new LinkedHashSet<>();
        boolean markers = false;

        String sectionPath = null;
        boolean sectionConflicted = false;
        Block block = Block.NONE;
        for (String line : output.lines().toList()) {
            if (isSectionHeader(line)) {
                if (sectionConflicted && sectionPath != null) paths.add(sectionPath);
                sectionPath = null;
                sectionConflicted = false;
                block = Block.NONE;
                continue;
            }
            String entryPath = entryPath(line);
            if (entryPath != null) {
                if (sectionPath == null) sectionPath = entryPath;
                continue;
            }
            String body = diffContent(line);
            if (body.startsWith(START)) {
                block = Block.OURS;
            } else if (block == Block.OURS && isMarker(body, SEPARATOR)) {
                block = Block.THEIRS;
            } else if (block == Block.THEIRS && body.startsWith(END)) {
                block = Block.NONE;
                markers = true;
                sectionConflicted = true;
            }
        }
        if (sectionConflicted && sectionPath != null) paths.add(sectionPath);
        return new Parsed(markers, List.copyOf(paths));
    }

    /** The line without its one-character diff prefix. */
    private static String diffContent(String line) {
        return line.startsWith("+") || line.startsWith("-") || line.startsWith(" ")
                ? line.substring(1) : line;
    }

    private static boolean isMarker(String body, String marker) {
        return body.equals(marker) || body.startsWith(marker + " ");
    }

    private static boolean isSectionHeader(String line) {
        return !line.isEmpty() && Character.isLetter(line.charAt(0));
    }

    /** Path of an entry line such as {@code "  our    100644 3f2a... src/App.java"}, else null. */
    private static String entryPath(String line) {
        if (!line.startsWith("  ")) return null;
        String[] fields = line.strip().split("\\s+", 4);
        if (fields.length < 4 || !ENTRY_ROLES.contains(fields[0])) return null;
        return fields[3];
    }
}
