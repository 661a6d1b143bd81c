package com.example.chunkstream.analysis;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Lexical operation detection used for program metadata and chunk complexity. Nothing here interprets
 * what a command does to the machine; it only recognizes words on a line.
 */
public final class GcodeTokens {
    private static final Pattern LINEAR_MOVE = Pattern.compile("(?<![A-Z])G0*1(?![0-9.])", Pattern.CASE_INSENSITIVE);
    private static final Pattern RAPID_MOVE = Pattern.compile("(?<![A-Z])G0*0(?![0-9.])", Pattern.CASE_INSENSITIVE);
    private static final Pattern ARC_MOVE = Pattern.compile("(?<![A-Z])G0*[23](?![0-9.])", Pattern.CASE_INSENSITIVE);
    private static final Pattern TOOL_CHANGE = Pattern.compile("(?<![A-Z])(T\\d+|M0*6(?![0-9.]))", Pattern.CASE_INSENSITIVE);
    private static final Pattern COORDINATE_SYSTEM = Pattern.compile("(?<![A-Z])G5[4-9](?![0-9.])", Pattern.CASE_INSENSITIVE);
    private static final Pattern SUB_PROGRAM = Pattern.compile("(?<![A-Z])M9[89](?![0-9.])", Pattern.CASE_INSENSITIVE);
    private static final Pattern INLINE_COMMENT = Pattern.compile("\\([^)]*\\)?");

    static final double LINEAR_WEIGHT = 1.0;
    static final double RAPID_WEIGHT = 0.5;
    static final double ARC_WEIGHT = 3.0;
    static final double TOOL_CHANGE_WEIGHT = 5.0;
    static final double COORDINATE_WEIGHT = 2.0;

    private GcodeTokens() {
    }

    public static boolean isCommentLine(String trimmed) {
        return trimmed.startsWith(";") || trimmed.startsWith("(");
    }

    public static boolean hasComment(String line) {
        return line.indexOf(';') >= 0 || line.indexOf('(') >= 0;
    }

    /**
     * Removes {@code ;} trailing comments and parenthesised comments.
     */
    public static String stripComments(String line) {
        String code = line;
        int semicolon = code.indexOf(';');
        if (semicolon >= 0) {
            code = code.substring(0, semicolon);
        }
        if (code.indexOf('(') >= 0) {
            code = INLINE_COMMENT.matcher(code).replaceAll(" ");
        }
        return code.trim();
    }

    public static boolean isLinearMove(String code) {
        return LINEAR_MOVE.matcher(code).find();
    }

    public static boolean isRapidMove(String code) {
        return RAPID_MOVE.matcher(code).find();
    }

    public static boolean isArcMove(String code) {
        return ARC_MOVE.matcher(code).find();
    }

    public static boolean isToolChange(String code) {
        return TOOL_CHANGE.matcher(code).find();
    }

    public static boolean isCoordinateSystemChange(String code) {
        return COORDINATE_SYSTEM.matcher(code).find();
    }

    public static boolean isSubProgramCall(String code) {
        return SUB_PROGRAM.matcher(code).find();
    }

    /**
     * Weighted operation count of one line, after comment removal.
     */
    public static double lineWeight(String line) {
        String code = stripComments(line);
        if (code.isEmpty()) {
            return 0;
        }
        double weight = 0;
        if (isLinearMove(code)) {
            weight += LINEAR_WEIGHT;
        }
        if (isRapidMove(code)) {
            weight += RAPID_WEIGHT;
        }
        if (isArcMove(code)) {
            weight += ARC_WEIGHT;
        }
        if (isToolChange(code)) {
            weight += TOOL_CHANGE_WEIGHT;
        }
        if (isCoordinateSystemChange(code)) {
            weight += COORDINATE_WEIGHT;
        }
        return weight;
    }

    /**
     * Average line weight rounded to one decimal place. Empty input scores zero.
     */
    public static double complexity(List<String> lines) {
        if (lines.isEmpty()) {
            return 0;
        }
        double sum = 0;
        for (String line : lines) {
            sum += lineWeight(line);
        }
        return Math.round(10 * sum / lines.size()) / 10.0;
    }
}
