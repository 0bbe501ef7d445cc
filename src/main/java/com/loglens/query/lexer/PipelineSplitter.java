package com.loglens.query.lexer;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits query text into pipe-separated stages.
 *
 * Pipes inside quoted strings and regex literals do not split. Quote and
 * regex boundaries follow the same rules as {@link Lexer}, so a stage never
 * ends in the middle of a token. Unterminated literals run to the end of the
 * text and are reported by the lexer.
 */
public final class PipelineSplitter {

    private PipelineSplitter() {
    }

    public static List<StageText> split(String query) {
        List<StageText> stages = new ArrayList<>();
        int start = 0;
        int i = 0;
        int length = query.length();
        while (i < length) {
            char c = query.charAt(i);
            if (c == '"' || c == '\'') {
                i = skipDelimited(query, i, c);
            } else if (c == '/' && (i == 0 || !Lexer.isWordChar(query.charAt(i - 1)))) {
                i = skipDelimited(query, i, '/');
            } else if (c == '|') {
                stages.add(new StageText(stages.size(), query.substring(start, i), start));
                start = i + 1;
                i++;
            } else {
                i++;
            }
        }
        stages.add(new StageText(stages.size(), query.substring(start), start));
        return stages;
    }

    /**
     * @return index just past the closing delimiter, or the text length if
     *         the literal is unterminated
     */
    private static int skipDelimited(String text, int open, char delimiter) {
        int i = open + 1;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (c == '\\') {
                i += 2;
            } else if (c == delimiter) {
                return i + 1;
            } else {
                i++;
            }
        }
        return text.length();
    }
}
