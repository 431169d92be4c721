package com.tiergate.invoker;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits a command line into arguments.
 *
 * <p>Rules:
 * <ul>
 *   <li>Whitespace separates arguments</li>
 *   <li>Single quotes group text literally</li>
 *   <li>Double quotes group text; backslash escapes the next character</li>
 *   <li>Outside quotes, backslash escapes the next character</li>
 * </ul>
 * No variable expansion, globbing or redirection: the command is spawned directly,
 * not through a shell.
 */
public final class CommandTokenizer {

    private CommandTokenizer() {
    }

    /**
     * Tokenize a command line.
     *
     * @throws IllegalArgumentException on an unterminated quote or trailing backslash
     */
    public static List<String> tokenize(String command) {
        List<String> tokens = new ArrayList<>();
        if (command == null) {
            return tokens;
        }

        StringBuilder current = new StringBuilder();
        boolean inToken = false;
        int pos = 0;
        int length = command.length();

        while (pos < length) {
            char c = command.charAt(pos);

            if (Character.isWhitespace(c)) {
                if (inToken) {
                    tokens.add(current.toString());
                    current.setLength(0);
                    inToken = false;
                }
                pos++;
            } else if (c == '\'') {
                int end = command.indexOf('\'', pos + 1);
                if (end < 0) {
                    throw new IllegalArgumentException("Unterminated single quote at position " + pos);
                }
                current.append(command, pos + 1, end);
                inToken = true;
                pos = end + 1;
            } else if (c == '"') {
                pos = readDoubleQuoted(command, pos, current);
                inToken = true;
            } else if (c == '\\') {
                if (pos + 1 >= length) {
                    throw new IllegalArgumentException("Trailing backslash at position " + pos);
                }
                current.append(command.charAt(pos + 1));
                inToken = true;
                pos += 2;
            } else {
                current.append(c);
                inToken = true;
                pos++;
            }
        }

        if (inToken) {
            tokens.add(current.toString());
        }
        return tokens;
    }

    /**
     * Append the contents of a double-quoted section starting at {@code start}.
     *
     * @return Position just after the closing quote
     */
    private static int readDoubleQuoted(String command, int start, StringBuilder out) {
        int pos = start + 1;
        while (pos < command.length()) {
            char c = command.charAt(pos);
            if (c == '"') {
                return pos + 1;
            }
            if (c == '\\' && pos + 1 < command.length()) {
                out.append(command.charAt(pos + 1));
                pos += 2;
            } else {
                out.append(c);
                pos++;
            }
        }
        throw new IllegalArgumentException("Unterminated double quote at position " + start);
    }
}
