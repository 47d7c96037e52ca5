package com.ninesync.imap;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Splits response data into tokens.
 *
 * <p>Produces {@link String} for atoms, quoted strings and literals,
 * {@link List} for parenthesized lists (nested to any depth) and
 * {@link Nil#NIL} for the NIL atom, which is distinct from "" and from
 * the quoted string "NIL". Parentheses inside quoted strings and literals
 * are never counted. Unbalanced input is rejected as a whole.</p>
 */
public final class ImapTokenizer {

    public enum Nil {
        NIL
    }

    private final String text;
    private int pos;

    private ImapTokenizer(String text) {
        this.text = text;
    }

    public static List<Object> tokenize(String text) throws ImapException {
        return new ImapTokenizer(text).readAll();
    }

    /**
     * Text of an atom/string token, null for NIL
     */
    public static String string(Object token) throws ImapException {
        if (token == Nil.NIL || token == null) {
            return null;
        }
        if (token instanceof String s) {
            return s;
        }
        throw ImapException.protocol("Expected string but got list " + token);
    }

    /**
     * Elements of a list token, empty for NIL
     */
    @SuppressWarnings("unchecked")
    public static List<Object> list(Object token) throws ImapException {
        if (token == Nil.NIL || token == null) {
            return List.of();
        }
        if (token instanceof List<?> l) {
            return (List<Object>) l;
        }
        throw ImapException.protocol("Expected list but got " + token);
    }

    private List<Object> readAll() throws ImapException {
        Deque<List<Object>> stack = new ArrayDeque<>();
        List<Object> current = new ArrayList<>();

        while (true) {
            skipSpaces();
            if (pos >= text.length()) {
                break;
            }
            char c = text.charAt(pos);
            if (c == '(') {
                pos++;
                stack.push(current);
                current = new ArrayList<>();
            } else if (c == ')') {
                if (stack.isEmpty()) {
                    throw ImapException.protocol("Unbalanced ')' at offset " + pos);
                }
                pos++;
                List<Object> done = current;
                current = stack.pop();
                current.add(done);
            } else if (c == '"') {
                current.add(readQuoted());
            } else if (c == '{') {
                current.add(readLiteral());
            } else {
                current.add(readAtom());
            }
        }
        if (!stack.isEmpty()) {
            throw ImapException.protocol("Unbalanced '(' : " + stack.size() + " list(s) not closed");
        }
        return current;
    }

    private void skipSpaces() {
        while (pos < text.length() && (text.charAt(pos) == ' ' || text.charAt(pos) == '\r' || text.charAt(pos) == '\n')) {
            pos++;
        }
    }

    private String readQuoted() throws ImapException {
        int start = pos;
        pos++; // opening quote
        StringBuilder sb = new StringBuilder();
        while (pos < text.length()) {
            char c = text.charAt(pos++);
            if (c == '\\' && pos < text.length()) {
                sb.append(text.charAt(pos++));
            } else if (c == '"') {
                return sb.toString();
            } else {
                sb.append(c);
            }
        }
        throw ImapException.protocol("Unterminated quoted string at offset " + start);
    }

    /**
     * {n}CRLF followed by n characters
     */
    private String readLiteral() throws ImapException {
        int close = text.indexOf('}', pos);
        if (close < 0) {
            throw ImapException.protocol("Malformed literal at offset " + pos);
        }
        String digits = text.substring(pos + 1, close);
        if (digits.endsWith("+")) {
            digits = digits.substring(0, digits.length() - 1);
        }
        if (digits.isEmpty() || !digits.chars().allMatch(ch -> ch >= '0' && ch <= '9')) {
            throw ImapException.protocol("Malformed literal size '" + digits + "'");
        }
        int size;
        try {
            size = Integer.parseInt(digits);
        } catch (NumberFormatException e) {
            throw ImapException.protocol("Literal size out of range '" + digits + "'");
        }
        int start = close + 1;
        if (text.startsWith("\r\n", start)) {
            start += 2;
        } else if (text.startsWith("\n", start)) {
            start += 1;
        }
        if (start + size > text.length()) {
            throw ImapException.protocol("Literal of " + size + " characters is truncated");
        }
        pos = start + size;
        return text.substring(start, start + size);
    }

    /**
     * Atom, possibly with a bracketed section: BODY[HEADER.FIELDS (SUBJECT)]&lt;0&gt;
     */
    private Object readAtom() throws ImapException {
        int start = pos;
        int brackets = 0;
        while (pos < text.length()) {
            char c = text.charAt(pos);
            if (c == '[') {
                brackets++;
            } else if (c == ']') {
                brackets--;
            } else if (brackets == 0 && (c == ' ' || c == '(' || c == ')' || c == '"')) {
                break;
            }
            pos++;
        }
        if (brackets > 0) {
            throw ImapException.protocol("Unbalanced '[' at offset " + start);
        }
        String atom = text.substring(start, pos);
        return "NIL".equalsIgnoreCase(atom) ? Nil.NIL : atom;
    }
}
