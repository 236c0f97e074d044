package com.raditha.rlint.syntax;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Splits R source text into tokens with attached trivia.
 * <p>
 * Lexing never fails: characters that do not start a valid token become
 * {@link RSyntaxKind#ERROR_TOKEN} tokens and are reported by the parser. The
 * returned list always ends with an {@link RSyntaxKind#EOF} token that owns the
 * trivia at the end of the file.
 */
public class RLexer {

    private static final Map<String, RSyntaxKind> KEYWORDS = Map.ofEntries(
            Map.entry("function", RSyntaxKind.FUNCTION_KW),
            Map.entry("if", RSyntaxKind.IF_KW),
            Map.entry("else", RSyntaxKind.ELSE_KW),
            Map.entry("for", RSyntaxKind.FOR_KW),
            Map.entry("in", RSyntaxKind.IN_KW),
            Map.entry("while", RSyntaxKind.WHILE_KW),
            Map.entry("repeat", RSyntaxKind.REPEAT_KW),
            Map.entry("break", RSyntaxKind.BREAK_KW),
            Map.entry("next", RSyntaxKind.NEXT_KW),
            Map.entry("TRUE", RSyntaxKind.TRUE_KW),
            Map.entry("FALSE", RSyntaxKind.FALSE_KW),
            Map.entry("NULL", RSyntaxKind.NULL_KW),
            Map.entry("NA", RSyntaxKind.NA_KW),
            Map.entry("NA_integer_", RSyntaxKind.NA_KW),
            Map.entry("NA_real_", RSyntaxKind.NA_KW),
            Map.entry("NA_character_", RSyntaxKind.NA_KW),
            Map.entry("NA_complex_", RSyntaxKind.NA_KW),
            Map.entry("Inf", RSyntaxKind.NUMBER),
            Map.entry("NaN", RSyntaxKind.NUMBER));

    // Longest operators first so that prefixes never win.
    private static final String[][] OPERATORS = {
            {"<<-", "SUPER_ASSIGN"}, {"->>", "SUPER_ASSIGN_RIGHT"}, {":::", "TRIPLE_COLON"},
            {"<-", "ASSIGN"}, {"->", "ASSIGN_RIGHT"}, {"<=", "LESS_THAN_OR_EQUAL_TO"},
            {">=", "GREATER_THAN_OR_EQUAL_TO"}, {"==", "EQUAL2"}, {"!=", "NOT_EQUAL"},
            {"&&", "AND2"}, {"||", "OR2"}, {"|>", "PIPE"}, {"::", "DOUBLE_COLON"},
            {":=", "WALRUS"}, {"**", "CARET"}, {"[[", "L_BRACK2"},
            {"<", "LESS_THAN"}, {">", "GREATER_THAN"}, {"!", "BANG"}, {"=", "EQUAL"},
            {"+", "PLUS"}, {"-", "MINUS"}, {"*", "STAR"}, {"/", "SLASH"}, {"^", "CARET"},
            {"&", "AND"}, {"|", "OR"}, {"~", "TILDE"}, {"?", "QUESTION"}, {":", "COLON"},
            {"$", "DOLLAR"}, {"@", "AT"}, {"(", "L_PAREN"}, {")", "R_PAREN"},
            {"{", "L_CURLY"}, {"}", "R_CURLY"}, {"[", "L_BRACK"}, {"]", "R_BRACK"},
            {",", "COMMA"}, {";", "SEMICOLON"}, {"\\", "BACKSLASH"}};

    private record RawToken(RSyntaxKind kind, TriviaKind trivia, String text, int offset) {
        boolean isTrivia() {
            return trivia != null;
        }
    }

    private final String source;
    private int pos;

    public RLexer(String source) {
        this.source = source;
    }

    public List<SyntaxToken> tokenize() {
        return attachTrivia(scan());
    }

    private List<RawToken> scan() {
        List<RawToken> raw = new ArrayList<>();
        pos = 0;
        while (pos < source.length()) {
            int start = pos;
            char c = source.charAt(pos);
            if (c == '\n') {
                pos++;
                raw.add(trivia(TriviaKind.NEWLINE, start));
            } else if (c == '\r') {
                pos += pos + 1 < source.length() && source.charAt(pos + 1) == '\n' ? 2 : 1;
                raw.add(trivia(TriviaKind.NEWLINE, start));
            } else if (isBlank(c)) {
                while (pos < source.length() && isBlank(source.charAt(pos))) {
                    pos++;
                }
                raw.add(trivia(TriviaKind.WHITESPACE, start));
            } else if (c == '#') {
                while (pos < source.length() && source.charAt(pos) != '\n' && source.charAt(pos) != '\r') {
                    pos++;
                }
                raw.add(trivia(TriviaKind.COMMENT, start));
            } else {
                RSyntaxKind kind = scanToken(c);
                raw.add(new RawToken(kind, null, source.substring(start, pos), start));
            }
        }
        return raw;
    }

    private RawToken trivia(TriviaKind kind, int start) {
        return new RawToken(null, kind, source.substring(start, pos), start);
    }

    private RSyntaxKind scanToken(char c) {
        if (c == '"' || c == '\'') {
            return scanString(c);
        }
        if ((c == 'r' || c == 'R') && isRawStringStart()) {
            return scanRawString();
        }
        if (Character.isDigit(c) || (c == '.' && pos + 1 < source.length() && Character.isDigit(source.charAt(pos + 1)))) {
            return scanNumber();
        }
        if (Character.isLetter(c) || c == '.') {
            int begin = pos;
            while (pos < source.length() && isIdentifierPart(source.charAt(pos))) {
                pos++;
            }
            return KEYWORDS.getOrDefault(source.substring(begin, pos), RSyntaxKind.IDENT);
        }
        if (c == '`') {
            return scanQuoted('`', RSyntaxKind.IDENT);
        }
        if (c == '%') {
            int end = source.indexOf('%', pos + 1);
            int lineEnd = source.indexOf('\n', pos + 1);
            if (end > 0 && (lineEnd < 0 || end < lineEnd)) {
                pos = end + 1;
                return RSyntaxKind.SPECIAL;
            }
            pos++;
            return RSyntaxKind.ERROR_TOKEN;
        }
        for (String[] operator : OPERATORS) {
            if (source.startsWith(operator[0], pos)) {
                pos += operator[0].length();
                return RSyntaxKind.valueOf(operator[1]);
            }
        }
        pos++;
        return RSyntaxKind.ERROR_TOKEN;
    }

    private RSyntaxKind scanString(char quote) {
        return scanQuoted(quote, RSyntaxKind.STRING);
    }

    private RSyntaxKind scanQuoted(char quote, RSyntaxKind kind) {
        pos++;
        while (pos < source.length()) {
            char c = source.charAt(pos);
            if (c == '\\') {
                pos += 2;
            } else if (c == quote) {
                pos++;
                return kind;
            } else {
                pos++;
            }
        }
        pos = source.length();
        return RSyntaxKind.ERROR_TOKEN;
    }

    private boolean isRawStringStart() {
        int i = pos + 1;
        if (i >= source.length() || (source.charAt(i) != '"' && source.charAt(i) != '\'')) {
            return false;
        }
        i++;
        while (i < source.length() && source.charAt(i) == '-') {
            i++;
        }
        return i < source.length() && "([{".indexOf(source.charAt(i)) >= 0;
    }

    private RSyntaxKind scanRawString() {
        char quote = source.charAt(pos + 1);
        int i = pos + 2;
        int dashes = 0;
        while (source.charAt(i) == '-') {
            dashes++;
            i++;
        }
        char open = source.charAt(i);
        char close = switch (open) {
            case '(' -> ')';
            case '[' -> ']';
            default -> '}';
        };
        String terminator = close + "-".repeat(dashes) + quote;
        int end = source.indexOf(terminator, i + 1);
        if (end < 0) {
            pos = source.length();
            return RSyntaxKind.ERROR_TOKEN;
        }
        pos = end + terminator.length();
        return RSyntaxKind.STRING;
    }

    private RSyntaxKind scanNumber() {
        if (source.startsWith("0x", pos) || source.startsWith("0X", pos)) {
            pos += 2;
            while (pos < source.length() && Character.digit(source.charAt(pos), 16) >= 0) {
                pos++;
            }
        } else {
            skipDigits();
            if (pos < source.length() && source.charAt(pos) == '.') {
                pos++;
                skipDigits();
            }
            if (pos < source.length() && (source.charAt(pos) == 'e' || source.charAt(pos) == 'E')) {
                int mark = pos;
                pos++;
                if (pos < source.length() && (source.charAt(pos) == '+' || source.charAt(pos) == '-')) {
                    pos++;
                }
                if (pos < source.length() && Character.isDigit(source.charAt(pos))) {
                    skipDigits();
                } else {
                    pos = mark;
                }
            }
        }
        if (pos < source.length() && (source.charAt(pos) == 'L' || source.charAt(pos) == 'i')) {
            pos++;
        }
        return RSyntaxKind.NUMBER;
    }

    private void skipDigits() {
        while (pos < source.length() && Character.isDigit(source.charAt(pos))) {
            pos++;
        }
    }

    private static boolean isBlank(char c) {
        return c == ' ' || c == '\t' || c == '\f' || c == '\u00A0';
    }

    private static boolean isIdentifierPart(char c) {
        return Character.isLetterOrDigit(c) || c == '.' || c == '_';
    }

    /**
     * Leading trivia runs up to and including the last line break before a token;
     * trailing trivia is whatever follows the token on its own line.
     */
    private List<SyntaxToken> attachTrivia(List<RawToken> raw) {
        List<SyntaxToken> tokens = new ArrayList<>();
        List<Trivia> leading = new ArrayList<>();
        int i = 0;
        while (i < raw.size()) {
            RawToken current = raw.get(i);
            if (current.isTrivia()) {
                leading.add(new Trivia(current.trivia(), current.text(), current.offset()));
                i++;
                continue;
            }
            i++;
            List<Trivia> trailing = new ArrayList<>();
            while (i < raw.size() && raw.get(i).isTrivia() && raw.get(i).trivia() != TriviaKind.NEWLINE) {
                RawToken t = raw.get(i);
                trailing.add(new Trivia(t.trivia(), t.text(), t.offset()));
                i++;
            }
            tokens.add(new SyntaxToken(current.kind(), current.text(), current.offset(), leading, trailing));
            leading = new ArrayList<>();
        }
        tokens.add(new SyntaxToken(RSyntaxKind.EOF, "", source.length(), leading, List.of()));
        return tokens;
    }
}
