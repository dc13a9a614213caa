package com.implang.compiler.lexer;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * IMP 词法分析器
 *
 * <p>换行与空白一样被跳过；语句由 {@code ;} 分隔。</p>
 */
public class Lexer {
    private final String source;
    private final String fileName;
    private final List<Token> tokens = new ArrayList<>();

    private int start = 0;
    private int current = 0;
    private int line = 1;
    private int column = 1;

    private final PrintStream errStream;

    // 关键词映射表
    private static final Map<String, TokenType> KEYWORDS;

    static {
        Map<String, TokenType> map = new HashMap<>();
        map.put("func", TokenType.KW_FUNC);
        map.put("return", TokenType.KW_RETURN);
        map.put("while", TokenType.KW_WHILE);
        KEYWORDS = Collections.unmodifiableMap(map);
    }

    public Lexer(String source, String fileName) {
        this(source, fileName, System.err);
    }

    public Lexer(String source, String fileName, PrintStream errStream) {
        this.source = source;
        this.fileName = fileName;
        this.errStream = errStream;
    }

    public Lexer(String source) {
        this(source, "<input>");
    }

    public String getFileName() {
        return fileName;
    }

    /**
     * 获取下一个 Token（流式接口）
     *
     * @return 下一个 Token，源码结束后始终返回 EOF
     */
    public Token nextToken() {
        while (true) {
            skipWhitespace();

            if (isAtEnd()) {
                return new Token(TokenType.EOF, "", null, line, column);
            }

            start = current;
            scanToken();

            // 注释不产生 token，继续扫描
            if (!tokens.isEmpty()) {
                return tokens.remove(tokens.size() - 1);
            }
        }
    }

    /**
     * 执行词法分析，返回 Token 列表（以 EOF 结尾）
     */
    public List<Token> scanTokens() {
        List<Token> result = new ArrayList<>();
        Token tok;
        do {
            tok = nextToken();
            result.add(tok);
        } while (tok.getType() != TokenType.EOF);
        return result;
    }

    private void skipWhitespace() {
        while (!isAtEnd()) {
            char c = peek();
            if (c == ' ' || c == '\r' || c == '\t') {
                advance();
            } else if (c == '\n') {
                advance();
                newLine();
            } else {
                break;
            }
        }
    }

    private void scanToken() {
        char c = advance();
        switch (c) {
            case '(': addToken(TokenType.LPAREN); break;
            case ')': addToken(TokenType.RPAREN); break;
            case '{': addToken(TokenType.LBRACE); break;
            case '}': addToken(TokenType.RBRACE); break;
            case ':': addToken(TokenType.COLON); break;
            case ';': addToken(TokenType.SEMICOLON); break;
            case '=': addToken(TokenType.ASSIGN); break;
            case ',': addToken(TokenType.COMMA); break;
            case '+': addToken(TokenType.PLUS); break;

            case '/':
                if (match('/')) {
                    // 单行注释
                    while (peek() != '\n' && !isAtEnd()) advance();
                } else if (match('*')) {
                    blockComment();
                } else {
                    error("Unexpected character: /");
                }
                break;

            case '"':
                string();
                break;

            default:
                if (isDigit(c)) {
                    number();
                } else if (isAlpha(c)) {
                    identifier();
                } else {
                    error("Unexpected character: " + c);
                }
                break;
        }
    }

    // === 辅助方法 ===

    private boolean isAtEnd() {
        return current >= source.length();
    }

    private char advance() {
        char c = source.charAt(current++);
        column++;
        return c;
    }

    private boolean match(char expected) {
        if (isAtEnd()) return false;
        if (source.charAt(current) != expected) return false;
        current++;
        column++;
        return true;
    }

    private char peek() {
        if (isAtEnd()) return '\0';
        return source.charAt(current);
    }

    private char peekNext() {
        if (current + 1 >= source.length()) return '\0';
        return source.charAt(current + 1);
    }

    private void newLine() {
        line++;
        column = 1;
    }

    private boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private boolean isAlpha(char c) {
        return (c >= 'a' && c <= 'z') ||
               (c >= 'A' && c <= 'Z') ||
               c == '_';
    }

    private boolean isAlphaNumeric(char c) {
        return isAlpha(c) || isDigit(c);
    }

    // === Token 构建 ===

    private void addToken(TokenType type) {
        addToken(type, null);
    }

    private void addToken(TokenType type, Object literal) {
        String lexeme = source.substring(start, current);
        int tokenColumn = column - (current - start);
        tokens.add(new Token(type, lexeme, literal, line, tokenColumn));
    }

    // === 复杂 Token 扫描 ===

    private void string() {
        StringBuilder value = new StringBuilder();
        while (!isAtEnd() && peek() != '"') {
            if (peek() == '\n') {
                error("Unterminated string");
                return;
            }
            if (peek() == '\\') {
                advance();
                if (isAtEnd()) break;
                char c = advance();
                switch (c) {
                    case 'n': value.append('\n'); break;
                    case 't': value.append('\t'); break;
                    case '"': value.append('"'); break;
                    case '\\': value.append('\\'); break;
                    default:
                        error("Invalid escape character: \\" + c);
                        return;
                }
            } else {
                value.append(advance());
            }
        }

        if (isAtEnd()) {
            error("Unterminated string");
            return;
        }
        advance(); // 结束引号
        addToken(TokenType.STRING_LITERAL, value.toString());
    }

    private void number() {
        while (isDigit(peek())) advance();
        if (isAlpha(peek())) {
            while (isAlphaNumeric(peek())) advance();
            error("Invalid integer literal: " + source.substring(start, current));
            return;
        }
        String text = source.substring(start, current);
        try {
            addToken(TokenType.INT_LITERAL, Long.parseLong(text));
        } catch (NumberFormatException e) {
            error("Integer literal out of range: " + text);
        }
    }

    private void identifier() {
        while (isAlphaNumeric(peek())) advance();

        String text = source.substring(start, current);
        TokenType type = KEYWORDS.get(text);
        if (type == null) type = TokenType.IDENTIFIER;
        addToken(type);
    }

    private void blockComment() {
        int depth = 1;
        while (depth > 0 && !isAtEnd()) {
            if (peek() == '/' && peekNext() == '*') {
                advance();
                advance();
                depth++;
            } else if (peek() == '*' && peekNext() == '/') {
                advance();
                advance();
                depth--;
            } else {
                if (advance() == '\n') newLine();
            }
        }
        if (depth > 0) {
            error("Unterminated block comment");
        }
    }

    private void error(String message) {
        String errorMsg = String.format("[%s:%d:%d] Lexer error: %s",
                fileName, line, column, message);
        errStream.println(errorMsg);
        addToken(TokenType.ERROR, message);
    }
}
