package com.implang.compiler.parser;

import com.implang.compiler.lexer.Token;
import imp.runtime.ImpException;

/**
 * 词法或语法错误，携带出错的 token
 */
public class ParseException extends ImpException {
    private final Token token;
    private final String expected;

    public ParseException(String message, Token token) {
        this(message, token, null);
    }

    /**
     * @param expected 期望内容的描述，例如 {@code "';' or '}'"}，可为 null
     */
    public ParseException(String message, Token token, String expected) {
        super(describe(message, token, expected));
        this.token = token;
        this.expected = expected;
    }

    public Token getToken() {
        return token;
    }

    public String getExpected() {
        return expected;
    }

    private static String describe(String message, Token token, String expected) {
        String text = message;
        if (token != null) {
            text += " at line " + token.getLine() + ", column " + token.getColumn()
                    + " (found '" + token.getLexeme() + "')";
        }
        if (expected != null) {
            text += ", expected: " + expected;
        }
        return text;
    }
}
