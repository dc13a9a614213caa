package com.implang.compiler.lexer;

/**
 * 词法单元。{@code literal} 对整数字面量是 Long，对字符串是去掉引号和转义后的内容，
 * 对 ERROR 是错误信息，其余为 null。
 */
public final class Token {
    private final TokenType type;
    private final String lexeme;
    private final Object literal;
    private final int line;
    private final int column;

    public Token(TokenType type, String lexeme, Object literal, int line, int column) {
        this.type = type;
        this.lexeme = lexeme;
        this.literal = literal;
        this.line = line;
        this.column = column;
    }

    public TokenType getType() {
        return type;
    }

    public String getLexeme() {
        return lexeme;
    }

    public Object getLiteral() {
        return literal;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    public boolean is(TokenType type) {
        return this.type == type;
    }

    @Override
    public String toString() {
        return type + " '" + lexeme + "' @" + line + ":" + column;
    }
}
