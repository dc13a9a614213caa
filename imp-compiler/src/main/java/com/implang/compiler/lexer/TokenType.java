package com.implang.compiler.lexer;

/**
 * IMP 词法单元类型
 */
public enum TokenType {
    // === 字面量 ===
    INT_LITERAL,
    STRING_LITERAL,

    // === 标识符 ===
    IDENTIFIER,

    // === 关键词 ===
    KW_FUNC, KW_RETURN, KW_WHILE,

    // === 符号 ===
    LPAREN,         // (
    RPAREN,         // )
    LBRACE,         // {
    RBRACE,         // }
    COLON,          // :
    SEMICOLON,      // ;
    ASSIGN,         // =
    COMMA,          // ,
    PLUS,           // +

    // === 特殊 ===
    ERROR,
    EOF;

    /**
     * 是否为关键词
     */
    public boolean isKeyword() {
        return name().startsWith("KW_");
    }

    /**
     * 用于错误信息的可读形式
     */
    public String display() {
        switch (this) {
            case KW_FUNC: return "'func'";
            case KW_RETURN: return "'return'";
            case KW_WHILE: return "'while'";
            case LPAREN: return "'('";
            case RPAREN: return "')'";
            case LBRACE: return "'{'";
            case RBRACE: return "'}'";
            case COLON: return "':'";
            case SEMICOLON: return "';'";
            case ASSIGN: return "'='";
            case COMMA: return "','";
            case PLUS: return "'+'";
            case INT_LITERAL: return "integer";
            case STRING_LITERAL: return "string";
            case IDENTIFIER: return "identifier";
            case EOF: return "end of file";
            default: return name();
        }
    }
}
