package com.implang.compiler.lexer;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Lexer 单元测试
 */
class LexerTest {

    /** 扫描源码，返回所有 token（含 EOF） */
    private List<Token> scan(String source) {
        return new Lexer(source, "<test>", new PrintStream(new ByteArrayOutputStream())).scanTokens();
    }

    /** 扫描源码，返回非 EOF 的 token 类型列表 */
    private List<TokenType> types(String source) {
        return scan(source).stream()
                .map(Token::getType)
                .filter(t -> t != TokenType.EOF)
                .collect(Collectors.toList());
    }

    /** 扫描源码，捕获错误输出 */
    private String scanWithErrors(String source) {
        ByteArrayOutputStream baos = new ByteArrayOutputStream();
        PrintStream ps = new PrintStream(baos, true, StandardCharsets.UTF_8);
        new Lexer(source, "<test>", ps).scanTokens();
        return baos.toString(StandardCharsets.UTF_8);
    }

    private void assertSingleToken(String source, TokenType expectedType, Object expectedLiteral) {
        List<Token> toks = scan(source);
        assertEquals(2, toks.size(), "Expected single token from: " + source);
        assertEquals(expectedType, toks.get(0).getType());
        assertEquals(expectedLiteral, toks.get(0).getLiteral());
    }

    @Nested
    @DisplayName("符号与关键词")
    class SymbolsAndKeywords {

        @Test
        @DisplayName("所有单字符符号")
        void symbols() {
            assertEquals(List.of(TokenType.LPAREN, TokenType.RPAREN, TokenType.LBRACE, TokenType.RBRACE,
                            TokenType.COLON, TokenType.SEMICOLON, TokenType.ASSIGN, TokenType.COMMA,
                            TokenType.PLUS),
                    types("( ) { } : ; = , +"));
        }

        @Test
        @DisplayName("关键词与标识符")
        void keywords() {
            assertEquals(List.of(TokenType.KW_FUNC, TokenType.KW_WHILE, TokenType.KW_RETURN,
                            TokenType.IDENTIFIER, TokenType.IDENTIFIER),
                    types("func while return funcs _x1"));
            assertTrue(TokenType.KW_WHILE.isKeyword());
            assertFalse(TokenType.IDENTIFIER.isKeyword());
        }

        @Test
        @DisplayName("函数声明的完整 token 序列")
        void declaration() {
            assertEquals(List.of(TokenType.KW_FUNC, TokenType.IDENTIFIER, TokenType.LPAREN,
                            TokenType.IDENTIFIER, TokenType.COLON, TokenType.IDENTIFIER, TokenType.RPAREN,
                            TokenType.COLON, TokenType.IDENTIFIER, TokenType.ASSIGN, TokenType.STRING_LITERAL,
                            TokenType.SEMICOLON),
                    types("func print(v: int): int = \"print_int\";"));
        }
    }

    @Nested
    @DisplayName("字面量")
    class Literals {

        @Test
        @DisplayName("整数字面量为 Long")
        void integers() {
            assertSingleToken("0", TokenType.INT_LITERAL, 0L);
            assertSingleToken("9223372036854775807", TokenType.INT_LITERAL, Long.MAX_VALUE);
        }

        @Test
        @DisplayName("整数越界报错")
        void integerOverflow() {
            List<Token> toks = scan("9223372036854775808");
            assertEquals(TokenType.ERROR, toks.get(0).getType());
        }

        @Test
        @DisplayName("数字后紧跟字母报错")
        void integerWithSuffix() {
            String errors = scanWithErrors("12abc");
            assertTrue(errors.contains("Invalid integer literal: 12abc"), errors);
        }

        @Test
        @DisplayName("字符串转义")
        void stringEscapes() {
            assertSingleToken("\"a\\n\\t\\\"\\\\\"", TokenType.STRING_LITERAL, "a\n\t\"\\");
        }

        @Test
        @DisplayName("未结束的字符串")
        void unterminatedString() {
            String errors = scanWithErrors("\"abc");
            assertTrue(errors.contains("[<test>:1:5] Lexer error: Unterminated string"), errors);
        }
    }

    @Nested
    @DisplayName("注释与位置")
    class CommentsAndPositions {

        @Test
        @DisplayName("行注释与嵌套块注释被跳过")
        void comments() {
            assertEquals(List.of(TokenType.IDENTIFIER, TokenType.IDENTIFIER),
                    types("a // comment\n/* outer /* inner */ still */ b"));
        }

        @Test
        @DisplayName("未结束的块注释")
        void unterminatedBlockComment() {
            assertTrue(scanWithErrors("/* open").contains("Unterminated block comment"));
        }

        @Test
        @DisplayName("行列号")
        void lineAndColumn() {
            List<Token> toks = scan("a\n  bc");
            assertEquals(1, toks.get(0).getLine());
            assertEquals(1, toks.get(0).getColumn());
            assertEquals(2, toks.get(1).getLine());
            assertEquals(3, toks.get(1).getColumn());
        }

        @Test
        @DisplayName("非法字符产生 ERROR token")
        void unexpectedCharacter() {
            List<Token> toks = scan("a $ b");
            assertEquals(TokenType.ERROR, toks.get(1).getType());
            assertEquals("Unexpected character: $", toks.get(1).getLiteral());
            assertEquals(TokenType.IDENTIFIER, toks.get(2).getType());
        }

        @Test
        @DisplayName("结束后持续返回 EOF")
        void eofRepeats() {
            Lexer lexer = new Lexer("x");
            lexer.nextToken();
            assertEquals(TokenType.EOF, lexer.nextToken().getType());
            assertEquals(TokenType.EOF, lexer.nextToken().getType());
        }
    }
}
