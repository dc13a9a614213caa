package com.implang.compiler.parser;

import com.implang.compiler.ast.AstNode;
import com.implang.compiler.ast.SourceLocation;
import com.implang.compiler.ast.decl.*;
import com.implang.compiler.ast.expr.*;
import com.implang.compiler.ast.stmt.*;
import com.implang.compiler.lexer.Lexer;
import com.implang.compiler.lexer.Token;
import com.implang.compiler.lexer.TokenType;

import java.util.ArrayList;
import java.util.List;

import static com.implang.compiler.lexer.TokenType.*;

/**
 * IMP 语法分析器（递归下降）
 *
 * <pre>
 * program   := item* EOF
 * item      := funcDecl | stmt ';'?
 * funcDecl  := 'func' IDENT '(' params? ')' ':' IDENT ( '=' STRING ';'? | block )
 * stmt      := block | 'while' '(' expr ')' stmt | 'return' expr | expr
 * expr      := call ( '+' call )*
 * call      := term ( '(' args? ')' )*
 * term      := IDENT | INT | '(' expr ')'
 * </pre>
 */
public class Parser {

    private final Lexer lexer;
    private final String fileName;
    private Token current;
    private Token previous;

    public Parser(Lexer lexer, String fileName) {
        this.lexer = lexer;
        this.fileName = fileName;
        advance();  // 读取第一个 token
    }

    public Parser(Lexer lexer) {
        this(lexer, lexer.getFileName());
    }

    // ============ 基础方法 ============

    /**
     * 前进到下一个 token，词法错误在此处转为解析异常
     */
    private Token advance() {
        previous = current;
        current = lexer.nextToken();
        if (current.is(ERROR)) {
            throw new ParseException("Lexical error: " + current.getLiteral(), current);
        }
        return previous;
    }

    private boolean check(TokenType type) {
        return current.getType() == type;
    }

    private boolean match(TokenType type) {
        if (check(type)) {
            advance();
            return true;
        }
        return false;
    }

    /**
     * 期望特定 token，否则报错
     */
    private Token expect(TokenType type, String message) {
        if (check(type)) {
            return advance();
        }
        throw new ParseException(message, current, type.display());
    }

    private SourceLocation location() {
        return locationOf(current);
    }

    private SourceLocation locationOf(Token token) {
        return new SourceLocation(fileName, token.getLine(), token.getColumn());
    }

    private boolean isAtEnd() {
        return check(EOF);
    }

    // ============ 程序解析 ============

    /**
     * 解析程序
     */
    public Program parse() {
        SourceLocation loc = location();
        List<AstNode> items = new ArrayList<>();
        while (!isAtEnd()) {
            if (match(SEMICOLON)) {
                continue;
            }
            if (check(KW_FUNC)) {
                items.add(parseDeclaration());
            } else {
                items.add(parseStatement());
                match(SEMICOLON);
            }
        }
        return new Program(loc, items);
    }

    // ============ 声明 ============

    private Declaration parseDeclaration() {
        SourceLocation loc = location();
        expect(KW_FUNC, "Expected 'func'");
        String name = expect(IDENTIFIER, "Expected function name").getLexeme();

        expect(LPAREN, "Expected '(' after function name");
        List<Parameter> params = new ArrayList<>();
        if (!check(RPAREN)) {
            do {
                params.add(parseParameter());
            } while (match(COMMA));
        }
        expect(RPAREN, "Expected ')' after parameters");
        expect(COLON, "Expected ':' before return type");
        String returnType = expect(IDENTIFIER, "Expected return type").getLexeme();

        if (match(ASSIGN)) {
            Token primitive = expect(STRING_LITERAL, "Expected primitive name string");
            match(SEMICOLON);
            return new ProtoDecl(loc, name, params, returnType, (String) primitive.getLiteral());
        }
        if (!check(LBRACE)) {
            throw new ParseException("Expected function body", current, "'{' or '='");
        }
        Block body = parseBlock();
        return new FunDecl(loc, name, params, returnType, body);
    }

    private Parameter parseParameter() {
        SourceLocation loc = location();
        String name = expect(IDENTIFIER, "Expected parameter name").getLexeme();
        expect(COLON, "Expected ':' after parameter name");
        String typeName = expect(IDENTIFIER, "Expected parameter type").getLexeme();
        return new Parameter(loc, name, typeName);
    }

    // ============ 语句 ============

    private Statement parseStatement() {
        SourceLocation loc = location();
        if (check(LBRACE)) {
            return parseBlock();
        }
        if (match(KW_WHILE)) {
            expect(LPAREN, "Expected '(' after 'while'");
            Expression condition = parseExpression();
            expect(RPAREN, "Expected ')' after condition");
            Statement body = parseStatement();
            return new WhileStmt(loc, condition, body);
        }
        if (match(KW_RETURN)) {
            Expression value = parseExpression();
            return new ReturnStmt(loc, value);
        }
        Expression expr = parseExpression();
        return new ExpressionStmt(loc, expr);
    }

    private Block parseBlock() {
        SourceLocation loc = location();
        expect(LBRACE, "Expected '{'");
        List<Statement> statements = new ArrayList<>();
        while (!check(RBRACE)) {
            if (isAtEnd()) {
                throw new ParseException("Unterminated block", current, "'}'");
            }
            statements.add(parseStatement());
            if (match(SEMICOLON) || check(RBRACE)) {
                continue;
            }
            // 以 '}' 结尾的语句后分号可省略
            if (previous.is(RBRACE)) {
                continue;
            }
            throw new ParseException("Expected ';' between statements", current, "';' or '}'");
        }
        expect(RBRACE, "Expected '}'");
        return new Block(loc, statements);
    }

    // ============ 表达式 ============

    private Expression parseExpression() {
        Expression left = parseCall();
        while (check(PLUS)) {
            SourceLocation loc = location();
            advance();
            Expression right = parseCall();
            left = new BinaryExpr(loc, left, BinaryExpr.BinaryOp.ADD, right);
        }
        return left;
    }

    private Expression parseCall() {
        Expression expr = parseTerm();
        while (check(LPAREN)) {
            SourceLocation loc = location();
            advance();
            List<Expression> args = new ArrayList<>();
            if (!check(RPAREN)) {
                do {
                    args.add(parseExpression());
                } while (match(COMMA));
            }
            expect(RPAREN, "Expected ')' after arguments");
            expr = new CallExpr(loc, expr, args);
        }
        return expr;
    }

    private Expression parseTerm() {
        SourceLocation loc = location();
        if (check(IDENTIFIER)) {
            return new Identifier(loc, advance().getLexeme());
        }
        if (check(INT_LITERAL)) {
            return new Literal(loc, (Long) advance().getLiteral());
        }
        if (match(LPAREN)) {
            Expression inner = parseExpression();
            expect(RPAREN, "Expected ')' after expression");
            return inner;
        }
        throw new ParseException("Expected expression", current, "identifier, integer or '('");
    }
}
