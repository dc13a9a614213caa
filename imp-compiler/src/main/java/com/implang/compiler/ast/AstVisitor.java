package com.implang.compiler.ast;

import com.implang.compiler.ast.decl.*;
import com.implang.compiler.ast.expr.*;
import com.implang.compiler.ast.stmt.*;

/**
 * AST 访问者接口
 *
 * <p>所有方法提供默认实现（返回 null），实现类只需覆盖感兴趣的节点类型。</p>
 */
public interface AstVisitor<R, C> {

    // ============ 声明 ============

    default R visitProgram(Program node, C ctx) { return null; }

    default R visitFunDecl(FunDecl node, C ctx) { return null; }

    default R visitProtoDecl(ProtoDecl node, C ctx) { return null; }

    default R visitParameter(Parameter node, C ctx) { return null; }

    // ============ 语句 ============

    default R visitBlock(Block node, C ctx) { return null; }

    default R visitWhileStmt(WhileStmt node, C ctx) { return null; }

    default R visitExpressionStmt(ExpressionStmt node, C ctx) { return null; }

    default R visitReturnStmt(ReturnStmt node, C ctx) { return null; }

    // ============ 表达式 ============

    default R visitIdentifier(Identifier node, C ctx) { return null; }

    default R visitBinaryExpr(BinaryExpr node, C ctx) { return null; }

    default R visitCallExpr(CallExpr node, C ctx) { return null; }

    default R visitLiteral(Literal node, C ctx) { return null; }
}
