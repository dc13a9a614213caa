package com.implang.compiler.analysis;

import com.implang.compiler.ast.AstNode;
import com.implang.compiler.ast.AstVisitor;
import com.implang.compiler.ast.SourceLocation;
import com.implang.compiler.ast.decl.*;
import com.implang.compiler.ast.expr.*;
import com.implang.compiler.ast.stmt.*;
import imp.runtime.NativePrimitive;
import imp.runtime.PrimitiveRegistry;

import java.util.ArrayList;
import java.util.List;

/**
 * 校验器：在代码生成前检查名称解析与调用约束，收集诊断。
 *
 * <p>通过校验的程序在代码生成阶段不会出现名称解析失败。检查项：</p>
 * <ul>
 *   <li>未定义名称、重复声明（顶层与参数）</li>
 *   <li>原型绑定的原语不存在，或原型参数个数与原语不符</li>
 *   <li>直接调用函数/原型时实参个数不符</li>
 *   <li>函数体外的 return，函数体不以 return 结束</li>
 * </ul>
 */
public final class Verifier implements AstVisitor<Void, Void> {

    private final PrimitiveRegistry primitives;
    private final Scope globalScope = new Scope(Scope.ScopeType.GLOBAL, null);
    private Scope currentScope = globalScope;
    private final List<SemanticDiagnostic> diagnostics = new ArrayList<SemanticDiagnostic>();

    public Verifier(PrimitiveRegistry primitives) {
        this.primitives = primitives;
    }

    /** 分析入口 */
    public AnalysisResult verify(Program program) {
        program.accept(this, null);
        return new AnalysisResult(globalScope, diagnostics);
    }

    // ============ 辅助方法 ============

    private void error(String message, AstNode node) {
        diagnostics.add(new SemanticDiagnostic(SemanticDiagnostic.Severity.ERROR, message, locationOf(node)));
    }

    private void warning(String message, AstNode node) {
        diagnostics.add(new SemanticDiagnostic(SemanticDiagnostic.Severity.WARNING, message, locationOf(node)));
    }

    private static SourceLocation locationOf(AstNode node) {
        return node != null && node.getLocation() != null ? node.getLocation() : SourceLocation.UNKNOWN;
    }

    private void enterScope(Scope.ScopeType type) {
        currentScope = new Scope(type, currentScope);
    }

    private void exitScope() {
        currentScope = currentScope.getParent();
    }

    // ============ 声明 ============

    @Override
    public Void visitProgram(Program node, Void ctx) {
        // 先登记全部顶层声明，函数可以在声明之前被引用
        for (AstNode item : node.getItems()) {
            if (item instanceof FunDecl) {
                declareGlobal((Declaration) item, SymbolKind.FUNCTION);
            } else if (item instanceof ProtoDecl) {
                declareGlobal((Declaration) item, SymbolKind.PROTOTYPE);
            }
        }
        for (AstNode item : node.getItems()) {
            item.accept(this, null);
        }
        return null;
    }

    private void declareGlobal(Declaration decl, SymbolKind kind) {
        if (globalScope.resolveLocal(decl.getName()) != null) {
            error("Duplicate declaration of '" + decl.getName() + "'", decl);
            return;
        }
        globalScope.define(new Symbol(decl.getName(), kind, decl.getArity(), decl.getLocation(), decl));
    }

    @Override
    public Void visitFunDecl(FunDecl node, Void ctx) {
        enterScope(Scope.ScopeType.FUNCTION);
        for (Parameter param : node.getParams()) {
            param.accept(this, null);
        }
        node.getBody().accept(this, null);
        exitScope();

        if (!alwaysReturns(node.getBody())) {
            error("Function '" + node.getName() + "' must end with a return statement", node);
        }
        return null;
    }

    @Override
    public Void visitParameter(Parameter node, Void ctx) {
        if (currentScope.resolveLocal(node.getName()) != null) {
            error("Duplicate parameter '" + node.getName() + "'", node);
            return null;
        }
        currentScope.define(new Symbol(node.getName(), SymbolKind.PARAMETER, -1, node.getLocation(), node));
        return null;
    }

    @Override
    public Void visitProtoDecl(ProtoDecl node, Void ctx) {
        NativePrimitive primitive = primitives != null ? primitives.lookup(node.getPrimitiveName()) : null;
        if (primitive == null) {
            error("Unknown primitive \"" + node.getPrimitiveName() + "\" for '" + node.getName() + "'", node);
        } else if (primitive.getArity() != node.getArity()) {
            error("Prototype '" + node.getName() + "' declares " + node.getArity()
                    + " parameter(s) but primitive \"" + primitive.getName() + "\" takes "
                    + primitive.getArity(), node);
        }
        return null;
    }

    /** 语句序列的最后一条语句是否为 return（块则递归检查其最后一条语句） */
    private static boolean alwaysReturns(Statement stmt) {
        if (stmt instanceof ReturnStmt) return true;
        if (stmt instanceof Block) {
            List<Statement> stmts = ((Block) stmt).getStatements();
            return !stmts.isEmpty() && alwaysReturns(stmts.get(stmts.size() - 1));
        }
        return false;
    }

    // ============ 语句 ============

    @Override
    public Void visitBlock(Block node, Void ctx) {
        enterScope(Scope.ScopeType.BLOCK);
        for (Statement stmt : node.getStatements()) {
            stmt.accept(this, null);
        }
        exitScope();
        return null;
    }

    @Override
    public Void visitWhileStmt(WhileStmt node, Void ctx) {
        node.getCondition().accept(this, null);
        node.getBody().accept(this, null);
        return null;
    }

    @Override
    public Void visitExpressionStmt(ExpressionStmt node, Void ctx) {
        node.getExpression().accept(this, null);
        return null;
    }

    @Override
    public Void visitReturnStmt(ReturnStmt node, Void ctx) {
        if (!currentScope.isInsideFunction()) {
            error("'return' outside of a function", node);
        }
        node.getValue().accept(this, null);
        return null;
    }

    // ============ 表达式 ============

    @Override
    public Void visitIdentifier(Identifier node, Void ctx) {
        if (currentScope.resolve(node.getName()) == null) {
            error("Unknown name '" + node.getName() + "'", node);
        }
        return null;
    }

    @Override
    public Void visitBinaryExpr(BinaryExpr node, Void ctx) {
        node.getLeft().accept(this, null);
        node.getRight().accept(this, null);
        return null;
    }

    @Override
    public Void visitCallExpr(CallExpr node, Void ctx) {
        for (Expression arg : node.getArgs()) {
            arg.accept(this, null);
        }
        Expression callee = node.getCallee();
        callee.accept(this, null);

        if (callee instanceof Identifier) {
            Symbol sym = currentScope.resolve(((Identifier) callee).getName());
            if (sym != null && sym.isCallable() && sym.getArity() != node.getArgs().size()) {
                error("'" + sym.getName() + "' expects " + sym.getArity()
                        + " argument(s) but got " + node.getArgs().size(), node);
            }
        } else if (callee instanceof Literal) {
            // 合法语法，运行时必然失败
            warning("Calling an integer literal always fails at runtime", node);
        }
        return null;
    }

    @Override
    public Void visitLiteral(Literal node, Void ctx) {
        return null;
    }
}
