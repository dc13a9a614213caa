package com.implang.compiler.ast.decl;

import com.implang.compiler.ast.AstNode;
import com.implang.compiler.ast.AstVisitor;
import com.implang.compiler.ast.SourceLocation;
import com.implang.compiler.ast.stmt.Statement;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 程序（编译单元）
 *
 * <p>顶层条目按源码顺序保存，每项为 {@link FunDecl}、{@link ProtoDecl} 或 {@link Statement}。</p>
 */
public class Program extends AstNode {
    private final List<AstNode> items;

    public Program(SourceLocation location, List<AstNode> items) {
        super(location);
        for (AstNode item : items) {
            if (!(item instanceof Declaration) && !(item instanceof Statement)) {
                throw new IllegalArgumentException("Not a top-level item: " + item.getClass().getSimpleName());
            }
        }
        this.items = Collections.unmodifiableList(new ArrayList<>(items));
    }

    public List<AstNode> getItems() {
        return items;
    }

    public List<FunDecl> getFunctions() {
        List<FunDecl> result = new ArrayList<>();
        for (AstNode item : items) {
            if (item instanceof FunDecl) result.add((FunDecl) item);
        }
        return result;
    }

    public List<ProtoDecl> getPrototypes() {
        List<ProtoDecl> result = new ArrayList<>();
        for (AstNode item : items) {
            if (item instanceof ProtoDecl) result.add((ProtoDecl) item);
        }
        return result;
    }

    /** 顶层裸语句（程序入口，按源码顺序） */
    public List<Statement> getStatements() {
        List<Statement> result = new ArrayList<>();
        for (AstNode item : items) {
            if (item instanceof Statement) result.add((Statement) item);
        }
        return result;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitProgram(this, context);
    }
}
