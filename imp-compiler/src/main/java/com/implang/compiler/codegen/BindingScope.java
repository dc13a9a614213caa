package com.implang.compiler.codegen;

import imp.runtime.NativePrimitive;

import java.util.Collections;
import java.util.Map;

/**
 * 代码生成期的作用域链，把名称解析为 {@link Binding}。
 *
 * <p>查找由内向外；全局作用域查找失败说明校验器放过了未绑定的名称，属于内部错误。</p>
 */
public abstract class BindingScope {

    protected final BindingScope parent;

    protected BindingScope(BindingScope parent) {
        this.parent = parent;
    }

    public BindingScope getParent() {
        return parent;
    }

    public abstract Binding lookup(String name);

    /**
     * 顶层作用域：函数名 → 入口标签，原型名 → 原生原语
     */
    public static final class Global extends BindingScope {
        private final Map<String, Label> functions;
        private final Map<String, NativePrimitive> prototypes;

        public Global(Map<String, Label> functions, Map<String, NativePrimitive> prototypes) {
            super(null);
            this.functions = Collections.unmodifiableMap(functions);
            this.prototypes = Collections.unmodifiableMap(prototypes);
        }

        @Override
        public Binding lookup(String name) {
            Label entry = functions.get(name);
            if (entry != null) {
                return Binding.function(entry);
            }
            NativePrimitive primitive = prototypes.get(name);
            if (primitive != null) {
                return Binding.nativePrimitive(primitive);
            }
            throw new IllegalStateException("Name not bound: " + name);
        }
    }

    /**
     * 函数作用域：参数名 → 按声明顺序的槽位（从 0 开始）
     */
    public static final class Function extends BindingScope {
        private final Map<String, Integer> arguments;

        public Function(BindingScope parent, Map<String, Integer> arguments) {
            super(parent);
            this.arguments = Collections.unmodifiableMap(arguments);
        }

        @Override
        public Binding lookup(String name) {
            Integer slot = arguments.get(name);
            if (slot != null) {
                return Binding.argument(slot);
            }
            return parent.lookup(name);
        }
    }

    /**
     * 块作用域：目前不引入绑定
     */
    public static final class Block extends BindingScope {

        public Block(BindingScope parent) {
            super(parent);
        }

        @Override
        public Binding lookup(String name) {
            return parent.lookup(name);
        }
    }
}
