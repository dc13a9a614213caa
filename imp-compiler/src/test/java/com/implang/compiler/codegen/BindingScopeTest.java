package com.implang.compiler.codegen;

import imp.runtime.NativePrimitive;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("代码生成作用域链")
class BindingScopeTest {

    private final LabelTable labels = new LabelTable();
    private final NativePrimitive print = new NativePrimitive("print_int", 1, s -> { });

    private BindingScope.Global global(Label fLabel) {
        Map<String, Label> functions = new HashMap<>();
        functions.put("f", fLabel);
        Map<String, NativePrimitive> protos = new HashMap<>();
        protos.put("print", print);
        return new BindingScope.Global(functions, protos);
    }

    @Test
    @DisplayName("全局作用域解析函数与原型")
    void globalLookup() {
        Label f = labels.newLabel();
        BindingScope.Global global = global(f);

        Binding fb = global.lookup("f");
        assertEquals(Binding.Kind.FUNCTION, fb.getKind());
        assertEquals(f, fb.getEntry());

        Binding pb = global.lookup("print");
        assertEquals(Binding.Kind.NATIVE, pb.getKind());
        assertSame(print, pb.getPrimitive());
    }

    @Test
    @DisplayName("全局查找失败是内部错误")
    void globalMiss() {
        BindingScope.Global global = global(labels.newLabel());
        assertThrows(IllegalStateException.class, () -> global.lookup("nope"));
    }

    @Test
    @DisplayName("函数作用域按声明顺序给出参数槽位，并遮蔽全局名")
    void functionScope() {
        Map<String, Integer> args = new HashMap<>();
        args.put("a", 0);
        args.put("f", 1);
        BindingScope.Function fn = new BindingScope.Function(global(labels.newLabel()), args);

        assertEquals(0, fn.lookup("a").getSlot());
        assertEquals(Binding.Kind.ARGUMENT, fn.lookup("f").getKind());
        assertEquals(1, fn.lookup("f").getSlot());
        assertEquals(Binding.Kind.NATIVE, fn.lookup("print").getKind());
    }

    @Test
    @DisplayName("块作用域委托给外层")
    void blockScope() {
        Map<String, Integer> args = new HashMap<>();
        args.put("x", 0);
        BindingScope.Function fn = new BindingScope.Function(global(labels.newLabel()), args);
        BindingScope.Block inner = new BindingScope.Block(new BindingScope.Block(fn));

        assertEquals(0, inner.lookup("x").getSlot());
        assertEquals(Binding.Kind.FUNCTION, inner.lookup("f").getKind());
        assertSame(fn, inner.getParent().getParent());
    }

    @Test
    @DisplayName("按错误种类读取绑定")
    void wrongKindAccess() {
        Binding arg = Binding.argument(2);
        assertThrows(IllegalStateException.class, arg::getEntry);
        assertEquals("argument #2", arg.toString());
    }
}
