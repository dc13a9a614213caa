package imp.runtime;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * 原生原语注册表：映射原语名称到 {@link NativePrimitive}
 *
 * <p>代码生成器按名称解析 {@code func f(...): int = "name"} 声明的原语，
 * 并把得到的原语身份嵌入字节码。</p>
 */
public final class PrimitiveRegistry {

    private final Map<String, NativePrimitive> primitives = new LinkedHashMap<>();

    public PrimitiveRegistry register(String name, int arity, NativeRoutine routine) {
        return register(new NativePrimitive(name, arity, routine));
    }

    public PrimitiveRegistry register(NativePrimitive primitive) {
        primitives.put(primitive.getName(), primitive);
        return this;
    }

    public boolean has(String name) {
        return primitives.containsKey(name);
    }

    /** 按名称查找，未注册返回 null */
    public NativePrimitive lookup(String name) {
        return primitives.get(name);
    }

    public Set<String> names() {
        return Collections.unmodifiableSet(primitives.keySet());
    }

    public int size() {
        return primitives.size();
    }
}
