package imp.runtime.interpreter;

/**
 * 安全策略配置类
 *
 * <p>控制 IMP 虚拟机的资源使用与标准输入输出访问。</p>
 *
 * <p>使用示例：</p>
 * <pre>
 * // 预定义级别
 * Interpreter vm = new Interpreter(bytecode, ImpSecurityPolicy.strict());
 *
 * // 自定义策略
 * ImpSecurityPolicy policy = ImpSecurityPolicy.custom()
 *     .allowStdio(false)
 *     .maxInstructions(5000)
 *     .build();
 * </pre>
 */
public final class ImpSecurityPolicy {

    /** 安全级别 */
    public enum Level { UNRESTRICTED, STANDARD, STRICT, CUSTOM }

    private final Level level;

    // --- 功能开关 ---
    private final boolean allowStdio;

    // --- 资源限制 ---
    private final int maxStackDepth;       // 0=无限制
    private final long maxInstructions;    // 0=无限制

    private ImpSecurityPolicy(Builder builder) {
        this.level = builder.level;
        this.allowStdio = builder.allowStdio;
        this.maxStackDepth = builder.maxStackDepth;
        this.maxInstructions = builder.maxInstructions;
    }

    // ============ 预定义工厂方法 ============

    /** 无限制模式（默认） */
    public static ImpSecurityPolicy unrestricted() {
        return new Builder(Level.UNRESTRICTED)
                .allowStdio(true)
                .build();
    }

    /** 标准模式：允许标准输入输出，限制栈深度与指令数 */
    public static ImpSecurityPolicy standard() {
        return new Builder(Level.STANDARD)
                .allowStdio(true)
                .maxStackDepth(65_536)
                .maxInstructions(100_000_000L)
                .build();
    }

    /** 严格模式：禁止标准输入输出 */
    public static ImpSecurityPolicy strict() {
        return new Builder(Level.STRICT)
                .allowStdio(false)
                .maxStackDepth(4_096)
                .maxInstructions(1_000_000L)
                .build();
    }

    /** 自定义模式 Builder */
    public static Builder custom() {
        return new Builder(Level.CUSTOM);
    }

    /**
     * 按名称取预定义策略（不区分大小写）
     *
     * @throws IllegalArgumentException 未知名称
     */
    public static ImpSecurityPolicy forName(String name) {
        switch (name.toLowerCase()) {
            case "unrestricted": return unrestricted();
            case "standard": return standard();
            case "strict": return strict();
            default:
                throw new IllegalArgumentException("Unknown sandbox level: " + name
                        + " (expected unrestricted, standard or strict)");
        }
    }

    // ============ 查询方法 ============

    public boolean isStdioAllowed() {
        return level == Level.UNRESTRICTED || allowStdio;
    }

    public Level getLevel() {
        return level;
    }

    public int getMaxStackDepth() {
        return maxStackDepth;
    }

    public long getMaxInstructions() {
        return maxInstructions;
    }

    // ============ 错误工厂 ============

    /** 创建安全拒绝异常 */
    public static ImpRuntimeException denied(String action) {
        return new ImpRuntimeException("Security policy denied: " + action);
    }

    // ============ Builder ============

    public static final class Builder {
        private final Level level;
        private boolean allowStdio = true;
        private int maxStackDepth = 0;
        private long maxInstructions = 0;

        Builder(Level level) {
            this.level = level;
        }

        public Builder allowStdio(boolean allow) {
            this.allowStdio = allow;
            return this;
        }

        public Builder maxStackDepth(int depth) {
            this.maxStackDepth = depth;
            return this;
        }

        public Builder maxInstructions(long max) {
            this.maxInstructions = max;
            return this;
        }

        public ImpSecurityPolicy build() {
            return new ImpSecurityPolicy(this);
        }
    }
}
