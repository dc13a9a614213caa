package imp.runtime;

import com.implang.compiler.analysis.AnalysisResult;
import com.implang.compiler.analysis.SemanticDiagnostic;
import com.implang.compiler.analysis.Verifier;
import com.implang.compiler.ast.decl.Program;
import com.implang.compiler.codegen.CodeGenerator;
import com.implang.compiler.lexer.Lexer;
import com.implang.compiler.parser.Parser;
import imp.runtime.bytecode.Bytecode;
import imp.runtime.interpreter.Builtins;
import imp.runtime.interpreter.ImpRuntimeException;
import imp.runtime.interpreter.ImpSecurityPolicy;
import imp.runtime.interpreter.InputReader;
import imp.runtime.interpreter.Interpreter;

import java.io.*;
import java.util.ArrayList;
import java.util.List;

/**
 * IMP 便捷 API：解析 → 校验 → 生成字节码 → 执行。
 *
 * <p>静态调用（每次创建临时实例）：</p>
 * <pre>
 * Imp.run("func print(v: int): int = \"print_int\"; print(1 + 2)");
 * Imp.runFile("program.imp");
 * </pre>
 *
 * <p>实例调用（可重定向输入输出、指定安全策略）：</p>
 * <pre>
 * Imp imp = new Imp(ImpSecurityPolicy.standard())
 *     .setStdin(in)
 *     .setStdout(out);
 * Bytecode code = imp.compile(source, "main.imp");
 * imp.execute(code);
 * </pre>
 */
public final class Imp {

    private final ImpSecurityPolicy policy;
    private InputStream stdin = System.in;
    private InputReader input;
    private PrintStream stdout = System.out;
    private PrintStream stderr = System.err;
    private boolean trace;
    private final List<NativePrimitive> extraPrimitives = new ArrayList<>();

    public Imp() {
        this(ImpSecurityPolicy.unrestricted());
    }

    public Imp(ImpSecurityPolicy policy) {
        this.policy = policy;
    }

    // ── IO 重定向 ─────────────────────────────────────────

    public Imp setStdin(InputStream in) {
        this.stdin = in;
        this.input = null;
        return this;
    }

    /**
     * 与其他读取方共用已包装的输入（例如 REPL 的行读取）
     */
    public Imp setInput(InputReader reader) {
        this.input = reader;
        return this;
    }

    public Imp setStdout(PrintStream out) {
        this.stdout = out;
        return this;
    }

    /** 词法错误与校验警告的输出流 */
    public Imp setStderr(PrintStream err) {
        this.stderr = err;
        return this;
    }

    public Imp setTrace(boolean trace) {
        this.trace = trace;
        return this;
    }

    /**
     * 注册额外的原生原语，与内置原语同名时覆盖内置原语
     */
    public Imp registerPrimitive(NativePrimitive primitive) {
        extraPrimitives.add(primitive);
        return this;
    }

    public Imp registerPrimitive(String name, int arity, NativeRoutine routine) {
        return registerPrimitive(new NativePrimitive(name, arity, routine));
    }

    public ImpSecurityPolicy getPolicy() {
        return policy;
    }

    /**
     * 标准输入的读取器，整个实例只包装一次，多次编译执行之间不丢失预读的输入
     */
    public InputReader getInput() {
        if (input == null) {
            input = new InputReader(stdin);
        }
        return input;
    }

    /**
     * 当前配置下的原语注册表（内置 + 额外注册）
     */
    public PrimitiveRegistry createRegistry() {
        PrimitiveRegistry registry = Builtins.createRegistry(getInput(), stdout, policy);
        for (NativePrimitive p : extraPrimitives) {
            registry.register(p);
        }
        return registry;
    }

    // ── 编译 ─────────────────────────────────────────────

    /**
     * 解析源码
     *
     * @throws com.implang.compiler.parser.ParseException 词法或语法错误
     */
    public Program parse(String code, String fileName) {
        Lexer lexer = new Lexer(code, fileName, stderr);
        return new Parser(lexer, fileName).parse();
    }

    /**
     * 解析并校验，返回诊断（不抛出校验错误）
     */
    public AnalysisResult check(String code, String fileName) {
        return new Verifier(createRegistry()).verify(parse(code, fileName));
    }

    /**
     * 编译为字节码，校验警告写入 stderr
     *
     * @throws com.implang.compiler.parser.ParseException 词法或语法错误
     * @throws com.implang.compiler.analysis.VerificationException 校验失败
     */
    public Bytecode compile(String code, String fileName) {
        PrimitiveRegistry registry = createRegistry();
        Program program = parse(code, fileName);
        AnalysisResult analysis = new Verifier(registry).verify(program);
        analysis.throwIfErrors();
        for (SemanticDiagnostic diag : analysis.getDiagnostics()) {
            stderr.println(diag);
        }
        return new CodeGenerator(registry).translate(program);
    }

    public Bytecode compileFile(File file) {
        return compile(readFile(file), file.getName());
    }

    // ── 执行 ─────────────────────────────────────────────

    /**
     * 在新的虚拟机上执行字节码
     *
     * @return 执行结束后的虚拟机（可查看栈与指令计数）
     */
    public Interpreter execute(Bytecode code) {
        Interpreter vm = new Interpreter(code, policy).setTrace(trace);
        vm.run();
        return vm;
    }

    /**
     * 编译并执行源码
     */
    public Interpreter eval(String code) {
        return execute(compile(code, "<input>"));
    }

    public Interpreter eval(String code, String fileName) {
        return execute(compile(code, fileName));
    }

    public Interpreter evalFile(String path) {
        return evalFile(new File(path));
    }

    public Interpreter evalFile(File file) {
        return execute(compileFile(file));
    }

    // ── 静态便捷方法 ─────────────────────────────────────

    /**
     * 使用标准输入输出编译并执行源码
     */
    public static void run(String code) {
        new Imp().eval(code);
    }

    public static void runFile(String path) {
        new Imp().evalFile(path);
    }

    /**
     * 使用内置原语编译源码
     */
    public static Bytecode compile(String code) {
        return new Imp().compile(code, "<compiled>");
    }

    // ── 内部工具 ──────────────────────────────────────────

    private static String readFile(File file) {
        try {
            BufferedReader reader = new BufferedReader(
                    new InputStreamReader(new FileInputStream(file), "UTF-8"));
            try {
                StringBuilder sb = new StringBuilder();
                char[] buf = new char[8192];
                int n;
                while ((n = reader.read(buf)) != -1) {
                    sb.append(buf, 0, n);
                }
                return sb.toString();
            } finally {
                reader.close();
            }
        } catch (IOException e) {
            throw new ImpRuntimeException("Cannot read file: " + file.getPath(), e);
        }
    }
}
