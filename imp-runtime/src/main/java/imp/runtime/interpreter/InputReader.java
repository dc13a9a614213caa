package imp.runtime.interpreter;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;

/**
 * 输入流上唯一的缓冲读取器
 *
 * <p>{@code read_int} 的整数读取与 REPL 的行读取共用同一个缓冲区。
 * 同一输入流只应包装一次，否则先创建的读取器预读的内容对后者不可见。</p>
 */
public final class InputReader {

    private final InputStream in;
    private BufferedReader reader;

    public InputReader(InputStream in) {
        this.in = in;
    }

    /**
     * 读取下一个以空白分隔的整数
     *
     * @throws ImpRuntimeException 输入结束、内容不是整数或读取失败
     */
    public long nextInt() {
        String token;
        try {
            token = nextToken();
        } catch (IOException e) {
            throw new ImpRuntimeException("Failed to read input: " + e.getMessage(), e);
        }
        if (token == null) {
            throw new ImpRuntimeException("read_int: end of input");
        }
        try {
            return Long.parseLong(token);
        } catch (NumberFormatException e) {
            throw new ImpRuntimeException("read_int: not an integer: " + token, e);
        }
    }

    /**
     * 读取一行（不含行尾），输入结束返回 null
     */
    public String readLine() throws IOException {
        return reader().readLine();
    }

    private String nextToken() throws IOException {
        BufferedReader r = reader();
        int c = r.read();
        while (c != -1 && Character.isWhitespace(c)) {
            c = r.read();
        }
        if (c == -1) {
            return null;
        }
        StringBuilder sb = new StringBuilder();
        while (c != -1 && !Character.isWhitespace(c)) {
            sb.append((char) c);
            c = r.read();
        }
        // 整数后紧跟的换行属于该行，行读取不应再看到一个空行
        if (c == '\r') {
            r.mark(1);
            if (r.read() != '\n') {
                r.reset();
            }
        }
        return sb.toString();
    }

    // 首次读取时才包装，未读取输入的程序不消费任何字节
    private BufferedReader reader() {
        if (reader == null) {
            reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
        }
        return reader;
    }
}
