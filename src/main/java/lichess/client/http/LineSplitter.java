package lichess.client.http;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.function.Consumer;

/**
 * Cuts a byte stream into UTF-8 lines at {@code \n}, dropping a trailing {@code \r}. A line may span any number of
 * buffers; splitting on the newline byte is safe because it never occurs inside a multi-byte UTF-8 sequence.
 */
final class LineSplitter {
    private byte[] pending = new byte[256];
    private int length;

    void feed(ByteBuffer bytes, Consumer<String> lines) {
        while (bytes.hasRemaining()) {
            byte b = bytes.get();
            if (b == '\n') {
                lines.accept(take());
            } else {
                append(b);
            }
        }
    }

    /**
     * Returns the unterminated last line, or null if the stream ended with a newline.
     */
    String finish() {
        return length == 0 ? null : take();
    }

    private void append(byte b) {
        if (length == pending.length) {
            pending = Arrays.copyOf(pending, pending.length * 2);
        }
        pending[length++] = b;
    }

    private String take() {
        int end = length;
        if (end > 0 && pending[end - 1] == '\r') {
            end--;
        }
        String line = new String(pending, 0, end, StandardCharsets.UTF_8);
        length = 0;
        return line;
    }
}
