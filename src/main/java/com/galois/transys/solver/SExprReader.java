package com.galois.transys.solver;

import java.io.IOException;
import java.io.Reader;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Reads SMT-LIB 2 responses as s-expressions.
 *
 * An atom is returned as a {@code String}, keeping the bars of quoted symbols
 * and the quotes of string literals. A list is returned as a
 * {@code List<Object>}.
 */
final class SExprReader {
    private final Reader in;
    private int peeked = -2;

    SExprReader(Reader in) {
        this.in = in;
    }

    private int peek() throws IOException {
        if (peeked == -2) peeked = in.read();
        return peeked;
    }

    private int read() throws IOException {
        int c = peek();
        peeked = -2;
        return c;
    }

    private void skipBlanks() throws IOException {
        while (true) {
            int c = peek();
            if (c == ';') {
                while (c != -1 && c != '\n') {
                    read();
                    c = peek();
                }
            } else if (c != -1 && Character.isWhitespace(c)) {
                read();
            } else {
                return;
            }
        }
    }

    /**
     * Read the next s-expression.
     *
     * @return the expression, or {@code null} at the end of the stream
     * @throws IOException on a read error or if the stream ends inside an
     *   expression
     */
    Object next() throws IOException {
        Deque<List<Object>> open = new ArrayDeque<List<Object>>();
        while (true) {
            skipBlanks();
            int c = peek();
            if (c == -1) {
                if (open.isEmpty()) return null;
                throw new IOException("unexpected end of solver output");
            }
            Object done;
            if (c == '(') {
                read();
                open.push(new ArrayList<Object>());
                continue;
            } else if (c == ')') {
                read();
                if (open.isEmpty()) {
                    throw new IOException("unbalanced ')' in solver output");
                }
                done = open.pop();
            } else {
                done = atom();
            }
            if (open.isEmpty()) return done;
            open.peek().add(done);
        }
    }

    private String atom() throws IOException {
        StringBuilder b = new StringBuilder();
        int c = peek();
        if (c == '|' || c == '"') {
            int close = c;
            b.append((char) read());
            while (true) {
                c = read();
                if (c == -1) throw new IOException("unterminated atom in solver output");
                b.append((char) c);
                if (c == close) {
                    // A doubled quote inside a string literal stands for one quote.
                    if (close == '"' && peek() == '"') {
                        read();
                        continue;
                    }
                    return b.toString();
                }
            }
        }
        while (c != -1 && c != '(' && c != ')' && c != ';'
               && !Character.isWhitespace(c)) {
            b.append((char) read());
            c = peek();
        }
        return b.toString();
    }
}
