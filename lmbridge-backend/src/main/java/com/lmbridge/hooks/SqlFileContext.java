package com.lmbridge.hooks;

import org.springframework.stereotype.Component;

/**
 * Binds the SQL template currently executing to the calling thread.
 *
 * <p>Callers must pair every {@link #set} with a {@link #reset} in a {@code finally} block.
 * Resetting restores the value that was bound before the matching {@code set}, so nested
 * template queries unwind correctly.
 */
@Component
public class SqlFileContext {

    private final ThreadLocal<Token> current = new ThreadLocal<>();

    /**
     * Bind a template identifier.
     *
     * @param sqlFile template identifier, may be null
     * @return token to pass to {@link #reset}
     */
    public Token set(String sqlFile) {
        Token token = new Token(this, Thread.currentThread(), sqlFile, current.get());
        current.set(token);
        return token;
    }

    /**
     * Restore the binding that was active before the given token was issued.
     *
     * @param token token returned by {@link #set}
     * @throws IllegalStateException if the token was issued by another context or thread, or is
     *     not the innermost binding
     */
    public void reset(Token token) {
        if (token == null || token.owner != this) {
            throw new IllegalStateException("Token was not created by this context");
        }
        if (token.thread != Thread.currentThread()) {
            throw new IllegalStateException("Token was created on a different thread");
        }
        if (current.get() != token) {
            throw new IllegalStateException("Token has already been reset or is not the innermost binding");
        }
        if (token.previous == null) {
            current.remove();
        } else {
            current.set(token.previous);
        }
    }

    /**
     * Get the template identifier bound to the calling thread.
     *
     * @return template identifier, or null when none is bound
     */
    public String get() {
        Token token = current.get();
        return token != null ? token.value : null;
    }

    /**
     * Handle for one {@link #set} call.
     */
    public static final class Token {
        private final SqlFileContext owner;
        private final Thread thread;
        private final String value;
        private final Token previous;

        private Token(SqlFileContext owner, Thread thread, String value, Token previous) {
            this.owner = owner;
            this.thread = thread;
            this.value = value;
            this.previous = previous;
        }

        public String getValue() {
            return value;
        }
    }
}
