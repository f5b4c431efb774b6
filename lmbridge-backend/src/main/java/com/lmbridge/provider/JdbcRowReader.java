package com.lmbridge.provider;

import java.io.Reader;
import java.sql.Clob;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;

/**
 * Converts JDBC column values into plain Java values that hooks and Jackson can handle.
 *
 * <p>PostgreSQL {@code json}/{@code jsonb} columns arrive as driver-specific {@code PGobject}s and
 * are unwrapped to their JSON text, which is the form the release filter expects for the
 * {@code album} column.
 */
public final class JdbcRowReader {
    private static final int MAX_NESTED_DEPTH = 3;
    private static final int MAX_CLOB_CHARS = 10_000_000;

    private JdbcRowReader() {
    }

    /**
     * Read a column value.
     *
     * @param rs result set positioned on a row
     * @param columnIndex 1-based column index
     * @return plain value
     * @throws SQLException on JDBC errors
     */
    public static Object readValue(ResultSet rs, int columnIndex) throws SQLException {
        return toPlain(rs.getObject(columnIndex), 0);
    }

    static Object toPlain(Object v, int depth) throws SQLException {
        if (v == null) {
            return null;
        }
        if (depth > MAX_NESTED_DEPTH) {
            return String.valueOf(v);
        }
        if (v instanceof String || v instanceof Number || v instanceof Boolean) {
            return v;
        }

        String pgValue = tryReadPgObject(v);
        if (pgValue != null) {
            return pgValue;
        }

        if (v instanceof java.util.UUID) {
            return v.toString();
        }
        if (v instanceof java.sql.Date || v instanceof java.sql.Time || v instanceof java.sql.Timestamp) {
            return v.toString();
        }
        if (v instanceof Clob clob) {
            return readClob(clob);
        }
        if (v instanceof java.sql.Array arr) {
            Object arrayValue = arr.getArray();
            if (arrayValue instanceof Object[] objectArray) {
                List<Object> out = new ArrayList<>(objectArray.length);
                for (Object elem : objectArray) {
                    out.add(toPlain(elem, depth + 1));
                }
                return out;
            }
            return String.valueOf(arrayValue);
        }
        return v;
    }

    private static String tryReadPgObject(Object v) {
        if (!"org.postgresql.util.PGobject".equals(v.getClass().getName())) {
            return null;
        }
        try {
            var m = v.getClass().getMethod("getValue");
            Object value = m.invoke(v);
            return value != null ? value.toString() : "";
        } catch (ReflectiveOperationException e) {
            return null;
        }
    }

    private static String readClob(Clob clob) throws SQLException {
        long length = clob.length();
        if (length <= 0) {
            return "";
        }
        if (length <= MAX_CLOB_CHARS) {
            return clob.getSubString(1, (int) length);
        }
        try (Reader reader = clob.getCharacterStream()) {
            char[] buf = new char[8192];
            StringBuilder sb = new StringBuilder();
            int n;
            while (sb.length() < MAX_CLOB_CHARS && (n = reader.read(buf, 0, Math.min(buf.length, MAX_CLOB_CHARS - sb.length()))) > 0) {
                sb.append(buf, 0, n);
            }
            return sb.toString();
        } catch (java.io.IOException e) {
            throw new SQLException("Failed to read CLOB", e);
        }
    }
}
