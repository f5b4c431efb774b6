package com.lmbridge.provider;

import com.lmbridge.intercept.QueryInvocation;
import org.springframework.stereotype.Component;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * JDBC {@link QueryExecutor}.
 *
 * Runs on the invocation's connection when one is attached (a routed pool or a caller-held
 * connection); otherwise borrows a connection from the provider's default pool for the duration
 * of the statement.
 */
@Component
public class JdbcQueryExecutor implements QueryExecutor {

    @Override
    public List<Map<String, Object>> execute(QueryInvocation invocation) throws SQLException {
        Connection attached = invocation.getConnection();
        if (attached != null) {
            return run(attached, invocation.getSql(), invocation.getArgs());
        }

        DataSource ds = invocation.getProvider().getDefaultPool();
        try (Connection conn = ds.getConnection()) {
            return run(conn, invocation.getSql(), invocation.getArgs());
        }
    }

    private List<Map<String, Object>> run(Connection conn, String sql, List<Object> params) throws SQLException {
        // Parameter-less statements skip the extended protocol.
        if (params == null || params.isEmpty()) {
            try (Statement stmt = conn.createStatement()) {
                try (ResultSet rs = stmt.executeQuery(sql)) {
                    return readRows(rs);
                }
            }
        }

        try (PreparedStatement stmt = conn.prepareStatement(sql)) {
            for (int i = 0; i < params.size(); i++) {
                stmt.setObject(i + 1, params.get(i));
            }
            try (ResultSet rs = stmt.executeQuery()) {
                return readRows(rs);
            }
        }
    }

    private List<Map<String, Object>> readRows(ResultSet rs) throws SQLException {
        ResultSetMetaData rsmd = rs.getMetaData();
        int columnCount = rsmd.getColumnCount();

        List<Map<String, Object>> rows = new ArrayList<>();
        while (rs.next()) {
            Map<String, Object> row = new LinkedHashMap<>();
            for (int i = 1; i <= columnCount; i++) {
                row.put(rsmd.getColumnLabel(i), JdbcRowReader.readValue(rs, i));
            }
            rows.add(row);
        }
        return rows;
    }
}
