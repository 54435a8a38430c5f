package com.hivestate.testing;

import org.h2.jdbcx.JdbcDataSource;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.UUID;

/**
 * In-memory H2 databases standing in for PostgreSQL. H2 has no JSONB type, so a domain of
 * that name is declared before the schema is created.
 */
public final class H2Databases {

    private H2Databases() {}

    public static DataSource create() {
        JdbcDataSource dataSource = new JdbcDataSource();
        dataSource.setURL("jdbc:h2:mem:" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1");
        dataSource.setUser("sa");
        try (Connection conn = dataSource.getConnection();
             Statement stmt = conn.createStatement()) {
            stmt.execute("CREATE DOMAIN IF NOT EXISTS JSONB AS VARCHAR");
        } catch (SQLException e) {
            throw new IllegalStateException("Failed to prepare H2 database", e);
        }
        return dataSource;
    }

    public static void execute(DataSource dataSource, String sql) {
        try (Connection conn = dataSource.getConnection();
             Statement stmt = conn.createStatement()) {
            stmt.execute(sql);
        } catch (SQLException e) {
            throw new IllegalStateException("Failed to execute: " + sql, e);
        }
    }
}
