package ru.aritmos.commshub.store;

import org.junit.jupiter.api.Test;

import java.sql.SQLException;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JdbcSupportTest {

    @Test
    void shouldClassifySqlStateClasses() {
        assertTrue(JdbcSupport.isIntegrityViolation(new SQLException("dup", "23505")));
        assertFalse(JdbcSupport.isIntegrityViolation(new SQLException("deadlock", "40P01")));

        assertTrue(JdbcSupport.isTransient(new SQLException("serialization", "40001")));
        assertFalse(JdbcSupport.isTransient(new SQLException("syntax", "42601")));
        assertFalse(JdbcSupport.isTransient(new SQLException("no state")));
    }

    @Test
    void shouldLookThroughCauseChain() {
        SQLException wrapper = new SQLException("batch failed", "XX000");
        wrapper.initCause(new SQLException("dup", "23505"));

        assertTrue(JdbcSupport.isIntegrityViolation(wrapper));
    }
}
