package com.ivamare.ordersaga.exception;

import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.dao.CannotAcquireLockException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.jdbc.BadSqlGrammarException;
import org.springframework.jdbc.CannotGetJdbcConnectionException;

import java.sql.SQLException;
import java.sql.SQLNonTransientConnectionException;
import java.sql.SQLRecoverableException;
import java.sql.SQLTransientConnectionException;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class DatabaseExceptionClassifierTest {

    @Nested
    class SqlStateClassification {

        @Test
        void shouldRetryConnectionAndResourceStates() {
            assertTrue(isRetryable("08001", "Unable to establish connection"));
            assertTrue(isRetryable("08006", "Connection failure"));
            assertTrue(isRetryable("53300", "Too many connections"));
            assertTrue(isRetryable("57P01", "Admin shutdown"));
        }

        @Test
        void shouldRetrySerializationFailureAndDeadlock() {
            assertTrue(isRetryable("40001", "Serialization failure"));
            assertTrue(isRetryable("40P01", "Deadlock detected"));
        }

        @Test
        void shouldNotRetryOtherStates() {
            assertFalse(isRetryable("42601", "Syntax error"));
            assertFalse(isRetryable("23505", "Unique violation"));
            assertFalse(isRetryable("22001", "String data right truncation"));
        }

        private boolean isRetryable(String sqlState, String message) {
            return DatabaseExceptionClassifier.isRetryable(new SQLException(message, sqlState));
        }
    }

    @Nested
    class ExceptionTypeClassification {

        @Test
        void shouldRetryStreamConflict() {
            ConcurrencyConflictException conflict =
                new ConcurrencyConflictException(UUID.randomUUID(), 3, "stream moved");

            assertTrue(DatabaseExceptionClassifier.isRetryable(conflict));
            assertEquals("stream conflict", DatabaseExceptionClassifier.retryReason(conflict).orElseThrow());
        }

        @Test
        void shouldRetryTransientSpringExceptions() {
            assertTrue(DatabaseExceptionClassifier.isRetryable(new CannotAcquireLockException("lock")));
            assertTrue(DatabaseExceptionClassifier.isRetryable(new QueryTimeoutException("slow")));
            assertTrue(DatabaseExceptionClassifier.isRetryable(
                new CannotGetJdbcConnectionException("pool exhausted")));
        }

        @Test
        void shouldRetryTransientJdbcExceptions() {
            assertTrue(DatabaseExceptionClassifier.isRetryable(new SQLTransientConnectionException("gone")));
            assertTrue(DatabaseExceptionClassifier.isRetryable(new SQLRecoverableException("recover")));
            assertTrue(DatabaseExceptionClassifier.isRetryable(new SQLNonTransientConnectionException("closed")));
        }

        @Test
        void shouldNotRetryIntegrityViolations() {
            assertFalse(DatabaseExceptionClassifier.isRetryable(new DuplicateKeyException("dup")));
            assertFalse(DatabaseExceptionClassifier.isRetryable(new DataIntegrityViolationException("bad")));
        }

        @Test
        void shouldNotRetryProgrammingErrors() {
            assertFalse(DatabaseExceptionClassifier.isRetryable(new IllegalStateException("bug")));
            assertFalse(DatabaseExceptionClassifier.isRetryable(new ContractViolationException(UUID.randomUUID(), "gap")));
            assertFalse(DatabaseExceptionClassifier.isRetryable(null));
        }
    }

    @Nested
    class CauseChain {

        @Test
        void shouldFindRetryableCause() {
            SQLException cause = new SQLException("deadlock", "40P01");
            RuntimeException wrapped = new RuntimeException("outer", new IllegalStateException("middle", cause));

            assertTrue(DatabaseExceptionClassifier.isRetryable(wrapped));
            assertEquals("SQL state 40P01", DatabaseExceptionClassifier.retryReason(wrapped).orElseThrow());
        }

        @Test
        void shouldMatchMessagePatterns() {
            RuntimeException ex = new RuntimeException("I/O error: Connection reset by peer");

            assertEquals("message pattern: connection reset",
                DatabaseExceptionClassifier.retryReason(ex).orElseThrow());
        }

        @Test
        void shouldExtractSqlStateFromChain() {
            SQLException sql = new SQLException("syntax", "42601");
            BadSqlGrammarException ex = new BadSqlGrammarException("select", "SELEC 1", sql);

            assertEquals("42601", DatabaseExceptionClassifier.sqlState(ex));
            assertNull(DatabaseExceptionClassifier.sqlState(new RuntimeException("no sql")));
        }
    }
}
