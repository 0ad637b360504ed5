package com.skanga.dbgate.db;

import org.junit.jupiter.api.Test;

import java.sql.Types;

import static org.junit.jupiter.api.Assertions.assertEquals;

class JdbcTypeNamesTest {
    @Test
    void testStandardTypes() {
        assertEquals("VARCHAR", JdbcTypeNames.nameOf(Types.VARCHAR));
        assertEquals("INTEGER", JdbcTypeNames.nameOf(Types.INTEGER));
        assertEquals("TIMESTAMP WITH TIME ZONE", JdbcTypeNames.nameOf(Types.TIMESTAMP_WITH_TIMEZONE));
    }

    @Test
    void testSqlServerTypes() {
        assertEquals("GUID", JdbcTypeNames.nameOf(-145));
        assertEquals("SMALLMONEY", JdbcTypeNames.nameOf(-146));
        assertEquals("MONEY", JdbcTypeNames.nameOf(-148));
        assertEquals("SMALLDATETIME", JdbcTypeNames.nameOf(-150));
        assertEquals("DATETIME", JdbcTypeNames.nameOf(-151));
        assertEquals("STRUCTURED", JdbcTypeNames.nameOf(-153));
        assertEquals("DATETIMEOFFSET", JdbcTypeNames.nameOf(-155));
        assertEquals("SQL_VARIANT", JdbcTypeNames.nameOf(-156));
        assertEquals("GEOMETRY", JdbcTypeNames.nameOf(-157));
        assertEquals("GEOGRAPHY", JdbcTypeNames.nameOf(-158));
        assertEquals("UNKNOWN(-147)", JdbcTypeNames.nameOf(-147));
    }

    @Test
    void testOracleTypes() {
        assertEquals("BINARY_DOUBLE", JdbcTypeNames.nameOf(101));
        assertEquals("TIMESTAMP WITH LOCAL TIME ZONE", JdbcTypeNames.nameOf(-102));
    }

    @Test
    void testUnknownType() {
        assertEquals("UNKNOWN(9999)", JdbcTypeNames.nameOf(9999));
    }
}
