package com.skanga.dbgate.db;

import java.sql.Types;
import java.util.HashMap;
import java.util.Map;

/**
 * Canonical names for JDBC type codes, including common vendor specific codes.
 */
public final class JdbcTypeNames {
    private static final Map<Integer, String> TYPE_NAMES = new HashMap<>();

    static {
        // Character
        TYPE_NAMES.put(Types.CHAR, "CHAR");
        TYPE_NAMES.put(Types.VARCHAR, "VARCHAR");
        TYPE_NAMES.put(Types.LONGVARCHAR, "LONGVARCHAR");
        TYPE_NAMES.put(Types.NCHAR, "NCHAR");
        TYPE_NAMES.put(Types.NVARCHAR, "NVARCHAR");
        TYPE_NAMES.put(Types.LONGNVARCHAR, "LONGNVARCHAR");
        TYPE_NAMES.put(Types.CLOB, "CLOB");
        TYPE_NAMES.put(Types.NCLOB, "NCLOB");

        // Numeric
        TYPE_NAMES.put(Types.BIT, "BIT");
        TYPE_NAMES.put(Types.BOOLEAN, "BOOLEAN");
        TYPE_NAMES.put(Types.TINYINT, "TINYINT");
        TYPE_NAMES.put(Types.SMALLINT, "SMALLINT");
        TYPE_NAMES.put(Types.INTEGER, "INTEGER");
        TYPE_NAMES.put(Types.BIGINT, "BIGINT");
        TYPE_NAMES.put(Types.REAL, "REAL");
        TYPE_NAMES.put(Types.FLOAT, "FLOAT");
        TYPE_NAMES.put(Types.DOUBLE, "DOUBLE");
        TYPE_NAMES.put(Types.NUMERIC, "NUMERIC");
        TYPE_NAMES.put(Types.DECIMAL, "DECIMAL");

        // Binary
        TYPE_NAMES.put(Types.BINARY, "BINARY");
        TYPE_NAMES.put(Types.VARBINARY, "VARBINARY");
        TYPE_NAMES.put(Types.LONGVARBINARY, "LONGVARBINARY");
        TYPE_NAMES.put(Types.BLOB, "BLOB");

        // Date and time
        TYPE_NAMES.put(Types.DATE, "DATE");
        TYPE_NAMES.put(Types.TIME, "TIME");
        TYPE_NAMES.put(Types.TIMESTAMP, "TIMESTAMP");
        TYPE_NAMES.put(Types.TIME_WITH_TIMEZONE, "TIME WITH TIME ZONE");
        TYPE_NAMES.put(Types.TIMESTAMP_WITH_TIMEZONE, "TIMESTAMP WITH TIME ZONE");

        // Other standard codes
        TYPE_NAMES.put(Types.NULL, "NULL");
        TYPE_NAMES.put(Types.OTHER, "OTHER");
        TYPE_NAMES.put(Types.JAVA_OBJECT, "JAVA_OBJECT");
        TYPE_NAMES.put(Types.DISTINCT, "DISTINCT");
        TYPE_NAMES.put(Types.STRUCT, "STRUCT");
        TYPE_NAMES.put(Types.ARRAY, "ARRAY");
        TYPE_NAMES.put(Types.REF, "REF");
        TYPE_NAMES.put(Types.DATALINK, "DATALINK");
        TYPE_NAMES.put(Types.ROWID, "ROWID");
        TYPE_NAMES.put(Types.SQLXML, "SQLXML");
        TYPE_NAMES.put(Types.REF_CURSOR, "REF_CURSOR");

        // SQL Server (microsoft.sql.Types)
        TYPE_NAMES.put(-145, "GUID");
        TYPE_NAMES.put(-146, "SMALLMONEY");
        TYPE_NAMES.put(-148, "MONEY");
        TYPE_NAMES.put(-150, "SMALLDATETIME");
        TYPE_NAMES.put(-151, "DATETIME");
        TYPE_NAMES.put(-153, "STRUCTURED");
        TYPE_NAMES.put(-155, "DATETIMEOFFSET");
        TYPE_NAMES.put(-156, "SQL_VARIANT");
        TYPE_NAMES.put(-157, "GEOMETRY");
        TYPE_NAMES.put(-158, "GEOGRAPHY");

        // Oracle
        TYPE_NAMES.put(-101, "TIMESTAMP WITH TIME ZONE");
        TYPE_NAMES.put(-102, "TIMESTAMP WITH LOCAL TIME ZONE");
        TYPE_NAMES.put(100, "BINARY_FLOAT");
        TYPE_NAMES.put(101, "BINARY_DOUBLE");
        TYPE_NAMES.put(-10, "CURSOR");
    }

    private JdbcTypeNames() {
    }

    /**
     * Returns the canonical name of a type code, or {@code UNKNOWN(code)}.
     */
    public static String nameOf(int typeCode) {
        String typeName = TYPE_NAMES.get(typeCode);
        return typeName != null ? typeName : "UNKNOWN(" + typeCode + ")";
    }
}
