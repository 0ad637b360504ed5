package com.skanga.dbgate.db;

/**
 * One column of a table.
 *
 * @param name column name
 * @param typeName driver type name, or the canonical name of the JDBC type code
 * @param size column size or precision, 0 when unknown
 * @param nullable whether the column accepts nulls
 * @param position 1-based ordinal position
 */
public record ColumnDescriptor(String name, String typeName, int size, boolean nullable, int position) {
}
