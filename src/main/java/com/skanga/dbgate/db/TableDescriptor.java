package com.skanga.dbgate.db;

/**
 * A base table. Catalog and schema are empty strings when the database does not report them.
 */
public record TableDescriptor(String catalog, String schema, String name, String type) {
    public TableDescriptor {
        catalog = catalog == null ? "" : catalog;
        schema = schema == null ? "" : schema;
    }

    /**
     * Name qualified with the schema when there is one.
     */
    public String qualifiedName() {
        return schema.isEmpty() ? name : schema + "." + name;
    }
}
