package com.tabledsl.generator.schema;

import java.util.List;

import com.tabledsl.generator.codegen.exception.ConnectionException;
import com.tabledsl.generator.codegen.exception.NoDatabaseSelectedException;
import com.tabledsl.generator.codegen.model.ColumnDescriptor;

/**
 * Reads schema information from one database engine and translates it into
 * engine-independent column descriptors.
 * <p>
 * An implementation holds a single connection and issues its catalog queries one
 * at a time. Column descriptors are returned in the order the database declares them.
 */
public interface SchemaFetcher {

    /**
     * Name of the database (or schema) the connection is bound to.
     *
     * @throws NoDatabaseSelectedException if the connection does not name a database
     */
    String getDatabaseName() throws ConnectionException, NoDatabaseSelectedException;

    List<String> getTableNames() throws ConnectionException;

    List<ColumnDescriptor> getFieldDescriptors(String tableName) throws ConnectionException;

    /**
     * Quotes an identifier for use in SQL against this engine.
     */
    String quoteIdentifier(String identifier);
}
