package com.tabledsl.generator.schema;

import java.lang.reflect.Proxy;
import java.sql.ResultSet;

/**
 * Single-row {@link ResultSet} answering the column getters the fetchers use.
 */
final class StubResultSet {

    private StubResultSet() {
    }

    static ResultSet row(Object... columns) {
        return (ResultSet) Proxy.newProxyInstance(
                StubResultSet.class.getClassLoader(),
                new Class<?>[] { ResultSet.class },
                (proxy, method, args) -> {
                    Object value = columns[(Integer) args[0] - 1];
                    switch (method.getName()) {
                        case "getString":
                            return value == null ? null : value.toString();
                        case "getInt":
                            return value == null ? 0 : ((Number) value).intValue();
                        case "getLong":
                            return value == null ? 0L : ((Number) value).longValue();
                        case "getBoolean":
                            return value != null && (Boolean) value;
                        default:
                            throw new UnsupportedOperationException(method.getName());
                    }
                });
    }
}
