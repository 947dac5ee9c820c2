package com.paylens.service.core.backend;

import com.fasterxml.jackson.databind.JsonNode;
import java.sql.ResultSet;
import java.sql.SQLException;

/**
 * Decodes one raw backend row into a typed analytics row. There is one method per raw row shape;
 * each backend only ever calls its own.
 *
 * @param <T> domain row type
 */
public interface RowLoader<T> {

    /** Row-oriented store: the result set is positioned on the row to decode. */
    T fromRelational(ResultSet row) throws SQLException;

    /** Columnar store: one element of the JSON {@code data} array. */
    T fromColumnar(JsonNode row);
}
