package io.facetrelay.facet;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;

public interface Facet {
    String id();

    /**
     * Canonical function signatures this facet serves, e.g. {@code ownerOf(uint256)}.
     */
    List<String> signatures();

    DispatchResult invoke(FacetCall call) throws Exception;

    default void initSchema(Connection connection) throws SQLException {
    }
}
