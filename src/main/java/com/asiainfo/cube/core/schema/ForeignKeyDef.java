package com.asiainfo.cube.core.schema;

import com.asiainfo.cube.core.model.SqlNames;

public record ForeignKeyDef(String column, String refTable, String refColumn) {

    public String toDdl() {
        return String.format("FOREIGN KEY (%s) REFERENCES %s (%s)",
                SqlNames.quote(column), SqlNames.quote(refTable), SqlNames.quote(refColumn));
    }
}
