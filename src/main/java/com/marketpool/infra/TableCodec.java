package com.marketpool.infra;

import java.util.List;

public interface TableCodec {

    byte[] encode(Table table);

    /**
     * Reads the columns named in {@code schema}; columns absent from the payload
     * come back as null cells, extra payload columns are ignored.
     */
    Table decode(byte[] data, List<Table.Column> schema);
}
