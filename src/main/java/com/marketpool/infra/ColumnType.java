package com.marketpool.infra;

public enum ColumnType {
    STRING,
    LONG,
    DOUBLE,
    BOOLEAN,
    STRING_LIST,
    DOUBLE_LIST
}
