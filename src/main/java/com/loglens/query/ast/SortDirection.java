package com.loglens.query.ast;

public enum SortDirection {
    ASC,
    DESC
}
