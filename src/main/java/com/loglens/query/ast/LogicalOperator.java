package com.loglens.query.ast;

public enum LogicalOperator {
    AND,
    OR
}
