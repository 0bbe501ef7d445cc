package com.loglens.query.sql;

import com.loglens.query.ast.SortDirection;

final class OrderItem {

    private final String name;
    private final String expression;
    private final SortDirection direction;

    OrderItem(String name, String expression, SortDirection direction) {
        this.name = name;
        this.expression = expression;
        this.direction = direction;
    }

    String getName() {
        return name;
    }

    String getExpression() {
        return expression;
    }

    SortDirection getDirection() {
        return direction;
    }

    OrderItem renamed(String newName) {
        return new OrderItem(newName, expression, direction);
    }

    OrderItem reversed() {
        return new OrderItem(name, expression,
            direction == SortDirection.ASC ? SortDirection.DESC : SortDirection.ASC);
    }

    String render() {
        return expression + " " + direction.name();
    }
}
