package com.loglens.query.parser;

import com.loglens.query.ast.BareTermExpression;
import com.loglens.query.ast.BinaryExpression;
import com.loglens.query.ast.ComparisonExpression;
import com.loglens.query.ast.ComparisonOperator;
import com.loglens.query.ast.Expression;
import com.loglens.query.ast.InListExpression;
import com.loglens.query.ast.MatchAllExpression;
import com.loglens.query.ast.NotExpression;
import com.loglens.query.ast.Value;
import com.loglens.query.ast.ValueType;
import com.loglens.query.ast.VariableExpression;
import com.loglens.query.lexer.Token;
import com.loglens.query.lexer.TokenType;

import java.util.ArrayList;
import java.util.List;

/**
 * Recursive-descent parser for search conditions.
 *
 * <pre>
 * and   := or ( [AND] or )*
 * or    := unary ( OR unary )*
 * unary := NOT unary | '(' and ')' | term
 * term  := '*' | field op value | field IN '(' value (',' value)* ')' | word | "string" | number | /regex/
 * </pre>
 * OR binds tighter than the implicit AND between space-separated terms.
 */
final class PredicateParser {

    static final String RAW_FIELD = "raw";

    private final TokenCursor cursor;

    PredicateParser(TokenCursor cursor) {
        this.cursor = cursor;
    }

    Expression parse() {
        if (cursor.atEnd()) {
            return MatchAllExpression.INSTANCE;
        }
        Expression expression = parseAnd();
        if (!cursor.atEnd()) {
            throw cursor.malformed("unexpected '" + cursor.peek().getText() + "'");
        }
        return expression;
    }

    private Expression parseAnd() {
        Expression left = parseOr();
        while (!cursor.atEnd() && !cursor.peekIs(TokenType.RPAREN)) {
            cursor.acceptKeyword("and");
            left = BinaryExpression.and(left, parseOr());
        }
        return left;
    }

    private Expression parseOr() {
        Expression left = parseUnary();
        while (cursor.acceptKeyword("or")) {
            left = BinaryExpression.or(left, parseUnary());
        }
        return left;
    }

    private Expression parseUnary() {
        if (cursor.acceptKeyword("not")) {
            return new NotExpression(parseUnary());
        }
        if (cursor.accept(TokenType.LPAREN)) {
            Expression inner = parseAnd();
            cursor.expect(TokenType.RPAREN, "missing ')'");
            return inner;
        }
        return parseTerm();
    }

    private Expression parseTerm() {
        if (cursor.atEnd()) {
            throw cursor.malformed("expected a search term");
        }
        Token token = cursor.next();
        switch (token.getType()) {
            case WILDCARD:
                return MatchAllExpression.INSTANCE;
            case IDENTIFIER:
                if (cursor.peekIs(TokenType.OPERATOR)) {
                    return parseComparison(token.getText());
                }
                if (cursor.peekKeyword("in") && cursor.peek(1) != null && cursor.peek(1).is(TokenType.LPAREN)) {
                    cursor.next();
                    return parseInList(token.getText());
                }
                return new BareTermExpression(new Value(ValueType.WORD, token.getText()));
            case STRING:
            case NUMBER:
                if (cursor.peekIs(TokenType.OPERATOR)) {
                    throw cursor.malformed("expected a field name before '" + cursor.peek().getText() + "'");
                }
                return new BareTermExpression(new Value(
                    token.is(TokenType.STRING) ? ValueType.STRING : ValueType.NUMBER, token.getText()));
            case REGEX:
                return new ComparisonExpression(RAW_FIELD, ComparisonOperator.REGEX,
                    new Value(ValueType.REGEX, token.getText()));
            case VARIABLE:
                return new VariableExpression(null, null, token.getText());
            case KEYWORD:
                if (token.isKeyword("and") || token.isKeyword("or") || token.isKeyword("not")) {
                    throw cursor.malformed("unexpected '" + token.getText() + "'");
                }
                return new BareTermExpression(new Value(ValueType.WORD, token.getText()));
            default:
                throw cursor.malformed("unexpected '" + token.getText() + "'");
        }
    }

    private Expression parseComparison(String field) {
        Token operatorToken = cursor.next();
        ComparisonOperator operator = ComparisonOperator.fromSymbol(operatorToken.getText())
            .orElseThrow(() -> cursor.malformed("unknown operator '" + operatorToken.getText() + "'"));
        if (cursor.atEnd()) {
            throw cursor.malformed("missing value after '" + field + operator.getSymbol() + "'");
        }
        Token valueToken = cursor.next();
        switch (valueToken.getType()) {
            case VARIABLE:
                return new VariableExpression(field, operator, valueToken.getText());
            case REGEX:
                return new ComparisonExpression(field, regexOperator(operator, field),
                    new Value(ValueType.REGEX, valueToken.getText()));
            case WILDCARD:
                if (!operator.isEquality()) {
                    throw cursor.malformed("'*' can only be compared with = or != (field '" + field + "')");
                }
                return new ComparisonExpression(field, operator, new Value(ValueType.WILDCARD, "*"));
            default:
                return new ComparisonExpression(field, operator, literal(valueToken));
        }
    }

    private ComparisonOperator regexOperator(ComparisonOperator operator, String field) {
        return switch (operator) {
            case EQ, REGEX -> ComparisonOperator.REGEX;
            case NE, NOT_REGEX -> ComparisonOperator.NOT_REGEX;
            default -> throw cursor.malformed("a regex can only be compared with =, != or ~ (field '" + field + "')");
        };
    }

    private Expression parseInList(String field) {
        cursor.expect(TokenType.LPAREN, "expected '(' after IN");
        List<Value> values = new ArrayList<>();
        while (!cursor.accept(TokenType.RPAREN)) {
            if (cursor.atEnd()) {
                throw cursor.malformed("missing ')' after IN list");
            }
            if (cursor.accept(TokenType.COMMA)) {
                continue;
            }
            Token token = cursor.next();
            if (token.is(TokenType.VARIABLE)) {
                throw cursor.malformed("variables are not supported inside IN lists; use " + field + "=$" + token.getText() + "$");
            }
            values.add(literal(token));
        }
        if (values.isEmpty()) {
            throw cursor.malformed("IN list for '" + field + "' is empty");
        }
        return new InListExpression(field, values);
    }

    private Value literal(Token token) {
        return switch (token.getType()) {
            case STRING -> new Value(ValueType.STRING, token.getText());
            case NUMBER -> new Value(ValueType.NUMBER, token.getText());
            case IDENTIFIER, KEYWORD -> new Value(ValueType.WORD, token.getText());
            default -> throw cursor.malformed("unexpected '" + token.getText() + "' where a value was expected");
        };
    }
}
