package com.loglens.query.parser;

import com.loglens.query.UnknownCommandException;
import com.loglens.query.VariableResolutionException;
import com.loglens.query.ast.Aggregation;
import com.loglens.query.ast.AggregationFunction;
import com.loglens.query.ast.BinStage;
import com.loglens.query.ast.DedupStage;
import com.loglens.query.ast.Expression;
import com.loglens.query.ast.FilterStage;
import com.loglens.query.ast.LimitStage;
import com.loglens.query.ast.RenamePair;
import com.loglens.query.ast.RenameStage;
import com.loglens.query.ast.SearchStage;
import com.loglens.query.ast.SortDirection;
import com.loglens.query.ast.SortKey;
import com.loglens.query.ast.SortStage;
import com.loglens.query.ast.Span;
import com.loglens.query.ast.Stage;
import com.loglens.query.ast.StatsStage;
import com.loglens.query.ast.TableStage;
import com.loglens.query.ast.TailStage;
import com.loglens.query.ast.TimechartStage;
import com.loglens.query.ast.TopStage;
import com.loglens.query.lexer.Token;
import com.loglens.query.lexer.TokenType;
import com.loglens.query.variable.VariableBinder;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Builds one stage node from the tokens of a pipeline stage.
 * Dispatches on the first token; one method per command.
 */
public class StageParser {

    private static final Set<String> COMMANDS = Set.of(
        "search", "filter", "where", "stats", "sort", "limit", "head",
        "table", "fields", "dedup", "rename", "top", "rare", "timechart", "bin", "tail");

    private static final Pattern FIELD_NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_.\\-]*");
    private static final Pattern NON_NEGATIVE = Pattern.compile("\\d+");

    private final VariableBinder binder;

    public StageParser(VariableBinder binder) {
        this.binder = binder;
    }

    public Stage parse(int stageIndex, List<Token> tokens) {
        Token first = tokens.get(0);
        String command = first.is(TokenType.IDENTIFIER) ? first.lowerText() : null;
        boolean isCommand = command != null && COMMANDS.contains(command)
            // "sort=asc" in the first stage is a condition, not a sort command
            && !(stageIndex == 0 && tokens.size() > 1 && tokens.get(1).is(TokenType.OPERATOR));

        if (!isCommand) {
            if (stageIndex == 0) {
                return parseSearch(new TokenCursor(tokens, 0, stageIndex, "search"));
            }
            throw new UnknownCommandException(stageIndex, first.getText());
        }

        TokenCursor cursor = new TokenCursor(tokens, 1, stageIndex, command);
        return switch (command) {
            case "search" -> parseSearch(cursor);
            case "filter", "where" -> parseFilter(cursor);
            case "stats" -> parseStats(cursor);
            case "sort" -> parseSort(cursor);
            case "limit", "head" -> parseLimit(cursor);
            case "table", "fields" -> parseTable(cursor);
            case "dedup" -> parseDedup(cursor);
            case "rename" -> parseRename(cursor);
            case "top", "rare" -> parseTop(cursor);
            case "timechart" -> parseTimechart(cursor);
            case "bin" -> parseBin(cursor);
            case "tail" -> parseTail(cursor);
            default -> throw new UnknownCommandException(stageIndex, first.getText());
        };
    }

    private Stage parseSearch(TokenCursor cursor) {
        return new SearchStage(cursor.getStageIndex(), predicate(cursor));
    }

    private Stage parseFilter(TokenCursor cursor) {
        if (cursor.atEnd()) {
            throw cursor.malformed("missing condition");
        }
        return new FilterStage(cursor.getStageIndex(), cursor.getCommand(), predicate(cursor));
    }

    private Expression predicate(TokenCursor cursor) {
        Expression parsed = new PredicateParser(cursor).parse();
        return binder.bind(parsed, cursor.getStageIndex());
    }

    private Stage parseStats(TokenCursor cursor) {
        List<Aggregation> aggregations = parseAggregations(cursor);

        List<String> groupBy = new ArrayList<>();
        if (cursor.acceptKeyword("by")) {
            groupBy = fieldList(cursor);
            if (groupBy.isEmpty()) {
                throw cursor.malformed("'by' needs at least one field");
            }
        }
        return new StatsStage(cursor.getStageIndex(), aggregations, groupBy);
    }

    /**
     * Aggregations up to {@code by}, a {@code span=} option or the end of the stage.
     */
    private List<Aggregation> parseAggregations(TokenCursor cursor) {
        List<Aggregation> aggregations = new ArrayList<>();
        Set<String> aliases = new HashSet<>();
        while (!cursor.atEnd() && !cursor.peekKeyword("by") && !atOption(cursor, "span")) {
            Token name = cursor.next();
            if (!name.is(TokenType.IDENTIFIER)) {
                throw cursor.malformed("expected an aggregation function but found '" + name.getText() + "'");
            }
            AggregationFunction function = AggregationFunction.fromKeyword(name.getText())
                .orElseThrow(() -> cursor.malformed("unknown function '" + name.getText() + "'"));

            String field = null;
            if (cursor.accept(TokenType.LPAREN)) {
                if (!cursor.peekIs(TokenType.RPAREN) && !cursor.accept(TokenType.WILDCARD)) {
                    field = fieldName(cursor);
                }
                cursor.expect(TokenType.RPAREN, "missing ')' after " + function.getKeyword() + "(");
            }
            if (function.isFieldRequired() && field == null) {
                throw cursor.malformed(function.getKeyword() + " requires a field");
            }

            String alias = null;
            if (cursor.acceptKeyword("as")) {
                if (cursor.atEnd()) {
                    throw cursor.malformed("missing name after 'as'");
                }
                alias = fieldName(cursor);
            }
            Aggregation aggregation = new Aggregation(function, field, alias);
            if (!aliases.add(aggregation.getAlias())) {
                throw cursor.malformed("duplicate output column '" + aggregation.getAlias() + "'");
            }
            aggregations.add(aggregation);
            cursor.accept(TokenType.COMMA);
        }
        if (aggregations.isEmpty()) {
            throw cursor.malformed("at least one aggregation is required");
        }
        return aggregations;
    }

    /**
     * {@code timechart [span=<span>] <aggregations> [by field] [span=<span>]};
     * the span defaults to one hour.
     */
    private Stage parseTimechart(TokenCursor cursor) {
        Span span = null;
        if (atOption(cursor, "span")) {
            span = spanOption(cursor);
        }
        List<Aggregation> aggregations = parseAggregations(cursor);

        String splitBy = null;
        if (cursor.acceptKeyword("by")) {
            if (cursor.atEnd() || atOption(cursor, "span")) {
                throw cursor.malformed("'by' needs a field");
            }
            splitBy = fieldName(cursor);
        }
        if (atOption(cursor, "span")) {
            if (span != null) {
                throw cursor.malformed("span is given twice");
            }
            span = spanOption(cursor);
        }
        if (!cursor.atEnd()) {
            throw cursor.malformed("splits by a single field but found '" + cursor.peek().getText() + "'");
        }
        if (span != null && !span.isTime()) {
            throw cursor.malformed("span " + span + " needs a time unit (s, m, h, d or w)");
        }
        return new TimechartStage(cursor.getStageIndex(),
            span == null ? TimechartStage.DEFAULT_SPAN : span, aggregations, splitBy);
    }

    /**
     * {@code bin [span=]<span> field [as name]}, with the span and the field
     * in either order.
     */
    private Stage parseBin(TokenCursor cursor) {
        Span span = null;
        String field = null;
        String alias = null;
        while (!cursor.atEnd()) {
            if (atOption(cursor, "span")) {
                if (span != null) {
                    throw cursor.malformed("span is given twice");
                }
                span = spanOption(cursor);
            } else if (cursor.acceptKeyword("as")) {
                if (field == null || alias != null || cursor.atEnd()) {
                    throw cursor.malformed("'as' must follow the field and name one new column");
                }
                alias = fieldName(cursor);
            } else if (field == null) {
                field = fieldName(cursor);
            } else {
                throw cursor.malformed("bins a single field but found '" + cursor.peek().getText() + "'");
            }
        }
        if (field == null) {
            throw cursor.malformed("a field is required");
        }
        if (span == null) {
            throw cursor.malformed("span=<width> is required");
        }
        return new BinStage(cursor.getStageIndex(), field, span, alias);
    }

    private Stage parseTail(TokenCursor cursor) {
        long limit = TailStage.DEFAULT_LIMIT;
        if (!cursor.atEnd()) {
            limit = limitValue(cursor);
        }
        cursor.expectEnd();
        return new TailStage(cursor.getStageIndex(), limit);
    }

    private static boolean atOption(TokenCursor cursor, String name) {
        Token token = cursor.peek();
        Token after = cursor.peek(1);
        return token != null && token.is(TokenType.IDENTIFIER) && name.equalsIgnoreCase(token.getText())
            && after != null && after.isOperator("=");
    }

    private Span spanOption(TokenCursor cursor) {
        cursor.next();
        cursor.next();
        if (cursor.atEnd()) {
            throw cursor.malformed("span= needs a width");
        }
        Token token = cursor.next();
        String text = switch (token.getType()) {
            case IDENTIFIER, NUMBER -> token.getText();
            case VARIABLE -> binder.resolveScalar(token.getText(), cursor.getStageIndex());
            default -> throw cursor.malformed("expected a span such as 5m or 100 but found '" + token.getText() + "'");
        };
        return Span.parse(text)
            .orElseThrow(() -> cursor.malformed("invalid span '" + text + "'; expected a positive width such as 5m or 100"));
    }

    /**
     * Groups are {@code [asc|desc]? field [asc|desc]?} or {@code -field} /
     * {@code +field}. A direction keyword right after a field that had no
     * leading direction applies to that field.
     */
    private Stage parseSort(TokenCursor cursor) {
        List<SortKey> keys = new ArrayList<>();
        SortDirection pending = null;
        boolean lastHadLeading = true;
        while (!cursor.atEnd()) {
            if (cursor.accept(TokenType.COMMA)) {
                continue;
            }
            Token token = cursor.peek();
            if (token.isKeyword("asc") || token.isKeyword("desc")) {
                cursor.next();
                SortDirection direction = token.isKeyword("asc") ? SortDirection.ASC : SortDirection.DESC;
                if (pending == null && !lastHadLeading && !keys.isEmpty()) {
                    SortKey previous = keys.remove(keys.size() - 1);
                    keys.add(new SortKey(previous.getField(), direction));
                    lastHadLeading = true;
                } else if (pending == null) {
                    pending = direction;
                } else {
                    throw cursor.malformed("two directions in a row");
                }
                continue;
            }

            SortDirection direction = pending;
            String field;
            if (token.is(TokenType.IDENTIFIER) && token.getText().length() > 1
                    && (token.getText().startsWith("-") || token.getText().startsWith("+"))) {
                cursor.next();
                if (direction != null) {
                    throw cursor.malformed("'" + token.getText() + "' already has a direction");
                }
                direction = token.getText().startsWith("-") ? SortDirection.DESC : SortDirection.ASC;
                field = token.getText().substring(1);
                lastHadLeading = true;
            } else {
                field = fieldName(cursor);
                lastHadLeading = pending != null;
            }
            keys.add(new SortKey(field, direction == null ? SortDirection.ASC : direction));
            pending = null;
        }
        if (pending != null) {
            throw cursor.malformed("direction without a field");
        }
        if (keys.isEmpty()) {
            throw cursor.malformed("at least one sort field is required");
        }
        return new SortStage(cursor.getStageIndex(), keys);
    }

    private Stage parseLimit(TokenCursor cursor) {
        if (cursor.atEnd()) {
            throw cursor.malformed("expects one non-negative integer");
        }
        Token token = cursor.next();
        String text;
        if (token.is(TokenType.VARIABLE)) {
            text = binder.resolveScalar(token.getText(), cursor.getStageIndex());
            if (!NON_NEGATIVE.matcher(text).matches()) {
                throw new VariableResolutionException(cursor.getStageIndex(), token.getText(),
                    "value '" + text + "' is not a non-negative integer");
            }
        } else if (token.is(TokenType.NUMBER) && NON_NEGATIVE.matcher(token.getText()).matches()) {
            text = token.getText();
        } else {
            throw cursor.malformed("expects one non-negative integer but found '" + token.getText() + "'");
        }
        cursor.expectEnd();
        try {
            return new LimitStage(cursor.getStageIndex(), Long.parseLong(text));
        } catch (NumberFormatException e) {
            throw cursor.malformed("limit " + text + " is out of range");
        }
    }

    private Stage parseTable(TokenCursor cursor) {
        boolean exclude = false;
        Token first = cursor.peek();
        if (first != null && first.is(TokenType.IDENTIFIER) && ("-".equals(first.getText()) || "+".equals(first.getText()))) {
            cursor.next();
            exclude = "-".equals(first.getText());
        }
        List<String> columns = fieldList(cursor);
        if (columns.isEmpty()) {
            throw cursor.malformed("at least one field is required");
        }
        return new TableStage(cursor.getStageIndex(), columns, exclude);
    }

    private Stage parseDedup(TokenCursor cursor) {
        List<String> keys = fieldList(cursor);
        if (keys.isEmpty()) {
            throw cursor.malformed("at least one field is required");
        }
        return new DedupStage(cursor.getStageIndex(), keys);
    }

    private Stage parseRename(TokenCursor cursor) {
        List<RenamePair> pairs = new ArrayList<>();
        while (!cursor.atEnd()) {
            if (cursor.accept(TokenType.COMMA)) {
                continue;
            }
            String from = fieldName(cursor);
            if (!cursor.acceptKeyword("as")) {
                throw cursor.malformed("rename of '" + from + "' is missing 'as'");
            }
            if (cursor.atEnd()) {
                throw cursor.malformed("rename of '" + from + "' is missing the new name");
            }
            pairs.add(new RenamePair(from, fieldName(cursor)));
        }
        if (pairs.isEmpty()) {
            throw cursor.malformed("at least one 'field as name' pair is required");
        }
        return new RenameStage(cursor.getStageIndex(), pairs);
    }

    private Stage parseTop(TokenCursor cursor) {
        long limit = TopStage.DEFAULT_LIMIT;
        String field = null;
        while (!cursor.atEnd()) {
            Token token = cursor.peek();
            Token after = cursor.peek(1);
            if (token.is(TokenType.IDENTIFIER) && "limit".equalsIgnoreCase(token.getText())
                    && after != null && after.isOperator("=")) {
                cursor.next();
                cursor.next();
                limit = limitValue(cursor);
            } else if (token.is(TokenType.NUMBER) && field == null) {
                limit = limitValue(cursor);
            } else if (field == null) {
                field = fieldName(cursor);
            } else {
                throw cursor.malformed("expects a single field but found '" + token.getText() + "'");
            }
        }
        if (field == null) {
            throw cursor.malformed("a field is required");
        }
        return new TopStage(cursor.getStageIndex(), field, limit, "rare".equals(cursor.getCommand()));
    }

    private long limitValue(TokenCursor cursor) {
        Token token = cursor.next();
        String text = token.is(TokenType.VARIABLE)
            ? binder.resolveScalar(token.getText(), cursor.getStageIndex())
            : token.getText();
        if (!NON_NEGATIVE.matcher(text).matches()) {
            throw cursor.malformed("limit must be a non-negative integer but was '" + text + "'");
        }
        try {
            return Long.parseLong(text);
        } catch (NumberFormatException e) {
            throw cursor.malformed("limit " + text + " is out of range");
        }
    }

    /**
     * Field names separated by spaces or commas, up to the end of the stage.
     */
    private List<String> fieldList(TokenCursor cursor) {
        List<String> fields = new ArrayList<>();
        while (!cursor.atEnd()) {
            if (cursor.accept(TokenType.COMMA)) {
                continue;
            }
            fields.add(fieldName(cursor));
        }
        return fields;
    }

    private String fieldName(TokenCursor cursor) {
        Token token = cursor.next();
        return switch (token.getType()) {
            case IDENTIFIER, STRING -> token.getText();
            case VARIABLE -> {
                String value = binder.resolveScalar(token.getText(), cursor.getStageIndex());
                if (!FIELD_NAME.matcher(value).matches()) {
                    throw new VariableResolutionException(cursor.getStageIndex(), token.getText(),
                        "value '" + value + "' is not a valid field name");
                }
                yield value;
            }
            default -> throw cursor.malformed("expected a field name but found '" + token.getText() + "'");
        };
    }
}
