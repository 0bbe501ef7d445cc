package com.loglens.query.parser;

import com.loglens.fields.FieldCatalog;
import com.loglens.query.MalformedStageException;
import com.loglens.query.ast.MatchAllExpression;
import com.loglens.query.ast.Query;
import com.loglens.query.ast.SearchStage;
import com.loglens.query.ast.Stage;
import com.loglens.query.lexer.Lexer;
import com.loglens.query.lexer.PipelineSplitter;
import com.loglens.query.lexer.StageText;
import com.loglens.query.lexer.Token;
import com.loglens.query.schema.SchemaTracker;
import com.loglens.query.variable.VariableBinder;
import com.loglens.query.variable.VariableBindings;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns query text into a validated {@link Query}.
 *
 * Stages are lexed, parsed and checked against the running schema one at a
 * time, so the first faulty stage is the one reported.
 */
public class QueryParser {

    public Query parse(String text, VariableBindings bindings, FieldCatalog catalog) {
        SchemaTracker tracker = new SchemaTracker(catalog);
        StageParser stageParser = new StageParser(new VariableBinder(bindings));

        List<Stage> stages = new ArrayList<>();
        if (text == null || text.isBlank()) {
            stages.add(tracker.apply(new SearchStage(0, MatchAllExpression.INSTANCE)));
            return new Query(stages, tracker.getSchema(), tracker.getWarnings());
        }

        for (StageText stageText : PipelineSplitter.split(text)) {
            List<Token> tokens = Lexer.tokenize(stageText);
            if (tokens.isEmpty()) {
                throw new MalformedStageException(stageText.getIndex(), "pipeline", "empty stage");
            }
            Stage stage = stageParser.parse(stageText.getIndex(), tokens);
            stages.add(tracker.apply(stage));
        }
        return new Query(stages, tracker.getSchema(), tracker.getWarnings());
    }
}
