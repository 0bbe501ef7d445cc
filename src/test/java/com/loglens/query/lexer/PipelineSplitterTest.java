package com.loglens.query.lexer;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class PipelineSplitterTest {

    @Test
    void shouldSplitOnPipes() {
        List<StageText> stages = PipelineSplitter.split("error | stats count by host | head 5");

        assertThat(stages).extracting(StageText::getText)
            .containsExactly("error ", " stats count by host ", " head 5");
        assertThat(stages).extracting(StageText::getIndex).containsExactly(0, 1, 2);
        assertThat(stages).extracting(StageText::getOffset).containsExactly(0, 7, 29);
    }

    @Test
    void shouldNotSplitInsideQuotesOrRegex() {
        List<StageText> stages = PipelineSplitter.split("message=\"a|b\" /x|y/ 'c|d' | head 1");

        assertThat(stages).hasSize(2);
        assertThat(stages.get(0).getText()).isEqualTo("message=\"a|b\" /x|y/ 'c|d' ");
    }

    @Test
    void shouldTreatSlashInsideWordAsPlainCharacter() {
        List<StageText> stages = PipelineSplitter.split("uri=a/b|head 1");

        assertThat(stages).extracting(StageText::getText).containsExactly("uri=a/b", "head 1");
    }

    @Test
    void shouldKeepEmptyStages() {
        List<StageText> stages = PipelineSplitter.split("a | | b |");

        assertThat(stages).hasSize(4);
        assertThat(stages.get(1).isBlank()).isTrue();
        assertThat(stages.get(3).isBlank()).isTrue();
    }

    @Test
    void shouldRunUnterminatedQuoteToTheEnd() {
        List<StageText> stages = PipelineSplitter.split("message=\"a | b");

        assertThat(stages).hasSize(1);
    }
}
