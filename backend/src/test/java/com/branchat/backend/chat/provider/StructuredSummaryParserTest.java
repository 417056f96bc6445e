package com.branchat.backend.chat.provider;

import static org.assertj.core.api.Assertions.assertThat;

import com.branchat.backend.chat.provider.model.StructuredSummaryOutcome;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

class StructuredSummaryParserTest {

  private final StructuredSummaryParser parser = new StructuredSummaryParser(new ObjectMapper());

  @Test
  void parsesValidSummary() {
    StructuredSummaryOutcome outcome =
        parser.parse(
            """
            {"summary": " Picked Liquibase ", "actions": ["Write changelog", " "],
             "artifacts": ["db.changelog-master.yaml"], "keywords": ["liquibase", "schema"]}
            """);

    assertThat(outcome.isParsed()).isTrue();
    assertThat(outcome.summary().summary()).isEqualTo("Picked Liquibase");
    assertThat(outcome.summary().actions()).containsExactly("Write changelog");
    assertThat(outcome.summary().artifacts()).containsExactly("db.changelog-master.yaml");
    assertThat(outcome.summary().keywords()).containsExactly("liquibase", "schema");
  }

  @Test
  void toleratesMarkdownFence() {
    StructuredSummaryOutcome outcome =
        parser.parse(
            "```json\n{\"summary\":\"ok\",\"actions\":[],\"artifacts\":[],\"keywords\":[]}\n```");

    assertThat(outcome.isParsed()).isTrue();
    assertThat(outcome.summary().summary()).isEqualTo("ok");
  }

  @Test
  void rejectsNonJsonAnswer() {
    StructuredSummaryOutcome outcome = parser.parse("We decided to ship on Friday.");

    assertThat(outcome.isParsed()).isFalse();
    assertThat(outcome.rawResponse()).isEqualTo("We decided to ship on Friday.");
    assertThat(outcome.failureReason()).startsWith("Response is not valid JSON");
  }

  @Test
  void rejectsMissingArrays() {
    StructuredSummaryOutcome outcome = parser.parse("{\"summary\":\"ok\",\"actions\":[]}");

    assertThat(outcome.isParsed()).isFalse();
    assertThat(outcome.failureReason()).isEqualTo("Field 'artifacts' must be an array");
  }

  @Test
  void rejectsNonStringArrayElements() {
    StructuredSummaryOutcome outcome =
        parser.parse("{\"summary\":\"ok\",\"actions\":[1],\"artifacts\":[],\"keywords\":[]}");

    assertThat(outcome.isParsed()).isFalse();
    assertThat(outcome.failureReason()).isEqualTo("Field 'actions' must contain only strings");
  }

  @Test
  void rejectsBlankSummaryAndEmptyAnswer() {
    assertThat(
            parser
                .parse("{\"summary\":\" \",\"actions\":[],\"artifacts\":[],\"keywords\":[]}")
                .isParsed())
        .isFalse();
    assertThat(parser.parse("").failureReason()).isEqualTo("Response is empty");
  }
}
