package com.phillippitts.interviewcopilot.service.recognition;

import com.phillippitts.interviewcopilot.domain.RecognitionResult;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class VoskJsonParserTest {

    @Test
    void parsesPartialResult() {
        RecognitionResult r = VoskJsonParser.parsePartial("{\"partial\" : \"tell me about\"}");

        assertThat(r.text()).isEqualTo("tell me about");
        assertThat(r.isFinal()).isFalse();
    }

    @Test
    void parsesFinalResultIgnoringWordTimings() {
        String json = "{\"result\":[{\"conf\":1.0,\"word\":\"why\"},{\"conf\":0.9,\"word\":\"kafka\"}],"
                + "\"text\":\" why kafka \"}";

        RecognitionResult r = VoskJsonParser.parseFinal(json);

        assertThat(r.text()).isEqualTo("why kafka");
        assertThat(r.isFinal()).isTrue();
    }

    @Test
    void takesFirstAlternativeWhenPresent() {
        String json = "{\"alternatives\":[{\"confidence\":212.1,\"text\":\"describe a conflict\"},"
                + "{\"confidence\":200.4,\"text\":\"describe the conflict\"}]}";

        assertThat(VoskJsonParser.parseFinal(json).text()).isEqualTo("describe a conflict");
        assertThat(VoskJsonParser.parseFinal("{\"alternatives\":[]}").text()).isEmpty();
    }

    @Test
    void missingFieldYieldsEmptyText() {
        assertThat(VoskJsonParser.parsePartial("{\"text\":\"final only\"}").text()).isEmpty();
    }

    @Test
    void blankOrMalformedInputYieldsEmptyText() {
        assertThat(VoskJsonParser.parseFinal(null).isEmpty()).isTrue();
        assertThat(VoskJsonParser.parseFinal("  ").isEmpty()).isTrue();
        assertThat(VoskJsonParser.parseFinal("{not json").isEmpty()).isTrue();
    }

    @Test
    void oversizedInputIsIgnored() {
        String huge = "{\"text\":\"" + "a".repeat(VoskJsonParser.MAX_JSON_SIZE) + "\"}";

        assertThat(VoskJsonParser.parseFinal(huge).text()).isEmpty();
    }
}
