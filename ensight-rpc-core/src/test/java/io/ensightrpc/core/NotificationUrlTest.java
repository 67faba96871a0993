package io.ensightrpc.core;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.entry;

class NotificationUrlTest {

    @Test
    void normalizeFoldsSecondQuestionMarkIntoAmpersand() {
        String raw = "grpc://abc/partlist?w={{WIDTH}}?enum=PARTS&uid=220";

        assertThat(NotificationUrl.normalize(raw)).isEqualTo("grpc://abc/partlist?w={{WIDTH}}&enum=PARTS&uid=220");
    }

    @Test
    void normalizeKeepsQuestionMarksInsideMacroValues() {
        String raw = "grpc://s/desc?d=Why?&x=1?enum=DESCRIPTION&uid=7";

        NotificationUrl url = NotificationUrl.parse(raw);

        assertThat(NotificationUrl.normalize(raw)).isEqualTo("grpc://s/desc?d=Why?&x=1&enum=DESCRIPTION&uid=7");
        assertThat(url.param("d")).contains("Why?");
        assertThat(url.param("x")).contains("1");
        assertThat(url.attribute()).contains("DESCRIPTION");
        assertThat(url.objectId()).hasValue(7L);
    }

    @Test
    void normalizeLeavesSingleQueryAlone() {
        String raw = "grpc://abc/partlist?enum=PARTS&uid=220";

        assertThat(NotificationUrl.normalize(raw)).isSameAs(raw);
    }

    @Test
    void parseSplitsSessionTagAndQuery() {
        NotificationUrl url = NotificationUrl.parse("grpc://1f2e/vport?x=10&y=20?enum=ORIGINX&uid=7");

        assertThat(url.url()).isEqualTo("grpc://1f2e/vport?x=10&y=20&enum=ORIGINX&uid=7");
        assertThat(url.sessionId()).isEqualTo("1f2e");
        assertThat(url.tag()).isEqualTo("vport");
        assertThat(url.query()).containsExactly(
                entry("x", "10"),
                entry("y", "20"),
                entry("enum", "ORIGINX"),
                entry("uid", "7"));
        assertThat(url.attribute()).contains("ORIGINX");
        assertThat(url.objectId()).hasValue(7L);
    }

    @Test
    void parseWithoutQuery() {
        NotificationUrl url = NotificationUrl.parse("grpc://s/just/a/path");

        assertThat(url.tag()).isEqualTo("just/a/path");
        assertThat(url.query()).isEmpty();
        assertThat(url.objectId()).isEmpty();
    }

    @Test
    void firstOccurrenceOfRepeatedParameterWins() {
        NotificationUrl url = NotificationUrl.parse("grpc://s/t?enum=A&enum=B");

        assertThat(url.param("enum")).contains("A");
    }

    @Test
    void parseRejectsStringWithoutScheme() {
        assertThatThrownBy(() -> NotificationUrl.parse("partlist?enum=PARTS"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shortTagDropsQuery() {
        assertThat(NotificationUrl.shortTag("foo?x=1")).isEqualTo("foo");
        assertThat(NotificationUrl.shortTag("foo")).isEqualTo("foo");
        assertThat(NotificationUrl.shortTag("?x=1")).isEmpty();
    }
}
