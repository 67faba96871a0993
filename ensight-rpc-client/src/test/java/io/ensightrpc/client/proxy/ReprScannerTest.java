package io.ensightrpc.client.proxy;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ReprScannerTest {

    @Test
    void plainTextIsOneLiteral() {
        assertThat(ReprScanner.scan("[1, 2, 3]")).containsExactly(new ReprToken.Literal("[1, 2, 3]"));
    }

    @Test
    void emptyTextHasNoTokens() {
        assertThat(ReprScanner.scan("")).isEmpty();
    }

    @Test
    void findsEachDescriptionInOrder() {
        String text = "[Class: ENS_PART, desc: 'Sphere', CvfObjID: 1078, cached:no, "
                + "Class: ENS_VAR, desc: 'p', CvfObjID: 12, cached:yes]";

        List<ReprToken> tokens = ReprScanner.scan(text);

        assertThat(tokens).hasSize(5);
        assertThat(tokens.get(0)).isEqualTo(new ReprToken.Literal("["));
        ReprToken.ObjectRef part = (ReprToken.ObjectRef) tokens.get(1);
        assertThat(part.className()).isEqualTo("ENS_PART");
        assertThat(part.objectId()).isEqualTo(1078);
        assertThat(part.cached()).isFalse();
        assertThat(tokens.get(2)).isEqualTo(new ReprToken.Literal(", "));
        ReprToken.ObjectRef var = (ReprToken.ObjectRef) tokens.get(3);
        assertThat(var.className()).isEqualTo("ENS_VAR");
        assertThat(var.objectId()).isEqualTo(12);
        assertThat(var.cached()).isTrue();
        assertThat(tokens.get(4)).isEqualTo(new ReprToken.Literal("]"));
    }

    @Test
    void classNameWithoutFurtherFields() {
        List<ReprToken> tokens = ReprScanner.scan("Class: ENS_GLOBALS CvfObjID: 3, cached:yes");

        assertThat(tokens).containsExactly(new ReprToken.ObjectRef("ENS_GLOBALS", 3, true, 0, 42));
    }

    @Test
    void markerWithoutClassStopsScanning() {
        String text = "'CvfObjID: 5, cached:no'";

        assertThat(ReprScanner.scan(text)).containsExactly(new ReprToken.Literal(text));
    }

    @Test
    void malformedQualifierLeavesRestLiteral() {
        String text = "[Class: ENS_PART, CvfObjID: 1, cached:no, Class: ENS_PART, CvfObjID: 2, cached:maybe]";

        List<ReprToken> tokens = ReprScanner.scan(text);

        assertThat(tokens).hasSize(3);
        assertThat(tokens.get(1)).isInstanceOf(ReprToken.ObjectRef.class);
        assertThat(tokens.get(2)).isEqualTo(new ReprToken.Literal(", Class: ENS_PART, CvfObjID: 2, cached:maybe]"));
    }

    @Test
    void missingDigitsStopScanning() {
        String text = "Class: ENS_PART, CvfObjID: x, cached:no";

        assertThat(ReprScanner.scan(text)).containsExactly(new ReprToken.Literal(text));
    }
}
