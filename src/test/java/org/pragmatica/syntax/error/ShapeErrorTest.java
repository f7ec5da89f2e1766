package org.pragmatica.syntax.error;

import org.junit.jupiter.api.Test;
import org.pragmatica.syntax.kind.NodeKind;
import org.pragmatica.syntax.kind.TokenKind;

import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class ShapeErrorTest {

    @Test
    void messages_nameKindAndSlot() {
        assertThat(new ShapeError.MissingRequiredSlot(NodeKind.ARRAY_TYPE, 1, "elementType").message())
            .isEqualTo("ARRAY_TYPE requires elementType (#1)");
        assertThat(new ShapeError.AbsentCollectionElement(NodeKind.STMT_LIST, 3).message())
            .isEqualTo("STMT_LIST element #3 is absent");
        assertThat(new ShapeError.UnknownShape(NodeKind.UNKNOWN).message())
            .isEqualTo("No shape registered for UNKNOWN");
        assertThat(new ShapeError.DisallowedKind(NodeKind.OPTIONAL_TYPE, 1, "questionMark",
                                                 TokenKind.EXCLAIM_POSTFIX, Set.of(TokenKind.QUESTION_POSTFIX)).message())
            .isEqualTo("OPTIONAL_TYPE does not accept EXCLAIM_POSTFIX at questionMark (#1), expected one of [QUESTION_POSTFIX]");
    }

    @Test
    void exception_carriesErrorAndMessage() {
        var error = new ShapeError.FixedTextMismatch(TokenKind.ARROW, "->", "=>");

        var exception = new ShapeViolationException(error);

        assertThat(exception).isInstanceOf(IllegalArgumentException.class)
                             .hasMessage("ARROW must be spelled '->', got '=>'");
        assertThat(exception.error()).isSameAs(error);
    }
}
