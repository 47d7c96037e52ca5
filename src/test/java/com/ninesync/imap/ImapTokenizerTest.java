package com.ninesync.imap;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * ImapTokenizer unit tests
 */
class ImapTokenizerTest {

    @Test
    @DisplayName("Atoms, quoted strings and nested lists")
    void testNestedLists() throws Exception {
        List<Object> tokens = ImapTokenizer.tokenize("UID 7 FLAGS (\\Seen (a \"b c\"))");

        assertThat(tokens).hasSize(4);
        assertThat(tokens.get(0)).isEqualTo("UID");
        List<Object> flags = ImapTokenizer.list(tokens.get(3));
        assertThat(flags.get(0)).isEqualTo("\\Seen");
        assertThat(ImapTokenizer.list(flags.get(1))).containsExactly("a", "b c");
    }

    @Test
    @DisplayName("NIL differs from the quoted string \"NIL\" and from empty string")
    void testNil() throws Exception {
        List<Object> tokens = ImapTokenizer.tokenize("NIL \"NIL\" \"\"");

        assertThat(tokens.get(0)).isSameAs(ImapTokenizer.Nil.NIL);
        assertThat(ImapTokenizer.string(tokens.get(0))).isNull();
        assertThat(tokens.get(1)).isEqualTo("NIL");
        assertThat(tokens.get(2)).isEqualTo("");
        assertThat(ImapTokenizer.list(tokens.get(0))).isEmpty();
    }

    @Test
    @DisplayName("Parentheses inside quoted strings and literals are not counted")
    void testParenthesesInStrings() throws Exception {
        List<Object> tokens = ImapTokenizer.tokenize("(\"a (b\" {3}\r\n)x( c)");

        List<Object> list = ImapTokenizer.list(tokens.get(0));
        assertThat(list).containsExactly("a (b", ")x(", "c");
    }

    @Test
    @DisplayName("Escaped quote inside a quoted string")
    void testEscapes() throws Exception {
        assertThat(ImapTokenizer.tokenize("\"say \\\"hi\\\"\"")).containsExactly("say \"hi\"");
    }

    @Test
    @DisplayName("Bracketed section stays part of the atom")
    void testBracketedAtom() throws Exception {
        List<Object> tokens = ImapTokenizer.tokenize("BODY[HEADER.FIELDS (SUBJECT)] {2}\r\nhi");

        assertThat(tokens).containsExactly("BODY[HEADER.FIELDS (SUBJECT)]", "hi");
    }

    @Test
    @DisplayName("Unbalanced input is rejected")
    void testUnbalanced() {
        assertThatThrownBy(() -> ImapTokenizer.tokenize("(a (b)"))
                .isInstanceOf(ImapException.class)
                .satisfies(e -> assertThat(((ImapException) e).getKind()).isEqualTo(ImapException.ErrorKind.PROTOCOL));
        assertThatThrownBy(() -> ImapTokenizer.tokenize("a)")).isInstanceOf(ImapException.class);
        assertThatThrownBy(() -> ImapTokenizer.tokenize("\"open")).isInstanceOf(ImapException.class);
        assertThatThrownBy(() -> ImapTokenizer.tokenize("{10}\r\nshort")).isInstanceOf(ImapException.class);
    }

    @Test
    @DisplayName("Negative or oversized literal sizes are protocol errors")
    void testBadLiteralSize() {
        assertThatThrownBy(() -> ImapTokenizer.tokenize("{-1}\r\nx"))
                .isInstanceOf(ImapException.class)
                .satisfies(e -> assertThat(((ImapException) e).getKind()).isEqualTo(ImapException.ErrorKind.PROTOCOL));
        assertThatThrownBy(() -> ImapTokenizer.tokenize("{99999999999}\r\nx"))
                .isInstanceOf(ImapException.class)
                .satisfies(e -> assertThat(((ImapException) e).getKind()).isEqualTo(ImapException.ErrorKind.PROTOCOL));
    }
}
