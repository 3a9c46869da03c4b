package dev.py2flow.python;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PythonLexerTest {

    @Test
    void emitsIndentAndDedentAroundBlocks() {
        String source = """
            if x:
                y = 1
            z = 2
            """;

        List<TokenType> types = PythonLexer.tokenize(source).stream().map(Token::type).toList();

        assertThat(types).containsExactly(
            TokenType.NAME, TokenType.NAME, TokenType.OP, TokenType.NEWLINE,
            TokenType.INDENT, TokenType.NAME, TokenType.OP, TokenType.NUMBER, TokenType.NEWLINE,
            TokenType.DEDENT, TokenType.NAME, TokenType.OP, TokenType.NUMBER, TokenType.NEWLINE,
            TokenType.EOF);
    }

    @Test
    void ignoresNewlinesInsideBrackets() {
        String source = """
            df = pd.merge(a,
                          b)
            """;

        List<Token> tokens = PythonLexer.tokenize(source);

        assertThat(tokens).filteredOn(t -> t.type() == TokenType.NEWLINE).hasSize(1);
        assertThat(tokens).filteredOn(t -> t.type() == TokenType.INDENT).isEmpty();
        assertThat(tokens.stream().filter(t -> t.text().equals("b")).findFirst().orElseThrow().line()).isEqualTo(2);
    }

    @Test
    void keepsStringPrefixAndQuotesInTokenText() {
        List<Token> tokens = PythonLexer.tokenize("path = f'{root}/data.csv'\n");

        assertThat(tokens.get(2).type()).isEqualTo(TokenType.STRING);
        assertThat(tokens.get(2).text()).isEqualTo("f'{root}/data.csv'");
    }

    @Test
    void prefersLongestOperator() {
        List<Token> tokens = PythonLexer.tokenize("a //= b ** 2\n");

        assertThat(tokens).extracting(Token::text).contains("//=", "**");
    }

    @Test
    void skipsCommentsAndBlankLines() {
        String source = """
            # load
            df = 1  # trailing

            """;

        List<Token> tokens = PythonLexer.tokenize(source);

        assertThat(tokens).extracting(Token::text).doesNotContain("# load", "# trailing");
        assertThat(tokens.get(0).line()).isEqualTo(2);
    }

    @Test
    void rejectsUnterminatedString() {
        assertThatThrownBy(() -> PythonLexer.tokenize("x = 'abc\n"))
            .isInstanceOf(PythonSyntaxException.class)
            .hasMessageContaining("unterminated string");
    }

    @Test
    void rejectsUnmatchedClosingBracket() {
        assertThatThrownBy(() -> PythonLexer.tokenize("x = 1)\n"))
            .isInstanceOf(PythonSyntaxException.class)
            .satisfies(e -> assertThat(((PythonSyntaxException) e).getLine()).isEqualTo(1));
    }
}
