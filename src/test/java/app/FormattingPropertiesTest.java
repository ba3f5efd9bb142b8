package app;

import domain.analyze.Depth;
import domain.analyze.Line;
import domain.analyze.Node;
import domain.analyze.NodeManager;
import domain.config.Mode;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Properties every formatted fixture must have.
 */
class FormattingPropertiesTest {

    private static final Mode MODE = Mode.defaults();
    private static final List<Path> FIXTURES = new ArrayList<>();

    @BeforeAll
    static void loadFixtures() throws IOException, URISyntaxException {
        Path dir = Paths.get(FormattingPropertiesTest.class.getResource("/fixtures").toURI());
        try (Stream<Path> files = Files.list(dir)) {
            files.filter(p -> p.toString().endsWith(".sql")).sorted().forEach(FIXTURES::add);
        }
        assertFalse(FIXTURES.isEmpty(), "no fixtures under " + dir);
    }

    private static String read(Path p) throws IOException {
        return new String(Files.readAllBytes(p), StandardCharsets.UTF_8);
    }

    @Test
    void formatting_twice_changes_nothing() throws IOException {
        for (Path fixture : FIXTURES) {
            String once = SqlfmtApi.format(read(fixture), MODE);
            assertEquals(once, SqlfmtApi.format(once, MODE), fixture.getFileName().toString());
        }
    }

    @Test
    void blank_lines_are_bounded_by_depth() throws IOException {
        for (Path fixture : FIXTURES) {
            String out = SqlfmtApi.format(read(fixture), MODE);
            assertFalse(out.contains("\n\n\n\n"), fixture.getFileName().toString());
            assertFalse(out.endsWith("\n\n"), fixture.getFileName().toString());

            int run = 0;
            for (Line line : SqlfmtApi.parse(out, MODE).getLines()) {
                if (!line.isBlank() || line.isFormattingDisabled()) {
                    run = 0;
                    continue;
                }
                run++;
                int max = Depth.ZERO.equals(line.depth()) ? 2 : 1;
                assertTrue(run <= max, fixture.getFileName() + ": " + run + " blank lines at " + line.depth());
            }
        }
    }

    @Test
    void output_relexes_with_depth_back_to_zero_at_each_statement_end() throws IOException {
        for (Path fixture : FIXTURES) {
            String out = SqlfmtApi.format(read(fixture), MODE);
            List<Node> nodes = SqlfmtApi.parse(out, MODE).getNodes();
            assertFalse(nodes.isEmpty(), fixture.getFileName().toString());
            for (Node node : nodes) {
                assertTrue(node.depth().getSql() >= 0, node.toString());
                assertTrue(node.depth().getJinja() >= 0, node.toString());
                if (node.isSemicolon()) {
                    assertEquals(Depth.ZERO, node.depth(), fixture.getFileName() + ": " + node);
                }
            }
            Node last = nodes.get(nodes.size() - 1);
            assertTrue(NodeManager.openBracketsAfter(last).stream().noneMatch(Node::isOpeningBracket),
                    fixture.getFileName() + " leaves a bracket open");
        }
    }

    @Test
    void rows_fit_the_line_length_unless_they_hold_a_single_token() throws IOException {
        for (Path fixture : FIXTURES) {
            String out = SqlfmtApi.format(read(fixture), MODE);
            for (Line line : SqlfmtApi.parse(out, MODE).getLines()) {
                if (line.isFormattingDisabled() || line.containsMultilineJinja()) continue;
                if (line.length() <= MODE.getLineLength()) continue;
                int tokens = line.contentCount() - (line.endsWithComma() ? 1 : 0);
                assertTrue(tokens <= 1, fixture.getFileName() + ": " + line.render());
            }
        }
    }

    @Test
    void indentation_and_trailing_spaces_of_the_input_do_not_matter() throws IOException {
        for (Path fixture : FIXTURES) {
            String src = read(fixture);
            StringBuilder reshaped = new StringBuilder();
            for (String row : src.split("\n", -1)) {
                reshaped.append(row.strip()).append("   \n");
            }
            assertEquals(SqlfmtApi.format(src, MODE), SqlfmtApi.format(reshaped.toString(), MODE),
                    fixture.getFileName().toString());
        }
    }
}
