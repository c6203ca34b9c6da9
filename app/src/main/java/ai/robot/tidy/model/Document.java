package ai.robot.tidy.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Root of a parsed suite or resource file.
 */
public final class Document {

    private final String source;
    private final List<Section> sections;

    public Document(String source, List<Section> sections) {
        this.source = Objects.requireNonNull(source, "source");
        this.sections = new ArrayList<>(Objects.requireNonNull(sections, "sections"));
    }

    /**
     * Name of the origin of this tree, usually a path; only used for reporting.
     */
    public String source() {
        return source;
    }

    /**
     * Live, mutable section list.
     */
    public List<Section> sections() {
        return sections;
    }

    public List<Token> tokens() {
        List<Token> tokens = new ArrayList<>();
        for (Section section : sections) {
            section.collectTokens(tokens);
        }
        return tokens;
    }
}
