package ai.robot.tidy.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Top-level section. The header is absent only for the implicit comment section at the start of a file.
 */
public final class Section extends Node {

    private final SectionKind sectionKind;
    private Statement header;
    private final List<Node> body;

    public Section(SectionKind sectionKind, Statement header, List<? extends Node> body) {
        this.sectionKind = Objects.requireNonNull(sectionKind, "sectionKind");
        this.header = header;
        this.body = new ArrayList<>(Objects.requireNonNull(body, "body"));
    }

    @Override
    public NodeKind kind() {
        return NodeKind.SECTION;
    }

    public SectionKind sectionKind() {
        return sectionKind;
    }

    public Optional<Statement> header() {
        return Optional.ofNullable(header);
    }

    public void setHeader(Statement header) {
        this.header = header;
    }

    /**
     * Live, mutable body.
     */
    public List<Node> body() {
        return body;
    }

    @Override
    public void collectTokens(List<Token> target) {
        if (header != null) {
            header.collectTokens(target);
        }
        for (Node node : body) {
            node.collectTokens(target);
        }
    }
}
