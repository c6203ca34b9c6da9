package ai.robot.tidy.transform;

import ai.robot.tidy.config.FormattingContext;
import ai.robot.tidy.model.Block;
import ai.robot.tidy.model.Document;
import ai.robot.tidy.model.IfBlock;
import ai.robot.tidy.model.Keyword;
import ai.robot.tidy.model.Node;
import ai.robot.tidy.model.Section;
import ai.robot.tidy.model.Statement;
import ai.robot.tidy.model.TestCase;
import java.util.ArrayList;
import java.util.List;

/**
 * Base class for rules that mutate the tree. Each {@code visitX} method decides the fate of one node
 * through a {@link Rewrite}; the default implementations recurse into children and keep the node.
 * Replacements returned for a child are spliced into the parent list and are not visited again.
 */
public abstract class ModelTransformer implements Rule {

    @Override
    public void apply(Document document, FormattingContext context) {
        visitDocument(document, context);
    }

    protected void visitDocument(Document document, FormattingContext context) {
        transformAll(document.sections(), Section.class, context);
    }

    protected Rewrite visitSection(Section section, FormattingContext context) {
        visitChildren(section, context);
        return Rewrite.keep();
    }

    protected Rewrite visitTestCase(TestCase testCase, FormattingContext context) {
        visitChildren(testCase, context);
        return Rewrite.keep();
    }

    protected Rewrite visitKeyword(Keyword keyword, FormattingContext context) {
        visitChildren(keyword, context);
        return Rewrite.keep();
    }

    protected Rewrite visitIf(IfBlock ifBlock, FormattingContext context) {
        visitChildren(ifBlock, context);
        return Rewrite.keep();
    }

    protected Rewrite visitStatement(Statement statement, FormattingContext context) {
        return Rewrite.keep();
    }

    protected final Rewrite visit(Node node, FormattingContext context) {
        return switch (node.kind()) {
            case SECTION -> visitSection((Section) node, context);
            case TEST_CASE -> visitTestCase((TestCase) node, context);
            case KEYWORD -> visitKeyword((Keyword) node, context);
            case IF_BLOCK -> visitIf((IfBlock) node, context);
            case STATEMENT -> visitStatement((Statement) node, context);
        };
    }

    protected final void visitChildren(Node node, FormattingContext context) {
        switch (node.kind()) {
            case SECTION -> {
                Section section = (Section) node;
                section.header().ifPresent(header ->
                        section.setHeader(visitSlot(header, Statement.class, context, false)));
                transformAll(section.body(), Node.class, context);
            }
            case TEST_CASE, KEYWORD -> visitBlock((Block) node, context);
            case IF_BLOCK -> {
                IfBlock ifBlock = (IfBlock) node;
                visitBlock(ifBlock, context);
                ifBlock.orElse().ifPresent(branch ->
                        ifBlock.setOrElse(visitSlot(branch, IfBlock.class, context, true)));
                ifBlock.end().ifPresent(end -> ifBlock.setEnd(visitSlot(end, Statement.class, context, true)));
            }
            case STATEMENT -> {
                // leaf
            }
        }
    }

    private void visitBlock(Block block, FormattingContext context) {
        block.setHeader(visitSlot(block.header(), Statement.class, context, false));
        transformAll(block.body(), Node.class, context);
    }

    protected final <N extends Node> void transformAll(List<N> nodes, Class<N> type, FormattingContext context) {
        List<N> result = new ArrayList<>(nodes.size());
        for (N node : List.copyOf(nodes)) {
            Rewrite rewrite = visit(node, context);
            switch (rewrite.action()) {
                case KEEP -> result.add(node);
                case DELETE -> {
                    // dropped
                }
                case REPLACE -> {
                    for (Node replacement : rewrite.replacement()) {
                        result.add(cast(replacement, type));
                    }
                }
            }
        }
        nodes.clear();
        nodes.addAll(result);
    }

    private <N extends Node> N visitSlot(N node, Class<N> type, FormattingContext context, boolean deletable) {
        Rewrite rewrite = visit(node, context);
        return switch (rewrite.action()) {
            case KEEP -> node;
            case DELETE -> {
                if (!deletable) {
                    throw new IllegalStateException("Header statements cannot be deleted: " + node);
                }
                yield null;
            }
            case REPLACE -> {
                if (rewrite.replacement().size() != 1) {
                    throw new IllegalStateException("Single-valued slot must be replaced by exactly one node, got "
                            + rewrite.replacement().size());
                }
                yield cast(rewrite.replacement().get(0), type);
            }
        };
    }

    private static <N extends Node> N cast(Node node, Class<N> type) {
        if (!type.isInstance(node)) {
            throw new IllegalStateException("Expected " + type.getSimpleName() + " but rule produced " + node.kind());
        }
        return type.cast(node);
    }
}
