package ai.robot.tidy.transform;

import ai.robot.tidy.model.Block;
import ai.robot.tidy.model.Document;
import ai.robot.tidy.model.IfBlock;
import ai.robot.tidy.model.Keyword;
import ai.robot.tidy.model.Node;
import ai.robot.tidy.model.Section;
import ai.robot.tidy.model.Statement;
import ai.robot.tidy.model.TestCase;

/**
 * Read-only walk over a document, used by the scans that run before a mutating pass.
 */
public abstract class ModelVisitor {

    public void visitDocument(Document document) {
        for (Section section : document.sections()) {
            visitSection(section);
        }
    }

    protected void visitSection(Section section) {
        visitChildren(section);
    }

    protected void visitTestCase(TestCase testCase) {
        visitChildren(testCase);
    }

    protected void visitKeyword(Keyword keyword) {
        visitChildren(keyword);
    }

    protected void visitIf(IfBlock ifBlock) {
        visitChildren(ifBlock);
    }

    protected void visitStatement(Statement statement) {
    }

    protected final void visit(Node node) {
        switch (node.kind()) {
            case SECTION -> visitSection((Section) node);
            case TEST_CASE -> visitTestCase((TestCase) node);
            case KEYWORD -> visitKeyword((Keyword) node);
            case IF_BLOCK -> visitIf((IfBlock) node);
            case STATEMENT -> visitStatement((Statement) node);
        }
    }

    protected final void visitChildren(Node node) {
        switch (node.kind()) {
            case SECTION -> {
                Section section = (Section) node;
                section.header().ifPresent(this::visit);
                section.body().forEach(this::visit);
            }
            case TEST_CASE, KEYWORD -> visitBlock((Block) node);
            case IF_BLOCK -> {
                IfBlock ifBlock = (IfBlock) node;
                visitBlock(ifBlock);
                ifBlock.orElse().ifPresent(this::visit);
                ifBlock.end().ifPresent(this::visit);
            }
            case STATEMENT -> {
                // leaf
            }
        }
    }

    private void visitBlock(Block block) {
        visit(block.header());
        block.body().forEach(this::visit);
    }
}
