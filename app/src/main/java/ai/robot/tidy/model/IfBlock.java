package ai.robot.tidy.model;

import java.util.List;
import java.util.Optional;

/**
 * One branch of an IF structure. ELSE IF and ELSE branches hang off {@link #orElse()} as a singly-linked
 * chain; only the outermost branch owns the END statement.
 */
public final class IfBlock extends Block {

    private IfBlock orElse;
    private Statement end;

    public IfBlock(Statement header, List<? extends Node> body, IfBlock orElse, Statement end) {
        super(header, body);
        this.orElse = orElse;
        this.end = end;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.IF_BLOCK;
    }

    public Optional<IfBlock> orElse() {
        return Optional.ofNullable(orElse);
    }

    public void setOrElse(IfBlock orElse) {
        this.orElse = orElse;
    }

    public Optional<Statement> end() {
        return Optional.ofNullable(end);
    }

    public void setEnd(Statement end) {
        this.end = end;
    }

    /**
     * Number of branches in the chain starting at this block.
     */
    public int branchCount() {
        int count = 1;
        IfBlock current = orElse;
        while (current != null) {
            count++;
            current = current.orElse;
        }
        return count;
    }

    @Override
    public void collectTokens(List<Token> target) {
        super.collectTokens(target);
        if (orElse != null) {
            orElse.collectTokens(target);
        }
        if (end != null) {
            end.collectTokens(target);
        }
    }
}
