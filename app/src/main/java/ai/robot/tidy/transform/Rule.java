package ai.robot.tidy.transform;

import ai.robot.tidy.config.FormattingContext;
import ai.robot.tidy.model.Document;

/**
 * One rewrite pass over a whole document. Implementations must not keep per-document state between calls.
 */
public interface Rule {

    void apply(Document document, FormattingContext context);
}
