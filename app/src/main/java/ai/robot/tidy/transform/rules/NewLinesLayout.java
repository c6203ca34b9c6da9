package ai.robot.tidy.transform.rules;

import ai.robot.tidy.model.Document;
import ai.robot.tidy.model.Node;
import ai.robot.tidy.model.NodeKind;
import ai.robot.tidy.model.Section;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;

/**
 * Facts gathered before blank lines are rewritten: which section is last, which test case or keyword
 * closes its section, and whether the suite is templated. Membership is by identity.
 */
final class NewLinesLayout {

    private final Section lastSection;
    private final Set<Node> lastInSection;
    private final boolean templated;

    private NewLinesLayout(Section lastSection, Set<Node> lastInSection, boolean templated) {
        this.lastSection = lastSection;
        this.lastInSection = lastInSection;
        this.templated = templated;
    }

    static NewLinesLayout scan(Document document, boolean separateTemplatedTests) {
        List<Section> sections = document.sections();
        Section last = sections.isEmpty() ? null : sections.get(sections.size() - 1);
        Set<Node> lastInSection = Collections.newSetFromMap(new IdentityHashMap<>());
        for (Section section : sections) {
            lastOfKind(section.body(), NodeKind.TEST_CASE, lastInSection);
            lastOfKind(section.body(), NodeKind.KEYWORD, lastInSection);
        }
        boolean templated = !separateTemplatedTests && TestTemplateFinder.isTemplated(document);
        return new NewLinesLayout(last, lastInSection, templated);
    }

    private static void lastOfKind(List<Node> body, NodeKind kind, Set<Node> target) {
        for (int i = body.size() - 1; i >= 0; i--) {
            if (body.get(i).kind() == kind) {
                target.add(body.get(i));
                return;
            }
        }
    }

    boolean isLastSection(Section section) {
        return section == lastSection;
    }

    boolean isLastInSection(Node node) {
        return lastInSection.contains(node);
    }

    boolean templated() {
        return templated;
    }
}
