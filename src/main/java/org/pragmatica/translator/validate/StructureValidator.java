package org.pragmatica.translator.validate;

import org.pragmatica.translator.tree.Node;
import org.pragmatica.translator.tree.Nodes;

import java.util.ArrayList;
import java.util.List;

/**
 * Checks that a translated message keeps the tags and placeholders of its source message.
 *
 * <p>Only presence, name and nesting count: text is ignored and siblings may be reordered,
 * so {@code "<a>hi</a> %n%"} and {@code "%n% <a>salut</a>"} are equivalent while
 * {@code "hi %n%"} is not.
 */
public final class StructureValidator {
    private StructureValidator() {}

    /**
     * Check whether {@code target} has the same tags, void tags and placeholders as {@code base}.
     * Each target node matches at most one base node, so repeated markup must be repeated in the
     * translation as well: {@code "%a% %a%"} is not equivalent to {@code "%a% %b%"}, even though every
     * base node has a same-named counterpart somewhere in the target.
     */
    public static boolean isStructurallyEquivalent(List<Node> base, List<Node> target) {
        var baseNodes = markup(base);
        var targetNodes = markup(target);
        if (baseNodes.size() != targetNodes.size()) {
            return false;
        }
        var unmatched = new ArrayList<>(targetNodes);
        for (var node : baseNodes) {
            if (!removeMatch(node, unmatched)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Describe what differs between the two messages, empty when they are equivalent.
     * A tag whose children differ is reported as missing from one side and unexpected on the other.
     */
    public static List<String> differences(List<Node> base, List<Node> target) {
        var unmatched = new ArrayList<>(markup(target));
        var result = new ArrayList<String>();
        for (var node : markup(base)) {
            if (!removeMatch(node, unmatched)) {
                result.add("missing " + Nodes.describe(node));
            }
        }
        for (var node : unmatched) {
            result.add("unexpected " + Nodes.describe(node));
        }
        return List.copyOf(result);
    }

    private static boolean removeMatch(Node node, List<Node> candidates) {
        for (int i = 0; i < candidates.size(); i++) {
            if (matches(node, candidates.get(i))) {
                candidates.remove(i);
                return true;
            }
        }
        return false;
    }

    private static boolean matches(Node base, Node target) {
        if (base.getClass() != target.getClass()) {
            return false;
        }
        if (!Nodes.nameOf(base).equals(Nodes.nameOf(target))) {
            return false;
        }
        if (base instanceof Node.Tag baseTag) {
            return isStructurallyEquivalent(baseTag.children(), ((Node.Tag) target).children());
        }
        return true;
    }

    private static List<Node> markup(List<Node> nodes) {
        return nodes.stream()
                    .filter(node -> !(node instanceof Node.Text))
                    .toList();
    }
}
