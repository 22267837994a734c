package org.processgraph.reasoning.issues;

import java.util.List;

/**
 * A structural finding, returned as data and never thrown.
 *
 * @param code    what kind of finding this is
 * @param message human-readable explanation
 * @param nodeIds ids of the nodes involved; the first one is the node the finding is reported on
 * @param edgeIds ids of the edges involved, may be empty
 */
public record Issue(
        IssueCode code,
        String message,
        List<String> nodeIds,
        List<String> edgeIds
) {
    public Issue {
        nodeIds = nodeIds == null ? List.of() : List.copyOf(nodeIds);
        edgeIds = edgeIds == null ? List.of() : List.copyOf(edgeIds);
    }

    public Issue(IssueCode code, String message, List<String> nodeIds) {
        this(code, message, nodeIds, List.of());
    }

    public boolean isActionable() {
        return code.isActionable();
    }
}
