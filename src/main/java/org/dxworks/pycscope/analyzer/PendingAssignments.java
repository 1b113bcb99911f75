package org.dxworks.pycscope.analyzer;

import org.dxworks.pycscope.cst.CstNode;
import org.dxworks.pycscope.exception.UnresolvedPendingException;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Set;

/**
 * Assignment targets noted by a statement but not visited yet, plus the flag
 * telling the walk that the node being visited must be resolved to the
 * identifier receiving the ASSIGN mark.
 */
public class PendingAssignments {
    private final Set<CstNode> targets = Collections.newSetFromMap(new IdentityHashMap<>());
    private boolean resolveNext;

    public void add(CstNode target) {
        targets.add(target);
    }

    /**
     * If the node is a pending target, removes it and raises the resolve flag.
     *
     * @return true when the node was pending
     */
    public boolean claim(CstNode node) {
        if (!targets.remove(node)) {
            return false;
        }
        if (resolveNext) {
            throw new UnresolvedPendingException("Assignment target " + node.getKind()
                    + " reached while another target is still being resolved");
        }
        resolveNext = true;
        return true;
    }

    /**
     * Reads and clears the resolve flag.
     */
    public boolean consumeResolve() {
        boolean resolve = resolveNext;
        resolveNext = false;
        return resolve;
    }

    public boolean contains(CstNode node) {
        return targets.contains(node);
    }

    public boolean isSettled() {
        return targets.isEmpty() && !resolveNext;
    }

    public int size() {
        return targets.size();
    }
}
