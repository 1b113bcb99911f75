package org.dxworks.pycscope.cst;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Pretty prints a concrete syntax tree as JSON, for debugging the indexer.
 */
public final class CstDumper {
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT);

    private CstDumper() {}

    public static String dump(CstNode root) {
        try {
            return MAPPER.writeValueAsString(toMap(root));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize tree of kind " + root.getKind(), e);
        }
    }

    /**
     * Builds nested maps bottom-up without recursion, so deep trees dump safely.
     */
    static Map<String, Object> toMap(CstNode root) {
        Map<CstNode, Map<String, Object>> converted = new IdentityHashMap<>();
        Deque<CstNode> pending = new ArrayDeque<>();
        Deque<CstNode> order = new ArrayDeque<>();
        pending.push(root);
        while (!pending.isEmpty()) {
            CstNode node = pending.pop();
            order.push(node);
            for (CstNode child : node.getChildren()) {
                pending.push(child);
            }
        }

        while (!order.isEmpty()) {
            CstNode node = order.pop();
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("kind", node.getKind());
            if (node.isTerminal()) {
                entry.put("text", node.getText());
                entry.put("line", node.getLine());
            } else {
                List<Map<String, Object>> children = new ArrayList<>();
                for (CstNode child : node.getChildren()) {
                    children.add(converted.remove(child));
                }
                entry.put("children", children);
            }
            converted.put(node, entry);
        }
        return converted.get(root);
    }
}
