package org.dxworks.pycscope.analyzer;

import org.dxworks.pycscope.cst.CstNode;
import org.dxworks.pycscope.exception.ShapeViolationException;
import org.dxworks.pycscope.model.Mark;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Recognizes definition, import, assignment and call shapes while the walk
 * passes over their non-terminal nodes, and registers marks on the terminals
 * below them. Nothing is emitted here; the {@link TerminalProcessor} picks the
 * marks up when it reaches the tokens.
 *
 * Node kinds are those of the tree-sitter-python grammar.
 */
public class ShapeRecognizer {

    private static final Set<String> UNPACKING_TARGETS =
            Set.of("tuple_pattern", "list_pattern", "tuple", "list", "parenthesized_expression");
    private static final Set<String> STARRED = Set.of("list_splat_pattern", "list_splat");
    private static final Set<String> PUNCTUATION = Set.of("(", ")", "[", "]", ",");
    private static final Set<String> CALL_ARGUMENTS = Set.of("argument_list", "generator_expression");

    public void visit(TraversalContext ctx, CstNode node) {
        // assignment resolution comes before call recognition on the same node
        ctx.pending.claim(node);
        if (ctx.pending.consumeResolve()) {
            resolveAssignmentTarget(ctx, node);
        }
        if (node.isTerminal()) {
            return;
        }

        switch (node.getKind()) {
            case "global_statement" -> markGlobals(ctx, node);
            case "function_definition" -> markFunctionDefinition(ctx, node);
            case "decorated_definition" -> markDecorators(ctx, node);
            case "import_from_statement" -> markFromImport(ctx, node);
            case "future_import_statement" -> markFutureImport(ctx, node);
            case "import_statement" -> startImport(ctx, node);
            case "dotted_name" -> markImportedPath(ctx, node);
            case "assignment" -> noteAssignment(ctx, node);
            case "augmented_assignment" -> ctx.pending.add(node.getChild(0));
            case "class_definition" -> markClassDefinition(ctx, node);
            case "call" -> markCall(ctx, node);
            default -> { }
        }
    }

    private void markGlobals(TraversalContext ctx, CstNode node) {
        for (CstNode child : node.getChildren()) {
            if (child.is("global") || child.is(",")) continue;
            if (!child.is(CstNode.IDENTIFIER)) {
                throw new ShapeViolationException("Expected a name in global statement, found " + child);
            }
            ctx.marks.register(child, Mark.GLOBAL);
        }
    }

    private void markFunctionDefinition(TraversalContext ctx, CstNode node) {
        // cscope has no notion of nested functions: only the outermost is a definition
        if (ctx.functionDepth != TraversalContext.NO_FUNCTION) {
            return;
        }
        ctx.functionDepth = ctx.indentDepth;
        CstNode name = node.childAfter("def");
        if (name == null || !name.is(CstNode.IDENTIFIER)) {
            throw new ShapeViolationException("Function definition without a name after 'def'");
        }
        ctx.marks.register(name, Mark.FUNC_DEF);
    }

    private void markDecorators(TraversalContext ctx, CstNode node) {
        CstNode definition = node.getLastChild();
        boolean function = definition != null && definition.is("function_definition");

        for (CstNode decorator : node.getChildren()) {
            if (!decorator.is("decorator")) continue;
            CstNode expression = decorator.childAfter("@");
            if (expression == null) {
                throw new ShapeViolationException("Decorator without an expression after '@'");
            }
            if (expression.is("call")) {
                ctx.decoratorCalls.add(expression);
                expression = expression.getChild(0);
            }
            if (!function) continue;

            List<CstNode> path = dottedPath(expression);
            if (path.size() > 1) {
                // only the last component of a dotted decorator is the function called
                ctx.marks.register(path.get(path.size() - 1), Mark.FUNC_CALL);
            } else if (path.size() == 1 && !PythonNames.NO_OP_DECORATORS.contains(path.get(0).getText())) {
                ctx.marks.register(path.get(0), Mark.FUNC_CALL);
            }
        }
    }

    /**
     * The name tokens of an {@code a.b.c} chain, or an empty list when the
     * expression is anything else.
     */
    private static List<CstNode> dottedPath(CstNode expression) {
        List<CstNode> reversed = new ArrayList<>();
        CstNode current = expression;
        while (current.is("attribute")) {
            CstNode name = current.getLastChild();
            if (name == null || !name.is(CstNode.IDENTIFIER)) {
                return List.of();
            }
            reversed.add(name);
            current = current.getChild(0);
        }
        if (!current.is(CstNode.IDENTIFIER)) {
            return List.of();
        }
        reversed.add(current);

        List<CstNode> path = new ArrayList<>(reversed.size());
        for (int i = reversed.size() - 1; i >= 0; i--) {
            path.add(reversed.get(i));
        }
        return path;
    }

    private void markFromImport(TraversalContext ctx, CstNode node) {
        CstNode module = node.childAfter("from");
        if (module == null) {
            throw new ShapeViolationException("Import statement without a module after 'from'");
        }
        if (module.is("relative_import")) {
            // leading dots stay plain text, only a following dotted name is included
            module = module.findFirstChild("dotted_name");
        }
        if (module != null && module.is("dotted_name")) {
            markInclude(ctx, module);
        }
    }

    private void markFutureImport(TraversalContext ctx, CstNode node) {
        CstNode module = node.childAfter("from");
        if (module == null || !module.isTerminal()) {
            throw new ShapeViolationException("Future import without '__future__' after 'from'");
        }
        ctx.marks.register(module, Mark.INCLUDE);
    }

    private void startImport(TraversalContext ctx, CstNode node) {
        int paths = 0;
        for (CstNode child : node.getChildren()) {
            if (child.is("dotted_name") || child.is("aliased_import")) {
                paths++;
            }
        }
        ctx.importCount = paths;
        ctx.importing = paths > 0;
    }

    private void markImportedPath(TraversalContext ctx, CstNode node) {
        if (!ctx.importing) {
            return;
        }
        // every token of a.b.c is an include, so they merge into one symbol
        markInclude(ctx, node);
        ctx.importCount--;
        if (ctx.importCount == 0) {
            ctx.importing = false;
        }
    }

    private static void markInclude(TraversalContext ctx, CstNode dottedName) {
        for (CstNode part : dottedName.getChildren()) {
            ctx.marks.register(part, Mark.INCLUDE);
        }
    }

    private void noteAssignment(TraversalContext ctx, CstNode node) {
        // annotated assignments (x: T = v) are not classified
        if (node.findFirstChild(":") != null || node.findFirstChild("=") == null) {
            return;
        }
        CstNode left = node.getChild(0);
        if (left.is("pattern_list")) {
            for (CstNode target : left.getChildren()) {
                if (!target.is(",")) {
                    ctx.pending.add(target);
                }
            }
        } else {
            ctx.pending.add(left);
        }
    }

    private void resolveAssignmentTarget(TraversalContext ctx, CstNode node) {
        String kind = node.getKind();
        if (node.is(CstNode.IDENTIFIER)) {
            ctx.marks.register(node, Mark.ASSIGN);
        } else if (UNPACKING_TARGETS.contains(kind)) {
            for (CstNode element : node.getChildren()) {
                if (PUNCTUATION.contains(element.getKind())) continue;
                if (STARRED.contains(element.getKind())) break;
                ctx.pending.add(element);
            }
        } else if (kind.equals("list_splat_pattern") || kind.equals("list_splat")) {
            CstNode operand = node.getLastChild();
            if (operand != null && !operand.is("*")) {
                ctx.pending.add(operand);
            }
        } else if (kind.equals("attribute")) {
            markAttributeName(ctx, node, Mark.ASSIGN);
        } else if (kind.equals("subscript")) {
            CstNode value = node.getChild(0);
            if (value.is(CstNode.IDENTIFIER)) {
                ctx.marks.register(value, Mark.ASSIGN);
            } else if (value.is("attribute")) {
                markAttributeName(ctx, value, Mark.ASSIGN);
            }
        }
        // any other target shape is left unmarked
    }

    private void markClassDefinition(TraversalContext ctx, CstNode node) {
        CstNode name = node.childAfter("class");
        if (name == null || !name.is(CstNode.IDENTIFIER)) {
            throw new ShapeViolationException("Class definition without a name after 'class'");
        }
        ctx.marks.register(name, Mark.CLASS);
    }

    private void markCall(TraversalContext ctx, CstNode node) {
        if (ctx.decoratorCalls.remove(node)) {
            return;
        }
        CstNode arguments = node.getLastChild();
        if (node.getChildCount() != 2 || !CALL_ARGUMENTS.contains(arguments.getKind())) {
            return;
        }
        CstNode function = node.getChild(0);
        if (function.is(CstNode.IDENTIFIER)) {
            ctx.marks.register(function, Mark.FUNC_CALL);
        } else if (function.is("attribute")) {
            markAttributeName(ctx, function, Mark.FUNC_CALL);
        }
    }

    private static void markAttributeName(TraversalContext ctx, CstNode attribute, Mark mark) {
        CstNode name = attribute.getLastChild();
        if (name != null && name.is(CstNode.IDENTIFIER)) {
            ctx.marks.register(name, mark);
        }
    }
}
