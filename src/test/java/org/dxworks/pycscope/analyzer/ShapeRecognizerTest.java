package org.dxworks.pycscope.analyzer;

import org.dxworks.pycscope.cst.CstNode;
import org.dxworks.pycscope.exception.MarkConflictException;
import org.dxworks.pycscope.model.Mark;
import org.junit.jupiter.api.Test;

import static org.dxworks.pycscope.analyzer.CstTrees.leaf;
import static org.dxworks.pycscope.analyzer.CstTrees.name;
import static org.dxworks.pycscope.analyzer.CstTrees.node;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class ShapeRecognizerTest {

    private final ShapeRecognizer shapes = new ShapeRecognizer();

    private static CstNode emptyArguments() {
        return node("argument_list", leaf("(", "(", 1), leaf(")", ")", 1));
    }

    private static CstNode function(String functionName) {
        return node("function_definition",
                leaf("def", "def", 2), name(functionName, 2),
                node("parameters", leaf("(", "(", 2), leaf(")", ")", 2)),
                leaf(":", ":", 2));
    }

    @Test
    void visit_NestedFunctionIsNotADefinition() {
        TraversalContext ctx = new TraversalContext(false);
        ctx.functionDepth = 0;

        shapes.visit(ctx, function("inner"));

        assertEquals(0, ctx.marks.size());
    }

    @Test
    void visit_OutermostFunctionRemembersDepth() {
        TraversalContext ctx = new TraversalContext(false);
        ctx.indentDepth = 1;
        CstNode definition = function("method");

        shapes.visit(ctx, definition);

        assertEquals(1, ctx.functionDepth);
        assertEquals(Mark.FUNC_DEF, ctx.marks.take(definition.getChild(1)));
    }

    @Test
    void visit_NoOpDecoratorIsNotACall() {
        TraversalContext ctx = new TraversalContext(false);
        CstNode decorated = node("decorated_definition",
                node("decorator", leaf("@", "@", 1), name("property", 1)),
                function("value"));

        shapes.visit(ctx, decorated);

        assertEquals(0, ctx.marks.size());
    }

    @Test
    void visit_PlainDecoratorIsACall() {
        TraversalContext ctx = new TraversalContext(false);
        CstNode decoratorName = name("staticmethod", 1);
        CstNode decorated = node("decorated_definition",
                node("decorator", leaf("@", "@", 1), decoratorName),
                function("build"));

        shapes.visit(ctx, decorated);

        assertEquals(Mark.FUNC_CALL, ctx.marks.take(decoratorName));
    }

    @Test
    void visit_DottedDecoratorMarksLastComponent() {
        TraversalContext ctx = new TraversalContext(false);
        CstNode functools = name("functools", 1);
        CstNode wraps = name("wraps", 1);
        CstNode decorated = node("decorated_definition",
                node("decorator", leaf("@", "@", 1), node("attribute", functools, leaf(".", ".", 1), wraps)),
                function("wrapper"));

        shapes.visit(ctx, decorated);

        assertFalse(ctx.marks.contains(functools));
        assertEquals(Mark.FUNC_CALL, ctx.marks.take(wraps));
    }

    @Test
    void visit_DecoratorCallIsMarkedOnce() {
        TraversalContext ctx = new TraversalContext(false);
        CstNode route = name("route", 1);
        CstNode call = node("call", node("attribute", name("app", 1), leaf(".", ".", 1), route), emptyArguments());
        CstNode decorated = node("decorated_definition",
                node("decorator", leaf("@", "@", 1), call),
                function("handler"));

        shapes.visit(ctx, decorated);
        shapes.visit(ctx, call);

        assertEquals(1, ctx.marks.size());
        assertEquals(Mark.FUNC_CALL, ctx.marks.take(route));
        assertTrue(ctx.decoratorCalls.isEmpty());
    }

    @Test
    void visit_ClassDecoratorIsNotMarked() {
        TraversalContext ctx = new TraversalContext(false);
        CstNode decorated = node("decorated_definition",
                node("decorator", leaf("@", "@", 1), name("dataclass", 1)),
                node("class_definition", leaf("class", "class", 2), name("Point", 2), leaf(":", ":", 2)));

        shapes.visit(ctx, decorated);

        assertEquals(0, ctx.marks.size());
    }

    @Test
    void visit_ImportCountsPathsAndMarksEachOne() {
        TraversalContext ctx = new TraversalContext(false);
        CstNode a = name("a", 1);
        CstNode b = name("b", 1);
        CstNode first = node("dotted_name", a);
        CstNode second = node("dotted_name", b);
        CstNode statement = node("import_statement",
                leaf("import", "import", 1), first, leaf(",", ",", 1),
                node("aliased_import", second, leaf("as", "as", 1), name("c", 1)));

        shapes.visit(ctx, statement);
        assertTrue(ctx.importing);
        shapes.visit(ctx, first);
        shapes.visit(ctx, second);

        assertFalse(ctx.importing);
        assertEquals(Mark.INCLUDE, ctx.marks.take(a));
        assertEquals(Mark.INCLUDE, ctx.marks.take(b));
    }

    @Test
    void visit_DottedNameOutsideImportIsIgnored() {
        TraversalContext ctx = new TraversalContext(false);

        shapes.visit(ctx, node("dotted_name", name("pkg", 1)));

        assertEquals(0, ctx.marks.size());
    }

    @Test
    void visit_RelativeImportMarksModuleOnly() {
        TraversalContext ctx = new TraversalContext(false);
        CstNode pkg = name("pkg", 1);
        CstNode imported = name("x", 1);
        CstNode statement = node("import_from_statement",
                leaf("from", "from", 1),
                node("relative_import", node("import_prefix", leaf(".", ".", 1)), node("dotted_name", pkg)),
                leaf("import", "import", 1),
                node("dotted_name", imported));

        shapes.visit(ctx, statement);

        assertEquals(1, ctx.marks.size());
        assertEquals(Mark.INCLUDE, ctx.marks.take(pkg));
    }

    @Test
    void visit_AnnotatedAssignmentIsNotClassified() {
        TraversalContext ctx = new TraversalContext(false);
        CstNode assignment = node("assignment",
                name("x", 1), leaf(":", ":", 1), node("type", name("int", 1)),
                leaf("=", "=", 1), leaf("integer", "5", 1));

        shapes.visit(ctx, assignment);

        assertEquals(0, ctx.pending.size());
    }

    @Test
    void visit_UnpackingStopsAtStarredElement() {
        TraversalContext ctx = new TraversalContext(false);
        CstNode a = name("a", 1);
        CstNode c = name("c", 1);
        CstNode targets = node("tuple_pattern",
                leaf("(", "(", 1), a, leaf(",", ",", 1),
                node("list_splat_pattern", leaf("*", "*", 1), name("b", 1)), leaf(",", ",", 1),
                c, leaf(")", ")", 1));

        shapes.visit(ctx, node("assignment", targets, leaf("=", "=", 1), name("values", 1)));
        shapes.visit(ctx, targets);

        assertTrue(ctx.pending.contains(a));
        assertFalse(ctx.pending.contains(c));
    }

    @Test
    void visit_SubscriptTargetMarksContainer() {
        TraversalContext ctx = new TraversalContext(false);
        CstNode table = name("table", 1);
        CstNode target = node("subscript", table, leaf("[", "[", 1), leaf("integer", "0", 1), leaf("]", "]", 1));

        shapes.visit(ctx, node("assignment", target, leaf("=", "=", 1), name("v", 1)));
        shapes.visit(ctx, target);

        assertEquals(Mark.ASSIGN, ctx.marks.take(table));
        assertTrue(ctx.pending.isSettled());
    }

    @Test
    void visit_SubscriptOfAttributeTargetMarksAttributeName() {
        TraversalContext ctx = new TraversalContext(false);
        CstNode owner = name("a", 1);
        CstNode field = name("b", 1);
        CstNode target = node("subscript", node("attribute", owner, leaf(".", ".", 1), field),
                leaf("[", "[", 1), leaf("integer", "0", 1), leaf("]", "]", 1));

        shapes.visit(ctx, node("assignment", target, leaf("=", "=", 1), name("v", 1)));
        shapes.visit(ctx, target);

        assertFalse(ctx.marks.contains(owner));
        assertEquals(Mark.ASSIGN, ctx.marks.take(field));
    }

    @Test
    void visit_StarredTargetQueuesOperand() {
        TraversalContext ctx = new TraversalContext(false);
        CstNode rest = name("rest", 1);
        CstNode starred = node("list_splat_pattern", leaf("*", "*", 1), rest);

        shapes.visit(ctx, node("assignment",
                node("pattern_list", name("a", 1), leaf(",", ",", 1), starred),
                leaf("=", "=", 1), name("x", 1)));
        shapes.visit(ctx, starred);

        assertTrue(ctx.pending.contains(rest));
        shapes.visit(ctx, rest);
        assertEquals(Mark.ASSIGN, ctx.marks.take(rest));
    }

    @Test
    void visit_CallThroughSubscriptIsNotMarked() {
        TraversalContext ctx = new TraversalContext(false);
        CstNode callee = node("subscript", name("handlers", 1), leaf("[", "[", 1),
                leaf("integer", "0", 1), leaf("]", "]", 1));

        shapes.visit(ctx, node("call", callee, emptyArguments()));

        assertEquals(0, ctx.marks.size());
    }

    @Test
    void visit_SecondMarkOnSameTokenConflicts() {
        TraversalContext ctx = new TraversalContext(false);
        CstNode f = name("f", 1);
        ctx.marks.register(f, Mark.ASSIGN);

        assertThrows(MarkConflictException.class, () -> shapes.visit(ctx, node("call", f, emptyArguments())));
    }
}
