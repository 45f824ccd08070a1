package com.whitehall.core.transform;

import com.whitehall.core.ast.CodeBlock;
import com.whitehall.core.ast.ExprNode;
import com.whitehall.core.ast.ExprNode.IndexAccess;
import com.whitehall.core.ast.ExprNode.Identifier;
import com.whitehall.core.ast.ExprNode.MemberAccess;
import com.whitehall.core.ast.StateScope;
import com.whitehall.core.emit.ExpressionPrinter;
import com.whitehall.core.parser.StatementScanner;
import com.whitehall.core.parser.StatementScanner.DispatchSite;
import com.whitehall.core.parser.StatementScanner.Span;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Applies the expression rewrites to verbatim code such as function bodies and lifecycle hooks.
 *
 * <p>Only statements that touch state are re-printed; all other text, comments included, is kept
 * byte for byte.
 */
public final class RawCodeRewriter {

    private final ExpressionTransformer transformer;
    private final ExpressionPrinter printer;

    public RawCodeRewriter(ExpressionTransformer transformer, ExpressionPrinter printer) {
        this.transformer = transformer;
        this.printer = printer;
    }

    /**
     * Rewrites state writes and dispatch blocks in a code block.
     *
     * @param block verbatim code
     * @param ctx transform context of the enclosing component or store
     * @return rewritten code
     */
    public String rewrite(CodeBlock block, TransformContext ctx) {
        List<Edit> edits = new ArrayList<>();
        for (Span span : StatementScanner.assignments(block, ctx.fileName(), target -> touchesState(target, ctx))) {
            ExprNode rewritten = transformer.transform(span.statement(), ctx);
            if (!rewritten.equals(span.statement())) {
                edits.add(new Edit(span.start(), span.end(), printer.print(rewritten)));
            }
        }
        for (DispatchSite site : StatementScanner.dispatchSites(block, ctx.fileName())) {
            boolean covered = edits.stream().anyMatch(e -> e.start() <= site.start() && site.start() < e.end());
            if (!covered) {
                String launch = ctx.symbols().dispatchScope() + ".launch(" + site.dispatcher().target() + ")";
                edits.add(new Edit(site.start(), site.end(), launch));
            }
        }
        if (edits.isEmpty()) {
            return block.text();
        }

        edits.sort(Comparator.comparingInt(Edit::start));
        StringBuilder out = new StringBuilder();
        int pos = 0;
        for (Edit edit : edits) {
            out.append(block.text(), pos, edit.start()).append(edit.replacement());
            pos = edit.end();
        }
        out.append(block.text().substring(pos));
        return out.toString();
    }

    /**
     * Whether any dispatch block appears in the code.
     *
     * @param block verbatim code
     * @param fileName file name for diagnostics
     * @return true if the code launches work
     */
    public static boolean usesDispatch(CodeBlock block, String fileName) {
        return !StatementScanner.dispatchSites(block, fileName).isEmpty();
    }

    private static boolean touchesState(ExprNode target, TransformContext ctx) {
        Identifier root = root(target);
        if (root == null) {
            return false;
        }
        String name = root.name();
        ScopeSymbols symbols = ctx.symbols();
        if (symbols.binding(name).isPresent() || symbols.bindingForState(name).isPresent()
            || symbols.localState().containsKey(name)) {
            return true;
        }
        return ctx.owningScope() == StateScope.STORE && symbols.currentStore() != null
            && (name.equals("this") || symbols.currentStore().field(name) != null);
    }

    private static Identifier root(ExprNode target) {
        ExprNode current = target;
        while (current instanceof MemberAccess || current instanceof IndexAccess) {
            current = current instanceof MemberAccess access ? access.target() : ((IndexAccess) current).target();
        }
        return current instanceof Identifier id ? id : null;
    }

    private record Edit(int start, int end, String replacement) {}
}
