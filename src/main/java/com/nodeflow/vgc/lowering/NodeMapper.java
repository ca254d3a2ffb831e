package com.nodeflow.vgc.lowering;

import com.nodeflow.vgc.api.VisualNode;
import com.nodeflow.vgc.ast.AstNode;

/**
 * Lowering strategy for one {@link com.nodeflow.vgc.api.NodeKind}.
 *
 * <p>
 * Implementations must be pure given their inputs: the same node and
 * context always produce an equal subtree. A mapper returns either a
 * {@link com.nodeflow.vgc.ast.Stmt} or an {@link com.nodeflow.vgc.ast.Expr};
 * lowering wraps expressions in a statement. Throwing is allowed; the
 * failing node is replaced by a comment.
 */
@FunctionalInterface
public interface NodeMapper {

    AstNode lower(VisualNode node, ConnectionContext context);
}
