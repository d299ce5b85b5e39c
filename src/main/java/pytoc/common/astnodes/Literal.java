package pytoc.common.astnodes;

/**
 * Base of all the literal nodes.
 *
 * There is nothing in this class, but it is useful to isolate
 * expressions that are constant literals.
 */
public abstract class Literal extends Expr {
}
