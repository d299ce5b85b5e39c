package pytoc.common.astnodes;

/**
 * Base of all AST nodes representing expressions.
 *
 * Expressions carry no type of their own; the translator infers one
 * for each expression it visits and keeps it outside the tree.
 */
public abstract class Expr extends Node {
}
