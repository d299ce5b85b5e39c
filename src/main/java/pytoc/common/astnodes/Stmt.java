package pytoc.common.astnodes;

/**
 * Base of all AST nodes representing statements.
 *
 * There is nothing in this class, but there will be many AST
 * node types that have fields that are *any statement*. For those
 * cases, the field type will be `Stmt`.
 */
public abstract class Stmt extends Node {
}
