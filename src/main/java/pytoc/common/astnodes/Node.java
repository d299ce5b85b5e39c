package pytoc.common.astnodes;

import java.util.Arrays;

import pytoc.common.analysis.NodeAnalyzer;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import java_cup.runtime.ComplexSymbolFactory.Location;

/**
 * Root of the AST class hierarchy.  Every node has a left and right
 * location, indicating the start and end of the represented construct
 * in the source text.
 *
 * Every node can be serialized to JSON; the concrete class is recorded
 * under the property "kind".  Nodes are never modified after the parser
 * produces them.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME,
              include = JsonTypeInfo.As.PROPERTY,
              property = "kind")
@JsonSubTypes({
        @JsonSubTypes.Type(AssignStmt.class),
        @JsonSubTypes.Type(AugAssignStmt.class),
        @JsonSubTypes.Type(BinaryExpr.class),
        @JsonSubTypes.Type(BooleanLiteral.class),
        @JsonSubTypes.Type(CallExpr.class),
        @JsonSubTypes.Type(ExprStmt.class),
        @JsonSubTypes.Type(FloatLiteral.class),
        @JsonSubTypes.Type(ForStmt.class),
        @JsonSubTypes.Type(FuncDef.class),
        @JsonSubTypes.Type(Identifier.class),
        @JsonSubTypes.Type(IfExpr.class),
        @JsonSubTypes.Type(IfStmt.class),
        @JsonSubTypes.Type(IntegerLiteral.class),
        @JsonSubTypes.Type(ListExpr.class),
        @JsonSubTypes.Type(NoneLiteral.class),
        @JsonSubTypes.Type(Program.class),
        @JsonSubTypes.Type(ReturnStmt.class),
        @JsonSubTypes.Type(StringLiteral.class),
        @JsonSubTypes.Type(UnaryExpr.class),
        @JsonSubTypes.Type(WhileStmt.class)})
public abstract class Node {

    /** Node-specific source text location, as
     *  [startLine, startCol, endLine, endCol].  Zeros mean unknown. */
    private final int[] location = new int[4];

    /** Return my source location as
     *  { <first line>, <first column>, <last line>, <last column> }.
     *  Result should not be modified, and contents will change after
     *  setLocation(). */
    public int[] getLocation() {
        return location;
    }

    /** Copy LOCATION as getLocation(). */
    public void setLocation(final int[] location) {
        System.arraycopy(location, 0, this.location, 0,
                         Math.min(location.length, this.location.length));
    }

    /** Return the start of my source span, or null if it is unknown. */
    @JsonIgnore
    public Location getLeft() {
        if (location[0] == 0) {
            return null;
        }
        return new Location(location[0], location[1]);
    }

    /** Return the end of my source span, or null if it is unknown. */
    @JsonIgnore
    public Location getRight() {
        if (location[2] == 0) {
            return null;
        }
        return new Location(location[2], location[3]);
    }

    /** Return the name of my node kind, as used in JSON. */
    @JsonIgnore
    public String getKind() {
        return getClass().getSimpleName();
    }

    /** Dispatch ANALYZER on me.  Returns the value produced by the
     *  analyze method overload matching my dynamic type. */
    public abstract <T> T dispatch(NodeAnalyzer<T> analyzer);

    @Override
    public String toString() {
        return getKind() + Arrays.toString(location);
    }

}
