package io.github.eutro.bin2ast.core.ast;

/**
 * A statement of the lowered function.
 * <p>
 * Statements are immutable, and are created by an {@link AstBuilder}, which gives each a unique id.
 */
public abstract class Stmt {
    private final int id;

    Stmt(int id) {
        this.id = id;
    }

    /**
     * Get the id of this statement, unique within the {@link AstBuilder} that created it.
     *
     * @return The id.
     */
    public int id() {
        return id;
    }

    /**
     * Visit this statement.
     *
     * @param visitor The visitor.
     * @param <R>     The result type of the visitor.
     * @return The result of the visitor.
     */
    public abstract <R> R accept(StmtVisitor<R> visitor);

    @Override
    public String toString() {
        return AstPrinter.print(this);
    }
}
