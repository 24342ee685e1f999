package io.github.eutro.bin2ast.core.ast;

import java.util.Collections;
import java.util.List;

/**
 * One labelled section of a {@link SwitchStmt}.
 * <p>
 * Several {@link CaseLabel}s can share a section, and the {@link DefaultLabel} can too.
 */
public final class SwitchCase {
    private final List<Label> labels;
    private final BlockStmt body;

    SwitchCase(List<Label> labels, BlockStmt body) {
        this.labels = Collections.unmodifiableList(labels);
        this.body = body;
    }

    public List<Label> labels() {
        return labels;
    }

    public BlockStmt body() {
        return body;
    }

    /**
     * Get whether this section carries the default label.
     *
     * @return Whether this is the default section.
     */
    public boolean isDefault() {
        for (Label label : labels) {
            if (label instanceof DefaultLabel) return true;
        }
        return false;
    }
}
