package com.prism.planner;

import com.prism.catalog.JoinSpec;
import com.prism.catalog.ResolvedSourceView;

/**
 * Renders catalog join descriptions into SQL join clauses against the planned source.
 */
public final class JoinEmitter {

    private JoinEmitter() {
    }

    /**
     * {@code <KIND> JOIN (<select>) AS <alias> ON log."<left>" = <alias>."<right>"}
     */
    public static String emit(JoinSpec join, ResolvedSourceView target) {
        return join.getKind().getKeyword() + " " + target.getSourceExpression()
            + " ON " + ViewQueryAssembler.SOURCE_ALIAS + ".\"" + join.getLeftColumn() + "\""
            + " = " + target.getAlias() + ".\"" + join.getRightColumn() + "\"";
    }
}
