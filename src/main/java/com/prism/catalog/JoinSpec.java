package com.prism.catalog;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * A join to a dimension view, described as data.
 *
 * Joins {@code log.<leftColumn>} of the planned source to
 * {@code <target alias>.<rightColumn>} of the source view named by {@code targetView}.
 */
public class JoinSpec {

    private final JoinKind kind;
    private final String targetView;
    private final String leftColumn;
    private final String rightColumn;

    @JsonCreator
    public JoinSpec(
            @JsonProperty("kind") JoinKind kind,
            @JsonProperty("targetView") String targetView,
            @JsonProperty("leftColumn") String leftColumn,
            @JsonProperty("rightColumn") String rightColumn) {
        this.kind = kind == null ? JoinKind.LEFT : kind;
        this.targetView = Objects.requireNonNull(targetView, "targetView");
        this.leftColumn = Objects.requireNonNull(leftColumn, "leftColumn");
        this.rightColumn = rightColumn == null ? leftColumn : rightColumn;
    }

    public static JoinSpec left(String targetView, String column) {
        return new JoinSpec(JoinKind.LEFT, targetView, column, column);
    }

    public JoinKind getKind() {
        return kind;
    }

    public String getTargetView() {
        return targetView;
    }

    public String getLeftColumn() {
        return leftColumn;
    }

    public String getRightColumn() {
        return rightColumn;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof JoinSpec)) return false;
        JoinSpec other = (JoinSpec) o;
        return kind == other.kind
            && targetView.equals(other.targetView)
            && leftColumn.equals(other.leftColumn)
            && rightColumn.equals(other.rightColumn);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, targetView, leftColumn, rightColumn);
    }

    @Override
    public String toString() {
        return kind + " " + targetView + " ON " + leftColumn + " = " + rightColumn;
    }
}
