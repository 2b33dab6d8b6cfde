package info.isaksson.erland.uast.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/**
 * 1-based line/column position.
 */
@JsonPropertyOrder({"line","column"})
public final class UastPosition {
    public final int line;
    public final int column;

    @JsonCreator
    public UastPosition(
            @JsonProperty("line") int line,
            @JsonProperty("column") int column
    ) {
        this.line = line;
        this.column = column;
    }

    /** Shift a 0-based parser (row, column) pair to 1-based line/column. */
    public static UastPosition fromZeroBased(int row, int column) {
        return new UastPosition(row + 1, column + 1);
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof UastPosition)) return false;
        UastPosition that = (UastPosition) o;
        return line == that.line && column == that.column;
    }

    @Override public int hashCode() {
        return Objects.hash(line, column);
    }

    @Override public String toString() {
        return line + ":" + column;
    }
}
