package info.isaksson.erland.uast.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

@JsonPropertyOrder({"start","end"})
public final class UastLocation {
    public final UastPosition start;
    public final UastPosition end;

    @JsonCreator
    public UastLocation(
            @JsonProperty("start") UastPosition start,
            @JsonProperty("end") UastPosition end
    ) {
        this.start = start == null ? new UastPosition(0, 0) : start;
        this.end = end == null ? new UastPosition(0, 0) : end;
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof UastLocation)) return false;
        UastLocation that = (UastLocation) o;
        return Objects.equals(start, that.start) && Objects.equals(end, that.end);
    }

    @Override public int hashCode() {
        return Objects.hash(start, end);
    }

    /** Compact form used by the text formatters: {@code l:c-l:c}. */
    @Override public String toString() {
        return start + "-" + end;
    }
}
