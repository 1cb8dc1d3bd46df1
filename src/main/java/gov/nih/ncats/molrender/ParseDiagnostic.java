package gov.nih.ncats.molrender;

import java.util.Objects;

/**
 * A piece of the input notation that the lenient parser skipped or could not use.
 * Diagnostics never stop a parse; they are only reported.
 *
 * @see MolRenderResult#getDiagnostics()
 */
public final class ParseDiagnostic {

    public enum Kind{
        UNKNOWN_CHARACTER,
        UNMATCHED_BRANCH_CLOSE,
        UNCLOSED_BRANCH,
        UNCLOSED_RING,
        RING_WITHOUT_ATOM,
        INVALID_RING_CLOSURE,
        MALFORMED_RING_NUMBER,
        UNTERMINATED_BRACKET_ATOM
    }

    private final int position;
    private final Kind kind;
    private final String message;

    public ParseDiagnostic(int position, Kind kind, String message) {
        this.position = position;
        this.kind = Objects.requireNonNull(kind);
        this.message = Objects.requireNonNull(message);
    }

    /**
     * Offset into the notation string where the problem was found.
     * @return a 0 based character offset.
     */
    public int getPosition() {
        return position;
    }

    public Kind getKind() {
        return kind;
    }

    public String getMessage() {
        return message;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ParseDiagnostic)) return false;
        ParseDiagnostic that = (ParseDiagnostic) o;
        return position == that.position &&
                kind == that.kind &&
                message.equals(that.message);
    }

    @Override
    public int hashCode() {
        return Objects.hash(position, kind, message);
    }

    @Override
    public String toString() {
        return kind + " at " + position + ": " + message;
    }
}
