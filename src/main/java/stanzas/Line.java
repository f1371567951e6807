package stanzas;

/**
 * One physical line of a stanza file. {@code text} is the exact rendering written back on output;
 * for parsed lines it is the original line without its terminator. {@code terminator} is the
 * parsed line's own line ending, {@code null} for lines created by an edit.
 */
final class Line {
    final LineType type;
    final String text;
    final String name;
    final String value;
    final String terminator;

    private Line(LineType type, String text, String name, String value, String terminator) {
        this.type = type;
        this.text = text;
        this.name = name;
        this.value = value;
        this.terminator = terminator;
    }

    static Line blank(String text) {
        return new Line(LineType.BLANK, text, null, null, null);
    }

    static Line comment(String text) {
        return new Line(LineType.COMMENT, text, null, null, null);
    }

    static Line stanza(String text, String name) {
        return new Line(LineType.STANZA, text, name, null, null);
    }

    /**
     * @param value attribute value, {@code null} for a bare attribute
     */
    static Line attribute(String text, String name, String value) {
        return new Line(LineType.ATTRIBUTE, text, name, value, null);
    }

    Line terminatedBy(String lineEnding) {
        return new Line(type, text, name, value, lineEnding);
    }

    boolean isBlank() {
        return type == LineType.BLANK;
    }

    boolean isStanza() {
        return type == LineType.STANZA;
    }

    boolean isAttribute() {
        return type == LineType.ATTRIBUTE;
    }

    @Override
    public String toString() {
        return type + ":" + text;
    }
}
