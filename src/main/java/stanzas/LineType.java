package stanzas;

enum LineType {
    BLANK, COMMENT, STANZA, ATTRIBUTE
}
