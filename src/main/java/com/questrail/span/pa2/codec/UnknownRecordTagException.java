package com.questrail.span.pa2.codec;

/**
 * The first two characters of a line do not name a registered record layout.
 */
public final class UnknownRecordTagException extends RecordDecodeException
{
    private final String tag;

    public UnknownRecordTagException(String tag) {
        super("Unknown PA2 record tag: '" + tag + "'");
        this.tag = tag;
    }

    /**
     * Returns the offending tag text. Shorter than two characters when the
     * line itself was.
     */
    public String tag() {
        return tag;
    }
}
