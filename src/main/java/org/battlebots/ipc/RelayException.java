package org.battlebots.ipc;

/**
 * Ends a relay pump. The kind tells which stage of the write-then-read cycle failed.
 */
public class RelayException extends Exception {

    public enum Kind {
        /** An outbound envelope could not be encoded. */
        SERIALIZATION,
        /** An inbound line was not a valid response list. */
        DESERIALIZATION,
        /** Writing to the bot failed. */
        WRITING,
        /** Reading from the bot failed, or the bot closed its output early. */
        READING
    }

    private final Kind kind;

    /**
     * Constructs a new exception.
     *
     * @param kind the failed stage.
     * @param message the detail message.
     * @param cause the underlying cause, may be null.
     */
    public RelayException(Kind kind, String message, Throwable cause) {
        super(kind + ": " + message, cause);
        this.kind = kind;
    }

    public Kind getKind() {
        return kind;
    }
}
