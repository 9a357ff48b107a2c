package com.amqpclient.transport;

/**
 * Why a connection or channel closed.
 */
public final class CloseReason {

    public static final int REPLY_SUCCESS = 200;
    public static final int NOT_FOUND = 404;
    public static final int PRECONDITION_FAILED = 406;
    public static final int CONNECTION_FORCED = 320;

    private final int replyCode;
    private final String replyText;
    private final boolean initiatedByApplication;
    private final Throwable cause;

    public CloseReason(int replyCode, String replyText, boolean initiatedByApplication, Throwable cause) {
        this.replyCode = replyCode;
        this.replyText = replyText;
        this.initiatedByApplication = initiatedByApplication;
        this.cause = cause;
    }

    public static CloseReason byApplication() {
        return new CloseReason(REPLY_SUCCESS, "OK", true, null);
    }

    public static CloseReason byBroker(int replyCode, String replyText) {
        return new CloseReason(replyCode, replyText, false, null);
    }

    public static CloseReason failure(Throwable cause) {
        return new CloseReason(0, cause != null ? String.valueOf(cause.getMessage()) : "unknown", false, cause);
    }

    public int getReplyCode() {
        return replyCode;
    }

    public String getReplyText() {
        return replyText;
    }

    public boolean isInitiatedByApplication() {
        return initiatedByApplication;
    }

    public Throwable getCause() {
        return cause;
    }

    /**
     * The broker refused a redeclaration because the entity already exists
     * with different parameters.
     */
    public boolean isDeclareConflict() {
        return replyCode == PRECONDITION_FAILED;
    }

    @Override
    public String toString() {
        return "(" + replyCode + ") " + replyText + (initiatedByApplication ? " [client]" : "");
    }
}
