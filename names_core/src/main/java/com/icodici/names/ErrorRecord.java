package com.icodici.names;

import com.icodici.names.tools.Binder;

public class ErrorRecord {
    private final String objectName;
    private final String message;
    private final Errors error;

    public ErrorRecord(Errors error, String objectName, String message) {
        this.objectName = objectName;
        this.message = message;
        this.error = error;
    }

    public String getObjectName() {
        return objectName;
    }

    public String getMessage() {
        return message;
    }

    public Errors getError() {
        return error;
    }

    public Binder toBinder() {
        return Binder.fromKeysValues(
                "error", error.name(),
                "object", objectName == null ? "" : objectName,
                "message", message == null ? "" : message
        );
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(error.name());
        if (objectName != null && !objectName.isEmpty())
            sb.append(" [").append(objectName).append("]");
        if (message != null && !message.isEmpty())
            sb.append(" ").append(message);
        return sb.toString();
    }
}
