package com.plughub.tasks;

import java.io.PrintWriter;
import java.io.StringWriter;

/**
 * Failure report handed to a task's error callback.
 *
 * @param message short, single-line description ({@code ExceptionType: message})
 * @param detail  full stack trace of the cause
 * @param cause   the original throwable
 */
public record TaskError(String message, String detail, Throwable cause) {

    public static TaskError of(Throwable cause) {
        String text = cause.getMessage();
        String message = cause.getClass().getSimpleName() + (text != null && !text.isBlank() ? ": " + text : "");
        StringWriter trace = new StringWriter();
        cause.printStackTrace(new PrintWriter(trace));
        return new TaskError(message, trace.toString(), cause);
    }
}
