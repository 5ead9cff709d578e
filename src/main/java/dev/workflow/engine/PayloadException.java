package dev.workflow.engine;

/**
 * The stdin payload of a run or resume is not usable.
 */
public class PayloadException extends Exception {

    public PayloadException(String message) {
        super(message);
    }
}
