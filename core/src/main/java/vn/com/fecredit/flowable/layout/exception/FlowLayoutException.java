package vn.com.fecredit.flowable.layout.exception;

/**
 * Base class for failures surfaced by the layout and export pipeline.
 */
public class FlowLayoutException extends RuntimeException {

    public FlowLayoutException(String message) {
        super(message);
    }

    public FlowLayoutException(String message, Throwable cause) {
        super(message, cause);
    }
}
