package vn.com.fecredit.flowable.layout.exception;

/**
 * The input cannot be read as a flow document at all. Topology problems inside a
 * well-formed document are absorbed by the engine and never raise this.
 */
public class InvalidFlowDocumentException extends FlowLayoutException {

    public InvalidFlowDocumentException(String message) {
        super(message);
    }

    public InvalidFlowDocumentException(String message, Throwable cause) {
        super(message, cause);
    }
}
