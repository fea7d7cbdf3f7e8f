package vn.com.fecredit.flowable.layout.exception;

public class DiagramRenderException extends FlowLayoutException {

    public DiagramRenderException(String message, Throwable cause) {
        super(message, cause);
    }
}
