package vn.com.fecredit.flowable.layout.exception;

public class BpmnConversionException extends FlowLayoutException {

    public BpmnConversionException(String message) {
        super(message);
    }

    public BpmnConversionException(String message, Throwable cause) {
        super(message, cause);
    }
}
