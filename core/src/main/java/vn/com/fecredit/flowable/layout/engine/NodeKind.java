package vn.com.fecredit.flowable.layout.engine;

public enum NodeKind {
    TASK,
    GATEWAY
}
