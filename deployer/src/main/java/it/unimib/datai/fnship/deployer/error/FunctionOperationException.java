package it.unimib.datai.fnship.deployer.error;

/**
 * Failure of a named deployer operation against a single function.
 * The message always reads {@code <operation>(<function>) failed: <detail>}.
 */
public abstract class FunctionOperationException extends RuntimeException {
    private final String operation;
    private final String functionName;

    protected FunctionOperationException(String operation, String functionName, String detail, Throwable cause) {
        super(describe(operation, functionName) + " failed: " + detail, cause);
        this.operation = operation;
        this.functionName = functionName;
    }

    public String operation() {
        return operation;
    }

    public String functionName() {
        return functionName;
    }

    static String describe(String operation, String functionName) {
        return functionName == null ? operation : operation + "(" + functionName + ")";
    }
}
