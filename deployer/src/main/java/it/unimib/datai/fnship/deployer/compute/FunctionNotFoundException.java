package it.unimib.datai.fnship.deployer.compute;

public class FunctionNotFoundException extends RuntimeException {

    public FunctionNotFoundException(String functionName) {
        super("Function not found: " + functionName);
    }

    public FunctionNotFoundException(String functionName, Throwable cause) {
        super("Function not found: " + functionName, cause);
    }
}
