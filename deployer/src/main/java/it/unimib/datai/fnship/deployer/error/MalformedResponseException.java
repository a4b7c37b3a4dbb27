package it.unimib.datai.fnship.deployer.error;

public final class MalformedResponseException extends FunctionOperationException {

    public MalformedResponseException(String functionName, Throwable cause) {
        super("invoke", functionName, "response is not valid JSON", cause);
    }
}
