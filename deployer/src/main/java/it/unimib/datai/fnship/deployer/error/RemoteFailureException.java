package it.unimib.datai.fnship.deployer.error;

public final class RemoteFailureException extends FunctionOperationException {

    public RemoteFailureException(String operation, String functionName, Throwable cause) {
        super(operation, functionName, messageOf(cause), cause);
    }

    private static String messageOf(Throwable cause) {
        if (cause == null) {
            return "unknown error";
        }
        String message = cause.getMessage();
        return message == null || message.isBlank() ? cause.getClass().getSimpleName() : message;
    }
}
