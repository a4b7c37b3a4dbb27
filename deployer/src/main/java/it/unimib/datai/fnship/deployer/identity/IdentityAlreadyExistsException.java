package it.unimib.datai.fnship.deployer.identity;

public final class IdentityAlreadyExistsException extends RuntimeException {
    private final String identityName;

    public IdentityAlreadyExistsException(String identityName, Throwable cause) {
        super("Identity already exists: " + identityName, cause);
        this.identityName = identityName;
    }

    public String identityName() {
        return identityName;
    }
}
