package it.unimib.datai.fnship.deployer.compute;

import it.unimib.datai.fnship.deployer.error.InvalidInputException;

public final class FunctionNames {

    private FunctionNames() {}

    public static String require(String name) {
        if (name == null || name.isBlank()) {
            throw new InvalidInputException("Function name must not be empty");
        }
        return name;
    }
}
