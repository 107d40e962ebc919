package io.github.hatchcrm.aiemployees.runtime.error;

/** Lookup miss within the caller's tenant. */
public class NotFoundException extends AiEmployeeException {

    public NotFoundException(String message) {
        super(message);
    }
}
