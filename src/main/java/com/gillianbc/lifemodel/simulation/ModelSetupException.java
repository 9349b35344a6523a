package com.gillianbc.lifemodel.simulation;

/**
 * Thrown when the simulated world is missing something an operation needs,
 * for example a deposit for a person who owns no bank account.
 */
public class ModelSetupException extends RuntimeException {

    public ModelSetupException(String message) {
        super(message);
    }
}
