package com.ogt.exposure.exception;

/**
 * A step needs a column that an earlier step should have produced.
 */
public class MissingColumnException extends UserInputException {

    private final String column;

    public MissingColumnException(String step, String column) {
        super(String.format("Step '%s' requires column '%s', which is not present. Run the step that produces it first.",
                step, column));
        this.column = column;
    }

    public String getColumn() {
        return column;
    }
}
