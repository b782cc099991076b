package com.example.docexport.text;

/**
 * Change applied to a single run descriptor
 */
@FunctionalInterface
public interface FormattingInstruction {

    FormattingInstruction NO_OP = run -> { };

    void applyTo(RunDescriptor run);
}
