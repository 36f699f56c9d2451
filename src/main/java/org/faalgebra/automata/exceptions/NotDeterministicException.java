package org.faalgebra.automata.exceptions;

/**
 * 操作要求 NFA 在非 epsilon 意义下是确定的，但输入不是。
 */
public class NotDeterministicException extends IllegalStateException {

    public NotDeterministicException(String message) {
        super(message);
    }
}
