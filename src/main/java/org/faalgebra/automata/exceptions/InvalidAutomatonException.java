package org.faalgebra.automata.exceptions;

/**
 * 自动机不满足结构不变量时抛出：初始状态不在状态集中、迁移引用了未知状态、
 * 迁移符号不在字母表中、EPSILON 出现在不允许的位置等。
 */
public class InvalidAutomatonException extends IllegalArgumentException {

    public InvalidAutomatonException(String message) {
        super(message);
    }
}
