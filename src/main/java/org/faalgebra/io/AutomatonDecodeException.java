package org.faalgebra.io;

import lombok.Getter;

import java.io.IOException;

/**
 * 持久化数据格式错误：缺少字段、引用了不存在的状态、重复的迁移键等。
 * field 指出出错的字段名。
 */
@Getter
public class AutomatonDecodeException extends IOException {

    private final String field;

    public AutomatonDecodeException(String field, String message) {
        super(field + ": " + message);
        this.field = field;
    }

    public AutomatonDecodeException(String field, String message, Throwable cause) {
        super(field + ": " + message, cause);
        this.field = field;
    }
}
