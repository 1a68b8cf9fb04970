package com.siccatalog.core.model;

import com.siccatalog.core.code.Code;

import java.util.Objects;

/**
 * A piece of text attached to a code, such as a leaf description or activity.
 *
 * @param code classification code
 * @param text attached text
 */
public record CodedText(Code code, String text) {

    public CodedText {
        Objects.requireNonNull(code, "code must not be null");
        Objects.requireNonNull(text, "text must not be null");
    }
}
