package org.hwviz.util;

/** Interface implemented by objects that can be printed on an indented stream. */
public interface ToIndentableString {
    IIndentStream toString(IIndentStream builder);
}
