package io.github.respkv.command;

import com.google.common.base.CharMatcher;
import lombok.Getter;

public class UnknownCommandException extends CommandException {
    private static final long serialVersionUID = 8190374466409528830L;

    @Getter
    private final String verb;

    public UnknownCommandException(String verb) {
        super("ERR unknown command '" + CharMatcher.javaIsoControl().replaceFrom(verb, '?') + "'");
        this.verb = verb;
    }
}
