package io.github.respkv.command;

/**
 * 参数个数或参数形式不对。
 */
public class CommandFormatException extends CommandException {
    private static final long serialVersionUID = -6005519385516380794L;

    public static final String INVALID_FORMAT = "ERR invalid command format";
    public static final String NOT_AN_INTEGER = "ERR value is not an integer or out of range";

    public CommandFormatException(String message) {
        super(message);
    }

    static CommandFormatException wrongArity(CommandType type) {
        return new CommandFormatException("ERR wrong number of arguments for '" + type.getVerb() + "' command");
    }
}
