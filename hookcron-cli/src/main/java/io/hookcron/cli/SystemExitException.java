package io.hookcron.cli;

/**
 * Ends a command with an exit code. Main prints the message as {@code error: <message>}.
 */
public class SystemExitException
        extends Exception
{
    private final int code;

    public SystemExitException(int code, String message)
    {
        super(message);
        this.code = code;
    }

    /**
     * Exit code 1 with the message, or 0 without a message when {@code errorMessage} is null.
     */
    public static SystemExitException systemExit(String errorMessage)
    {
        return errorMessage == null
            ? new SystemExitException(0, null)
            : new SystemExitException(1, errorMessage);
    }

    public static SystemExitException canceled()
    {
        return new SystemExitException(1, "canceled.");
    }

    public int getCode()
    {
        return code;
    }

    public boolean isError()
    {
        return code != 0;
    }
}
