package io.hookcron.core.schedule;

/**
 * The message of a due schedule can't be built, so the occurrence is skipped.
 */
public class PayloadUnavailableException
        extends Exception
{
    public PayloadUnavailableException(String message)
    {
        super(message);
    }

    public PayloadUnavailableException(String message, Throwable cause)
    {
        super(message, cause);
    }
}
