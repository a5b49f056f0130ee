package io.hookcron.core.repository;

/**
 * Thrown when creating a resource would exceed a configured limit.
 *
 * The count is checked in the same transaction that inserts the new resource but
 * without a table lock, so two concurrent requests may both pass the check.
 */
public abstract class ResourceLimitExceededException
        extends Exception
{
    private final int limit;

    protected ResourceLimitExceededException(String message, int limit)
    {
        super(message);
        this.limit = limit;
    }

    public int getLimit()
    {
        return limit;
    }
}
