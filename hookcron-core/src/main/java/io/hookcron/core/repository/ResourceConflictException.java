package io.hookcron.core.repository;

/**
 * Thrown when a schedule exists but its current state rejects the requested change.
 */
public class ResourceConflictException extends Exception
{
    private final String resourceId;

    public ResourceConflictException(String resourceId, String message)
    {
        super(message);
        this.resourceId = resourceId;
    }

    public String getResourceId()
    {
        return resourceId;
    }
}
