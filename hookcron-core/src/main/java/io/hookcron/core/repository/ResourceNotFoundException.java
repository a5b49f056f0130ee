package io.hookcron.core.repository;

/**
 * Thrown when a schedule or another stored resource is looked up by id and is missing,
 * for example because it was deleted concurrently.
 */
public class ResourceNotFoundException extends Exception
{
    private final String resourceType;
    private final String resourceId;

    public ResourceNotFoundException(String resourceType, String resourceId)
    {
        super("Resource does not exist: " + resourceType + " id=" + resourceId);
        this.resourceType = resourceType;
        this.resourceId = resourceId;
    }

    public static ResourceNotFoundException ofSchedule(String scheduleId)
    {
        return new ResourceNotFoundException("schedule", scheduleId);
    }

    public String getResourceType()
    {
        return resourceType;
    }

    public String getResourceId()
    {
        return resourceId;
    }
}
